package com.identityvault.domain.exception;

/**
 * An envelope failed authentication: the GCM tag did not verify or the
 * wrapped key could not be unwrapped.
 *
 * <p>Indicates tampering or corruption. Never retried, never downgraded to
 * a partial result.
 */
public class AuthenticationFailureException extends VaultException {

    private final String keyVersion;

    public AuthenticationFailureException(String keyVersion, String message, Throwable cause) {
        super(message, cause);
        this.keyVersion = keyVersion;
    }

    public String getKeyVersion() {
        return keyVersion;
    }
}
