package com.identityvault.domain.exception;

/**
 * Public key material could not be imported for sealing.
 */
public class InitializationException extends VaultException {

    public InitializationException(String message) {
        super(message);
    }

    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
