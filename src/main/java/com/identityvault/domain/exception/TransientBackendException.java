package com.identityvault.domain.exception;

/**
 * A dependency (database, key material store) failed in a way that may
 * succeed on retry.
 */
public class TransientBackendException extends VaultException {

    public TransientBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
