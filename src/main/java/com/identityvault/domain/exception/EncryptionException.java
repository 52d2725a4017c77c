package com.identityvault.domain.exception;

/**
 * A cryptographic primitive failed while sealing or hashing.
 */
public class EncryptionException extends VaultException {

    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
