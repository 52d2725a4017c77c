package com.identityvault.domain.exception;

/**
 * A sealing cipher was used before a public key was imported.
 */
public class NotInitializedException extends VaultException {

    public NotInitializedException(String message) {
        super(message);
    }
}
