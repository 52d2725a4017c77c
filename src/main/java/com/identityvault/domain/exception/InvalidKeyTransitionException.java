package com.identityvault.domain.exception;

import com.identityvault.domain.model.KeyState;

/**
 * A key lifecycle move was rejected.
 */
public class InvalidKeyTransitionException extends VaultException {

    public InvalidKeyTransitionException(String keyVersion, KeyState from, KeyState to) {
        super("Key version " + keyVersion + " cannot move from " + from + " to " + to);
    }

    public InvalidKeyTransitionException(String message) {
        super(message);
    }
}
