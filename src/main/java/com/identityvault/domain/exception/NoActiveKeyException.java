package com.identityvault.domain.exception;

import com.identityvault.domain.model.KeyDomain;

/**
 * No version of a key domain is active for writes. Fatal misconfiguration.
 */
public class NoActiveKeyException extends VaultException {

    private final KeyDomain domain;

    public NoActiveKeyException(KeyDomain domain) {
        super("No " + domain + " key version is active for writes; promote a version first");
        this.domain = domain;
    }

    public KeyDomain getDomain() {
        return domain;
    }
}
