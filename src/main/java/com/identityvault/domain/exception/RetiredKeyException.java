package com.identityvault.domain.exception;

import com.identityvault.domain.model.KeyDomain;

/**
 * A read was attempted against a retired key version.
 *
 * <p>Data protected by a retired version is unreadable by policy. Operators
 * use this type to tell "data is gone by policy" apart from a defect.
 */
public class RetiredKeyException extends VaultException {

    private final KeyDomain domain;
    private final String keyVersion;

    public RetiredKeyException(KeyDomain domain, String keyVersion) {
        super(domain + " key version " + keyVersion
            + " is retired; data protected by it is no longer readable");
        this.domain = domain;
        this.keyVersion = keyVersion;
    }

    public KeyDomain getDomain() {
        return domain;
    }

    public String getKeyVersion() {
        return keyVersion;
    }
}
