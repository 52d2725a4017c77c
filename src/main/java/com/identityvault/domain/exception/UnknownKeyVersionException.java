package com.identityvault.domain.exception;

import com.identityvault.domain.model.KeyDomain;

/**
 * A key version was referenced that is not registered, not yet usable, or
 * for which no key material is held.
 */
public class UnknownKeyVersionException extends VaultException {

    private final KeyDomain domain;
    private final String keyVersion;

    public UnknownKeyVersionException(KeyDomain domain, String keyVersion, String message) {
        super(message);
        this.domain = domain;
        this.keyVersion = keyVersion;
    }

    public UnknownKeyVersionException(KeyDomain domain, String keyVersion) {
        this(domain, keyVersion, "Unknown " + domain + " key version: " + keyVersion);
    }

    public KeyDomain getDomain() {
        return domain;
    }

    public String getKeyVersion() {
        return keyVersion;
    }
}
