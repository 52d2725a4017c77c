package com.identityvault.domain.exception;

/**
 * Retirement was requested while records still reference the version.
 */
public class OutstandingReferencesException extends VaultException {

    private final String keyVersion;
    private final long outstandingReferences;

    public OutstandingReferencesException(String keyVersion, long outstandingReferences) {
        super("Key version " + keyVersion + " is still referenced by "
            + outstandingReferences + " record(s); migrate them or force retirement");
        this.keyVersion = keyVersion;
        this.outstandingReferences = outstandingReferences;
    }

    public String getKeyVersion() {
        return keyVersion;
    }

    public long getOutstandingReferences() {
        return outstandingReferences;
    }
}
