package com.identityvault.domain.exception;

import java.util.UUID;

/**
 * A record with the same blind index token already exists.
 */
public class DuplicateRecordException extends VaultException {

    private final UUID existingId;

    public DuplicateRecordException(UUID existingId) {
        super("Record already exists (ID: " + existingId + ")");
        this.existingId = existingId;
    }

    public UUID getExistingId() {
        return existingId;
    }
}
