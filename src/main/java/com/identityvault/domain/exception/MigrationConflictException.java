package com.identityvault.domain.exception;

import java.util.UUID;

/**
 * A conditional write matched no row: another worker or an application
 * overwrite got there first. Expected under concurrency and absorbed as a
 * no-op by the migration engine.
 */
public class MigrationConflictException extends VaultException {

    private final UUID recordId;

    public MigrationConflictException(UUID recordId, String expectedVersion) {
        super("Record " + recordId + " no longer carries version " + expectedVersion);
        this.recordId = recordId;
    }

    public UUID getRecordId() {
        return recordId;
    }
}
