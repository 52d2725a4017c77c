package com.identityvault.application.migration;

/**
 * What happened to one selected record.
 */
public enum MigrationOutcome {
    MIGRATED,
    /** Another writer changed the record first; nothing was written. */
    CONFLICT,
    FAILED
}
