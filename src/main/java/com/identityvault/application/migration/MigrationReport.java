package com.identityvault.application.migration;

import com.identityvault.domain.model.KeyDomain;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Result of one bounded migration batch.
 */
@Value
@Builder
public class MigrationReport {
    UUID batchId;
    KeyDomain domain;
    String sourceVersion;
    String targetVersion;
    int selected;
    int migrated;
    int conflicts;
    int failures;
    @Singular
    List<UUID> failedRecordIds;
    /** Records still tagged with the source version after the batch. */
    long remaining;
    boolean stopped;
    Duration elapsed;

    public boolean isDrained() {
        return remaining == 0;
    }
}
