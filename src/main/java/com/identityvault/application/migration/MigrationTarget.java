package com.identityvault.application.migration;

import com.identityvault.application.KeyRegistry;
import com.identityvault.domain.model.ProtectedRecord;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The versioned field a migration moves: how to find records still on a
 * source version and how to conditionally rewrite one of them.
 */
public interface MigrationTarget {

    KeyRegistry registry();

    List<ProtectedRecord> select(String sourceVersion, int limit);

    /**
     * Rewrite one record under the current write version.
     *
     * @throws com.identityvault.domain.exception.MigrationConflictException if the stored
     *         record no longer matches what was read
     */
    void migrate(ProtectedRecord record, String sourceVersion, UUID batchId);

    /**
     * Persist that {@code record} failed to migrate, so later selections
     * reach untried records before it.
     *
     * @return false if the record changed since it was read
     */
    boolean markFailed(ProtectedRecord record, String sourceVersion, Instant failedAt);

    long remaining(String sourceVersion);
}
