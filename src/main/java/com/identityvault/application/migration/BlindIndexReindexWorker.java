package com.identityvault.application.migration;

import com.identityvault.application.BlindIndexer;
import com.identityvault.application.EnvelopeOpener;
import com.identityvault.application.KeyRegistry;
import com.identityvault.config.VaultProperties;
import com.identityvault.domain.exception.MigrationConflictException;
import com.identityvault.domain.model.BlindIndexEntry;
import com.identityvault.domain.model.ProtectedRecord;
import com.identityvault.domain.repository.ProtectedRecordRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Recomputes blind index tokens off a DECRYPT_ONLY HMAC version.
 * The envelope itself is not touched.
 */
@Component
public class BlindIndexReindexWorker implements MigrationTarget {

    private final MigrationEngine engine;
    private final KeyRegistry blindIndexRegistry;
    private final EnvelopeOpener opener;
    private final BlindIndexer indexer;
    private final ProtectedRecordRepository records;
    private final Clock clock;
    private final int defaultBatchSize;

    public BlindIndexReindexWorker(
            MigrationEngine engine,
            @Qualifier("blindIndexKeyRegistry") KeyRegistry blindIndexRegistry,
            EnvelopeOpener opener,
            BlindIndexer indexer,
            ProtectedRecordRepository records,
            Clock clock,
            VaultProperties properties) {
        this.engine = engine;
        this.blindIndexRegistry = blindIndexRegistry;
        this.opener = opener;
        this.indexer = indexer;
        this.records = records;
        this.clock = clock;
        this.defaultBatchSize = properties.getMigration().getBatchSize();
    }

    public MigrationReport runBatch(String sourceVersion) {
        return runBatch(sourceVersion, defaultBatchSize, () -> false);
    }

    public MigrationReport runBatch(String sourceVersion, BooleanSupplier stopRequested) {
        return runBatch(sourceVersion, defaultBatchSize, stopRequested);
    }

    public MigrationReport runBatch(String sourceVersion, int batchSize, BooleanSupplier stopRequested) {
        return engine.run(this, sourceVersion, batchSize, stopRequested);
    }

    @Override
    public KeyRegistry registry() {
        return blindIndexRegistry;
    }

    @Override
    public List<ProtectedRecord> select(String sourceVersion, int limit) {
        return records.selectByHmacVersion(sourceVersion, limit);
    }

    @Override
    public void migrate(ProtectedRecord record, String sourceVersion, UUID batchId) {
        BlindIndexEntry observed = record.getBlindIndex();
        if (!sourceVersion.equals(observed.getHmacVersion())) {
            throw new MigrationConflictException(record.getId(), sourceVersion);
        }

        byte[] plaintext = opener.open(record.getEnvelope());
        try {
            BlindIndexEntry fresh = indexer.index(new String(plaintext, StandardCharsets.UTF_8));
            int updated = records.compareAndSwapBlindIndex(
                record.getId(), sourceVersion, observed.getToken(), fresh, clock.instant(), batchId);
            if (updated == 0) {
                throw new MigrationConflictException(record.getId(), sourceVersion);
            }
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    @Override
    public boolean markFailed(ProtectedRecord record, String sourceVersion, Instant failedAt) {
        return records.markReindexFailed(record.getId(), sourceVersion, record.getBlindIndex().getToken(), failedAt) > 0;
    }

    @Override
    public long remaining(String sourceVersion) {
        return records.countByHmacVersion(sourceVersion);
    }
}
