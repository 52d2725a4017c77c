package com.identityvault.application.migration;

import com.identityvault.application.EnvelopeOpener;
import com.identityvault.application.KeyRegistry;
import com.identityvault.application.SealingKeyring;
import com.identityvault.config.VaultProperties;
import com.identityvault.domain.exception.MigrationConflictException;
import com.identityvault.domain.model.KeyVersion;
import com.identityvault.domain.model.ProtectedRecord;
import com.identityvault.domain.model.RecordEnvelope;
import com.identityvault.domain.repository.ProtectedRecordRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Moves envelopes off a DECRYPT_ONLY sealing version onto the active one.
 *
 * <p>Each record is opened under its own version, resealed with a fresh DEK
 * and nonce, and written back only if the stored version and nonce are still
 * the ones that were read.
 */
@Component
public class ReencryptionWorker implements MigrationTarget {

    private final MigrationEngine engine;
    private final KeyRegistry sealingRegistry;
    private final EnvelopeOpener opener;
    private final SealingKeyring keyring;
    private final ProtectedRecordRepository records;
    private final Clock clock;
    private final int defaultBatchSize;

    public ReencryptionWorker(
            MigrationEngine engine,
            @Qualifier("sealingKeyRegistry") KeyRegistry sealingRegistry,
            EnvelopeOpener opener,
            SealingKeyring keyring,
            ProtectedRecordRepository records,
            Clock clock,
            VaultProperties properties) {
        this.engine = engine;
        this.sealingRegistry = sealingRegistry;
        this.opener = opener;
        this.keyring = keyring;
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
        return sealingRegistry;
    }

    @Override
    public List<ProtectedRecord> select(String sourceVersion, int limit) {
        return records.selectByDekVersion(sourceVersion, limit);
    }

    @Override
    public void migrate(ProtectedRecord record, String sourceVersion, UUID batchId) {
        RecordEnvelope observed = record.getEnvelope();
        if (!sourceVersion.equals(observed.getDekVersion())) {
            throw new MigrationConflictException(record.getId(), sourceVersion);
        }

        byte[] plaintext = opener.open(observed);
        try {
            KeyVersion target = sealingRegistry.resolveForWrite();
            RecordEnvelope fresh = keyring.seal(plaintext, target);
            int updated = records.compareAndSwapEnvelope(
                record.getId(), sourceVersion, observed.getIv(), fresh, clock.instant(), batchId);
            if (updated == 0) {
                throw new MigrationConflictException(record.getId(), sourceVersion);
            }
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    @Override
    public boolean markFailed(ProtectedRecord record, String sourceVersion, Instant failedAt) {
        return records.markMigrationFailed(record.getId(), sourceVersion, record.getEnvelope().getIv(), failedAt) > 0;
    }

    @Override
    public long remaining(String sourceVersion) {
        return records.countByDekVersion(sourceVersion);
    }
}
