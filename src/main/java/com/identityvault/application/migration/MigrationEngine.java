package com.identityvault.application.migration;

import com.identityvault.domain.exception.AuthenticationFailureException;
import com.identityvault.domain.exception.MigrationConflictException;
import com.identityvault.domain.exception.NoActiveKeyException;
import com.identityvault.domain.model.KeyDomain;
import com.identityvault.domain.model.KeyState;
import com.identityvault.domain.model.KeyVersion;
import com.identityvault.domain.model.ProtectedRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Runs one bounded batch of a {@link MigrationTarget}.
 *
 * <p>Per-record failures are isolated: the record's value stays as it was,
 * it is reported and stamped as failed, and the batch moves on. The stamp
 * sends it behind every untried record on the next selection. Transient backend failures are retried
 * with backoff before counting as failures. Configuration errors abort the
 * batch.
 *
 * <p>Holds no state between invocations. Concurrent batches over the same
 * source version are safe; the conditional write lets exactly one of them
 * win each record.
 */
@Component
@Slf4j
public class MigrationEngine {

    private final RetryTemplate retryTemplate;
    private final MigrationObserver observer;
    private final Clock clock;

    public MigrationEngine(
            @Qualifier("migrationRetryTemplate") RetryTemplate retryTemplate,
            MigrationObserver observer,
            Clock clock) {
        this.retryTemplate = retryTemplate;
        this.observer = observer;
        this.clock = clock;
    }

    /**
     * @param stopRequested checked between records; the record in flight always completes
     * @throws NoActiveKeyException if the domain has no write version
     * @throws IllegalArgumentException if the source version is the write version or not DECRYPT_ONLY
     */
    public MigrationReport run(
            MigrationTarget target,
            String sourceVersion,
            int batchSize,
            BooleanSupplier stopRequested) {

        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive");
        }
        KeyDomain domain = target.registry().getDomain();
        KeyVersion writeVersion = target.registry().resolveForWrite();
        checkSource(domain, target.registry().get(sourceVersion), writeVersion);

        UUID batchId = UUID.randomUUID();
        Instant startedAt = clock.instant();
        List<ProtectedRecord> batch = retryTemplate.execute(ctx -> target.select(sourceVersion, batchSize));

        if (log.isDebugEnabled()) {
            log.debug("Batch {} selected {} {} records on {}", batchId, batch.size(), domain, sourceVersion);
        }

        MigrationReport.MigrationReportBuilder report = MigrationReport.builder()
            .batchId(batchId)
            .domain(domain)
            .sourceVersion(sourceVersion)
            .targetVersion(writeVersion.getVersionId())
            .selected(batch.size());

        int migrated = 0;
        int conflicts = 0;
        int failures = 0;
        boolean stopped = false;

        for (ProtectedRecord record : batch) {
            if (stopRequested.getAsBoolean()) {
                stopped = true;
                log.info("Batch {} stopping on request after {} of {} records",
                    batchId, migrated + conflicts + failures, batch.size());
                break;
            }
            switch (migrateOne(target, record, sourceVersion, batchId)) {
                case MIGRATED -> migrated++;
                case CONFLICT -> conflicts++;
                case FAILED -> {
                    failures++;
                    report.failedRecordId(record.getId());
                    markFailed(target, record, sourceVersion);
                }
            }
        }

        long remaining = retryTemplate.execute(ctx -> target.remaining(sourceVersion));

        MigrationReport result = report
            .migrated(migrated)
            .conflicts(conflicts)
            .failures(failures)
            .remaining(remaining)
            .stopped(stopped)
            .elapsed(Duration.between(startedAt, clock.instant()))
            .build();

        log.info("Batch {} {} {} -> {}: selected={} migrated={} conflicts={} failures={} remaining={}",
            batchId, domain, sourceVersion, result.getTargetVersion(),
            result.getSelected(), migrated, conflicts, failures, remaining);

        observer.onBatchCompleted(result);
        return result;
    }

    private MigrationOutcome migrateOne(MigrationTarget target, ProtectedRecord record, String sourceVersion, UUID batchId) {
        try {
            retryTemplate.execute(ctx -> {
                if (ctx.getRetryCount() > 0) {
                    log.warn("Retrying record {} (attempt {}): {}",
                        record.getId(), ctx.getRetryCount() + 1, ctx.getLastThrowable().getMessage());
                }
                target.migrate(record, sourceVersion, batchId);
                return null;
            });
            return MigrationOutcome.MIGRATED;
        } catch (MigrationConflictException e) {
            if (log.isDebugEnabled()) {
                log.debug("Record {} changed concurrently; skipped", record.getId());
            }
            return MigrationOutcome.CONFLICT;
        } catch (NoActiveKeyException e) {
            throw e;
        } catch (AuthenticationFailureException e) {
            log.error("Record {} failed authentication under {} and was left untouched",
                record.getId(), e.getKeyVersion());
            return MigrationOutcome.FAILED;
        } catch (RuntimeException e) {
            log.warn("Record {} could not be migrated and was left untouched: {}", record.getId(), e.getMessage());
            return MigrationOutcome.FAILED;
        }
    }

    private void markFailed(MigrationTarget target, ProtectedRecord record, String sourceVersion) {
        try {
            if (!target.markFailed(record, sourceVersion, clock.instant()) && log.isDebugEnabled()) {
                log.debug("Record {} changed before its failure could be stamped", record.getId());
            }
        } catch (RuntimeException e) {
            log.warn("Could not stamp failure on record {}; it stays at the head of the queue: {}",
                record.getId(), e.getMessage());
        }
    }

    private static void checkSource(KeyDomain domain, KeyVersion source, KeyVersion writeVersion) {
        if (source.getVersionId().equals(writeVersion.getVersionId())) {
            throw new IllegalArgumentException(
                domain + " key version " + source.getVersionId() + " is the write version and cannot be a migration source");
        }
        if (source.getState() != KeyState.DECRYPT_ONLY) {
            throw new IllegalArgumentException(
                domain + " key version " + source.getVersionId() + " is " + source.getState() + ", expected DECRYPT_ONLY");
        }
    }
}
