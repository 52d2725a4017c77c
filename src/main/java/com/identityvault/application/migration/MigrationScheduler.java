package com.identityvault.application.migration;

import com.identityvault.application.KeyRegistry;
import com.identityvault.domain.exception.VaultException;
import com.identityvault.domain.model.KeyState;
import com.identityvault.domain.model.KeyVersion;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.function.BooleanSupplier;

/**
 * Drives both workers over every DECRYPT_ONLY version on a fixed delay.
 *
 * <p>One batch per version per tick. Stopping or pausing takes effect
 * between records.
 */
@Component
@ConditionalOnProperty(prefix = "vault.migration", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class MigrationScheduler {

    private final ReencryptionWorker reencryptionWorker;
    private final BlindIndexReindexWorker reindexWorker;
    private final KeyRegistry sealingRegistry;
    private final KeyRegistry blindIndexRegistry;

    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);

    public MigrationScheduler(
            ReencryptionWorker reencryptionWorker,
            BlindIndexReindexWorker reindexWorker,
            @Qualifier("sealingKeyRegistry") KeyRegistry sealingRegistry,
            @Qualifier("blindIndexKeyRegistry") KeyRegistry blindIndexRegistry) {
        this.reencryptionWorker = reencryptionWorker;
        this.reindexWorker = reindexWorker;
        this.sealingRegistry = sealingRegistry;
        this.blindIndexRegistry = blindIndexRegistry;
    }

    @Scheduled(
        initialDelayString = "${vault.migration.poll-interval:30s}",
        fixedDelayString = "${vault.migration.poll-interval:30s}")
    public void tick() {
        if (paused.get() || stopping.get()) {
            return;
        }
        drain(sealingRegistry, reencryptionWorker::runBatch);
        drain(blindIndexRegistry, reindexWorker::runBatch);
    }

    private void drain(KeyRegistry registry, BiFunction<String, BooleanSupplier, MigrationReport> worker) {
        for (KeyVersion source : registry.versionsInState(KeyState.DECRYPT_ONLY)) {
            if (paused.get() || stopping.get()) {
                return;
            }
            try {
                worker.apply(source.getVersionId(), this::stopRequested);
            } catch (VaultException | IllegalArgumentException e) {
                // Configuration problems abort this domain's tick; the next tick tries again
                log.error("Migration of {} key version {} aborted: {}",
                    registry.getDomain(), source.getVersionId(), e.getMessage(), e);
                return;
            }
        }
    }

    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.info("Migration paused");
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("Migration resumed");
        }
    }

    public boolean isPaused() {
        return paused.get();
    }

    /**
     * Stop signal for in-flight batches.
     */
    boolean stopRequested() {
        return paused.get() || stopping.get();
    }

    @PreDestroy
    public void stop() {
        stopping.set(true);
        log.info("Migration stopping");
    }
}
