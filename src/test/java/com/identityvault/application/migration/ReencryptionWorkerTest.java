package com.identityvault.application.migration;

import com.identityvault.application.ProtectedRecordView;
import com.identityvault.domain.exception.NoActiveKeyException;
import com.identityvault.domain.model.KeyDomain;
import com.identityvault.domain.model.ProtectedRecord;
import com.identityvault.domain.model.RecordEnvelope;
import com.identityvault.support.VaultFixture;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ReencryptionWorkerTest {

    private final VaultFixture vault = new VaultFixture().withInitialKeys();

    private List<UUID> protect(int count) {
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ids.add(vault.service.protect("Person " + i, String.format("100-00-%04d", i)).getId());
            vault.clock.advance(Duration.ofSeconds(1));
        }
        return ids;
    }

    @Test
    void migrates_every_record_and_reports_lag() {
        List<UUID> ids = protect(3);
        vault.activate(KeyDomain.SEALING, "v2");

        MigrationReport report = vault.reencryptionWorker.runBatch("v1");

        assertEquals(3, report.getSelected());
        assertEquals(3, report.getMigrated());
        assertEquals(0, report.getConflicts());
        assertEquals(0, report.getFailures());
        assertEquals(0, report.getRemaining());
        assertEquals("v2", report.getTargetVersion());
        for (int i = 0; i < ids.size(); i++) {
            assertEquals("v2", vault.records.raw(ids.get(i)).getDekVersion());
            assertEquals(String.format("100-00-%04d", i), vault.service.reveal(ids.get(i)));
        }
        assertEquals(List.of(report), vault.reports, "observer sees every batch");
    }

    @Test
    void running_again_after_completion_is_a_no_op() {
        protect(2);
        vault.activate(KeyDomain.SEALING, "v2");
        vault.reencryptionWorker.runBatch("v1");
        int casBefore = vault.records.casCalls();

        MigrationReport again = vault.reencryptionWorker.runBatch("v1");

        assertEquals(0, again.getSelected());
        assertEquals(0, again.getMigrated());
        assertTrue(again.isDrained());
        assertEquals(casBefore, vault.records.casCalls());
    }

    @Test
    void migration_leaves_the_blind_index_alone() {
        UUID id = protect(1).get(0);
        String tokenBefore = vault.records.raw(id).getBlindIndex().getToken();
        vault.activate(KeyDomain.SEALING, "v2");

        vault.reencryptionWorker.runBatch("v1");

        assertEquals(tokenBefore, vault.records.raw(id).getBlindIndex().getToken());
        assertEquals("h1", vault.records.raw(id).getHmacVersion());
    }

    @Test
    void one_bad_record_does_not_stop_the_batch() {
        List<UUID> ids = protect(3);
        vault.activate(KeyDomain.SEALING, "v2");
        corruptTag(ids.get(1));

        MigrationReport report = vault.reencryptionWorker.runBatch("v1");

        assertEquals(2, report.getMigrated());
        assertEquals(1, report.getFailures());
        assertEquals(List.of(ids.get(1)), report.getFailedRecordIds());
        assertEquals(1, report.getRemaining());
        assertEquals("v1", vault.records.raw(ids.get(1)).getDekVersion(), "failed record left as it was");
        assertEquals("v2", vault.records.raw(ids.get(0)).getDekVersion());
        assertEquals("v2", vault.records.raw(ids.get(2)).getDekVersion());
    }

    @Test
    void authentication_failures_are_not_retried() {
        List<UUID> ids = protect(1);
        vault.activate(KeyDomain.SEALING, "v2");
        corruptTag(ids.get(0));
        int lookupsBefore = vault.keyMaterial.privateKeyLookups();

        MigrationReport report = vault.reencryptionWorker.runBatch("v1");

        assertEquals(1, report.getFailures());
        assertEquals(1, vault.keyMaterial.privateKeyLookups() - lookupsBefore, "opened exactly once");
        assertEquals(0, vault.records.casCalls());
    }

    @Test
    void failing_records_at_the_head_do_not_starve_the_rest() {
        List<UUID> ids = protect(4);
        vault.activate(KeyDomain.SEALING, "v2");
        corruptTag(ids.get(0));
        corruptTag(ids.get(1));

        MigrationReport first = vault.reencryptionWorker.runBatch("v1", 2, () -> false);
        vault.clock.advance(Duration.ofSeconds(30));
        MigrationReport second = vault.reencryptionWorker.runBatch("v1", 2, () -> false);

        assertEquals(List.of(ids.get(0), ids.get(1)), first.getFailedRecordIds());
        assertEquals(0, first.getMigrated());
        assertEquals(2, second.getMigrated());
        assertEquals(0, second.getFailures());
        assertEquals(2, second.getRemaining());
        assertEquals("v2", vault.records.raw(ids.get(2)).getDekVersion());
        assertEquals("v2", vault.records.raw(ids.get(3)).getDekVersion());
        assertNotNull(vault.records.raw(ids.get(0)).getMigrationFailedAt());
        assertNull(vault.records.raw(ids.get(2)).getMigrationFailedAt());
    }

    @Test
    void failed_records_are_retried_least_recently_failed_first() {
        List<UUID> ids = protect(3);
        vault.activate(KeyDomain.SEALING, "v2");
        ids.forEach(this::corruptTag);

        vault.reencryptionWorker.runBatch("v1", 2, () -> false);
        vault.clock.advance(Duration.ofSeconds(30));
        MigrationReport second = vault.reencryptionWorker.runBatch("v1", 2, () -> false);

        assertEquals(ids.get(2), second.getFailedRecordIds().get(0), "never-failed record goes first");
        assertEquals(ids.get(0), second.getFailedRecordIds().get(1));
    }

    @Test
    void overwrite_clears_the_failure_stamp() {
        UUID id = protect(1).get(0);
        vault.activate(KeyDomain.SEALING, "v2");
        corruptTag(id);
        vault.reencryptionWorker.runBatch("v1");
        assertNotNull(vault.records.raw(id).getMigrationFailedAt());

        vault.service.overwrite(id, "555-55-5555");

        ProtectedRecord rewritten = vault.records.raw(id);
        assertNull(rewritten.getMigrationFailedAt());
        assertEquals("v2", rewritten.getDekVersion());
    }

    @Test
    void transient_backend_failures_are_retried() {
        UUID id = protect(1).get(0);
        vault.activate(KeyDomain.SEALING, "v2");
        vault.records.failNextCas(2);

        MigrationReport report = vault.reencryptionWorker.runBatch("v1");

        assertEquals(1, report.getMigrated());
        assertEquals(0, report.getFailures());
        assertEquals(3, vault.records.casCalls());
        assertEquals("v2", vault.records.raw(id).getDekVersion());
    }

    @Test
    void exhausted_retries_count_as_a_failure() {
        UUID id = protect(1).get(0);
        vault.activate(KeyDomain.SEALING, "v2");
        vault.records.failNextCas(10);

        MigrationReport report = vault.reencryptionWorker.runBatch("v1");

        assertEquals(1, report.getFailures());
        assertEquals("v1", vault.records.raw(id).getDekVersion());
    }

    @Test
    void concurrent_overwrite_turns_into_a_conflict() {
        UUID id = protect(1).get(0);
        vault.activate(KeyDomain.SEALING, "v2");
        AtomicBoolean once = new AtomicBoolean();
        vault.records.beforeCas(() -> {
            if (once.compareAndSet(false, true)) {
                vault.service.overwrite(id, "999-99-9999");
            }
        });

        MigrationReport report = vault.reencryptionWorker.runBatch("v1");

        assertEquals(0, report.getMigrated());
        assertEquals(1, report.getConflicts());
        assertEquals(0, report.getFailures());
        assertEquals("999-99-9999", vault.service.reveal(id), "application write survives");
    }

    @Test
    void stop_signal_is_honored_between_records() {
        protect(5);
        vault.activate(KeyDomain.SEALING, "v2");
        AtomicInteger checks = new AtomicInteger();

        MigrationReport report = vault.reencryptionWorker.runBatch("v1", 100, () -> checks.incrementAndGet() > 2);

        assertTrue(report.isStopped());
        assertEquals(5, report.getSelected());
        assertEquals(2, report.getMigrated());
        assertEquals(3, report.getRemaining());
    }

    @Test
    void active_version_cannot_be_a_source() {
        protect(1);

        assertThrows(IllegalArgumentException.class, () -> vault.reencryptionWorker.runBatch("v1"));
    }

    @Test
    void future_version_cannot_be_a_source() {
        vault.lifecycle.register(KeyDomain.SEALING, "v3", "sealing-v3", VaultFixture.ACTOR);

        assertThrows(IllegalArgumentException.class, () -> vault.reencryptionWorker.runBatch("v3"));
    }

    @Test
    void missing_write_version_is_fatal() {
        VaultFixture empty = new VaultFixture();

        assertThrows(NoActiveKeyException.class, () -> empty.reencryptionWorker.runBatch("v1"));
    }

    @Test
    void racing_workers_migrate_each_record_exactly_once() throws Exception {
        List<UUID> ids = protect(20);
        vault.activate(KeyDomain.SEALING, "v2");

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<MigrationReport>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return vault.reencryptionWorker.runBatch("v1");
                }));
            }
            start.countDown();

            int migrated = 0;
            int failures = 0;
            for (Future<MigrationReport> future : futures) {
                MigrationReport report = future.get(60, TimeUnit.SECONDS);
                migrated += report.getMigrated();
                failures += report.getFailures();
            }

            assertEquals(20, migrated, "every record written by exactly one worker");
            assertEquals(0, failures);
        } finally {
            pool.shutdownNow();
        }

        for (int i = 0; i < ids.size(); i++) {
            ProtectedRecord record = vault.records.raw(ids.get(i));
            assertEquals("v2", record.getDekVersion());
            assertEquals(String.format("100-00-%04d", i), vault.service.reveal(ids.get(i)));
        }
    }

    @Test
    void migrated_records_stay_findable() {
        ProtectedRecordView view = vault.service.protect("Ada Lovelace", "123-45-6789");
        vault.activate(KeyDomain.SEALING, "v2");

        vault.reencryptionWorker.runBatch("v1");

        assertEquals(view.getId(), vault.service.findBySensitiveValue("123-45-6789").orElseThrow().getId());
    }

    private void corruptTag(UUID id) {
        ProtectedRecord record = vault.records.raw(id);
        RecordEnvelope envelope = record.getEnvelope();
        byte[] tag = envelope.getAuthTag();
        tag[0] ^= 0x01;
        record.overwrite(
            new RecordEnvelope(envelope.getEncryptedData(), envelope.getEncryptedKey(), envelope.getIv(), tag,
                envelope.getDekVersion()),
            record.getBlindIndex(),
            record.getUpdatedAt());
        vault.records.save(record);
    }
}
