package com.identityvault.application.migration;

import com.identityvault.application.KeyRegistry;
import com.identityvault.domain.exception.NoActiveKeyException;
import com.identityvault.domain.model.KeyDomain;
import com.identityvault.domain.model.KeyState;
import com.identityvault.domain.model.KeyVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MigrationSchedulerTest {

    @Mock
    ReencryptionWorker reencryptionWorker;
    @Mock
    BlindIndexReindexWorker reindexWorker;
    @Mock
    KeyRegistry sealingRegistry;
    @Mock
    KeyRegistry blindIndexRegistry;

    private MigrationScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new MigrationScheduler(reencryptionWorker, reindexWorker, sealingRegistry, blindIndexRegistry);
    }

    private static KeyVersion decryptOnly(KeyDomain domain, String id) {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        return KeyVersion.reconstitute(domain, id, "ref-" + id, KeyState.DECRYPT_ONLY, now, now, now, null);
    }

    @Test
    void tick_runs_one_batch_per_decrypt_only_version_in_each_domain() {
        when(sealingRegistry.versionsInState(KeyState.DECRYPT_ONLY))
            .thenReturn(List.of(decryptOnly(KeyDomain.SEALING, "v1"), decryptOnly(KeyDomain.SEALING, "v2")));
        when(blindIndexRegistry.versionsInState(KeyState.DECRYPT_ONLY))
            .thenReturn(List.of(decryptOnly(KeyDomain.BLIND_INDEX, "h1")));

        scheduler.tick();

        verify(reencryptionWorker).runBatch(eq("v1"), any(BooleanSupplier.class));
        verify(reencryptionWorker).runBatch(eq("v2"), any(BooleanSupplier.class));
        verify(reindexWorker).runBatch(eq("h1"), any(BooleanSupplier.class));
    }

    @Test
    void paused_scheduler_does_nothing_until_resumed() {
        scheduler.pause();
        scheduler.tick();

        assertTrue(scheduler.isPaused());
        verifyNoInteractions(reencryptionWorker, reindexWorker, sealingRegistry, blindIndexRegistry);

        when(sealingRegistry.versionsInState(KeyState.DECRYPT_ONLY)).thenReturn(List.of());
        when(blindIndexRegistry.versionsInState(KeyState.DECRYPT_ONLY)).thenReturn(List.of());
        scheduler.resume();
        scheduler.tick();

        assertFalse(scheduler.isPaused());
        verify(sealingRegistry).versionsInState(KeyState.DECRYPT_ONLY);
    }

    @Test
    void stop_signal_passed_to_workers_follows_pause() {
        when(sealingRegistry.versionsInState(KeyState.DECRYPT_ONLY))
            .thenReturn(List.of(decryptOnly(KeyDomain.SEALING, "v1")));
        when(blindIndexRegistry.versionsInState(KeyState.DECRYPT_ONLY)).thenReturn(List.of());

        scheduler.tick();

        ArgumentCaptor<BooleanSupplier> stop = ArgumentCaptor.forClass(BooleanSupplier.class);
        verify(reencryptionWorker).runBatch(eq("v1"), stop.capture());
        assertFalse(stop.getValue().getAsBoolean());
        scheduler.pause();
        assertTrue(stop.getValue().getAsBoolean());
    }

    @Test
    void configuration_failure_in_one_domain_does_not_block_the_other() {
        when(sealingRegistry.versionsInState(KeyState.DECRYPT_ONLY))
            .thenReturn(List.of(decryptOnly(KeyDomain.SEALING, "v1")));
        when(sealingRegistry.getDomain()).thenReturn(KeyDomain.SEALING);
        when(reencryptionWorker.runBatch(eq("v1"), any(BooleanSupplier.class)))
            .thenThrow(new NoActiveKeyException(KeyDomain.SEALING));
        when(blindIndexRegistry.versionsInState(KeyState.DECRYPT_ONLY))
            .thenReturn(List.of(decryptOnly(KeyDomain.BLIND_INDEX, "h1")));

        scheduler.tick();

        verify(reindexWorker).runBatch(eq("h1"), any(BooleanSupplier.class));
    }

    @Test
    void stopped_scheduler_ignores_ticks() {
        scheduler.stop();
        scheduler.tick();

        verify(reencryptionWorker, never()).runBatch(anyString(), any(BooleanSupplier.class));
    }
}
