package com.identityvault.domain.model;

import com.identityvault.domain.exception.InvalidKeyTransitionException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class KeyStateTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void only_active_and_decrypt_only_are_readable() {
        assertFalse(KeyState.FUTURE.isReadable());
        assertTrue(KeyState.ACTIVE_WRITE.isReadable());
        assertTrue(KeyState.DECRYPT_ONLY.isReadable());
        assertFalse(KeyState.RETIRED.isReadable());
    }

    @Test
    void forward_transitions_follow_the_lifecycle() {
        assertTrue(KeyState.FUTURE.canTransitionTo(KeyState.ACTIVE_WRITE));
        assertTrue(KeyState.ACTIVE_WRITE.canTransitionTo(KeyState.DECRYPT_ONLY));
        assertTrue(KeyState.DECRYPT_ONLY.canTransitionTo(KeyState.RETIRED));

        assertFalse(KeyState.FUTURE.canTransitionTo(KeyState.DECRYPT_ONLY));
        assertFalse(KeyState.ACTIVE_WRITE.canTransitionTo(KeyState.RETIRED));
        assertFalse(KeyState.DECRYPT_ONLY.canTransitionTo(KeyState.ACTIVE_WRITE));
        for (KeyState target : KeyState.values()) {
            assertFalse(KeyState.RETIRED.canTransitionTo(target), "RETIRED is terminal");
        }
    }

    @Test
    void key_version_walks_the_full_lifecycle() {
        KeyVersion version = KeyVersion.provision(KeyDomain.SEALING, "v1", "sealing-v1", NOW);
        assertEquals(KeyState.FUTURE, version.getState());

        version.activate(NOW.plusSeconds(1));
        assertTrue(version.isActiveWrite());
        assertEquals(NOW.plusSeconds(1), version.getActivatedAt());

        version.deactivate(NOW.plusSeconds(2));
        assertEquals(KeyState.DECRYPT_ONLY, version.getState());

        version.retire(NOW.plusSeconds(3));
        assertEquals(KeyState.RETIRED, version.getState());
        assertEquals(NOW.plusSeconds(3), version.getRetiredAt());
    }

    @Test
    void rollback_only_from_decrypt_only() {
        KeyVersion version = KeyVersion.provision(KeyDomain.SEALING, "v1", "sealing-v1", NOW);
        assertThrows(InvalidKeyTransitionException.class, () -> version.rollBack(NOW));

        version.activate(NOW);
        version.deactivate(NOW.plusSeconds(5));
        version.rollBack(NOW.plusSeconds(10));

        assertTrue(version.isActiveWrite());
        assertNull(version.getDeactivatedAt());
    }

    @Test
    void retiring_an_active_version_is_rejected() {
        KeyVersion version = KeyVersion.provision(KeyDomain.BLIND_INDEX, "h1", "bi-h1", NOW);
        version.activate(NOW);

        InvalidKeyTransitionException e = assertThrows(InvalidKeyTransitionException.class,
            () -> version.retire(NOW));
        assertTrue(e.getMessage().contains("h1"));
        assertTrue(version.isActiveWrite(), "state unchanged after a rejected move");
    }
}
