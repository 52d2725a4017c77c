package com.identityvault.domain.model;

/**
 * Lifecycle state of a key version.
 *
 * <p>Valid transitions:
 * <pre>
 *   FUTURE → ACTIVE_WRITE → DECRYPT_ONLY → RETIRED
 *                  ↑              │
 *                  └── rollback ──┘   (explicit operator action only)
 * </pre>
 */
public enum KeyState {

    /** Provisioned but not yet used for anything. */
    FUTURE,

    /** Used for new writes and for reads. At most one per domain. */
    ACTIVE_WRITE,

    /** Reads only; records tagged with it are awaiting migration. */
    DECRYPT_ONLY,

    /** Unusable. Records still tagged with it can no longer be read. */
    RETIRED;

    public boolean isReadable() {
        return this == ACTIVE_WRITE || this == DECRYPT_ONLY;
    }

    /**
     * Forward-only transition check. Rollback is not a forward move and is
     * validated separately by {@link #canRollBack()}.
     */
    public boolean canTransitionTo(KeyState target) {
        return switch (this) {
            case FUTURE -> target == ACTIVE_WRITE;
            case ACTIVE_WRITE -> target == DECRYPT_ONLY;
            case DECRYPT_ONLY -> target == RETIRED;
            case RETIRED -> false;
        };
    }

    public boolean canRollBack() {
        return this == DECRYPT_ONLY;
    }
}
