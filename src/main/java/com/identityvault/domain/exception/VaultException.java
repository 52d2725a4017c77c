package com.identityvault.domain.exception;

/**
 * Base type for every failure raised by the vault core.
 *
 * <p>All vault errors are unchecked. Callers distinguish them by type:
 * cryptographic failures are surfaced as-is and never retried, configuration
 * failures are fatal, and only {@link TransientBackendException} is eligible
 * for retry with backoff.
 *
 * @since 1.0.0
 */
public abstract class VaultException extends RuntimeException {

    protected VaultException(String message) {
        super(message);
    }

    protected VaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
