package com.identityvault.infrastructure.persistence;

import com.identityvault.domain.exception.TransientBackendException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

import java.util.function.Supplier;

/**
 * Maps Spring's retryable data access failures onto {@link TransientBackendException}.
 * Everything else propagates unchanged.
 */
final class DataAccessTranslation {

    private DataAccessTranslation() {
    }

    static <T> T translate(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (TransientDataAccessException
                 | DataAccessResourceFailureException
                 | RecoverableDataAccessException e) {
            throw new TransientBackendException("Storage temporarily unavailable: " + e.getMessage(), e);
        }
    }
}
