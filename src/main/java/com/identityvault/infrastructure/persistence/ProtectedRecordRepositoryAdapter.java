package com.identityvault.infrastructure.persistence;

import com.identityvault.domain.exception.DuplicateRecordException;
import com.identityvault.domain.model.BlindIndexEntry;
import com.identityvault.domain.model.ProtectedRecord;
import com.identityvault.domain.model.RecordEnvelope;
import com.identityvault.domain.repository.ProtectedRecordRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing the protected record port with Spring Data JPA.
 *
 * <p>No class-level transaction: every call, and in particular every
 * conditional update, commits on its own.
 */
@Component
@Slf4j
public class ProtectedRecordRepositoryAdapter implements ProtectedRecordRepository {

    private final SpringDataProtectedRecordRepository springDataRepository;

    @PersistenceContext
    private EntityManager entityManager;

    public ProtectedRecordRepositoryAdapter(SpringDataProtectedRecordRepository springDataRepository) {
        this.springDataRepository = springDataRepository;
    }

    @Override
    public Optional<ProtectedRecord> findById(UUID id) {
        return DataAccessTranslation.translate(() -> springDataRepository.findById(id));
    }

    @Override
    public Optional<ProtectedRecord> findByBlindIndex(String hmacVersion, String token) {
        return DataAccessTranslation.translate(() -> springDataRepository.findByBlindIndex(hmacVersion, token));
    }

    @Override
    public ProtectedRecord save(ProtectedRecord record) {
        try {
            ProtectedRecord saved = DataAccessTranslation.translate(() -> springDataRepository.saveAndFlush(record));
            if (log.isDebugEnabled()) {
                log.debug("Record persisted: id={}, dekVersion={}, hmacVersion={}",
                    saved.getId(), saved.getDekVersion(), saved.getHmacVersion());
            }
            return saved;
        } catch (DataIntegrityViolationException e) {
            BlindIndexEntry index = record.getBlindIndex();
            Optional<ProtectedRecord> existing = findByBlindIndex(index.getHmacVersion(), index.getToken());
            if (existing.isPresent() && !existing.get().getId().equals(record.getId())) {
                throw new DuplicateRecordException(existing.get().getId());
            }
            throw e;
        }
    }

    @Override
    public List<ProtectedRecord> findPage(int offset, int limit) {
        return DataAccessTranslation.translate(() -> entityManager
            .createQuery("SELECT r FROM ProtectedRecord r ORDER BY r.createdAt ASC, r.id ASC", ProtectedRecord.class)
            .setFirstResult(offset)
            .setMaxResults(limit)
            .getResultList());
    }

    @Override
    public long count() {
        return DataAccessTranslation.translate(springDataRepository::count);
    }

    @Override
    public List<ProtectedRecord> selectByDekVersion(String dekVersion, int limit) {
        return DataAccessTranslation.translate(
            () -> springDataRepository.selectByDekVersion(dekVersion, PageRequest.ofSize(limit)));
    }

    @Override
    public long countByDekVersion(String dekVersion) {
        return DataAccessTranslation.translate(() -> springDataRepository.countByDekVersion(dekVersion));
    }

    @Override
    public int markMigrationFailed(UUID id, String expectedDekVersion, byte[] expectedIv, Instant failedAt) {
        return DataAccessTranslation.translate(
            () -> springDataRepository.markMigrationFailed(id, expectedDekVersion, expectedIv, failedAt));
    }

    @Override
    public int compareAndSwapEnvelope(
            UUID id,
            String expectedDekVersion,
            byte[] expectedIv,
            RecordEnvelope replacement,
            Instant reencryptedAt,
            UUID batchId) {

        int updated = DataAccessTranslation.translate(() -> springDataRepository.compareAndSwapEnvelope(
            id,
            expectedDekVersion,
            expectedIv,
            replacement.getEncryptedData(),
            replacement.getEncryptedKey(),
            replacement.getIv(),
            replacement.getAuthTag(),
            replacement.getDekVersion(),
            reencryptedAt,
            batchId));

        if (log.isDebugEnabled()) {
            log.debug("Envelope CAS id={} {} -> {}: {} row(s)",
                id, expectedDekVersion, replacement.getDekVersion(), updated);
        }
        return updated;
    }

    @Override
    public List<ProtectedRecord> selectByHmacVersion(String hmacVersion, int limit) {
        return DataAccessTranslation.translate(
            () -> springDataRepository.selectByHmacVersion(hmacVersion, PageRequest.ofSize(limit)));
    }

    @Override
    public long countByHmacVersion(String hmacVersion) {
        return DataAccessTranslation.translate(() -> springDataRepository.countByHmacVersion(hmacVersion));
    }

    @Override
    public int markReindexFailed(UUID id, String expectedHmacVersion, String expectedToken, Instant failedAt) {
        return DataAccessTranslation.translate(
            () -> springDataRepository.markReindexFailed(id, expectedHmacVersion, expectedToken, failedAt));
    }

    @Override
    public int compareAndSwapBlindIndex(
            UUID id,
            String expectedHmacVersion,
            String expectedToken,
            BlindIndexEntry replacement,
            Instant reindexedAt,
            UUID batchId) {

        int updated = DataAccessTranslation.translate(() -> springDataRepository.compareAndSwapBlindIndex(
            id,
            expectedHmacVersion,
            expectedToken,
            replacement.getHmacVersion(),
            replacement.getToken(),
            reindexedAt,
            batchId));

        if (log.isDebugEnabled()) {
            log.debug("Blind index CAS id={} {} -> {}: {} row(s)",
                id, expectedHmacVersion, replacement.getHmacVersion(), updated);
        }
        return updated;
    }
}
