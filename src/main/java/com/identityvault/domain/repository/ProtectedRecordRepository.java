package com.identityvault.domain.repository;

import com.identityvault.domain.model.BlindIndexEntry;
import com.identityvault.domain.model.ProtectedRecord;
import com.identityvault.domain.model.RecordEnvelope;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage contract for protected records.
 *
 * <p>Implementations must provide:
 * <ul>
 *   <li>Point reads by id and by blind index</li>
 *   <li>Bounded selection by key version: records without a failure marker
 *       first, oldest-updated first, then failed records least recently
 *       failed first</li>
 *   <li>Conditional updates of the versioned fields that replace them
 *       atomically and report the number of rows affected</li>
 * </ul>
 *
 * <p>Transient storage failures surface as
 * {@link com.identityvault.domain.exception.TransientBackendException}.
 *
 * @since 1.0.0
 */
public interface ProtectedRecordRepository {

    Optional<ProtectedRecord> findById(UUID id);

    Optional<ProtectedRecord> findByBlindIndex(String hmacVersion, String token);

    /**
     * Create or fully overwrite a record.
     */
    ProtectedRecord save(ProtectedRecord record);

    List<ProtectedRecord> findPage(int offset, int limit);

    long count();

    /**
     * Up to {@code limit} records whose envelope carries {@code dekVersion}.
     */
    List<ProtectedRecord> selectByDekVersion(String dekVersion, int limit);

    long countByDekVersion(String dekVersion);

    /**
     * Stamp a failed re-encryption attempt, only if the envelope is still
     * the one that was read.
     *
     * @return rows affected
     */
    int markMigrationFailed(UUID id, String expectedDekVersion, byte[] expectedIv, Instant failedAt);

    /**
     * Replace the envelope only if the stored version and nonce still equal
     * what the caller read.
     *
     * @return rows affected, 0 when another writer got there first
     */
    int compareAndSwapEnvelope(
        UUID id,
        String expectedDekVersion,
        byte[] expectedIv,
        RecordEnvelope replacement,
        Instant reencryptedAt,
        UUID batchId);

    List<ProtectedRecord> selectByHmacVersion(String hmacVersion, int limit);

    long countByHmacVersion(String hmacVersion);

    /**
     * Stamp a failed reindex attempt, only if the blind index is still the
     * one that was read.
     *
     * @return rows affected
     */
    int markReindexFailed(UUID id, String expectedHmacVersion, String expectedToken, Instant failedAt);

    /**
     * Replace the blind index only if the stored version and token still
     * equal what the caller read.
     *
     * @return rows affected, 0 when another writer got there first
     */
    int compareAndSwapBlindIndex(
        UUID id,
        String expectedHmacVersion,
        String expectedToken,
        BlindIndexEntry replacement,
        Instant reindexedAt,
        UUID batchId);
}
