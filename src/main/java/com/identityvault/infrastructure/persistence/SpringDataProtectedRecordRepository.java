package com.identityvault.infrastructure.persistence;

import com.identityvault.domain.model.ProtectedRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for protected records.
 *
 * <p>The conditional updates are single statements; the WHERE clause is the
 * compare half of compare-and-swap. Selection puts records that have never
 * failed on the version ahead of those that have, so a run of permanently
 * failing records cannot starve the rest.
 */
@Repository
public interface SpringDataProtectedRecordRepository extends JpaRepository<ProtectedRecord, UUID> {

    @Query("SELECT r FROM ProtectedRecord r WHERE r.blindIndex.hmacVersion = :version AND r.blindIndex.token = :token")
    Optional<ProtectedRecord> findByBlindIndex(@Param("version") String hmacVersion, @Param("token") String token);

    @Query("""
        SELECT r FROM ProtectedRecord r
        WHERE r.envelope.dekVersion = :version
        ORDER BY r.migrationFailedAt ASC NULLS FIRST, r.updatedAt ASC, r.id ASC
        """)
    List<ProtectedRecord> selectByDekVersion(@Param("version") String dekVersion, Pageable page);

    @Query("SELECT COUNT(r) FROM ProtectedRecord r WHERE r.envelope.dekVersion = :version")
    long countByDekVersion(@Param("version") String dekVersion);

    @Query("""
        SELECT r FROM ProtectedRecord r
        WHERE r.blindIndex.hmacVersion = :version
        ORDER BY r.reindexFailedAt ASC NULLS FIRST, r.updatedAt ASC, r.id ASC
        """)
    List<ProtectedRecord> selectByHmacVersion(@Param("version") String hmacVersion, Pageable page);

    @Query("SELECT COUNT(r) FROM ProtectedRecord r WHERE r.blindIndex.hmacVersion = :version")
    long countByHmacVersion(@Param("version") String hmacVersion);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ProtectedRecord r SET
            r.envelope.encryptedData = :encryptedData,
            r.envelope.encryptedKey = :encryptedKey,
            r.envelope.iv = :iv,
            r.envelope.authTag = :authTag,
            r.envelope.dekVersion = :dekVersion,
            r.reencryptedAt = :reencryptedAt,
            r.migrationBatchId = :batchId,
            r.migrationFailedAt = NULL
        WHERE r.id = :id
          AND r.envelope.dekVersion = :expectedVersion
          AND r.envelope.iv = :expectedIv
        """)
    int compareAndSwapEnvelope(
        @Param("id") UUID id,
        @Param("expectedVersion") String expectedVersion,
        @Param("expectedIv") byte[] expectedIv,
        @Param("encryptedData") byte[] encryptedData,
        @Param("encryptedKey") byte[] encryptedKey,
        @Param("iv") byte[] iv,
        @Param("authTag") byte[] authTag,
        @Param("dekVersion") String dekVersion,
        @Param("reencryptedAt") Instant reencryptedAt,
        @Param("batchId") UUID batchId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ProtectedRecord r SET
            r.blindIndex.hmacVersion = :hmacVersion,
            r.blindIndex.token = :token,
            r.reindexedAt = :reindexedAt,
            r.reindexBatchId = :batchId,
            r.reindexFailedAt = NULL
        WHERE r.id = :id
          AND r.blindIndex.hmacVersion = :expectedVersion
          AND r.blindIndex.token = :expectedToken
        """)
    int compareAndSwapBlindIndex(
        @Param("id") UUID id,
        @Param("expectedVersion") String expectedVersion,
        @Param("expectedToken") String expectedToken,
        @Param("hmacVersion") String hmacVersion,
        @Param("token") String token,
        @Param("reindexedAt") Instant reindexedAt,
        @Param("batchId") UUID batchId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ProtectedRecord r SET r.migrationFailedAt = :failedAt
        WHERE r.id = :id
          AND r.envelope.dekVersion = :expectedVersion
          AND r.envelope.iv = :expectedIv
        """)
    int markMigrationFailed(
        @Param("id") UUID id,
        @Param("expectedVersion") String expectedVersion,
        @Param("expectedIv") byte[] expectedIv,
        @Param("failedAt") Instant failedAt);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE ProtectedRecord r SET r.reindexFailedAt = :failedAt
        WHERE r.id = :id
          AND r.blindIndex.hmacVersion = :expectedVersion
          AND r.blindIndex.token = :expectedToken
        """)
    int markReindexFailed(
        @Param("id") UUID id,
        @Param("expectedVersion") String expectedVersion,
        @Param("expectedToken") String expectedToken,
        @Param("failedAt") Instant failedAt);
}
