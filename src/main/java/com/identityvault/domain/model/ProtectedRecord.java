package com.identityvault.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A protected identity record: a display name, the sealed sensitive value
 * and its blind index.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>The envelope is replaced whole, either by {@link #overwrite} or by a
 *       migration worker's conditional update, never edited in place</li>
 *   <li>An application overwrite always carries the current write versions and
 *       clears the migration markers</li>
 *   <li>A migration failure marker is set only while the record is still on the
 *       version that failed; it moves the record behind untried ones</li>
 *   <li>The sensitive value is never held in cleartext</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Entity
@Table(
    name = "protected_records",
    indexes = {
        @Index(name = "idx_protected_records_dek_version", columnList = "dek_version, migration_failed_at, updated_at"),
        @Index(name = "idx_protected_records_hmac_version", columnList = "hmac_version, reindex_failed_at, updated_at"),
        @Index(name = "idx_protected_records_blind_index", columnList = "hmac_version, blind_index", unique = true)
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class ProtectedRecord {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "full_name", nullable = false, length = 255)
    private String fullName;

    @Embedded
    private RecordEnvelope envelope;

    @Embedded
    private BlindIndexEntry blindIndex;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "reencrypted_at")
    private Instant reencryptedAt;

    @Column(name = "migration_batch_id")
    private UUID migrationBatchId;

    @Column(name = "migration_failed_at")
    private Instant migrationFailedAt;

    @Column(name = "reindexed_at")
    private Instant reindexedAt;

    @Column(name = "reindex_batch_id")
    private UUID reindexBatchId;

    @Column(name = "reindex_failed_at")
    private Instant reindexFailedAt;

    private ProtectedRecord(
            UUID id,
            String fullName,
            RecordEnvelope envelope,
            BlindIndexEntry blindIndex,
            Instant createdAt) {

        this.id = Objects.requireNonNull(id, "id");
        this.fullName = Objects.requireNonNull(fullName, "fullName");
        this.envelope = Objects.requireNonNull(envelope, "envelope");
        this.blindIndex = Objects.requireNonNull(blindIndex, "blindIndex");
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public static ProtectedRecord create(
            UUID id,
            String fullName,
            RecordEnvelope envelope,
            BlindIndexEntry blindIndex,
            Instant now) {

        return new ProtectedRecord(id, fullName, envelope, blindIndex, now);
    }

    /**
     * Reconstitute a record from storage.
     */
    public static ProtectedRecord reconstitute(
            UUID id,
            String fullName,
            RecordEnvelope envelope,
            BlindIndexEntry blindIndex,
            Instant createdAt,
            Instant updatedAt,
            Instant reencryptedAt,
            UUID migrationBatchId,
            Instant migrationFailedAt,
            Instant reindexedAt,
            UUID reindexBatchId,
            Instant reindexFailedAt) {

        ProtectedRecord record = new ProtectedRecord(id, fullName, envelope, blindIndex, createdAt);
        record.updatedAt = updatedAt;
        record.reencryptedAt = reencryptedAt;
        record.migrationBatchId = migrationBatchId;
        record.migrationFailedAt = migrationFailedAt;
        record.reindexedAt = reindexedAt;
        record.reindexBatchId = reindexBatchId;
        record.reindexFailedAt = reindexFailedAt;
        return record;
    }

    /**
     * Full application overwrite with a freshly sealed value.
     */
    public void overwrite(RecordEnvelope freshEnvelope, BlindIndexEntry freshIndex, Instant now) {
        this.envelope = Objects.requireNonNull(freshEnvelope, "envelope");
        this.blindIndex = Objects.requireNonNull(freshIndex, "blindIndex");
        this.updatedAt = now;
        this.reencryptedAt = null;
        this.migrationBatchId = null;
        this.migrationFailedAt = null;
        this.reindexedAt = null;
        this.reindexBatchId = null;
        this.reindexFailedAt = null;
    }

    public String getDekVersion() {
        return envelope.getDekVersion();
    }

    public String getHmacVersion() {
        return blindIndex.getHmacVersion();
    }
}
