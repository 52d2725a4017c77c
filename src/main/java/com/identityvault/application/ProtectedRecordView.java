package com.identityvault.application;

import com.identityvault.domain.model.ProtectedRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record metadata without the sensitive value.
 */
@Value
@Builder
public class ProtectedRecordView {
    UUID id;
    String fullName;
    String dekVersion;
    String hmacVersion;
    Instant createdAt;
    Instant updatedAt;
    Instant reencryptedAt;
    UUID migrationBatchId;

    public static ProtectedRecordView from(ProtectedRecord record) {
        return ProtectedRecordView.builder()
            .id(record.getId())
            .fullName(record.getFullName())
            .dekVersion(record.getDekVersion())
            .hmacVersion(record.getHmacVersion())
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt())
            .reencryptedAt(record.getReencryptedAt())
            .migrationBatchId(record.getMigrationBatchId())
            .build();
    }
}
