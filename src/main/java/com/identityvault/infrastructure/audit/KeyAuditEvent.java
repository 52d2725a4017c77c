package com.identityvault.infrastructure.audit;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "key_audit_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class KeyAuditEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String domain;

    @Column(nullable = false, length = 32)
    private String action;

    @Column(nullable = false, name = "key_version", length = 64)
    private String keyVersion;

    @Column(nullable = false, length = 128)
    private String actor;

    @Column(nullable = false, length = 1024)
    private String detail;

    @Column(nullable = false, name = "created_at")
    private Instant createdAt;
}
