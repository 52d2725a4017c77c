package com.identityvault.infrastructure.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface KeyAuditEventRepository extends JpaRepository<KeyAuditEvent, Long> {
    List<KeyAuditEvent> findByDomainAndKeyVersionOrderByCreatedAtAsc(String domain, String keyVersion);
}
