package com.identityvault.infrastructure.audit;

/**
 * Records key lifecycle events: registration, promotion, rollback, retirement.
 */
public interface AuditService {
    void record(String domain, String action, String keyVersion, String actor, String detail);
}
