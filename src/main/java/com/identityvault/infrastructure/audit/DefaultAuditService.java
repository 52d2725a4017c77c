package com.identityvault.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultAuditService implements AuditService {
    private final KeyAuditEventRepository events;
    private final Clock clock;

    @Override
    public void record(String domain, String action, String keyVersion, String actor, String detail) {
        log.info("AUDIT domain={} action={} keyVersion={} actor={} detail={}",
                domain, action, keyVersion, actor, detail);
        try {
            KeyAuditEvent evt = KeyAuditEvent.builder()
                    .domain(domain)
                    .action(action)
                    .keyVersion(keyVersion)
                    .actor(actor)
                    .detail(detail)
                    .createdAt(clock.instant())
                    .build();
            events.save(evt);
        } catch (DataAccessException e) {
            // The transition itself has already been applied; the log line above is the record of it
            log.warn("Failed to persist audit event domain={} action={} keyVersion={}: {}",
                    domain, action, keyVersion, e.getMessage());
        }
    }
}
