package com.identityvault.application;

import com.identityvault.domain.model.KeyDomain;
import com.identityvault.domain.model.KeyVersion;
import com.identityvault.domain.repository.ProtectedRecordRepository;
import com.identityvault.infrastructure.audit.AuditService;
import com.identityvault.infrastructure.crypto.KeyMaterialProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Operator-facing key rotation.
 *
 * <p>Each registry call commits on its own; the audit event is written after
 * the transition is durable.
 */
@Service
@Slf4j
public class KeyLifecycleService {

    private final KeyRegistry sealingRegistry;
    private final KeyRegistry blindIndexRegistry;
    private final KeyMaterialProvider keyMaterial;
    private final ProtectedRecordRepository records;
    private final AuditService audit;

    public KeyLifecycleService(
            @Qualifier("sealingKeyRegistry") KeyRegistry sealingRegistry,
            @Qualifier("blindIndexKeyRegistry") KeyRegistry blindIndexRegistry,
            KeyMaterialProvider keyMaterial,
            ProtectedRecordRepository records,
            AuditService audit) {
        this.sealingRegistry = sealingRegistry;
        this.blindIndexRegistry = blindIndexRegistry;
        this.keyMaterial = keyMaterial;
        this.records = records;
        this.audit = audit;
    }

    public KeyVersion register(KeyDomain domain, String versionId, String materialRef, String actor) {
        keyMaterial.provision(domain, materialRef);
        KeyVersion version = registry(domain).register(versionId, materialRef);
        audit.record(domain.name(), "REGISTER", versionId, actor, "material=" + materialRef);
        return version;
    }

    public KeyVersion promote(KeyDomain domain, String versionId, String actor) {
        KeyVersion version = registry(domain).promote(versionId);
        audit.record(domain.name(), "PROMOTE", versionId, actor, "state=" + version.getState());
        return version;
    }

    public KeyVersion rollback(KeyDomain domain, String versionId, String actor) {
        KeyVersion version = registry(domain).rollback(versionId);
        audit.record(domain.name(), "ROLLBACK", versionId, actor, "state=" + version.getState());
        return version;
    }

    /**
     * Retire a DECRYPT_ONLY version. Unforced retirement requires that no
     * record still references the version.
     */
    public KeyVersion retire(KeyDomain domain, String versionId, String actor) {
        long outstanding = outstandingReferences(domain, versionId);
        KeyVersion version = registry(domain).retire(versionId, RetirementEvidence.referenceCount(outstanding));
        audit.record(domain.name(), "RETIRE", versionId, actor, "outstanding=0");
        return version;
    }

    public KeyVersion forceRetire(KeyDomain domain, String versionId, String actor, String reason) {
        long outstanding = outstandingReferences(domain, versionId);
        KeyVersion version = registry(domain).retire(versionId, RetirementEvidence.forced(reason));
        audit.record(domain.name(), "FORCE_RETIRE", versionId, actor,
            "outstanding=" + outstanding + " reason=" + reason);
        return version;
    }

    public long outstandingReferences(KeyDomain domain, String versionId) {
        return switch (domain) {
            case SEALING -> records.countByDekVersion(versionId);
            case BLIND_INDEX -> records.countByHmacVersion(versionId);
        };
    }

    public List<KeyVersion> versions(KeyDomain domain) {
        return registry(domain).allVersions();
    }

    KeyRegistry registry(KeyDomain domain) {
        return switch (domain) {
            case SEALING -> sealingRegistry;
            case BLIND_INDEX -> blindIndexRegistry;
        };
    }
}
