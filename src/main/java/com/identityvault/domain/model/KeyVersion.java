package com.identityvault.domain.model;

import com.identityvault.domain.exception.InvalidKeyTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;

/**
 * A named generation of key material with an explicit lifecycle state.
 *
 * <p>Only an opaque reference to the material is stored here; the key bytes
 * themselves are resolved through the key material provider.
 *
 * @since 1.0.0
 */
@Entity
@Table(
    name = "key_versions",
    uniqueConstraints = @UniqueConstraint(name = "uq_key_versions_domain_version",
        columnNames = {"domain", "version_id"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class KeyVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "domain", nullable = false, length = 32)
    private KeyDomain domain;

    @Column(name = "version_id", nullable = false, length = 64)
    private String versionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 32)
    private KeyState state;

    /**
     * Handle understood by the key material provider (file stem, KMS alias).
     */
    @Column(name = "material_ref", nullable = false, length = 256)
    private String materialRef;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "activated_at")
    private Instant activatedAt;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;

    @Column(name = "retired_at")
    private Instant retiredAt;

    private KeyVersion(KeyDomain domain, String versionId, String materialRef, Instant createdAt) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.versionId = RecordEnvelope.validateVersionTag(versionId);
        this.materialRef = Objects.requireNonNull(materialRef, "materialRef");
        this.state = KeyState.FUTURE;
        this.createdAt = createdAt;
    }

    public static KeyVersion provision(KeyDomain domain, String versionId, String materialRef, Instant now) {
        return new KeyVersion(domain, versionId, materialRef, now);
    }

    /**
     * Rebuild a version with a known state, as stored.
     */
    public static KeyVersion reconstitute(
            KeyDomain domain,
            String versionId,
            String materialRef,
            KeyState state,
            Instant createdAt,
            Instant activatedAt,
            Instant deactivatedAt,
            Instant retiredAt) {

        KeyVersion version = new KeyVersion(domain, versionId, materialRef, createdAt);
        version.state = state;
        version.activatedAt = activatedAt;
        version.deactivatedAt = deactivatedAt;
        version.retiredAt = retiredAt;
        return version;
    }

    public void activate(Instant now) {
        moveTo(KeyState.ACTIVE_WRITE);
        this.activatedAt = now;
    }

    public void deactivate(Instant now) {
        moveTo(KeyState.DECRYPT_ONLY);
        this.deactivatedAt = now;
    }

    public void retire(Instant now) {
        moveTo(KeyState.RETIRED);
        this.retiredAt = now;
    }

    public void rollBack(Instant now) {
        if (!state.canRollBack()) {
            throw new InvalidKeyTransitionException(versionId, state, KeyState.ACTIVE_WRITE);
        }
        this.state = KeyState.ACTIVE_WRITE;
        this.activatedAt = now;
        this.deactivatedAt = null;
    }

    private void moveTo(KeyState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidKeyTransitionException(versionId, state, target);
        }
        this.state = target;
    }

    public boolean isReadable() {
        return state.isReadable();
    }

    public boolean isActiveWrite() {
        return state == KeyState.ACTIVE_WRITE;
    }

    @Override
    public String toString() {
        return "KeyVersion[" + domain + "/" + versionId + ", state=" + state + "]";
    }
}
