package com.identityvault.application;

import com.identityvault.domain.exception.InvalidKeyTransitionException;
import com.identityvault.domain.exception.NoActiveKeyException;
import com.identityvault.domain.exception.OutstandingReferencesException;
import com.identityvault.domain.exception.RetiredKeyException;
import com.identityvault.domain.exception.UnknownKeyVersionException;
import com.identityvault.domain.model.KeyDomain;
import com.identityvault.domain.model.KeyState;
import com.identityvault.domain.model.KeyVersion;
import com.identityvault.domain.repository.KeyVersionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Lifecycle bookkeeping for the key versions of one {@link KeyDomain}.
 *
 * <p>Resolves the single version used for writes and the versions permitted
 * for reads, and applies lifecycle transitions:
 * <pre>
 *   register  → FUTURE
 *   promote   FUTURE → ACTIVE_WRITE   (prior ACTIVE_WRITE → DECRYPT_ONLY)
 *   rollback  DECRYPT_ONLY → ACTIVE_WRITE   (current ACTIVE_WRITE → DECRYPT_ONLY)
 *   retire    DECRYPT_ONLY → RETIRED
 * </pre>
 *
 * <p>Promotion and rollback lock every version of the domain for the length
 * of the transaction, so exactly one ACTIVE_WRITE exists at any commit.
 *
 * <p>One instance per domain, wired explicitly; instances never share state.
 *
 * @since 1.0.0
 */
@Slf4j
@Transactional
public class KeyRegistry {

    private final KeyDomain domain;
    private final KeyVersionRepository repository;
    private final Duration retirementGracePeriod;
    private final Clock clock;

    public KeyRegistry(
            KeyDomain domain,
            KeyVersionRepository repository,
            Duration retirementGracePeriod,
            Clock clock) {

        this.domain = Objects.requireNonNull(domain, "domain");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.retirementGracePeriod = Objects.requireNonNull(retirementGracePeriod, "retirementGracePeriod");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public KeyDomain getDomain() {
        return domain;
    }

    /**
     * @throws NoActiveKeyException if no version is active for writes (fatal, not retried)
     */
    @Transactional(readOnly = true)
    public KeyVersion resolveForWrite() {
        List<KeyVersion> active = repository.findByDomainAndState(domain, KeyState.ACTIVE_WRITE);
        if (active.isEmpty()) {
            throw new NoActiveKeyException(domain);
        }
        if (active.size() > 1) {
            // Guarded by the promotion lock and the partial unique index; reaching this is a storage defect
            throw new IllegalStateException(
                "Multiple " + domain + " versions are ACTIVE_WRITE: " + active);
        }
        return active.get(0);
    }

    /**
     * @throws RetiredKeyException if the version is retired
     * @throws UnknownKeyVersionException if the version was never registered or is not yet active
     */
    @Transactional(readOnly = true)
    public KeyVersion resolveForRead(String versionId) {
        KeyVersion version = repository.findByDomainAndVersionId(domain, versionId)
            .orElseThrow(() -> new UnknownKeyVersionException(domain, versionId));

        return switch (version.getState()) {
            case ACTIVE_WRITE, DECRYPT_ONLY -> version;
            case RETIRED -> throw new RetiredKeyException(domain, versionId);
            case FUTURE -> throw new UnknownKeyVersionException(domain, versionId,
                domain + " key version " + versionId + " has not been promoted yet");
        };
    }

    /**
     * Look up a version in any state.
     */
    @Transactional(readOnly = true)
    public KeyVersion get(String versionId) {
        return repository.findByDomainAndVersionId(domain, versionId)
            .orElseThrow(() -> new UnknownKeyVersionException(domain, versionId));
    }

    @Transactional(readOnly = true)
    public List<KeyVersion> readableVersions() {
        return repository.findByDomain(domain).stream()
            .filter(KeyVersion::isReadable)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<KeyVersion> versionsInState(KeyState state) {
        return repository.findByDomainAndState(domain, state);
    }

    @Transactional(readOnly = true)
    public List<KeyVersion> allVersions() {
        return repository.findByDomain(domain);
    }

    /**
     * Register a new FUTURE version referencing already provisioned material.
     */
    public KeyVersion register(String versionId, String materialRef) {
        List<KeyVersion> locked = repository.lockDomain(domain);
        boolean exists = locked.stream().anyMatch(v -> v.getVersionId().equals(versionId));
        if (exists) {
            throw new InvalidKeyTransitionException(domain + " key version " + versionId + " already exists");
        }
        KeyVersion version = repository.save(KeyVersion.provision(domain, versionId, materialRef, now()));
        log.info("Registered {} key version {} (material {})", domain, versionId, materialRef);
        return version;
    }

    /**
     * FUTURE → ACTIVE_WRITE, demoting the prior ACTIVE_WRITE to DECRYPT_ONLY.
     */
    public KeyVersion promote(String versionId) {
        List<KeyVersion> locked = repository.lockDomain(domain);
        KeyVersion target = find(locked, versionId);
        if (target.getState() != KeyState.FUTURE) {
            throw new InvalidKeyTransitionException(versionId, target.getState(), KeyState.ACTIVE_WRITE);
        }
        return swapActive(locked, target, false);
    }

    /**
     * Operator rollback: re-promote a DECRYPT_ONLY version, demoting the current ACTIVE_WRITE.
     */
    public KeyVersion rollback(String versionId) {
        List<KeyVersion> locked = repository.lockDomain(domain);
        KeyVersion target = find(locked, versionId);
        if (!target.getState().canRollBack()) {
            throw new InvalidKeyTransitionException(versionId, target.getState(), KeyState.ACTIVE_WRITE);
        }
        return swapActive(locked, target, true);
    }

    /**
     * DECRYPT_ONLY → RETIRED.
     *
     * @throws OutstandingReferencesException if records still reference the version and retirement is not forced
     * @throws InvalidKeyTransitionException if the version is not DECRYPT_ONLY, or the grace period has not elapsed
     */
    public KeyVersion retire(String versionId, RetirementEvidence evidence) {
        Objects.requireNonNull(evidence, "evidence");
        List<KeyVersion> locked = repository.lockDomain(domain);
        KeyVersion target = find(locked, versionId);

        if (target.getState() != KeyState.DECRYPT_ONLY) {
            throw new InvalidKeyTransitionException(versionId, target.getState(), KeyState.RETIRED);
        }

        Instant now = now();
        if (evidence.forced()) {
            log.warn("Forced retirement of {} key version {}: {}. Records still tagged with it become unreadable",
                domain, versionId, evidence.reason());
        } else {
            if (evidence.outstandingReferences() > 0) {
                throw new OutstandingReferencesException(versionId, evidence.outstandingReferences());
            }
            Instant eligibleAt = target.getDeactivatedAt() == null
                ? now
                : target.getDeactivatedAt().plus(retirementGracePeriod);
            if (now.isBefore(eligibleAt)) {
                throw new InvalidKeyTransitionException(
                    domain + " key version " + versionId + " is in its retirement grace period until " + eligibleAt);
            }
        }

        target.retire(now);
        KeyVersion saved = repository.save(target);
        log.info("Retired {} key version {}", domain, versionId);
        return saved;
    }

    private KeyVersion swapActive(List<KeyVersion> locked, KeyVersion target, boolean rollback) {
        Instant now = now();
        locked.stream()
            .filter(v -> v.getState() == KeyState.ACTIVE_WRITE)
            .forEach(previous -> {
                previous.deactivate(now);
                repository.save(previous);
                log.info("Demoted {} key version {} to DECRYPT_ONLY", domain, previous.getVersionId());
            });

        if (rollback) {
            target.rollBack(now);
        } else {
            target.activate(now);
        }
        KeyVersion saved = repository.save(target);
        log.info("{} {} key version {} to ACTIVE_WRITE", rollback ? "Rolled back" : "Promoted", domain, target.getVersionId());
        return saved;
    }

    private KeyVersion find(List<KeyVersion> versions, String versionId) {
        return versions.stream()
            .filter(v -> v.getVersionId().equals(versionId))
            .findFirst()
            .orElseThrow(() -> new UnknownKeyVersionException(domain, versionId));
    }

    private Instant now() {
        return clock.instant();
    }
}
