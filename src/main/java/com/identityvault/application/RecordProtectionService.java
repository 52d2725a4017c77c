package com.identityvault.application;

import com.identityvault.domain.exception.DuplicateRecordException;
import com.identityvault.domain.exception.RecordNotFoundException;
import com.identityvault.domain.model.BlindIndexEntry;
import com.identityvault.domain.model.KeyVersion;
import com.identityvault.domain.model.ProtectedRecord;
import com.identityvault.domain.model.RecordEnvelope;
import com.identityvault.domain.repository.ProtectedRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Application entry point for protected records.
 *
 * <p>Every write stores an envelope under the active sealing version and a
 * blind index under the active HMAC version, so application writes never
 * add work for the migration workers.
 *
 * <p>Plaintext is held only for the duration of a call and never logged.
 */
@Service
@Slf4j
public class RecordProtectionService {

    private static final int MAX_PAGE_SIZE = 500;

    private final ProtectedRecordRepository records;
    private final KeyRegistry sealingRegistry;
    private final SealingKeyring keyring;
    private final EnvelopeOpener opener;
    private final BlindIndexer indexer;
    private final Clock clock;

    public RecordProtectionService(
            ProtectedRecordRepository records,
            @Qualifier("sealingKeyRegistry") KeyRegistry sealingRegistry,
            SealingKeyring keyring,
            EnvelopeOpener opener,
            BlindIndexer indexer,
            Clock clock) {
        this.records = records;
        this.sealingRegistry = sealingRegistry;
        this.keyring = keyring;
        this.opener = opener;
        this.indexer = indexer;
        this.clock = clock;
    }

    /**
     * Store a value sealed by a client under a published public key.
     *
     * <p>The envelope is opened to verify it and compute the blind index.
     * A client that sealed under a version demoted since it fetched the
     * public key gets its value resealed under the active version.
     *
     * @throws com.identityvault.domain.exception.AuthenticationFailureException if the envelope does not verify
     * @throws DuplicateRecordException if a record with the same value exists
     */
    public ProtectedRecordView ingest(String fullName, RecordEnvelope clientEnvelope) {
        byte[] plaintext = opener.open(clientEnvelope);
        try {
            String value = new String(plaintext, StandardCharsets.UTF_8);
            rejectDuplicate(value, null);

            KeyVersion active = sealingRegistry.resolveForWrite();
            RecordEnvelope stored = clientEnvelope;
            if (!active.getVersionId().equals(clientEnvelope.getDekVersion())) {
                log.info("Client sealed under {} while {} is active; resealing",
                    clientEnvelope.getDekVersion(), active.getVersionId());
                stored = keyring.seal(plaintext, active);
            }

            ProtectedRecord record = ProtectedRecord.create(
                UUID.randomUUID(), fullName, stored, indexer.index(value), clock.instant());
            ProtectedRecord saved = records.save(record);
            log.info("Ingested record {} under {}", saved.getId(), saved.getDekVersion());
            return ProtectedRecordView.from(saved);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    /**
     * Seal a value server-side and store it.
     */
    public ProtectedRecordView protect(String fullName, String value) {
        rejectDuplicate(value, null);
        RecordEnvelope envelope = keyring.seal(value.getBytes(StandardCharsets.UTF_8));
        ProtectedRecord record = ProtectedRecord.create(
            UUID.randomUUID(), fullName, envelope, indexer.index(value), clock.instant());
        ProtectedRecord saved = records.save(record);
        log.info("Protected record {} under {}", saved.getId(), saved.getDekVersion());
        return ProtectedRecordView.from(saved);
    }

    /**
     * @throws RecordNotFoundException if no such record exists
     * @throws com.identityvault.domain.exception.RetiredKeyException if the record's sealing version is retired
     */
    public String reveal(UUID id) {
        ProtectedRecord record = records.findById(id).orElseThrow(() -> new RecordNotFoundException(id));
        byte[] plaintext = opener.open(record.getEnvelope());
        try {
            return new String(plaintext, StandardCharsets.UTF_8);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    /**
     * Replace the sensitive value; always written under the active versions.
     */
    public ProtectedRecordView overwrite(UUID id, String value) {
        ProtectedRecord record = records.findById(id).orElseThrow(() -> new RecordNotFoundException(id));
        rejectDuplicate(value, id);

        RecordEnvelope envelope = keyring.seal(value.getBytes(StandardCharsets.UTF_8));
        BlindIndexEntry index = indexer.index(value);
        record.overwrite(envelope, index, clock.instant());
        ProtectedRecord saved = records.save(record);
        log.info("Overwrote record {} under {}", id, saved.getDekVersion());
        return ProtectedRecordView.from(saved);
    }

    /**
     * Equality lookup through the blind index, across every readable HMAC version.
     */
    public Optional<ProtectedRecordView> findBySensitiveValue(String value) {
        return findByValue(value).map(ProtectedRecordView::from);
    }

    public RecordPage list(int skip, int limit) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must not be negative");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        List<ProtectedRecordView> data = records.findPage(skip, limit).stream()
            .map(ProtectedRecordView::from)
            .toList();
        return new RecordPage(data, records.count());
    }

    private Optional<ProtectedRecord> findByValue(String value) {
        for (BlindIndexEntry entry : indexer.readableEntries(value)) {
            Optional<ProtectedRecord> match = records.findByBlindIndex(entry.getHmacVersion(), entry.getToken());
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    private void rejectDuplicate(String value, UUID self) {
        findByValue(value)
            .filter(existing -> !existing.getId().equals(self))
            .ifPresent(existing -> {
                throw new DuplicateRecordException(existing.getId());
            });
    }
}
