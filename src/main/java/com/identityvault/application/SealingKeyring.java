package com.identityvault.application;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.identityvault.domain.model.KeyVersion;
import com.identityvault.domain.model.RecordEnvelope;
import com.identityvault.infrastructure.crypto.KeyMaterialProvider;
import com.identityvault.infrastructure.crypto.SealingCipher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * Seals under whichever sealing version is currently ACTIVE_WRITE.
 *
 * <p>One {@link SealingCipher} per version, bound on first use. Holds no private keys.
 */
@Component
@Slf4j
public class SealingKeyring implements PublicKeySource {

    private final KeyRegistry sealingRegistry;
    private final KeyMaterialProvider keyMaterial;
    private final SecureRandom secureRandom = new SecureRandom();
    private final Cache<String, SealingCipher> ciphers = Caffeine.newBuilder()
        .maximumSize(16)
        .build();

    public SealingKeyring(
            @Qualifier("sealingKeyRegistry") KeyRegistry sealingRegistry,
            KeyMaterialProvider keyMaterial) {
        this.sealingRegistry = sealingRegistry;
        this.keyMaterial = keyMaterial;
    }

    public RecordEnvelope seal(byte[] plaintext) {
        KeyVersion active = sealingRegistry.resolveForWrite();
        return seal(plaintext, active);
    }

    /**
     * Seal under an explicit version. The caller is responsible for having
     * resolved it as the write version.
     */
    public RecordEnvelope seal(byte[] plaintext, KeyVersion version) {
        return cipherFor(version).seal(plaintext).tag(version.getVersionId());
    }

    @Override
    public PublishedPublicKey currentPublicKey() {
        KeyVersion active = sealingRegistry.resolveForWrite();
        return new PublishedPublicKey(active.getVersionId(), keyMaterial.publicKeyPem(active));
    }

    private SealingCipher cipherFor(KeyVersion version) {
        return ciphers.get(version.getVersionId(), versionId -> {
            SealingCipher cipher = new SealingCipher(secureRandom);
            cipher.initialize(keyMaterial.publicKeyPem(version));
            if (log.isDebugEnabled()) {
                log.debug("Bound sealing cipher to version {}", versionId);
            }
            return cipher;
        });
    }
}
