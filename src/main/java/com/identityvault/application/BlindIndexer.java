package com.identityvault.application;

import com.identityvault.domain.model.BlindIndexEntry;
import com.identityvault.domain.model.KeyVersion;
import com.identityvault.infrastructure.crypto.HmacTokenizer;
import com.identityvault.infrastructure.crypto.KeyMaterialProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Deterministic equality tokens for sensitive values, keyed per blind index version.
 */
@Component
public class BlindIndexer {

    private final KeyRegistry blindIndexRegistry;
    private final KeyMaterialProvider keyMaterial;

    public BlindIndexer(
            @Qualifier("blindIndexKeyRegistry") KeyRegistry blindIndexRegistry,
            KeyMaterialProvider keyMaterial) {
        this.blindIndexRegistry = blindIndexRegistry;
        this.keyMaterial = keyMaterial;
    }

    public String tokenize(String plaintext, String hmacVersion) {
        KeyVersion version = blindIndexRegistry.resolveForRead(hmacVersion);
        return HmacTokenizer.tokenize(keyMaterial.hmacKey(version), plaintext);
    }

    /**
     * Token under the active version, ready to store.
     */
    public BlindIndexEntry index(String plaintext) {
        KeyVersion active = blindIndexRegistry.resolveForWrite();
        return new BlindIndexEntry(active.getVersionId(), HmacTokenizer.tokenize(keyMaterial.hmacKey(active), plaintext));
    }

    /**
     * One entry per readable version, so lookups keep matching records that
     * have not been reindexed yet. Active version first.
     */
    public List<BlindIndexEntry> readableEntries(String plaintext) {
        return blindIndexRegistry.readableVersions().stream()
            .sorted((a, b) -> Boolean.compare(!a.isActiveWrite(), !b.isActiveWrite()))
            .map(v -> new BlindIndexEntry(v.getVersionId(), HmacTokenizer.tokenize(keyMaterial.hmacKey(v), plaintext)))
            .toList();
    }
}
