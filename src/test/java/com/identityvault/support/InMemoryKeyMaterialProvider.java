package com.identityvault.support;

import com.identityvault.domain.exception.UnknownKeyVersionException;
import com.identityvault.domain.model.KeyDomain;
import com.identityvault.domain.model.KeyVersion;
import com.identityvault.infrastructure.crypto.KeyMaterialProvider;
import com.identityvault.infrastructure.crypto.PemCodec;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryKeyMaterialProvider implements KeyMaterialProvider {

    private final Map<String, KeyPair> keyPairs = new ConcurrentHashMap<>();
    private final Map<String, SecretKey> hmacKeys = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();
    private final AtomicInteger privateKeyLookups = new AtomicInteger();

    @Override
    public void provision(KeyDomain domain, String materialRef) {
        switch (domain) {
            case SEALING -> keyPairs.computeIfAbsent(materialRef, ref -> generateKeyPair());
            case BLIND_INDEX -> hmacKeys.computeIfAbsent(materialRef, ref -> {
                byte[] secret = new byte[32];
                random.nextBytes(secret);
                return new SecretKeySpec(secret, "HmacSHA256");
            });
        }
    }

    @Override
    public String publicKeyPem(KeyVersion version) {
        return PemCodec.encodePublicKey(keyPair(version).getPublic());
    }

    @Override
    public PrivateKey privateKey(KeyVersion version) {
        privateKeyLookups.incrementAndGet();
        return keyPair(version).getPrivate();
    }

    @Override
    public SecretKey hmacKey(KeyVersion version) {
        SecretKey key = hmacKeys.get(version.getMaterialRef());
        if (key == null) {
            throw new UnknownKeyVersionException(KeyDomain.BLIND_INDEX, version.getVersionId());
        }
        return key;
    }

    /** One lookup per unseal attempt. */
    public int privateKeyLookups() {
        return privateKeyLookups.get();
    }

    /** Replace a version's key pair with an unrelated one, as if the material had been swapped. */
    public void replaceKeyPair(String materialRef) {
        keyPairs.put(materialRef, generateKeyPair());
    }

    private KeyPair keyPair(KeyVersion version) {
        KeyPair pair = keyPairs.get(version.getMaterialRef());
        if (pair == null) {
            throw new UnknownKeyVersionException(KeyDomain.SEALING, version.getVersionId());
        }
        return pair;
    }

    private static KeyPair generateKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(2048);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }
}
