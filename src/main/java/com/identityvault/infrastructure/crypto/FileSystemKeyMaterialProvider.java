package com.identityvault.infrastructure.crypto;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.identityvault.config.VaultProperties;
import com.identityvault.domain.exception.InitializationException;
import com.identityvault.domain.exception.TransientBackendException;
import com.identityvault.domain.exception.UnknownKeyVersionException;
import com.identityvault.domain.model.KeyDomain;
import com.identityvault.domain.model.KeyVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.spec.InvalidKeySpecException;
import java.util.Base64;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Key material kept as files in a local directory.
 *
 * <p>Layout per material reference:
 * <ul>
 *   <li>{@code <ref>.public.pem} / {@code <ref>.private.pem}: RSA key pair for sealing versions</li>
 *   <li>{@code <ref>.hmac}: base64 HMAC secret for blind index versions, unless
 *       {@code vault.blind-index.secrets.<ref>} supplies one</li>
 * </ul>
 *
 * <p>Parsed keys are immutable per version and cached with Caffeine.
 * Production deployments replace this provider with a KMS-backed one.
 */
@Component
@Slf4j
public class FileSystemKeyMaterialProvider implements KeyMaterialProvider {

    private static final Pattern MATERIAL_REF = Pattern.compile("^[A-Za-z0-9_.-]{1,128}$");
    private static final int HMAC_KEY_BYTES = 32;

    private final Path directory;
    private final int rsaKeySize;
    private final boolean generateMissing;
    private final Map<String, String> configuredSecrets;
    private final SecureRandom secureRandom = new SecureRandom();

    private final Cache<String, String> publicKeys;
    private final Cache<String, PrivateKey> privateKeys;
    private final Cache<String, SecretKey> hmacKeys;

    public FileSystemKeyMaterialProvider(VaultProperties properties) {
        VaultProperties.Keys keys = properties.getKeys();
        this.directory = Paths.get(keys.getDirectory());
        this.rsaKeySize = keys.getRsaKeySize();
        this.generateMissing = keys.isGenerateMissing();
        this.configuredSecrets = Map.copyOf(properties.getBlindIndex().getSecrets());

        this.publicKeys = newCache(keys);
        this.privateKeys = newCache(keys);
        this.hmacKeys = newCache(keys);
    }

    private static <V> Cache<String, V> newCache(VaultProperties.Keys keys) {
        return Caffeine.newBuilder()
            .maximumSize(keys.getCacheMaximumSize())
            .expireAfterAccess(keys.getCacheExpireAfterAccess())
            .build();
    }

    @Override
    public synchronized void provision(KeyDomain domain, String materialRef) {
        validateRef(materialRef);
        try {
            switch (domain) {
                case SEALING -> provisionKeyPair(materialRef);
                case BLIND_INDEX -> provisionHmacSecret(materialRef);
            }
        } catch (IOException e) {
            throw new TransientBackendException("Failed to write key material for " + materialRef, e);
        }
    }

    private void provisionKeyPair(String ref) throws IOException {
        Path publicPath = publicKeyPath(ref);
        Path privatePath = privateKeyPath(ref);
        if (Files.exists(publicPath) && Files.exists(privatePath)) {
            log.debug("RSA key pair already present for {}", ref);
            return;
        }
        requireGeneration(KeyDomain.SEALING, ref);

        KeyPair pair;
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(rsaKeySize, secureRandom);
            pair = generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new InitializationException("Failed to generate RSA key pair for " + ref, e);
        }

        Files.createDirectories(directory);
        writeSecret(privatePath, PemCodec.encodePrivateKey(pair.getPrivate()));
        Files.writeString(publicPath, PemCodec.encodePublicKey(pair.getPublic()), StandardCharsets.US_ASCII);

        log.info("Generated {}-bit RSA key pair for material {}", rsaKeySize, ref);
    }

    private void provisionHmacSecret(String ref) throws IOException {
        if (configuredSecrets.containsKey(ref) || Files.exists(hmacKeyPath(ref))) {
            log.debug("HMAC secret already present for {}", ref);
            return;
        }
        requireGeneration(KeyDomain.BLIND_INDEX, ref);

        byte[] secret = new byte[HMAC_KEY_BYTES];
        secureRandom.nextBytes(secret);
        Files.createDirectories(directory);
        writeSecret(hmacKeyPath(ref), Base64.getEncoder().encodeToString(secret));

        log.info("Generated HMAC secret for material {}", ref);
    }

    @Override
    public String publicKeyPem(KeyVersion version) {
        requireDomain(version, KeyDomain.SEALING);
        return publicKeys.get(version.getMaterialRef(),
            ref -> readMaterial(version, publicKeyPath(ref)));
    }

    @Override
    public PrivateKey privateKey(KeyVersion version) {
        requireDomain(version, KeyDomain.SEALING);
        return privateKeys.get(version.getMaterialRef(), ref -> {
            String pem = readMaterial(version, privateKeyPath(ref));
            try {
                return PemCodec.decodePrivateKey(pem);
            } catch (InvalidKeySpecException e) {
                throw new InitializationException("Private key material for " + ref + " is malformed", e);
            }
        });
    }

    @Override
    public SecretKey hmacKey(KeyVersion version) {
        requireDomain(version, KeyDomain.BLIND_INDEX);
        return hmacKeys.get(version.getMaterialRef(), ref -> {
            String encoded = configuredSecrets.containsKey(ref)
                ? configuredSecrets.get(ref)
                : readMaterial(version, hmacKeyPath(ref));
            try {
                byte[] secret = Base64.getDecoder().decode(encoded.trim());
                if (secret.length < 16) {
                    throw new InitializationException("HMAC secret for " + ref + " is shorter than 128 bits");
                }
                return new SecretKeySpec(secret, HmacTokenizer.ALGORITHM);
            } catch (IllegalArgumentException e) {
                throw new InitializationException("HMAC secret for " + ref + " is not valid base64", e);
            }
        });
    }

    private String readMaterial(KeyVersion version, Path path) {
        validateRef(version.getMaterialRef());
        if (!Files.exists(path)) {
            throw new UnknownKeyVersionException(version.getDomain(), version.getVersionId(),
                "No key material found for " + version.getDomain() + " version " + version.getVersionId());
        }
        try {
            return Files.readString(path, StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new TransientBackendException("Failed to read key material for " + version.getVersionId(), e);
        }
    }

    private void writeSecret(Path path, String content) throws IOException {
        Files.writeString(path, content, StandardCharsets.US_ASCII);
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.warn("File system does not support POSIX permissions; restrict access to {} manually", path);
        }
    }

    private void requireGeneration(KeyDomain domain, String ref) {
        if (!generateMissing) {
            throw new UnknownKeyVersionException(domain, ref,
                "No key material for " + ref + " and generation of missing material is disabled");
        }
    }

    private static void requireDomain(KeyVersion version, KeyDomain expected) {
        if (version.getDomain() != expected) {
            throw new IllegalArgumentException(
                "Expected a " + expected + " key version but got " + version);
        }
    }

    private static void validateRef(String ref) {
        if (ref == null || !MATERIAL_REF.matcher(ref).matches() || ref.contains("..")) {
            throw new IllegalArgumentException("Invalid key material reference: " + ref);
        }
    }

    private Path publicKeyPath(String ref) {
        return directory.resolve(ref + ".public.pem");
    }

    private Path privateKeyPath(String ref) {
        return directory.resolve(ref + ".private.pem");
    }

    private Path hmacKeyPath(String ref) {
        return directory.resolve(ref + ".hmac");
    }
}
