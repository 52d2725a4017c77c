package com.identityvault.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Base64;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Persisted, versioned form of one hybrid-encrypted value.
 *
 * <p>Layout:
 * <ul>
 *   <li>{@code encrypted_data}: AES-256-GCM ciphertext, tag stripped</li>
 *   <li>{@code encrypted_key}: the per-record DEK wrapped with RSA-OAEP</li>
 *   <li>{@code iv}: 96-bit GCM nonce, unique per seal</li>
 *   <li>{@code auth_tag}: 128-bit GCM tag</li>
 *   <li>{@code dek_version}: the sealing key version that wrapped the DEK</li>
 * </ul>
 *
 * <p>Immutable. A record's envelope is only ever replaced as a whole, never
 * edited field by field.
 *
 * @since 1.0.0
 */
@Embeddable
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@EqualsAndHashCode
public final class RecordEnvelope implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;

    private static final Pattern VERSION_TAG = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");

    @Column(name = "encrypted_data", nullable = false, columnDefinition = "BYTEA")
    private byte[] encryptedData;

    @Column(name = "encrypted_key", nullable = false, columnDefinition = "BYTEA")
    private byte[] encryptedKey;

    @Column(name = "iv", nullable = false, columnDefinition = "BYTEA")
    private byte[] iv;

    @Column(name = "auth_tag", nullable = false, columnDefinition = "BYTEA")
    private byte[] authTag;

    @Column(name = "dek_version", nullable = false, length = 64)
    private String dekVersion;

    /**
     * @throws IllegalArgumentException if any component is missing or malformed
     */
    public RecordEnvelope(
            byte[] encryptedData,
            byte[] encryptedKey,
            byte[] iv,
            byte[] authTag,
            String dekVersion) {

        // Empty ciphertext is legal: GCM over an empty plaintext yields only a tag
        this.encryptedData = Objects.requireNonNull(encryptedData, "Encrypted data must not be null").clone();
        this.encryptedKey = Objects.requireNonNull(encryptedKey, "Encrypted key must not be null").clone();
        if (encryptedKey.length == 0) {
            throw new IllegalArgumentException("Encrypted key must not be empty");
        }

        this.iv = Objects.requireNonNull(iv, "IV must not be null").clone();
        if (iv.length != NONCE_LENGTH) {
            throw new IllegalArgumentException("AES-256-GCM requires 12-byte IV");
        }

        this.authTag = Objects.requireNonNull(authTag, "Auth tag must not be null").clone();
        if (authTag.length != TAG_LENGTH) {
            throw new IllegalArgumentException("AES-256-GCM requires 16-byte auth tag");
        }

        this.dekVersion = validateVersionTag(dekVersion);
    }

    /**
     * Validates a key version tag (alphanumeric, hyphens, underscores; at most 64 chars).
     */
    public static String validateVersionTag(String version) {
        if (version == null || !VERSION_TAG.matcher(version).matches()) {
            throw new IllegalArgumentException(
                "Invalid key version tag (must be 1-64 alphanumeric, hyphen or underscore characters)"
            );
        }
        return version;
    }

    public byte[] getEncryptedData() {
        return encryptedData.clone();
    }

    public byte[] getEncryptedKey() {
        return encryptedKey.clone();
    }

    public byte[] getIv() {
        return iv.clone();
    }

    public byte[] getAuthTag() {
        return authTag.clone();
    }

    public String getDekVersion() {
        return dekVersion;
    }

    /**
     * Ciphertext followed by tag, the layout JCE's GCM implementation expects on decrypt.
     */
    public byte[] ciphertextWithTag() {
        byte[] combined = new byte[encryptedData.length + authTag.length];
        System.arraycopy(encryptedData, 0, combined, 0, encryptedData.length);
        System.arraycopy(authTag, 0, combined, encryptedData.length, authTag.length);
        return combined;
    }

    /**
     * Does NOT expose key material or plaintext; ciphertext is truncated.
     */
    @Override
    public String toString() {
        String encoded = Base64.getEncoder().encodeToString(encryptedData);
        String truncated = encoded.length() > 16 ? encoded.substring(0, 16) + "..." : encoded;
        return String.format("RecordEnvelope[dekVersion=%s, encryptedData=%s]", dekVersion, truncated);
    }
}
