package com.identityvault.infrastructure.crypto;

import com.identityvault.domain.exception.EncryptionException;
import com.identityvault.domain.exception.InitializationException;
import com.identityvault.domain.exception.NotInitializedException;
import com.identityvault.domain.model.SealedPayload;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sealing half of the hybrid scheme. Holds a public key only.
 *
 * <p>Each {@link #seal} call:
 * <ol>
 *   <li>generates a fresh AES-256 DEK and a fresh 96-bit nonce</li>
 *   <li>encrypts with AES-256-GCM, splitting off the 128-bit tag</li>
 *   <li>wraps the DEK with RSA-OAEP (SHA-256)</li>
 * </ol>
 * The DEK never outlives the call and is never logged.
 *
 * <p>Thread-safe: the imported key is the only shared state and is read-only
 * once set. One instance is bound to one key version.
 *
 * @since 1.0.0
 */
@Slf4j
public class SealingCipher {

    private final SecureRandom secureRandom;
    private final AtomicReference<RSAPublicKey> publicKey = new AtomicReference<>();

    public SealingCipher() {
        this(new SecureRandom());
    }

    public SealingCipher(SecureRandom secureRandom) {
        this.secureRandom = Objects.requireNonNull(secureRandom, "secureRandom");
    }

    /**
     * Import a PEM-encoded SubjectPublicKeyInfo.
     *
     * @throws InitializationException if the material is malformed, not RSA, or too short
     */
    public void initialize(String publicKeyPem) {
        try {
            initialize(PemCodec.decodePublicKey(publicKeyPem));
        } catch (InvalidKeySpecException e) {
            throw new InitializationException("Public key material is malformed or not RSA", e);
        }
    }

    /**
     * Import a DER-encoded SubjectPublicKeyInfo.
     */
    public void initialize(byte[] spki) {
        if (spki == null || spki.length == 0) {
            throw new InitializationException("Public key material is empty");
        }
        try {
            initialize(PemCodec.decodePublicKey(spki));
        } catch (InvalidKeySpecException e) {
            throw new InitializationException("Public key material is malformed or not RSA", e);
        }
    }

    private void initialize(RSAPublicKey key) {
        if (key.getModulus().bitLength() < HybridScheme.MIN_RSA_MODULUS_BITS) {
            throw new InitializationException(
                "RSA key of " + key.getModulus().bitLength() + " bits is below the "
                    + HybridScheme.MIN_RSA_MODULUS_BITS + "-bit minimum");
        }
        if (!publicKey.compareAndSet(null, key) && !publicKey.get().equals(key)) {
            throw new InitializationException("Cipher is already bound to a different public key");
        }
    }

    public boolean isInitialized() {
        return publicKey.get() != null;
    }

    /**
     * @throws NotInitializedException if no public key has been imported
     * @throws EncryptionException on any primitive failure
     */
    public SealedPayload seal(byte[] plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        RSAPublicKey key = publicKey.get();
        if (key == null) {
            throw new NotInitializedException("Sealing cipher not initialized. Call initialize() first.");
        }

        byte[] rawDek = null;
        try {
            SecretKey dek = generateDek();

            byte[] nonce = new byte[HybridScheme.GCM_IV_LENGTH];
            secureRandom.nextBytes(nonce);

            Cipher aes = Cipher.getInstance(HybridScheme.DATA_TRANSFORMATION);
            aes.init(Cipher.ENCRYPT_MODE, dek, new GCMParameterSpec(HybridScheme.GCM_TAG_LENGTH, nonce));

            // GCM produces ciphertext || auth_tag
            byte[] ciphertextWithTag = aes.doFinal(plaintext);
            int tagLength = HybridScheme.GCM_TAG_LENGTH / 8;
            int ciphertextLength = ciphertextWithTag.length - tagLength;
            byte[] ciphertext = Arrays.copyOfRange(ciphertextWithTag, 0, ciphertextLength);
            byte[] authTag = Arrays.copyOfRange(ciphertextWithTag, ciphertextLength, ciphertextWithTag.length);

            rawDek = dek.getEncoded();
            Cipher rsa = Cipher.getInstance(HybridScheme.WRAP_TRANSFORMATION);
            rsa.init(Cipher.ENCRYPT_MODE, key, HybridScheme.OAEP_SHA256, secureRandom);
            byte[] wrappedKey = rsa.doFinal(rawDek);

            if (log.isDebugEnabled()) {
                log.debug("Sealed {} bytes", plaintext.length);
            }

            return new SealedPayload(ciphertext, wrappedKey, nonce, authTag);

        } catch (GeneralSecurityException e) {
            log.error("Sealing failed", e);
            throw new EncryptionException("Failed to seal payload", e);
        } finally {
            if (rawDek != null) {
                Arrays.fill(rawDek, (byte) 0);
            }
        }
    }

    private SecretKey generateDek() throws GeneralSecurityException {
        KeyGenerator keyGen = KeyGenerator.getInstance("AES");
        keyGen.init(HybridScheme.DEK_SIZE_BITS, secureRandom);
        return keyGen.generateKey();
    }
}
