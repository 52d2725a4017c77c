package com.identityvault.infrastructure.crypto;

import com.identityvault.domain.exception.AuthenticationFailureException;
import com.identityvault.domain.exception.EncryptionException;
import com.identityvault.domain.exception.UnknownKeyVersionException;
import com.identityvault.domain.model.KeyDomain;
import com.identityvault.domain.model.RecordEnvelope;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.util.Arrays;
import java.util.Objects;

/**
 * Unsealing half of the hybrid scheme. Stateless; the private key is passed
 * in per call and never retained.
 *
 * <p>GCM verifies the tag before releasing any plaintext, so a tampered
 * envelope yields {@link AuthenticationFailureException} and nothing else.
 *
 * @since 1.0.0
 */
@Slf4j
public class UnsealingCipher {

    private static final int DEK_LENGTH_BYTES = HybridScheme.DEK_SIZE_BITS / 8;

    /**
     * @param privateKey private key for the envelope's {@code dek_version}, or null if none is held
     * @throws UnknownKeyVersionException if no private key was supplied
     * @throws AuthenticationFailureException if the wrapped key or the tag does not verify
     */
    public byte[] unseal(RecordEnvelope envelope, PrivateKey privateKey) {
        Objects.requireNonNull(envelope, "envelope");
        String version = envelope.getDekVersion();
        if (privateKey == null) {
            throw new UnknownKeyVersionException(KeyDomain.SEALING, version,
                "No private key material supplied for key version " + version);
        }

        byte[] rawDek = unwrapDek(envelope, privateKey);
        try {
            Cipher aes = Cipher.getInstance(HybridScheme.DATA_TRANSFORMATION);
            aes.init(Cipher.DECRYPT_MODE,
                new SecretKeySpec(rawDek, "AES"),
                new GCMParameterSpec(HybridScheme.GCM_TAG_LENGTH, envelope.getIv()));

            byte[] plaintext = aes.doFinal(envelope.ciphertextWithTag());

            if (log.isDebugEnabled()) {
                log.debug("Unsealed {} bytes with key version {}", plaintext.length, version);
            }
            return plaintext;

        } catch (BadPaddingException e) {
            // AEADBadTagException: tag mismatch
            log.warn("Authentication tag mismatch for envelope on key version {}", version);
            throw new AuthenticationFailureException(version, "Envelope failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to unseal payload", e);
        } finally {
            Arrays.fill(rawDek, (byte) 0);
        }
    }

    private byte[] unwrapDek(RecordEnvelope envelope, PrivateKey privateKey) {
        String version = envelope.getDekVersion();
        byte[] rawDek;
        try {
            Cipher rsa = Cipher.getInstance(HybridScheme.WRAP_TRANSFORMATION);
            rsa.init(Cipher.DECRYPT_MODE, privateKey, HybridScheme.OAEP_SHA256);
            rawDek = rsa.doFinal(envelope.getEncryptedKey());
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            log.warn("Wrapped key could not be unwrapped with key version {}", version);
            throw new AuthenticationFailureException(version, "Wrapped key failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to unwrap data encryption key", e);
        }

        if (rawDek.length != DEK_LENGTH_BYTES) {
            Arrays.fill(rawDek, (byte) 0);
            throw new AuthenticationFailureException(version,
                "Unwrapped key has unexpected length " + rawDek.length, null);
        }
        return rawDek;
    }
}
