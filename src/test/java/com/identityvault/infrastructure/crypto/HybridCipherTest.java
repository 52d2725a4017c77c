package com.identityvault.infrastructure.crypto;

import com.identityvault.domain.exception.AuthenticationFailureException;
import com.identityvault.domain.exception.InitializationException;
import com.identityvault.domain.exception.NotInitializedException;
import com.identityvault.domain.exception.UnknownKeyVersionException;
import com.identityvault.domain.model.RecordEnvelope;
import com.identityvault.domain.model.SealedPayload;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class HybridCipherTest {

    private static KeyPair keyPair;
    private static KeyPair otherKeyPair;

    private final UnsealingCipher unsealing = new UnsealingCipher();

    @BeforeAll
    static void generateKeys() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        keyPair = generator.generateKeyPair();
        otherKeyPair = generator.generateKeyPair();
    }

    private SealingCipher boundCipher() {
        SealingCipher cipher = new SealingCipher();
        cipher.initialize(PemCodec.encodePublicKey(keyPair.getPublic()));
        return cipher;
    }

    private RecordEnvelope seal(String value) {
        return boundCipher().seal(value.getBytes(StandardCharsets.UTF_8)).tag("v1");
    }

    @Test
    void round_trip_restores_plaintext() {
        RecordEnvelope envelope = seal("123-45-6789");

        byte[] plaintext = unsealing.unseal(envelope, keyPair.getPrivate());

        assertEquals("123-45-6789", new String(plaintext, StandardCharsets.UTF_8));
        assertEquals("v1", envelope.getDekVersion());
        assertEquals(12, envelope.getIv().length);
        assertEquals(16, envelope.getAuthTag().length);
        assertEquals(256, envelope.getEncryptedKey().length, "2048-bit RSA wraps to 256 bytes");
    }

    @Test
    void empty_plaintext_round_trips() {
        RecordEnvelope envelope = seal("");

        assertEquals(0, envelope.getEncryptedData().length);
        assertEquals(0, unsealing.unseal(envelope, keyPair.getPrivate()).length);
    }

    @Test
    void sealing_same_value_twice_differs_in_every_random_component() {
        SealingCipher cipher = boundCipher();
        byte[] value = "123-45-6789".getBytes(StandardCharsets.UTF_8);

        SealedPayload first = cipher.seal(value);
        SealedPayload second = cipher.seal(value);

        assertFalse(Arrays.equals(first.nonce(), second.nonce()));
        assertFalse(Arrays.equals(first.wrappedKey(), second.wrappedKey()));
        assertFalse(Arrays.equals(first.ciphertext(), second.ciphertext()));
    }

    @Test
    void flipped_ciphertext_bit_fails_authentication() {
        RecordEnvelope envelope = seal("123-45-6789");
        byte[] data = envelope.getEncryptedData();
        data[0] ^= 0x01;
        RecordEnvelope tampered = new RecordEnvelope(
            data, envelope.getEncryptedKey(), envelope.getIv(), envelope.getAuthTag(), "v1");

        AuthenticationFailureException e = assertThrows(AuthenticationFailureException.class,
            () -> unsealing.unseal(tampered, keyPair.getPrivate()));
        assertEquals("v1", e.getKeyVersion());
    }

    @Test
    void flipped_tag_bit_fails_authentication() {
        RecordEnvelope envelope = seal("123-45-6789");
        byte[] tag = envelope.getAuthTag();
        tag[15] ^= 0x01;
        RecordEnvelope tampered = new RecordEnvelope(
            envelope.getEncryptedData(), envelope.getEncryptedKey(), envelope.getIv(), tag, "v1");

        assertThrows(AuthenticationFailureException.class, () -> unsealing.unseal(tampered, keyPair.getPrivate()));
    }

    @Test
    void flipped_wrapped_key_bit_fails_authentication() {
        RecordEnvelope envelope = seal("123-45-6789");
        byte[] wrapped = envelope.getEncryptedKey();
        wrapped[10] ^= 0x01;
        RecordEnvelope tampered = new RecordEnvelope(
            envelope.getEncryptedData(), wrapped, envelope.getIv(), envelope.getAuthTag(), "v1");

        assertThrows(AuthenticationFailureException.class, () -> unsealing.unseal(tampered, keyPair.getPrivate()));
    }

    @Test
    void altered_nonce_fails_authentication() {
        RecordEnvelope envelope = seal("123-45-6789");
        byte[] iv = envelope.getIv();
        iv[0] ^= 0x01;
        RecordEnvelope tampered = new RecordEnvelope(
            envelope.getEncryptedData(), envelope.getEncryptedKey(), iv, envelope.getAuthTag(), "v1");

        assertThrows(AuthenticationFailureException.class, () -> unsealing.unseal(tampered, keyPair.getPrivate()));
    }

    @Test
    void wrong_private_key_fails_authentication() {
        RecordEnvelope envelope = seal("123-45-6789");

        assertThrows(AuthenticationFailureException.class,
            () -> unsealing.unseal(envelope, otherKeyPair.getPrivate()));
    }

    @Test
    void missing_private_key_is_unknown_version() {
        RecordEnvelope envelope = seal("123-45-6789");

        UnknownKeyVersionException e = assertThrows(UnknownKeyVersionException.class,
            () -> unsealing.unseal(envelope, null));
        assertEquals("v1", e.getKeyVersion());
    }

    @Test
    void seal_before_initialize_fails() {
        SealingCipher cipher = new SealingCipher();

        assertFalse(cipher.isInitialized());
        assertThrows(NotInitializedException.class, () -> cipher.seal(new byte[]{1}));
    }

    @Test
    void initialize_accepts_der_spki() {
        SealingCipher cipher = new SealingCipher();
        cipher.initialize(keyPair.getPublic().getEncoded());

        RecordEnvelope envelope = cipher.seal(new byte[]{42}).tag("v1");

        assertArrayEquals(new byte[]{42}, unsealing.unseal(envelope, keyPair.getPrivate()));
    }

    @Test
    void initialize_rejects_malformed_material() {
        SealingCipher cipher = new SealingCipher();

        assertThrows(InitializationException.class,
            () -> cipher.initialize("-----BEGIN PUBLIC KEY-----\nbm90IGEga2V5\n-----END PUBLIC KEY-----"));
        assertThrows(InitializationException.class, () -> cipher.initialize(new byte[0]));
        assertFalse(cipher.isInitialized());
    }

    @Test
    void initialize_rejects_short_rsa_keys() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(1024);
        String weak = PemCodec.encodePublicKey(generator.generateKeyPair().getPublic());

        assertThrows(InitializationException.class, () -> new SealingCipher().initialize(weak));
    }

    @Test
    void reinitialize_with_same_key_is_noop_but_different_key_fails() {
        SealingCipher cipher = boundCipher();

        assertDoesNotThrow(() -> cipher.initialize(PemCodec.encodePublicKey(keyPair.getPublic())));
        assertThrows(InitializationException.class,
            () -> cipher.initialize(PemCodec.encodePublicKey(otherKeyPair.getPublic())));
    }
}
