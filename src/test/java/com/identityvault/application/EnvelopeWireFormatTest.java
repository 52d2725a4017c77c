package com.identityvault.application;

import com.identityvault.domain.model.RecordEnvelope;
import com.identityvault.support.VaultFixture;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeWireFormatTest {

    @Test
    void wire_envelope_from_a_client_opens_on_the_server() {
        VaultFixture vault = new VaultFixture().withInitialKeys();
        RecordEnvelope sealed = vault.keyring.seal("123-45-6789".getBytes(StandardCharsets.UTF_8));

        EnvelopeWireFormat wire = EnvelopeWireFormat.from(sealed);
        RecordEnvelope parsed = wire.toEnvelope();

        assertEquals("v1", wire.dekVersion());
        assertEquals(16, wire.iv().length(), "12 bytes in base64");
        assertEquals("123-45-6789", new String(vault.opener.open(parsed), StandardCharsets.UTF_8));
    }

    @Test
    void rejects_invalid_base64() {
        EnvelopeWireFormat wire = new EnvelopeWireFormat("AAAA", "!!not-base64!!", "AAAAAAAAAAAAAAAA",
            "AAAAAAAAAAAAAAAAAAAAAA==", "v1");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, wire::toEnvelope);
        assertTrue(e.getMessage().contains("encrypted_key"));
    }

    @Test
    void rejects_missing_fields_and_bad_lengths() {
        assertThrows(IllegalArgumentException.class,
            () -> new EnvelopeWireFormat("AAAA", "AAAA", null, "AAAAAAAAAAAAAAAAAAAAAA==", "v1").toEnvelope());
        assertThrows(IllegalArgumentException.class,
            () -> new EnvelopeWireFormat("AAAA", "AAAA", "AAAA", "AAAAAAAAAAAAAAAAAAAAAA==", "v1").toEnvelope());
    }
}
