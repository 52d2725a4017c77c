package com.identityvault.application;

import com.identityvault.domain.model.RecordEnvelope;

import java.util.Base64;

/**
 * Text form of an envelope: binary fields as standard base64, version verbatim.
 * Matches what browser clients produce with WebCrypto.
 */
public record EnvelopeWireFormat(
        String encryptedData,
        String encryptedKey,
        String iv,
        String authTag,
        String dekVersion) {

    public static EnvelopeWireFormat from(RecordEnvelope envelope) {
        Base64.Encoder encoder = Base64.getEncoder();
        return new EnvelopeWireFormat(
            encoder.encodeToString(envelope.getEncryptedData()),
            encoder.encodeToString(envelope.getEncryptedKey()),
            encoder.encodeToString(envelope.getIv()),
            encoder.encodeToString(envelope.getAuthTag()),
            envelope.getDekVersion());
    }

    /**
     * @throws IllegalArgumentException if a field is missing, not base64, or of the wrong length
     */
    public RecordEnvelope toEnvelope() {
        return new RecordEnvelope(
            decode("encrypted_data", encryptedData),
            decode("encrypted_key", encryptedKey),
            decode("iv", iv),
            decode("auth_tag", authTag),
            dekVersion);
    }

    private static byte[] decode(String field, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Missing envelope field " + field);
        }
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Envelope field " + field + " is not valid base64", e);
        }
    }
}
