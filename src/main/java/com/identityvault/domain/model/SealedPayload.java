package com.identityvault.domain.model;

import java.util.Objects;

/**
 * Raw output of one seal operation, before it is tagged with a key version.
 */
public record SealedPayload(byte[] ciphertext, byte[] wrappedKey, byte[] nonce, byte[] tag) {

    public SealedPayload {
        Objects.requireNonNull(ciphertext, "ciphertext");
        Objects.requireNonNull(wrappedKey, "wrappedKey");
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(tag, "tag");
    }

    public RecordEnvelope tag(String dekVersion) {
        return new RecordEnvelope(ciphertext, wrappedKey, nonce, tag, dekVersion);
    }

    @Override
    public String toString() {
        return "SealedPayload[ciphertext=" + ciphertext.length + " bytes]";
    }
}
