package com.identityvault.infrastructure.crypto;

import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;
import java.security.spec.MGF1ParameterSpec;

/**
 * Parameters of the hybrid scheme shared by both cipher roles.
 *
 * <p>RSA-OAEP with SHA-256 for both the digest and MGF1 (what WebCrypto calls
 * {@code RSA-OAEP}/{@code SHA-256}), wrapping an AES-256-GCM DEK.
 */
final class HybridScheme {

    static final String WRAP_TRANSFORMATION = "RSA/ECB/OAEPPadding";
    static final String DATA_TRANSFORMATION = "AES/GCM/NoPadding";

    // JCE's "OAEPWithSHA-256AndMGF1Padding" defaults MGF1 to SHA-1; spell it out.
    static final OAEPParameterSpec OAEP_SHA256 = new OAEPParameterSpec(
        "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, PSource.PSpecified.DEFAULT);

    static final int DEK_SIZE_BITS = 256;
    static final int GCM_IV_LENGTH = 12; // 96 bits recommended for GCM
    static final int GCM_TAG_LENGTH = 128; // 128 bits authentication tag
    static final int MIN_RSA_MODULUS_BITS = 2048;

    private HybridScheme() {}
}
