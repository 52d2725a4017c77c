package com.identityvault.infrastructure.crypto;

import com.identityvault.domain.exception.EncryptionException;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * HMAC-SHA256 over the UTF-8 bytes of a value, rendered as lowercase hex.
 */
public final class HmacTokenizer {

    static final String ALGORITHM = "HmacSHA256";

    private HmacTokenizer() {}

    public static String tokenize(SecretKey key, String plaintext) {
        try {
            // Mac is not thread-safe; one per call
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(plaintext.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to compute blind index", e);
        }
    }
}
