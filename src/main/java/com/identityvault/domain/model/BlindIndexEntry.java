package com.identityvault.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.regex.Pattern;

/**
 * Deterministic search token for a protected value, tagged with the HMAC
 * key version that produced it.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@EqualsAndHashCode
public final class BlindIndexEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Pattern HEX_TOKEN = Pattern.compile("^[0-9a-f]{64}$");

    @Column(name = "hmac_version", nullable = false, length = 64)
    private String hmacVersion;

    @Column(name = "blind_index", nullable = false, length = 64)
    private String token;

    public BlindIndexEntry(String hmacVersion, String token) {
        this.hmacVersion = RecordEnvelope.validateVersionTag(hmacVersion);
        if (token == null || !HEX_TOKEN.matcher(token).matches()) {
            throw new IllegalArgumentException("Blind index token must be 64 lowercase hex characters");
        }
        this.token = token;
    }

    @Override
    public String toString() {
        return "BlindIndexEntry[hmacVersion=" + hmacVersion + ", token=" + token.substring(0, 8) + "...]";
    }
}
