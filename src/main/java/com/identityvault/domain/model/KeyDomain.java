package com.identityvault.domain.model;

/**
 * Independent families of key versions. Each domain has its own lifecycle
 * and at most one version active for writes.
 */
public enum KeyDomain {

    /** RSA key pairs wrapping the per-record DEK; tagged on records as {@code dek_version}. */
    SEALING,

    /** HMAC secrets for blind index tokens; tagged on records as {@code hmac_version}. */
    BLIND_INDEX
}
