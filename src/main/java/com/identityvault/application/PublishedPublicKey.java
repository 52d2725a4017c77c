package com.identityvault.application;

/**
 * The public key clients seal under, with the version they must tag envelopes with.
 */
public record PublishedPublicKey(String version, String pem) {
}
