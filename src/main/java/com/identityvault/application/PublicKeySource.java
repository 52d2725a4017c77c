package com.identityvault.application;

/**
 * Distributes the public half of the active sealing version.
 */
public interface PublicKeySource {

    /**
     * @throws com.identityvault.domain.exception.NoActiveKeyException if no sealing version is active
     */
    PublishedPublicKey currentPublicKey();
}
