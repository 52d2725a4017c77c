package com.identityvault.infrastructure.crypto;

import com.identityvault.domain.model.KeyDomain;
import com.identityvault.domain.model.KeyVersion;

import javax.crypto.SecretKey;
import java.security.PrivateKey;

/**
 * Resolves key material for a registered key version (KMS/HSM-like).
 *
 * <p>Implementations fail with
 * {@link com.identityvault.domain.exception.UnknownKeyVersionException} when
 * no material exists for a version, and with
 * {@link com.identityvault.domain.exception.TransientBackendException} when
 * the backing store is temporarily unreachable.
 */
public interface KeyMaterialProvider {

    /**
     * Make sure material exists for {@code materialRef}, creating it if the
     * provider is allowed to.
     */
    void provision(KeyDomain domain, String materialRef);

    /**
     * PEM SubjectPublicKeyInfo for a {@link KeyDomain#SEALING} version.
     */
    String publicKeyPem(KeyVersion version);

    PrivateKey privateKey(KeyVersion version);

    SecretKey hmacKey(KeyVersion version);
}
