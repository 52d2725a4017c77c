package com.identityvault.application;

import com.identityvault.domain.model.KeyVersion;
import com.identityvault.domain.model.RecordEnvelope;
import com.identityvault.infrastructure.crypto.KeyMaterialProvider;
import com.identityvault.infrastructure.crypto.UnsealingCipher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Opens envelopes of any readable sealing version.
 */
@Component
public class EnvelopeOpener {

    private final KeyRegistry sealingRegistry;
    private final KeyMaterialProvider keyMaterial;
    private final UnsealingCipher unsealingCipher;

    public EnvelopeOpener(
            @Qualifier("sealingKeyRegistry") KeyRegistry sealingRegistry,
            KeyMaterialProvider keyMaterial,
            UnsealingCipher unsealingCipher) {
        this.sealingRegistry = sealingRegistry;
        this.keyMaterial = keyMaterial;
        this.unsealingCipher = unsealingCipher;
    }

    /**
     * @throws com.identityvault.domain.exception.RetiredKeyException if the envelope's version is retired
     * @throws com.identityvault.domain.exception.UnknownKeyVersionException if the version is not registered
     * @throws com.identityvault.domain.exception.AuthenticationFailureException if the envelope was altered
     */
    public byte[] open(RecordEnvelope envelope) {
        KeyVersion version = sealingRegistry.resolveForRead(envelope.getDekVersion());
        return unsealingCipher.unseal(envelope, keyMaterial.privateKey(version));
    }
}
