package com.identityvault.domain.repository;

import com.identityvault.domain.model.KeyDomain;
import com.identityvault.domain.model.KeyState;
import com.identityvault.domain.model.KeyVersion;

import java.util.List;
import java.util.Optional;

/**
 * Persistent lifecycle state of key versions, independent of process restarts.
 *
 * @since 1.0.0
 */
public interface KeyVersionRepository {

    Optional<KeyVersion> findByDomainAndVersionId(KeyDomain domain, String versionId);

    List<KeyVersion> findByDomainAndState(KeyDomain domain, KeyState state);

    List<KeyVersion> findByDomain(KeyDomain domain);

    /**
     * Load every version of a domain, locked against concurrent lifecycle
     * changes until the surrounding transaction ends.
     */
    List<KeyVersion> lockDomain(KeyDomain domain);

    KeyVersion save(KeyVersion keyVersion);
}
