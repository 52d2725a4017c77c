package com.identityvault.infrastructure.persistence;

import com.identityvault.domain.model.KeyDomain;
import com.identityvault.domain.model.KeyState;
import com.identityvault.domain.model.KeyVersion;
import com.identityvault.domain.repository.KeyVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Adapter implementing the key version port with Spring Data JPA.
 *
 * <p>{@link #save} flushes immediately: a demotion must reach the database
 * before the promotion that follows it, or the single-active index rejects
 * the promotion.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KeyVersionRepositoryAdapter implements KeyVersionRepository {

    private final SpringDataKeyVersionRepository springDataRepository;

    @Override
    public Optional<KeyVersion> findByDomainAndVersionId(KeyDomain domain, String versionId) {
        return DataAccessTranslation.translate(() -> springDataRepository.findByDomainAndVersionId(domain, versionId));
    }

    @Override
    public List<KeyVersion> findByDomainAndState(KeyDomain domain, KeyState state) {
        return DataAccessTranslation.translate(() -> springDataRepository.findByDomainAndStateOrderByIdAsc(domain, state));
    }

    @Override
    public List<KeyVersion> findByDomain(KeyDomain domain) {
        return DataAccessTranslation.translate(() -> springDataRepository.findByDomainOrderByIdAsc(domain));
    }

    @Override
    public List<KeyVersion> lockDomain(KeyDomain domain) {
        List<KeyVersion> locked = DataAccessTranslation.translate(() -> springDataRepository.lockByDomain(domain));
        if (log.isDebugEnabled()) {
            log.debug("Locked {} {} key versions", locked.size(), domain);
        }
        return locked;
    }

    @Override
    public KeyVersion save(KeyVersion keyVersion) {
        return DataAccessTranslation.translate(() -> springDataRepository.saveAndFlush(keyVersion));
    }
}
