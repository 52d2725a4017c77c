package com.identityvault.infrastructure.persistence;

import com.identityvault.domain.model.KeyDomain;
import com.identityvault.domain.model.KeyState;
import com.identityvault.domain.model.KeyVersion;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SpringDataKeyVersionRepository extends JpaRepository<KeyVersion, Long> {

    Optional<KeyVersion> findByDomainAndVersionId(KeyDomain domain, String versionId);

    List<KeyVersion> findByDomainAndStateOrderByIdAsc(KeyDomain domain, KeyState state);

    List<KeyVersion> findByDomainOrderByIdAsc(KeyDomain domain);

    /**
     * SELECT ... FOR UPDATE over the whole domain; serializes lifecycle changes.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT k FROM KeyVersion k WHERE k.domain = :domain ORDER BY k.id")
    List<KeyVersion> lockByDomain(@Param("domain") KeyDomain domain);
}
