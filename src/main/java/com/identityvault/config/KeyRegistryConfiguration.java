package com.identityvault.config;

import com.identityvault.application.KeyRegistry;
import com.identityvault.domain.exception.TransientBackendException;
import com.identityvault.domain.model.KeyDomain;
import com.identityvault.domain.repository.KeyVersionRepository;
import com.identityvault.infrastructure.crypto.UnsealingCipher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;

/**
 * Key registries, one per domain, and the collaborators shared by the
 * sealing and migration paths.
 */
@Configuration
@Slf4j
public class KeyRegistryConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KeyRegistry sealingKeyRegistry(KeyVersionRepository repository, VaultProperties properties, Clock clock) {
        return new KeyRegistry(KeyDomain.SEALING, repository, properties.getRetirement().getGracePeriod(), clock);
    }

    @Bean
    public KeyRegistry blindIndexKeyRegistry(KeyVersionRepository repository, VaultProperties properties, Clock clock) {
        return new KeyRegistry(KeyDomain.BLIND_INDEX, repository, properties.getRetirement().getGracePeriod(), clock);
    }

    @Bean
    public UnsealingCipher unsealingCipher() {
        return new UnsealingCipher();
    }

    /**
     * Exponential backoff for transient storage and key material failures.
     * Nothing else is retried.
     */
    @Bean
    public RetryTemplate migrationRetryTemplate(VaultProperties properties) {
        VaultProperties.Migration migration = properties.getMigration();
        log.info("Migration retry: maxAttempts={}, initialBackoff={}, multiplier={}, maxBackoff={}",
            migration.getMaxAttempts(), migration.getInitialBackoff(),
            migration.getBackoffMultiplier(), migration.getMaxBackoff());

        return RetryTemplate.builder()
            .maxAttempts(migration.getMaxAttempts())
            .exponentialBackoff(
                migration.getInitialBackoff().toMillis(),
                migration.getBackoffMultiplier(),
                migration.getMaxBackoff().toMillis())
            .retryOn(TransientBackendException.class)
            .build();
    }
}
