package com.identityvault;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Identity vault backend.
 *
 * <ul>
 *   <li><strong>Hybrid sealing</strong>: RSA-OAEP wrapped AES-256-GCM keys, one per record</li>
 *   <li><strong>Versioned keys</strong>: FUTURE, ACTIVE_WRITE, DECRYPT_ONLY, RETIRED per domain</li>
 *   <li><strong>Online rotation</strong>: background re-encryption and reindexing with compare-and-swap writes</li>
 *   <li><strong>Blind index</strong>: HMAC-SHA256 equality search without decryption</li>
 * </ul>
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class IdentityVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(IdentityVaultApplication.class, args);
        log.info("Identity vault started");
    }
}
