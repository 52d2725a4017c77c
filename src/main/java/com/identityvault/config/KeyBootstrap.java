package com.identityvault.config;

import com.identityvault.application.KeyLifecycleService;
import com.identityvault.domain.model.KeyDomain;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Local development convenience: gives every empty domain an active {@code v1}.
 */
@Component
@ConditionalOnProperty(prefix = "vault.keys", name = "bootstrap", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class KeyBootstrap implements ApplicationRunner {

    static final String INITIAL_VERSION = "v1";
    private static final String ACTOR = "bootstrap";

    private final KeyLifecycleService lifecycle;

    @Override
    public void run(ApplicationArguments args) {
        for (KeyDomain domain : KeyDomain.values()) {
            if (!lifecycle.versions(domain).isEmpty()) {
                continue;
            }
            String materialRef = domain.name().toLowerCase(Locale.ROOT).replace('_', '-') + "-" + INITIAL_VERSION;
            log.warn("No {} key versions found; bootstrapping {} with material {}", domain, INITIAL_VERSION, materialRef);
            lifecycle.register(domain, INITIAL_VERSION, materialRef, ACTOR);
            lifecycle.promote(domain, INITIAL_VERSION, ACTOR);
        }
    }
}
