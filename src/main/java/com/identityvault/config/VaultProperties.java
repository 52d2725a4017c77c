package com.identityvault.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Operational knobs for key handling and migration, bound from {@code vault.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "vault")
public class VaultProperties {

    @Valid
    private Keys keys = new Keys();

    @Valid
    private BlindIndex blindIndex = new BlindIndex();

    @Valid
    private Migration migration = new Migration();

    @Valid
    private Retirement retirement = new Retirement();

    @Data
    public static class Keys {

        /**
         * Directory holding {@code <ref>.public.pem}, {@code <ref>.private.pem} and {@code <ref>.hmac}.
         */
        @NotBlank
        private String directory = "keys";

        @Min(2048)
        @Max(8192)
        private int rsaKeySize = 2048;

        /**
         * Generate missing material on provisioning (local development only).
         */
        private boolean generateMissing = true;

        /**
         * Provision and promote {@code v1} in any domain without versions at startup.
         */
        private boolean bootstrap = false;

        @Min(1)
        private int cacheMaximumSize = 64;

        @NotNull
        private Duration cacheExpireAfterAccess = Duration.ofMinutes(15);
    }

    @Data
    public static class BlindIndex {

        /**
         * HMAC secrets by material reference, base64-encoded. Take precedence over files.
         */
        private Map<String, String> secrets = new HashMap<>();
    }

    @Data
    public static class Migration {

        private boolean enabled = true;

        @Min(1)
        @Max(10_000)
        private int batchSize = 500;

        @NotNull
        private Duration pollInterval = Duration.ofSeconds(30);

        @Min(1)
        private int schedulerPoolSize = 2;

        @Min(1)
        private int maxAttempts = 4;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(200);

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(5);
    }

    @Data
    public static class Retirement {

        /**
         * Minimum time a version spends in DECRYPT_ONLY before unforced retirement.
         */
        @NotNull
        private Duration gracePeriod = Duration.ofDays(7);
    }
}
