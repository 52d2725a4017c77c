package com.identityvault.application.migration;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes batch outcomes as counters and the remaining work per source
 * version as a gauge.
 *
 * Security: versions and counts only; never record ids.
 */
@Component
@Slf4j
public class MicrometerMigrationObserver implements MigrationObserver {

    private final MeterRegistry meterRegistry;
    private final Map<String, AtomicLong> lag = new ConcurrentHashMap<>();

    public MicrometerMigrationObserver(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("Initialized migration metrics");
    }

    @Override
    public void onBatchCompleted(MigrationReport report) {
        String domain = report.getDomain().name();
        increment(domain, "migrated", report.getMigrated());
        increment(domain, "conflict", report.getConflicts());
        increment(domain, "failed", report.getFailures());
        meterRegistry.counter("vault.migration.batches", "domain", domain).increment();

        lagGauge(domain, report.getSourceVersion()).set(report.getRemaining());
    }

    private void increment(String domain, String outcome, int amount) {
        if (amount > 0) {
            meterRegistry.counter("vault.migration.records", "domain", domain, "outcome", outcome).increment(amount);
        }
    }

    private AtomicLong lagGauge(String domain, String version) {
        return lag.computeIfAbsent(domain + "/" + version, key -> meterRegistry.gauge(
            "vault.migration.lag",
            Tags.of("domain", domain, "version", version),
            new AtomicLong()));
    }
}
