package com.identityvault.application.migration;

@FunctionalInterface
public interface MigrationObserver {

    void onBatchCompleted(MigrationReport report);
}
