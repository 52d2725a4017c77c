package com.identityvault.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Bounded platform-thread scheduler for background migration.
 *
 * Migration is CPU-bound (RSA unwrap, AES-GCM), so the pool stays small.
 */
@Configuration
@EnableScheduling
@Slf4j
public class SchedulingConfiguration {

    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler(VaultProperties properties) {
        int poolSize = properties.getMigration().getSchedulerPoolSize();
        log.info("Configuring migration scheduler with {} threads", poolSize);

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("migration-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.setErrorHandler(t -> log.error("Scheduled migration task failed", t));
        return scheduler;
    }
}
