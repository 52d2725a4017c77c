package com.identityvault.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Timers around crypto and storage calls.
 *
 * Security: tags carry method names and outcomes only, never values or ids.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    static Object timed(MeterRegistry meterRegistry, String name, String description, ProceedingJoinPoint joinPoint)
            throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "failure";
        try {
            Object result = joinPoint.proceed();
            outcome = "success";
            return result;
        } finally {
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", outcome)
                .description(description)
                .register(meterRegistry));
        }
    }

    /**
     * Aspect for timing repository operations.
     */
    @Aspect
    @Component
    public static class RepositoryPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public RepositoryPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.identityvault.infrastructure.persistence.*Adapter.*(..))")
        public Object timeRepositoryMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "repository.operation", "Repository operation timing", joinPoint);
        }
    }

    /**
     * Aspect for timing seal, open and tokenize calls.
     */
    @Aspect
    @Component
    public static class CryptoPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public CryptoPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.identityvault.application.SealingKeyring.seal(..))"
            + " || execution(* com.identityvault.application.EnvelopeOpener.open(..))"
            + " || execution(* com.identityvault.application.BlindIndexer.*(..))")
        public Object timeCryptoOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "crypto.operation", "Cryptographic operation timing", joinPoint);
        }
    }
}
