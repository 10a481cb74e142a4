package com.mesenforcement.config;

import com.mesenforcement.domain.model.decision.EnforcementDecision;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance and decision metrics.
 *
 * <p>Tracks store latency per adapter method and the allow/deny/bypass mix of
 * enforcement decisions. Identifiers never appear in tags.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing store access through the persistence adapters.
     */
    @Aspect
    @Component
    @Slf4j
    public static class RepositoryPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public RepositoryPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.mesenforcement.infrastructure.persistence.*Adapter.*(..))")
        public Object timeRepositoryMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            String methodName = joinPoint.getSignature().toShortString();

            Timer.Sample sample = Timer.start(meterRegistry);

            try {
                Object result = joinPoint.proceed();

                sample.stop(Timer.builder("enforcement.store.operation")
                    .tag("method", methodName)
                    .tag("outcome", "success")
                    .description("Enforcement store access timing")
                    .register(meterRegistry));

                return result;

            } catch (Exception e) {
                sample.stop(Timer.builder("enforcement.store.operation")
                    .tag("method", methodName)
                    .tag("outcome", "failure")
                    .description("Enforcement store access timing")
                    .register(meterRegistry));

                throw e;
            }
        }
    }

    /**
     * Counters for enforcement outcomes.
     */
    @Component
    @Slf4j
    public static class EnforcementMetrics {

        private final MeterRegistry meterRegistry;

        public EnforcementMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized enforcement metrics");
        }

        /**
         * Record one decision and each bypass it applied.
         */
        public void recordDecision(String operation, EnforcementDecision decision) {
            String mode = decision.getConfigMode() == null ? "UNKNOWN" : decision.getConfigMode().name();
            meterRegistry.counter("enforcement.decisions",
                "operation", operation,
                "outcome", decision.isAllowed() ? "allowed" : "denied",
                "mode", mode).increment();

            decision.getBypassesApplied().forEach(bypass ->
                meterRegistry.counter("enforcement.bypasses",
                    "operation", operation,
                    "bypass", bypass).increment());
        }

        public void recordAuditWrite(String category, boolean succeeded) {
            meterRegistry.counter("enforcement.audit.writes",
                "category", category,
                "outcome", succeeded ? "success" : "failure").increment();
        }
    }
}
