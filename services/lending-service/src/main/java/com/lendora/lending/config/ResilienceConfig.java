package com.lendora.lending.config;

import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resilience4j Configuration
 *
 * Bounds every call to the price oracle and the credit verifier so no protocol operation
 * waits on an external collaborator indefinitely.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String PRICE_ORACLE = "priceOracle";
    public static final String CREDIT_GATE = "creditGate";

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(LendingProperties properties) {
        TimeLimiterConfig defaultConfig = TimeLimiterConfig.custom()
            .timeoutDuration(properties.getOracle().getTimeout())
            .cancelRunningFuture(true)
            .build();

        TimeLimiterConfig creditGateConfig = TimeLimiterConfig.from(defaultConfig)
            .timeoutDuration(properties.getCreditGate().getTimeout())
            .build();

        TimeLimiterRegistry registry = TimeLimiterRegistry.of(defaultConfig);
        registry.timeLimiter(PRICE_ORACLE, defaultConfig);
        registry.timeLimiter(CREDIT_GATE, creditGateConfig);

        log.info("Time limiters configured: priceOracle={}, creditGate={}",
            properties.getOracle().getTimeout(), properties.getCreditGate().getTimeout());
        return registry;
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService externalCallExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "external-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }
}
