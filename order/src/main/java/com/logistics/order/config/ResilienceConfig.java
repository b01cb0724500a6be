package com.logistics.order.config;

import com.logistics.order.service.ConcurrencyConflictException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Retry policy for command dispatch.
 *
 * Only optimistic-concurrency conflicts are retried: the handler reloads the
 * history on every attempt, so a retry works against the winner's events.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    public static final String COMMAND_DISPATCH_RETRY = "command-dispatch";

    @Bean
    public RetryRegistry retryRegistry(
            @Value("${ingress.retry.max-attempts:3}") int maxAttempts,
            @Value("${ingress.retry.initial-interval-ms:100}") long initialIntervalMs,
            MeterRegistry meterRegistry) {
        RetryRegistry registry = RetryRegistry.of(commandDispatchRetryConfig(maxAttempts, initialIntervalMs));
        TaggedRetryMetrics.ofRetryRegistry(registry).bindTo(meterRegistry);
        return registry;
    }

    @Bean
    public Retry commandDispatchRetry(RetryRegistry retryRegistry) {
        Retry retry = retryRegistry.retry(COMMAND_DISPATCH_RETRY);
        retry.getEventPublisher()
                .onRetry(event -> log.info(
                        "[RETRY] name={}, attempt={}, waitDuration={}ms, cause={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "N/A"))
                .onError(event -> log.warn(
                        "[RETRY_EXHAUSTED] name={}, attempts={}, error={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable().getMessage()));
        return retry;
    }

    /**
     * Exponential backoff (x2) with 50% randomization, retrying
     * {@link ConcurrencyConflictException} only.
     */
    public static RetryConfig commandDispatchRetryConfig(int maxAttempts, long initialIntervalMs) {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Duration.ofMillis(initialIntervalMs), 2.0, 0.5))
                .retryExceptions(ConcurrencyConflictException.class)
                .build();
    }
}
