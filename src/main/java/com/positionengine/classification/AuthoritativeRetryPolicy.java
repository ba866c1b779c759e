package com.positionengine.classification;

import com.positionengine.exception.ConfigurationException;
import com.positionengine.exception.SecurityLookupException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry policy for authoritative lookups: a fixed number of attempts with exponential backoff,
 * retrying only failures another attempt can fix.
 *
 * <p>Retryable: {@link SecurityLookupException} flagged retryable (transport errors, 429, 5xx)
 * and raw I/O errors. Everything else fails on the first attempt.
 */
public class AuthoritativeRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(AuthoritativeRetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Retry retry;

    public AuthoritativeRetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {
        if (maxAttempts < 1) {
            throw new ConfigurationException("classification.authoritative.retry.max-attempts must be >= 1: " + maxAttempts);
        }
        if (initialBackoff == null || initialBackoff.toMillis() < 1) {
            throw new ConfigurationException(
                    "classification.authoritative.retry.initial-backoff must be at least 1ms: " + initialBackoff);
        }
        if (multiplier < 1.0) {
            throw new ConfigurationException("classification.authoritative.retry.multiplier must be >= 1.0: " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryOnException(AuthoritativeRetryPolicy::isRetryable)
                .build();
        this.retry = Retry.of("authoritativeLookup", retryConfig);
        this.retry.getEventPublisher().onRetry(event -> log.debug(
                "Retrying authoritative lookup, attempt {} after {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown error"));
    }

    public <T> T execute(Supplier<T> call) {
        return Retry.decorateSupplier(retry, call).get();
    }

    public static boolean isRetryable(Throwable throwable) {
        if (throwable instanceof SecurityLookupException) {
            return ((SecurityLookupException) throwable).isRetryable();
        }
        return throwable instanceof IOException || throwable instanceof UncheckedIOException;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public double getMultiplier() {
        return multiplier;
    }
}
