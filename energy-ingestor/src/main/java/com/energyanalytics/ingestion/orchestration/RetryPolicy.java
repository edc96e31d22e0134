package com.energyanalytics.ingestion.orchestration;

import com.energyanalytics.ingestion.config.EnergyIngestionProperties;
import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Attempt budget and delay schedule for fetching a source.
 *
 * @param maxAttempts total attempts, including the first one
 * @param intervals   delay in millis before attempt n+1, given n failed attempts
 */
public record RetryPolicy(int maxAttempts, IntervalFunction intervals) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
    }

    public static RetryPolicy from(EnergyIngestionProperties.Ingestion config) {
        Duration delay = config.getRetryDelay();
        int attempts = Math.max(1, config.getMaxRetries());
        if (delay.toMillis() < 1) {
            return new RetryPolicy(attempts, attempt -> 0L);
        }
        IntervalFunction intervals = switch (config.getBackoff()) {
            case FIXED -> IntervalFunction.of(delay);
            case EXPONENTIAL -> IntervalFunction.ofExponentialBackoff(
                    delay, config.getBackoffMultiplier(), max(delay, config.getMaxRetryDelay()));
        };
        return new RetryPolicy(attempts, intervals);
    }

    public static RetryPolicy fixed(int maxAttempts, Duration delay) {
        return delay.toMillis() < 1
                ? new RetryPolicy(maxAttempts, attempt -> 0L)
                : new RetryPolicy(maxAttempts, IntervalFunction.of(delay));
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
