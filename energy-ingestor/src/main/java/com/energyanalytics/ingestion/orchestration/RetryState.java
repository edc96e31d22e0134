package com.energyanalytics.ingestion.orchestration;

import com.energyanalytics.ingestion.exception.FetchException;

import java.time.Duration;

/**
 * Per-run attempt counter. Lives for one fetch phase and is discarded after success or exhaustion.
 */
public class RetryState {

    public enum Decision {
        /** Transient failure with attempts left */
        RETRY,
        /** Permanent failure, stop immediately */
        ABORT,
        /** Transient failure but the attempt budget is spent */
        EXHAUSTED
    }

    private final RetryPolicy policy;
    private int attempts;
    private Duration accumulatedBackoff = Duration.ZERO;
    private FetchException lastError;

    public RetryState(RetryPolicy policy) {
        this.policy = policy;
    }

    public void beginAttempt() {
        attempts++;
    }

    public Decision onFailure(FetchException error) {
        lastError = error;
        if (!error.isRetryable()) {
            return Decision.ABORT;
        }
        return attempts >= policy.maxAttempts() ? Decision.EXHAUSTED : Decision.RETRY;
    }

    /** Delay before the next attempt; adds it to the accumulated backoff. */
    public Duration nextDelay() {
        Duration delay = Duration.ofMillis(policy.intervals().apply(attempts));
        accumulatedBackoff = accumulatedBackoff.plus(delay);
        return delay;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return policy.maxAttempts();
    }

    public Duration getAccumulatedBackoff() {
        return accumulatedBackoff;
    }

    public FetchException getLastError() {
        return lastError;
    }
}
