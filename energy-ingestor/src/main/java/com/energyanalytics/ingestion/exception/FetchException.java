package com.energyanalytics.ingestion.exception;

/**
 * A source fetch failed. The orchestrator retries only when {@link #isRetryable()} is true.
 */
public abstract class FetchException extends IngestionException {

    protected FetchException(String message) {
        super(message);
    }

    protected FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
