package com.energyanalytics.ingestion.exception;

/**
 * Network error, timeout, rate limit or 5xx. Worth another attempt after a delay.
 */
public class TransientFetchException extends FetchException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
