package com.energyanalytics.ingestion.exception;

/**
 * Authentication failure or a payload whose schema we cannot read. Retrying will not help.
 */
public class PermanentFetchException extends FetchException {

    public PermanentFetchException(String message) {
        super(message);
    }

    public PermanentFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
