package com.energyanalytics.ingestion.exception;

/**
 * Root of the ingestion failure taxonomy. Everything the orchestrator turns into a job status extends this.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
