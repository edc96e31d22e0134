package com.energyanalytics.ingestion.exception;

import com.energyanalytics.ingestion.model.ValidationOutcome;

/**
 * Batch quality fell below the accepted tolerance. Nothing is written.
 */
public class ValidationRejectedException extends IngestionException {

    private final transient ValidationOutcome outcome;

    public ValidationRejectedException(ValidationOutcome outcome) {
        super("Validation rejected batch: " + outcome.summary());
        this.outcome = outcome;
    }

    public ValidationOutcome getOutcome() {
        return outcome;
    }
}
