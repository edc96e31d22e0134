package com.energyanalytics.ingestion.orchestration;

import com.energyanalytics.ingestion.exception.IngestionException;

/**
 * The run's thread was interrupted between fetch attempts.
 */
class RunCancelledException extends IngestionException {

    RunCancelledException(String message) {
        super(message);
    }
}
