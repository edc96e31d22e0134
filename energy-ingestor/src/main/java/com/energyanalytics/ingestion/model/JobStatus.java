package com.energyanalytics.ingestion.model;

import java.util.Arrays;

/**
 * Lifecycle status of an ingestion job as stored in metadata.ingestion_log.
 */
public enum JobStatus {

    RUNNING("running"),
    SUCCESS("success"),
    PARTIAL_SUCCESS("partial_success"),
    FAILED("failed");

    private final String dbValue;

    JobStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static JobStatus fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.dbValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job status: " + value));
    }
}
