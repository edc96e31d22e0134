package com.energyanalytics.ingestion.model;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Tracks each ingestion run for observability.
 * Stored in the metadata.ingestion_log table.
 *
 * endTime is null exactly while status is RUNNING.
 */
@Data
@Builder(toBuilder = true)
public class IngestionJob {

    private Long id;                 // null until the start row is persisted
    private String jobName;          // e.g. weather_incremental_ingestion
    private String dataSource;       // e.g. Open-Meteo
    private Instant startTime;
    private Instant endTime;
    private JobStatus status;
    private int recordsProcessed;
    private int recordsInserted;
    private int recordsUpdated;
    private int recordsRejected;
    private Long processingDurationSeconds;
    private String errorMessage;     // null on full success

    /**
     * Move the job into a terminal status, stamping the end time and duration.
     */
    public void finish(JobStatus terminalStatus, Instant finishedAt) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        this.status = terminalStatus;
        this.endTime = finishedAt;
        this.processingDurationSeconds = Duration.between(startTime, finishedAt).toSeconds();
    }
}
