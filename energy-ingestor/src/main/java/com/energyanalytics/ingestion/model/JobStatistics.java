package com.energyanalytics.ingestion.model;

/**
 * Aggregate view over the job log for a trailing period.
 */
public record JobStatistics(int days,
                            long totalJobs,
                            long successfulJobs,
                            long partialJobs,
                            long failedJobs,
                            long recordsProcessed,
                            long recordsInserted,
                            double averageDurationSeconds) {

    public double successRate() {
        return totalJobs == 0 ? 0.0 : successfulJobs * 100.0 / totalJobs;
    }
}
