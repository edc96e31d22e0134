package com.energyanalytics.ingestion.tracking;

import com.energyanalytics.ingestion.model.IngestionJob;
import com.energyanalytics.ingestion.model.JobStatistics;

import java.time.Instant;
import java.util.List;

/**
 * Records the lifecycle of every ingestion run in the job log.
 */
public interface JobTracker {

    /**
     * Create a job in status running. The returned job's id is null when the
     * start row could not be persisted; {@link #complete} then writes the full row.
     */
    IngestionJob start(String jobName, String dataSource);

    /** Persist the terminal state of a job previously returned by {@link #start}. */
    void complete(IngestionJob job);

    /** Most recent jobs first. */
    List<IngestionJob> recentJobs(int limit);

    /** Failed jobs started at or after {@code since}, most recent first. */
    List<IngestionJob> failedJobs(Instant since);

    /** Aggregates over jobs started in the trailing {@code days} days. */
    JobStatistics statistics(int days);
}
