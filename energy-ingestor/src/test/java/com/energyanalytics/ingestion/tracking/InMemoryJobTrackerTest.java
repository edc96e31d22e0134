package com.energyanalytics.ingestion.tracking;

import com.energyanalytics.ingestion.model.IngestionJob;
import com.energyanalytics.ingestion.model.JobStatistics;
import com.energyanalytics.ingestion.model.JobStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryJobTracker Tests")
class InMemoryJobTrackerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final InMemoryJobTracker tracker = new InMemoryJobTracker(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("Start creates a running job with an id and no end time")
    void testStart() {
        IngestionJob job = tracker.start("grid_incremental_ingestion", "Open Power System Data");

        assertNotNull(job.getId());
        assertEquals(JobStatus.RUNNING, job.getStatus());
        assertEquals(NOW, job.getStartTime());
        assertNull(job.getEndTime());
    }

    @Test
    @DisplayName("Complete stores the terminal state")
    void testComplete() {
        IngestionJob job = tracker.start("weather_incremental_ingestion", "Open-Meteo");
        job.setRecordsProcessed(72);
        job.setRecordsInserted(70);
        job.finish(JobStatus.SUCCESS, NOW.plusSeconds(12));
        tracker.complete(job);

        IngestionJob stored = tracker.recentJobs(1).get(0);
        assertEquals(JobStatus.SUCCESS, stored.getStatus());
        assertEquals(12L, stored.getProcessingDurationSeconds());
        assertEquals(70, stored.getRecordsInserted());
    }

    @Test
    @DisplayName("A job without start row is inserted on completion")
    void testCompleteWithoutId() {
        IngestionJob job = IngestionJob.builder()
                .jobName("household_backfill_ingestion")
                .dataSource("UCI Household Power Consumption")
                .startTime(NOW)
                .status(JobStatus.RUNNING)
                .build();
        job.finish(JobStatus.FAILED, NOW.plusSeconds(3));
        tracker.complete(job);

        List<IngestionJob> jobs = tracker.recentJobs(10);
        assertEquals(1, jobs.size());
        assertNotNull(jobs.get(0).getId());
    }

    @Test
    @DisplayName("Statistics count jobs by status and compute the success rate")
    void testStatistics() {
        complete(JobStatus.SUCCESS, 10, 4);
        complete(JobStatus.SUCCESS, 20, 6);
        complete(JobStatus.PARTIAL_SUCCESS, 5, 2);
        complete(JobStatus.FAILED, 0, 0);

        JobStatistics stats = tracker.statistics(7);

        assertEquals(4, stats.totalJobs());
        assertEquals(2, stats.successfulJobs());
        assertEquals(1, stats.partialJobs());
        assertEquals(1, stats.failedJobs());
        assertEquals(35, stats.recordsProcessed());
        assertEquals(50.0, stats.successRate(), 1e-9);
        assertEquals(3.0, stats.averageDurationSeconds(), 1e-9);
    }

    private void complete(JobStatus status, int processed, int durationSeconds) {
        IngestionJob job = tracker.start("grid_incremental_ingestion", "Open Power System Data");
        job.setRecordsProcessed(processed);
        job.finish(status, NOW.plusSeconds(durationSeconds));
        tracker.complete(job);
    }

    @Test
    @DisplayName("Failed jobs since a point in time, newest first")
    void testFailedJobs() {
        completeAt("grid_incremental_ingestion", NOW.minus(Duration.ofDays(3)), JobStatus.FAILED);
        completeAt("weather_incremental_ingestion", NOW.minus(Duration.ofHours(5)), JobStatus.FAILED);
        completeAt("household_incremental_ingestion", NOW.minus(Duration.ofHours(4)), JobStatus.SUCCESS);
        completeAt("grid_incremental_ingestion", NOW.minus(Duration.ofHours(1)), JobStatus.FAILED);

        List<IngestionJob> failed = tracker.failedJobs(NOW.minus(Duration.ofDays(1)));

        assertEquals(2, failed.size());
        assertEquals(NOW.minus(Duration.ofHours(1)), failed.get(0).getStartTime());
        assertEquals("weather_incremental_ingestion", failed.get(1).getJobName());
    }

    private void completeAt(String jobName, Instant start, JobStatus status) {
        IngestionJob job = IngestionJob.builder()
                .jobName(jobName)
                .dataSource("test")
                .startTime(start)
                .status(JobStatus.RUNNING)
                .build();
        job.finish(status, start.plusSeconds(5));
        tracker.complete(job);
    }
}
