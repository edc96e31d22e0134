package com.energyanalytics.ingestion.tracking;

import com.energyanalytics.ingestion.model.IngestionJob;
import com.energyanalytics.ingestion.model.JobStatistics;
import com.energyanalytics.ingestion.model.JobStatus;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Job log in the metadata.ingestion_log table.
 *
 * Writes go through the "jobLog" Resilience4j retry. When a write still fails the
 * run carries on: a job whose start row is missing gets its full row inserted at
 * completion.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "energy-ingestion.job-log.persistence-enabled", havingValue = "true")
public class JdbcJobTracker implements JobTracker {

    private static final String INSERT_START = """
            INSERT INTO metadata.ingestion_log (job_name, data_source, start_time, status)
            VALUES (?, ?, ?, ?)
            RETURNING id
            """;

    private static final String UPDATE_COMPLETE = """
            UPDATE metadata.ingestion_log
            SET end_time = ?, status = ?, records_processed = ?, records_inserted = ?,
                records_updated = ?, records_rejected = ?, processing_duration_seconds = ?, error_message = ?
            WHERE id = ?
            """;

    private static final String INSERT_FULL = """
            INSERT INTO metadata.ingestion_log
            (job_name, data_source, start_time, end_time, status, records_processed, records_inserted,
             records_updated, records_rejected, processing_duration_seconds, error_message)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_RECENT = """
            SELECT id, job_name, data_source, start_time, end_time, status, records_processed,
                   records_inserted, records_updated, records_rejected, processing_duration_seconds, error_message
            FROM metadata.ingestion_log
            ORDER BY start_time DESC, id DESC
            LIMIT ?
            """;

    private static final String SELECT_FAILED = """
            SELECT id, job_name, data_source, start_time, end_time, status, records_processed,
                   records_inserted, records_updated, records_rejected, processing_duration_seconds, error_message
            FROM metadata.ingestion_log
            WHERE status = 'failed' AND start_time >= ?
            ORDER BY start_time DESC, id DESC
            """;

    private static final String SELECT_STATISTICS = """
            SELECT COUNT(*)                                                  AS total_jobs,
                   COUNT(*) FILTER (WHERE status = 'success')                AS successful_jobs,
                   COUNT(*) FILTER (WHERE status = 'partial_success')        AS partial_jobs,
                   COUNT(*) FILTER (WHERE status = 'failed')                 AS failed_jobs,
                   COALESCE(SUM(records_processed), 0)                       AS records_processed,
                   COALESCE(SUM(records_inserted), 0)                        AS records_inserted,
                   COALESCE(AVG(processing_duration_seconds), 0)             AS avg_duration
            FROM metadata.ingestion_log
            WHERE start_time >= ?
            """;

    private static final RowMapper<IngestionJob> JOB_ROW_MAPPER = (rs, rowNum) -> IngestionJob.builder()
            .id(rs.getLong("id"))
            .jobName(rs.getString("job_name"))
            .dataSource(rs.getString("data_source"))
            .startTime(toInstant(rs.getTimestamp("start_time")))
            .endTime(toInstant(rs.getTimestamp("end_time")))
            .status(JobStatus.fromDbValue(rs.getString("status")))
            .recordsProcessed(rs.getInt("records_processed"))
            .recordsInserted(rs.getInt("records_inserted"))
            .recordsUpdated(rs.getInt("records_updated"))
            .recordsRejected(rs.getInt("records_rejected"))
            .processingDurationSeconds(rs.getObject("processing_duration_seconds") != null
                    ? rs.getLong("processing_duration_seconds") : null)
            .errorMessage(rs.getString("error_message"))
            .build();

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcJobTracker(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbc = jdbcTemplate;
        this.clock = clock;
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static Timestamp toTimestamp(Instant i) {
        return i != null ? Timestamp.from(i) : null;
    }

    @Override
    @Retry(name = "jobLog", fallbackMethod = "startWithoutRow")
    public IngestionJob start(String jobName, String dataSource) {
        Instant now = clock.instant();
        Long id = jdbc.queryForObject(INSERT_START, Long.class,
                jobName, dataSource, toTimestamp(now), JobStatus.RUNNING.getDbValue());
        return IngestionJob.builder()
                .id(id)
                .jobName(jobName)
                .dataSource(dataSource)
                .startTime(now)
                .status(JobStatus.RUNNING)
                .build();
    }

    private IngestionJob startWithoutRow(String jobName, String dataSource, Exception e) {
        log.error("Could not record start of job {}: {}", jobName, e.getMessage());
        return IngestionJob.builder()
                .jobName(jobName)
                .dataSource(dataSource)
                .startTime(clock.instant())
                .status(JobStatus.RUNNING)
                .build();
    }

    @Override
    @Retry(name = "jobLog", fallbackMethod = "completeFailed")
    public void complete(IngestionJob job) {
        if (job.getId() != null) {
            int rows = jdbc.update(UPDATE_COMPLETE,
                    toTimestamp(job.getEndTime()),
                    job.getStatus().getDbValue(),
                    job.getRecordsProcessed(),
                    job.getRecordsInserted(),
                    job.getRecordsUpdated(),
                    job.getRecordsRejected(),
                    job.getProcessingDurationSeconds(),
                    job.getErrorMessage(),
                    job.getId());
            if (rows > 0) return;
            log.warn("Job {} has no start row, inserting full record", job.getId());
        }
        jdbc.update(INSERT_FULL,
                job.getJobName(),
                job.getDataSource(),
                toTimestamp(job.getStartTime()),
                toTimestamp(job.getEndTime()),
                job.getStatus().getDbValue(),
                job.getRecordsProcessed(),
                job.getRecordsInserted(),
                job.getRecordsUpdated(),
                job.getRecordsRejected(),
                job.getProcessingDurationSeconds(),
                job.getErrorMessage());
    }

    private void completeFailed(IngestionJob job, Exception e) {
        log.error("Could not record completion of job {} ({} {}): {}",
                job.getId(), job.getJobName(), job.getStatus(), e.getMessage());
    }

    @Override
    public List<IngestionJob> recentJobs(int limit) {
        return jdbc.query(SELECT_RECENT, JOB_ROW_MAPPER, Math.max(1, limit));
    }

    @Override
    public List<IngestionJob> failedJobs(Instant since) {
        return jdbc.query(SELECT_FAILED, JOB_ROW_MAPPER, toTimestamp(since));
    }

    @Override
    public JobStatistics statistics(int days) {
        Instant since = clock.instant().minus(Duration.ofDays(days));
        return jdbc.queryForObject(SELECT_STATISTICS, (rs, rowNum) -> new JobStatistics(
                days,
                rs.getLong("total_jobs"),
                rs.getLong("successful_jobs"),
                rs.getLong("partial_jobs"),
                rs.getLong("failed_jobs"),
                rs.getLong("records_processed"),
                rs.getLong("records_inserted"),
                rs.getDouble("avg_duration")), toTimestamp(since));
    }
}
