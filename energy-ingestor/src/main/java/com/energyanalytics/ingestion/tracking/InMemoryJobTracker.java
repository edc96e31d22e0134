package com.energyanalytics.ingestion.tracking;

import com.energyanalytics.ingestion.model.IngestionJob;
import com.energyanalytics.ingestion.model.JobStatistics;
import com.energyanalytics.ingestion.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Job log kept in memory. Used when no job-log database is configured, and in tests.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "energy-ingestion.job-log.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryJobTracker implements JobTracker {

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, IngestionJob> jobs = new ConcurrentHashMap<>();

    public InMemoryJobTracker(Clock clock) {
        this.clock = clock;
    }

    @Override
    public IngestionJob start(String jobName, String dataSource) {
        IngestionJob job = IngestionJob.builder()
                .id(sequence.incrementAndGet())
                .jobName(jobName)
                .dataSource(dataSource)
                .startTime(clock.instant())
                .status(JobStatus.RUNNING)
                .build();
        jobs.put(job.getId(), job.toBuilder().build());
        log.debug("Started job {} ({})", job.getId(), jobName);
        return job;
    }

    @Override
    public void complete(IngestionJob job) {
        IngestionJob copy = job.toBuilder().build();
        if (copy.getId() == null) {
            copy.setId(sequence.incrementAndGet());
        }
        jobs.put(copy.getId(), copy);
    }

    @Override
    public List<IngestionJob> recentJobs(int limit) {
        return jobs.values().stream()
                .sorted(Comparator.comparing(IngestionJob::getStartTime).reversed()
                        .thenComparing(IngestionJob::getId, Comparator.reverseOrder()))
                .limit(Math.max(1, limit))
                .map(j -> j.toBuilder().build())
                .toList();
    }

    @Override
    public List<IngestionJob> failedJobs(Instant since) {
        return jobs.values().stream()
                .filter(j -> j.getStatus() == JobStatus.FAILED && !j.getStartTime().isBefore(since))
                .sorted(Comparator.comparing(IngestionJob::getStartTime).reversed()
                        .thenComparing(IngestionJob::getId, Comparator.reverseOrder()))
                .map(j -> j.toBuilder().build())
                .toList();
    }

    @Override
    public JobStatistics statistics(int days) {
        Instant since = clock.instant().minus(Duration.ofDays(days));
        List<IngestionJob> window = jobs.values().stream()
                .filter(j -> !j.getStartTime().isBefore(since))
                .toList();

        double avgDuration = window.stream()
                .filter(j -> j.getProcessingDurationSeconds() != null)
                .mapToLong(IngestionJob::getProcessingDurationSeconds)
                .average()
                .orElse(0.0);

        return new JobStatistics(days,
                window.size(),
                count(window, JobStatus.SUCCESS),
                count(window, JobStatus.PARTIAL_SUCCESS),
                count(window, JobStatus.FAILED),
                window.stream().mapToLong(IngestionJob::getRecordsProcessed).sum(),
                window.stream().mapToLong(IngestionJob::getRecordsInserted).sum(),
                avgDuration);
    }

    private long count(List<IngestionJob> jobs, JobStatus status) {
        return jobs.stream().filter(j -> j.getStatus() == status).count();
    }
}
