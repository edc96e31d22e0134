package com.energyanalytics.ingestion.orchestration;

import com.energyanalytics.ingestion.config.EnergyIngestionProperties;
import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.exception.FetchException;
import com.energyanalytics.ingestion.exception.PartialWriteException;
import com.energyanalytics.ingestion.exception.ValidationRejectedException;
import com.energyanalytics.ingestion.model.FetchResult;
import com.energyanalytics.ingestion.model.IngestionJob;
import com.energyanalytics.ingestion.model.JobStatus;
import com.energyanalytics.ingestion.model.RunMode;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.TimeWindow;
import com.energyanalytics.ingestion.model.ValidationOutcome;
import com.energyanalytics.ingestion.model.WriteResult;
import com.energyanalytics.ingestion.persistence.Upserter;
import com.energyanalytics.ingestion.source.SourceClient;
import com.energyanalytics.ingestion.tracking.JobTracker;
import com.energyanalytics.ingestion.validation.RecordValidator;
import com.energyanalytics.ingestion.validation.ValidationPolicy;
import com.energyanalytics.ingestion.validation.ValidationRules;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one ingestion for one source: fetch (with retries) → validate → upsert, and
 * records the outcome as an {@link IngestionJob}.
 *
 * {@link #run} never throws. Every failure ends up in the returned job's status and
 * error message. Runs of the same orchestrator are serialised.
 */
@Slf4j
public class IngestionOrchestrator {

    static final String MDC_SOURCE = "ingestion.source";
    static final String MDC_JOB_ID = "job.id";

    private final SourceType sourceType;
    private final SourceClient client;
    private final SourceSettings settings;
    private final RecordValidator validator;
    private final ValidationRules rules;
    private final EnergyIngestionProperties.Validation validationConfig;
    private final Upserter upserter;
    private final JobTracker jobTracker;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;

    private final ReentrantLock runLock = new ReentrantLock();
    private volatile RunState state = RunState.IDLE;

    @Builder
    public IngestionOrchestrator(SourceClient client,
                                 SourceSettings settings,
                                 RecordValidator validator,
                                 EnergyIngestionProperties.Validation validationConfig,
                                 Upserter upserter,
                                 JobTracker jobTracker,
                                 RetryPolicy retryPolicy,
                                 Sleeper sleeper,
                                 Clock clock) {
        this.sourceType = client.sourceType();
        this.client = client;
        this.settings = settings;
        this.validator = validator;
        this.rules = ValidationRules.forSource(sourceType, settings);
        this.validationConfig = validationConfig;
        this.upserter = upserter;
        this.jobTracker = jobTracker;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    public RunState getState() {
        return state;
    }

    public IngestionJob run(TimeWindow window, RunMode mode) {
        runLock.lock();
        try {
            MDC.put(MDC_SOURCE, sourceType.name().toLowerCase(Locale.ROOT));
            return execute(window, mode);
        } finally {
            MDC.remove(MDC_JOB_ID);
            MDC.remove(MDC_SOURCE);
            runLock.unlock();
        }
    }

    // ── Run phases ────────────────────────────────────────────────────────────

    private IngestionJob execute(TimeWindow window, RunMode mode) {
        IngestionJob job = startJob(sourceType.jobName(mode));
        state = RunState.RUNNING;
        log.info("Starting {} run for {} (job {})", mode, window, job.getId());

        try {
            FetchResult fetched = fetchWithRetry(window);
            job.setRecordsProcessed(fetched.size());
            if (fetched.synthetic()) {
                log.warn("{} batch is synthetic ({}), {} records", sourceType, fetched.origin(), fetched.size());
            }

            ValidationOutcome outcome = validator.validate(fetched.records(), ValidationPolicy.of(validationConfig, rules, mode));
            job.setRecordsRejected(outcome.rejectedCount());
            if (!outcome.acceptable()) {
                throw new ValidationRejectedException(outcome);
            }

            WriteResult written = upserter.write(outcome.acceptedRecords(), job.getId());
            job.setRecordsInserted(written.inserted());
            job.setRecordsUpdated(written.updated());
            if (!written.isComplete()) {
                throw new PartialWriteException(written);
            }

            finish(job, JobStatus.SUCCESS, null);

        } catch (ValidationRejectedException e) {
            log.error("{} run rejected by validation: {}", sourceType, e.getOutcome().summary());
            finish(job, JobStatus.FAILED, e.getMessage());

        } catch (PartialWriteException e) {
            WriteResult result = e.getResult();
            job.setRecordsRejected(job.getRecordsRejected() + result.failed());
            JobStatus status = result.committed() > 0 ? JobStatus.PARTIAL_SUCCESS : JobStatus.FAILED;
            log.error("{} write incomplete: {}", sourceType, e.getMessage());
            finish(job, status, e.getMessage());

        } catch (FetchException e) {
            log.error("{} fetch failed: {}", sourceType, e.getMessage());
            finish(job, JobStatus.FAILED, e.getMessage());

        } catch (RunCancelledException e) {
            log.warn("{} run cancelled: {}", sourceType, e.getMessage());
            finish(job, JobStatus.FAILED, e.getMessage());

        } catch (RuntimeException e) {
            log.error("{} run failed unexpectedly: {}", sourceType, e.getMessage(), e);
            finish(job, JobStatus.FAILED, "Unexpected error: " + e.getMessage());
        }

        return job;
    }

    private IngestionJob startJob(String jobName) {
        IngestionJob job;
        try {
            job = jobTracker.start(jobName, sourceType.getDisplayName());
        } catch (RuntimeException e) {
            log.error("Job tracker unavailable, continuing untracked: {}", e.getMessage());
            job = IngestionJob.builder()
                    .jobName(jobName)
                    .dataSource(sourceType.getDisplayName())
                    .startTime(clock.instant())
                    .status(JobStatus.RUNNING)
                    .build();
        }
        if (job.getId() != null) {
            MDC.put(MDC_JOB_ID, String.valueOf(job.getId()));
        }
        return job;
    }

    private FetchResult fetchWithRetry(TimeWindow window) {
        RetryState retry = new RetryState(retryPolicy);
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new RunCancelledException("Cancelled before fetch attempt " + (retry.getAttempts() + 1));
            }
            retry.beginAttempt();
            try {
                return client.fetch(window, settings);
            } catch (FetchException e) {
                switch (retry.onFailure(e)) {
                    case ABORT -> {
                        log.error("{} fetch attempt {}/{} failed permanently: {}",
                                sourceType, retry.getAttempts(), retry.getMaxAttempts(), e.getMessage());
                        throw e;
                    }
                    case EXHAUSTED -> {
                        log.error("{} fetch gave up after {} attempts ({} total backoff): {}",
                                sourceType, retry.getAttempts(), retry.getAccumulatedBackoff(), e.getMessage());
                        throw e;
                    }
                    case RETRY -> {
                        Duration delay = retry.nextDelay();
                        log.warn("{} fetch attempt {}/{} failed, retrying in {}: {}",
                                sourceType, retry.getAttempts(), retry.getMaxAttempts(), delay, e.getMessage());
                        pause(delay, retry);
                    }
                }
            }
        }
    }

    private void pause(Duration delay, RetryState retry) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Cancelled while waiting to retry after attempt " + retry.getAttempts());
        }
    }

    private void finish(IngestionJob job, JobStatus status, String errorMessage) {
        job.setErrorMessage(errorMessage);
        job.finish(status, clock.instant());
        state = switch (status) {
            case SUCCESS -> RunState.SUCCEEDED;
            case PARTIAL_SUCCESS -> RunState.PARTIALLY_SUCCEEDED;
            default -> RunState.FAILED;
        };
        try {
            jobTracker.complete(job);
        } catch (RuntimeException e) {
            log.error("Could not record completion of job {}: {}", job.getId(), e.getMessage());
        }
        log.info("{} job {} finished {}: processed={}, inserted={}, updated={}, rejected={}, duration={}s",
                sourceType, job.getId(), status, job.getRecordsProcessed(), job.getRecordsInserted(),
                job.getRecordsUpdated(), job.getRecordsRejected(), job.getProcessingDurationSeconds());
    }
}
