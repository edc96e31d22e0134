package com.energyanalytics.ingestion.service;

import com.energyanalytics.ingestion.config.EnergyIngestionProperties;
import com.energyanalytics.ingestion.model.IngestionJob;
import com.energyanalytics.ingestion.model.JobStatus;
import com.energyanalytics.ingestion.model.RunMode;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.TimeWindow;
import com.energyanalytics.ingestion.orchestration.IngestionOrchestrator;
import com.energyanalytics.ingestion.orchestration.OrchestratorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One-shot ingestion entry points used by the REST triggers and the startup backfill.
 *
 * The latest run asks for the source's configured lookback ending now. A backfill walks
 * the last N days one day at a time, oldest first, so each day is its own job.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionService {

    private final OrchestratorRegistry registry;
    private final EnergyIngestionProperties properties;
    private final Clock clock;

    public boolean isEnabled(SourceType source) {
        return registry.enabledSources().contains(source);
    }

    /**
     * Ingest the most recent window for one source.
     */
    public IngestionJob ingestLatest(SourceType source) {
        IngestionOrchestrator orchestrator = registry.forSource(source);
        Duration lookback = properties.settingsFor(source).getLookback();
        TimeWindow window = TimeWindow.endingAt(clock.instant(), lookback);
        log.info("Ingesting latest {} window {}", source, window);
        return orchestrator.run(window, RunMode.INCREMENTAL);
    }

    /**
     * Backfill the last {@code days} days of one source. Days beyond the retention period are not requested.
     */
    public List<IngestionJob> backfill(SourceType source, int days) {
        IngestionOrchestrator orchestrator = registry.forSource(source);
        int effectiveDays = clampDays(days);

        Instant end = clock.instant().truncatedTo(ChronoUnit.HOURS);
        TimeWindow range = new TimeWindow(end.minus(Duration.ofDays(effectiveDays)), end);
        List<TimeWindow> slices = range.splitByDay();
        log.info("Starting {} backfill: {} days in {} windows", source, effectiveDays, slices.size());

        List<IngestionJob> jobs = new ArrayList<>();
        for (TimeWindow slice : slices) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("{} backfill interrupted after {}/{} windows", source, jobs.size(), slices.size());
                break;
            }
            jobs.add(orchestrator.run(slice, RunMode.BACKFILL));
        }

        long failed = jobs.stream().filter(j -> j.getStatus() == JobStatus.FAILED).count();
        log.info("{} backfill complete: {} windows, {} failed", source, jobs.size(), failed);
        return jobs;
    }

    /**
     * Backfill every enabled source, one source after the other.
     */
    public Map<SourceType, List<IngestionJob>> backfillAll(int days) {
        Map<SourceType, List<IngestionJob>> results = new EnumMap<>(SourceType.class);
        for (SourceType source : registry.enabledSources()) {
            results.put(source, backfill(source, days));
        }
        return results;
    }

    private int clampDays(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be at least 1: " + days);
        }
        int retention = properties.getIngestion().getRetentionDays();
        if (days > retention) {
            log.warn("Backfill of {} days exceeds retention of {} days, clamping", days, retention);
            return retention;
        }
        return days;
    }
}
