package com.energyanalytics.ingestion.config;

import com.energyanalytics.ingestion.model.IngestionJob;
import com.energyanalytics.ingestion.model.JobStatistics;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.orchestration.StreamingManager;
import com.energyanalytics.ingestion.service.IngestionService;
import com.energyanalytics.ingestion.tracking.JobTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionService ingestionService;
    private final JobTracker jobTracker;
    private final StreamingManager streamingManager;
    private final Clock clock;

    // ── Ingestion triggers ────────────────────────────────────────────────────

    @PostMapping("/ingest/{source}/trigger")
    public ResponseEntity<Map<String, String>> trigger(@PathVariable String source) {
        SourceType type;
        try {
            type = SourceType.fromPath(source);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        if (!ingestionService.isEnabled(type)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Source " + name(type) + " is disabled"));
        }
        new Thread(() -> runSafely(() -> ingestionService.ingestLatest(type), "trigger " + type),
                "manual-ingest-" + name(type)).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "source", name(type), "target", "latest"));
    }

    @PostMapping("/ingest/{source}/backfill")
    public ResponseEntity<Map<String, String>> backfill(@PathVariable String source,
                                                        @RequestParam(defaultValue = "30") int days) {
        SourceType type;
        try {
            type = SourceType.fromPath(source);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        if (!ingestionService.isEnabled(type)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Source " + name(type) + " is disabled"));
        }
        if (days < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "days must be at least 1"));
        }
        new Thread(() -> runSafely(() -> ingestionService.backfill(type, days), "backfill " + type),
                "manual-backfill-" + name(type)).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "source", name(type), "days", String.valueOf(days)));
    }

    @PostMapping("/ingest/backfill")
    public ResponseEntity<Map<String, String>> backfillAll(@RequestParam(defaultValue = "30") int days) {
        if (days < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "days must be at least 1"));
        }
        new Thread(() -> runSafely(() -> ingestionService.backfillAll(days), "backfill all"),
                "manual-backfill-all").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "source", "all", "days", String.valueOf(days)));
    }

    // ── Job log and status ────────────────────────────────────────────────────

    @GetMapping("/ingest/jobs")
    public ResponseEntity<?> recentJobs(@RequestParam(defaultValue = "20") int limit) {
        try {
            List<IngestionJob> jobs = jobTracker.recentJobs(limit);
            return ResponseEntity.ok(jobs);
        } catch (Exception e) {
            log.error("Job query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /ingest/jobs/failed?hours=24
     *
     * Failed jobs started in the trailing window, most recent first.
     */
    @GetMapping("/ingest/jobs/failed")
    public ResponseEntity<?> failedJobs(@RequestParam(defaultValue = "24") int hours) {
        if (hours < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "hours must be at least 1"));
        }
        try {
            Instant since = clock.instant().minus(Duration.ofHours(hours));
            return ResponseEntity.ok(jobTracker.failedJobs(since));
        } catch (Exception e) {
            log.error("Failed job query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /ingest/jobs/stats?days=7
     *
     * Totals by status, records processed and inserted, success rate (%) and average duration.
     */
    @GetMapping("/ingest/jobs/stats")
    public ResponseEntity<?> statistics(@RequestParam(defaultValue = "7") int days) {
        if (days < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "days must be at least 1"));
        }
        try {
            JobStatistics stats = jobTracker.statistics(days);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("days", stats.days());
            body.put("totalJobs", stats.totalJobs());
            body.put("successfulJobs", stats.successfulJobs());
            body.put("partialJobs", stats.partialJobs());
            body.put("failedJobs", stats.failedJobs());
            body.put("recordsProcessed", stats.recordsProcessed());
            body.put("recordsInserted", stats.recordsInserted());
            body.put("averageDurationSeconds", stats.averageDurationSeconds());
            body.put("successRate", stats.successRate());
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("Job statistics query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/ingest/streaming/status")
    public ResponseEntity<StreamingManager.StreamingStatus> streamingStatus() {
        return ResponseEntity.ok(streamingManager.status());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void runSafely(Runnable task, String description) {
        try {
            task.run();
        } catch (Exception e) {
            log.error("Manual {} failed: {}", description, e.getMessage(), e);
        }
    }

    private String name(SourceType type) {
        return type.name().toLowerCase(Locale.ROOT);
    }
}
