package com.energyanalytics.ingestion.scheduler;

import com.energyanalytics.ingestion.config.EnergyIngestionProperties;
import com.energyanalytics.ingestion.orchestration.StreamingManager;
import com.energyanalytics.ingestion.service.IngestionService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ties the streaming manager to the application lifecycle.
 *
 * On startup:
 *  1. Optionally run a backfill of every source if run-on-startup is set
 *  2. Start streaming if enabled
 * On shutdown, stop streaming and give in-flight runs the drain timeout to finish.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestionScheduler {

    private final StreamingManager streamingManager;
    private final IngestionService ingestionService;
    private final EnergyIngestionProperties properties;

    @PostConstruct
    public void onStartup() {
        EnergyIngestionProperties.Streaming streaming = properties.getStreaming();

        if (streaming.isRunOnStartup()) {
            int days = streaming.getBackfillDays();
            log.info("run-on-startup=true, backfilling {} days in the background", days);
            new Thread(() -> {
                try {
                    ingestionService.backfillAll(days);
                } catch (Exception e) {
                    log.error("Startup backfill failed: {}", e.getMessage(), e);
                }
            }, "startup-backfill").start();
        }

        if (streaming.isEnabled()) {
            streamingManager.start();
        } else {
            log.info("Streaming disabled. Ingestion runs only on demand via /ingest endpoints.");
        }
    }

    @PreDestroy
    public void onShutdown() {
        if (streamingManager.isRunning()) {
            log.info("Stopping streaming (drain timeout {})", properties.getStreaming().getDrainTimeout());
            streamingManager.stop(properties.getStreaming().getDrainTimeout());
        }
    }
}
