package com.energyanalytics.ingestion.orchestration;

import com.energyanalytics.ingestion.config.EnergyIngestionProperties;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.persistence.Upserter;
import com.energyanalytics.ingestion.source.SourceClient;
import com.energyanalytics.ingestion.tracking.JobTracker;
import com.energyanalytics.ingestion.validation.RecordValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One orchestrator per enabled source, built once at startup.
 */
@Component
@Slf4j
public class OrchestratorRegistry {

    private final Map<SourceType, IngestionOrchestrator> orchestrators = new EnumMap<>(SourceType.class);

    public OrchestratorRegistry(List<SourceClient> clients,
                                EnergyIngestionProperties properties,
                                RecordValidator validator,
                                Upserter upserter,
                                JobTracker jobTracker,
                                Sleeper sleeper,
                                Clock clock) {
        Map<SourceType, SourceClient> byType = new EnumMap<>(SourceType.class);
        for (SourceClient client : clients) {
            byType.put(client.sourceType(), client);
        }

        RetryPolicy retryPolicy = RetryPolicy.from(properties.getIngestion());
        for (SourceType type : SourceType.values()) {
            if (!properties.settingsFor(type).isEnabled()) {
                log.info("Source {} disabled", type);
                continue;
            }
            SourceClient client = byType.get(type);
            if (client == null) {
                throw new IllegalStateException("No SourceClient registered for " + type);
            }
            orchestrators.put(type, IngestionOrchestrator.builder()
                    .client(client)
                    .settings(properties.settingsFor(type))
                    .validator(validator)
                    .validationConfig(properties.getValidation())
                    .upserter(upserter)
                    .jobTracker(jobTracker)
                    .retryPolicy(retryPolicy)
                    .sleeper(sleeper)
                    .clock(clock)
                    .build());
        }
        log.info("Ingestion sources enabled: {}", orchestrators.keySet());
    }

    /**
     * @throws IllegalArgumentException when the source is disabled
     */
    public IngestionOrchestrator forSource(SourceType type) {
        IngestionOrchestrator orchestrator = orchestrators.get(type);
        if (orchestrator == null) {
            throw new IllegalArgumentException("Source " + type.name().toLowerCase() + " is disabled");
        }
        return orchestrator;
    }

    public Set<SourceType> enabledSources() {
        return Collections.unmodifiableSet(orchestrators.keySet());
    }
}
