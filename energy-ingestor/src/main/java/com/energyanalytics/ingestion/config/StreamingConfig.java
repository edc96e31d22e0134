package com.energyanalytics.ingestion.config;

import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.orchestration.OrchestratorRegistry;
import com.energyanalytics.ingestion.orchestration.Sleeper;
import com.energyanalytics.ingestion.orchestration.StreamingManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class StreamingConfig {

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public StreamingManager streamingManager(OrchestratorRegistry registry,
                                             EnergyIngestionProperties properties,
                                             Clock clock) {
        List<StreamingManager.Stream> streams = new ArrayList<>();
        for (SourceType type : registry.enabledSources()) {
            SourceSettings s = properties.settingsFor(type);
            streams.add(new StreamingManager.Stream(
                    registry.forSource(type), s.getCadence(), s.getInitialDelay(), s.getLookback()));
        }
        return new StreamingManager(streams, clock);
    }
}
