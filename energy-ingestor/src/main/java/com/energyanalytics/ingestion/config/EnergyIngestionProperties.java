package com.energyanalytics.ingestion.config;

import com.energyanalytics.ingestion.model.SourceType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Component
@ConfigurationProperties(prefix = "energy-ingestion")
@Data
public class EnergyIngestionProperties {

    private Ingestion ingestion = new Ingestion();
    private Validation validation = new Validation();
    private Streaming streaming = new Streaming();
    private JobLog jobLog = new JobLog();

    private SourceSettings household = SourceSettings.householdDefaults();
    private SourceSettings weather = SourceSettings.weatherDefaults();
    private SourceSettings grid = SourceSettings.gridDefaults();

    public SourceSettings settingsFor(SourceType type) {
        return switch (type) {
            case HOUSEHOLD -> household;
            case WEATHER -> weather;
            case GRID -> grid;
        };
    }

    @Data
    public static class Ingestion {
        private int batchSize = 1000;

        /** Fetch attempts per run; application.yml raises this to 10 */
        private int maxRetries = 3;

        /** Plain numbers are read as seconds */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration retryDelay = Duration.ofSeconds(60);

        private Backoff backoff = Backoff.EXPONENTIAL;
        private double backoffMultiplier = 2.0;
        private Duration maxRetryDelay = Duration.ofMinutes(10);

        /** Extra attempts per chunk before the write gives up and reports a partial result */
        private int chunkRetries = 2;
        private Duration chunkRetryDelay = Duration.ofSeconds(1);

        private int retentionDays = 1095;

        public enum Backoff {
            FIXED, EXPONENTIAL
        }
    }

    @Data
    public static class Validation {
        private boolean strict = false;

        /** Highest rejected/total ratio a non-strict run accepts */
        private double rejectionTolerance = 0.2;

        private QualityWeights weights = new QualityWeights();

        @Data
        public static class QualityWeights {
            private double completeness = 0.25;
            private double accuracy = 0.25;
            private double freshness = 0.25;
            private double consistency = 0.25;
        }
    }

    @Data
    public static class Streaming {
        private boolean enabled = false;
        private Duration drainTimeout = Duration.ofSeconds(30);
        private boolean runOnStartup = false;
        private int backfillDays = 30;
    }

    @Data
    public static class JobLog {
        private boolean persistenceEnabled = false;
    }
}
