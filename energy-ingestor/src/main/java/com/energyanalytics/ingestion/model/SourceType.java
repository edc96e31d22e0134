package com.energyanalytics.ingestion.model;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * The closed set of ingestion sources. Each variant knows the table it lands in,
 * the natural-key columns used for upsert conflict resolution and the sampling
 * granularity of its time series.
 */
public enum SourceType {

    HOUSEHOLD("household.consumption", "household_id", Duration.ofMinutes(1), "UCI Household Power Consumption"),
    WEATHER("weather.observations", "location_id", Duration.ofHours(1), "Open-Meteo"),
    GRID("grid.operations", "country_code", Duration.ofHours(1), "Open Power System Data");

    private final String tableName;
    private final String entityColumn;
    private final Duration granularity;
    private final String displayName;

    SourceType(String tableName, String entityColumn, Duration granularity, String displayName) {
        this.tableName = tableName;
        this.entityColumn = entityColumn;
        this.granularity = granularity;
        this.displayName = displayName;
    }

    public String getTableName() {
        return tableName;
    }

    public String getEntityColumn() {
        return entityColumn;
    }

    public List<String> getConflictColumns() {
        return List.of("timestamp", entityColumn);
    }

    public Duration getGranularity() {
        return granularity;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String jobName(RunMode mode) {
        return name().toLowerCase(Locale.ROOT) + "_" + mode.name().toLowerCase(Locale.ROOT) + "_ingestion";
    }

    /**
     * Lenient lookup used by the REST surface: "weather", "WEATHER" and " Weather " all resolve.
     */
    public static SourceType fromPath(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("source must not be empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown source: " + value + " (expected household, weather or grid)");
        }
    }
}
