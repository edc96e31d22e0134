package com.energyanalytics.ingestion.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hourly weather observation for one configured location.
 */
@Data
@Builder(toBuilder = true)
public class WeatherObservation implements NormalizedRecord {

    // ── Natural key ─────────────────────────────────────────────────────────
    private Instant timestamp;

    /** Configured location identifier, e.g. "paris_fr_001" */
    private String locationId;

    // ── Location ────────────────────────────────────────────────────────────
    private Double latitude;
    private Double longitude;

    // ── Measurements ────────────────────────────────────────────────────────
    private Double temperature2mC;
    private Double relativeHumidity2mPct;
    private Double dewPoint2mC;
    private Double apparentTemperatureC;
    private Double rainMm;
    private Double shortwaveRadiationWm2;
    private Double windSpeed10mKmh;
    private Double windDirection10mDeg;
    private Double windGusts10mKmh;
    private Double cloudCoverPct;
    private Double surfacePressureHpa;
    private Double visibilityM;

    // ── Metadata ────────────────────────────────────────────────────────────
    private Double dataQualityScore;

    /** e.g. "Open-Meteo ERA5", "Open-Meteo Forecast", "Synthetic Generator" */
    private String dataProvider;

    private SyntheticQuality syntheticQuality;

    @Override
    public SourceType getSourceType() {
        return SourceType.WEATHER;
    }

    @Override
    public String getEntityKey() {
        return locationId;
    }

    @Override
    public Map<String, Double> measurements() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("temperature_2m_c", temperature2mC);
        values.put("relative_humidity_2m_pct", relativeHumidity2mPct);
        values.put("dew_point_2m_c", dewPoint2mC);
        values.put("apparent_temperature_c", apparentTemperatureC);
        values.put("rain_mm", rainMm);
        values.put("shortwave_radiation_w_m2", shortwaveRadiationWm2);
        values.put("wind_speed_10m_kmh", windSpeed10mKmh);
        values.put("wind_direction_10m_deg", windDirection10mDeg);
        values.put("wind_gusts_10m_kmh", windGusts10mKmh);
        values.put("cloud_cover_pct", cloudCoverPct);
        values.put("surface_pressure_hpa", surfacePressureHpa);
        values.put("visibility_m", visibilityM);
        return values;
    }

    @Override
    public Map<String, Object> columnValues() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("timestamp", timestamp);
        columns.put("location_id", locationId);
        columns.put("latitude", latitude);
        columns.put("longitude", longitude);
        columns.putAll(measurements());
        columns.put("data_quality_score", dataQualityScore);
        columns.put("data_provider", dataProvider);
        return columns;
    }
}
