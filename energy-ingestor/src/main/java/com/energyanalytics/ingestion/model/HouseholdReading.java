package com.energyanalytics.ingestion.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One minute of household electricity consumption.
 *
 * Units follow the UCI dataset:
 *  - global active/reactive power in kW (minute-averaged)
 *  - voltage in V, intensity in A
 *  - sub-metering in Wh of active energy for the minute
 */
@Data
@Builder(toBuilder = true)
public class HouseholdReading implements NormalizedRecord {

    // ── Natural key ─────────────────────────────────────────────────────────
    /** Minute the reading covers, UTC */
    private Instant timestamp;

    private String householdId;

    // ── Measurements ────────────────────────────────────────────────────────
    private Double globalActivePower;
    private Double globalReactivePower;
    private Double voltage;
    private Double globalIntensity;

    /** Kitchen: dishwasher, oven, microwave */
    private Double subMetering1;

    /** Laundry room: washing machine, tumble-drier, fridge, light */
    private Double subMetering2;

    /** Water heater and air conditioner */
    private Double subMetering3;

    // ── Metadata ────────────────────────────────────────────────────────────
    private Double dataQualityScore;

    /** Archive entry or file the row was read from, "synthetic" for generated rows */
    private String sourceFile;

    private SyntheticQuality syntheticQuality;

    /**
     * Active energy (Wh) consumed in the minute by circuits not covered by the sub-meters.
     * Null when any input is missing.
     */
    public Double getCalculatedOtherConsumption() {
        if (globalActivePower == null || subMetering1 == null || subMetering2 == null || subMetering3 == null) {
            return null;
        }
        return globalActivePower * 1000.0 / 60.0 - subMetering1 - subMetering2 - subMetering3;
    }

    @Override
    public SourceType getSourceType() {
        return SourceType.HOUSEHOLD;
    }

    @Override
    public String getEntityKey() {
        return householdId;
    }

    @Override
    public Map<String, Double> measurements() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("global_active_power", globalActivePower);
        values.put("global_reactive_power", globalReactivePower);
        values.put("voltage", voltage);
        values.put("global_intensity", globalIntensity);
        values.put("sub_metering_1", subMetering1);
        values.put("sub_metering_2", subMetering2);
        values.put("sub_metering_3", subMetering3);
        return values;
    }

    @Override
    public Map<String, Object> columnValues() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("timestamp", timestamp);
        columns.put("household_id", householdId);
        columns.putAll(measurements());
        columns.put("calculated_other_consumption", getCalculatedOtherConsumption());
        columns.put("data_quality_score", dataQualityScore);
        columns.put("source_file", sourceFile);
        return columns;
    }
}
