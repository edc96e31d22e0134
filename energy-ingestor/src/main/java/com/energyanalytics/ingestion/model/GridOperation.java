package com.energyanalytics.ingestion.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hourly grid load, generation mix and price for one country. All power values in MW.
 */
@Data
@Builder(toBuilder = true)
public class GridOperation implements NormalizedRecord {

    // ── Natural key ─────────────────────────────────────────────────────────
    private Instant timestamp;

    /** ISO 3166 alpha-2, e.g. "FR" */
    private String countryCode;

    /** Bidding zone / control area. Equal to countryCode for the supported countries */
    private String regionCode;

    // ── Load ────────────────────────────────────────────────────────────────
    private Double loadActualMw;
    private Double loadForecastMw;

    // ── Generation by source ────────────────────────────────────────────────
    private Double solarGenerationActualMw;
    private Double windOnshoreGenerationActualMw;
    private Double windOffshoreGenerationActualMw;
    private Double hydroGenerationActualMw;
    private Double nuclearGenerationActualMw;
    private Double fossilGenerationActualMw;
    private Double otherRenewableGenerationMw;
    private Double totalGenerationMw;
    private Double netImportExportMw;

    // ── Market ──────────────────────────────────────────────────────────────
    private Double priceDayAheadEurMwh;

    // ── Metadata ────────────────────────────────────────────────────────────
    private Double dataQualityScore;

    /** "Open Power System Data" or "Synthetic Generator" */
    private String source;

    private SyntheticQuality syntheticQuality;

    @Override
    public SourceType getSourceType() {
        return SourceType.GRID;
    }

    @Override
    public String getEntityKey() {
        return countryCode;
    }

    @Override
    public Map<String, Double> measurements() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put("load_actual_mw", loadActualMw);
        values.put("load_forecast_mw", loadForecastMw);
        values.put("solar_generation_actual_mw", solarGenerationActualMw);
        values.put("wind_onshore_generation_actual_mw", windOnshoreGenerationActualMw);
        values.put("wind_offshore_generation_actual_mw", windOffshoreGenerationActualMw);
        values.put("hydro_generation_actual_mw", hydroGenerationActualMw);
        values.put("nuclear_generation_actual_mw", nuclearGenerationActualMw);
        values.put("fossil_generation_actual_mw", fossilGenerationActualMw);
        values.put("other_renewable_generation_mw", otherRenewableGenerationMw);
        values.put("total_generation_mw", totalGenerationMw);
        values.put("net_import_export_mw", netImportExportMw);
        values.put("price_day_ahead_eur_mwh", priceDayAheadEurMwh);
        return values;
    }

    @Override
    public Map<String, Object> columnValues() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("timestamp", timestamp);
        columns.put("country_code", countryCode);
        columns.put("region_code", regionCode);
        columns.putAll(measurements());
        columns.put("data_quality_score", dataQualityScore);
        columns.put("source", source);
        return columns;
    }
}
