package com.energyanalytics.ingestion.validation;

import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.model.GridOperation;
import com.energyanalytics.ingestion.model.HouseholdReading;
import com.energyanalytics.ingestion.model.NormalizedRecord;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.WeatherObservation;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Per-source checks applied by {@link RecordValidator}.
 */
@Getter
@Builder
public class ValidationRules {

    private final SourceType sourceType;

    /** Measurement columns that must be present for a record to count as complete */
    @Singular
    private final List<String> requiredFields;

    /** Physical bounds per measurement column, inclusive */
    @Singular
    private final Map<String, Range> bounds;

    @Singular
    private final List<ConsistencyCheck> consistencyChecks;

    private final Duration stalenessThreshold;

    private final double completenessMinimum;

    public record Range(double min, double max) {
        public boolean contains(double value) {
            return value >= min && value <= max;
        }
    }

    /**
     * Cross-field rule. {@code holds} returns true when the record is consistent or
     * the inputs are missing. Violations are warnings only.
     */
    public record ConsistencyCheck(String description, Predicate<NormalizedRecord> holds) {
    }

    // Rounding in sources and generators can put a sum a hair over its total
    private static final double SUM_TOLERANCE = 1.0;

    public static ValidationRules forSource(SourceType type, SourceSettings settings) {
        ValidationRulesBuilder builder = switch (type) {
            case HOUSEHOLD -> household();
            case WEATHER -> weather();
            case GRID -> grid();
        };
        return builder
                .sourceType(type)
                .stalenessThreshold(settings.getStalenessThreshold())
                .completenessMinimum(settings.getCompletenessMinimum())
                .build();
    }

    // ── Household ─────────────────────────────────────────────────────────────

    private static ValidationRulesBuilder household() {
        return ValidationRules.builder()
                .requiredField("global_active_power")
                .requiredField("voltage")
                .requiredField("global_intensity")
                .bound("global_active_power", new Range(0, 20))
                .bound("global_reactive_power", new Range(0, 10))
                .bound("voltage", new Range(200, 260))
                .bound("global_intensity", new Range(0, 100))
                .bound("sub_metering_1", new Range(0, 350))
                .bound("sub_metering_2", new Range(0, 350))
                .bound("sub_metering_3", new Range(0, 350))
                .consistencyCheck(new ConsistencyCheck(
                        "sub-metering exceeds active energy", ValidationRules::subMeteringWithinTotal));
    }

    private static boolean subMeteringWithinTotal(NormalizedRecord record) {
        HouseholdReading r = (HouseholdReading) record;
        Double other = r.getCalculatedOtherConsumption();
        return other == null || other >= -SUM_TOLERANCE;
    }

    // ── Weather ───────────────────────────────────────────────────────────────

    private static ValidationRulesBuilder weather() {
        return ValidationRules.builder()
                .requiredField("temperature_2m_c")
                .requiredField("relative_humidity_2m_pct")
                .requiredField("wind_speed_10m_kmh")
                .bound("temperature_2m_c", new Range(-60, 60))
                .bound("relative_humidity_2m_pct", new Range(0, 100))
                .bound("dew_point_2m_c", new Range(-80, 60))
                .bound("apparent_temperature_c", new Range(-80, 70))
                .bound("rain_mm", new Range(0, 200))
                .bound("shortwave_radiation_w_m2", new Range(0, 1500))
                .bound("wind_speed_10m_kmh", new Range(0, 200))
                .bound("wind_direction_10m_deg", new Range(0, 360))
                .bound("wind_gusts_10m_kmh", new Range(0, 300))
                .bound("cloud_cover_pct", new Range(0, 100))
                .bound("surface_pressure_hpa", new Range(800, 1100))
                .bound("visibility_m", new Range(0, 100000))
                .consistencyCheck(new ConsistencyCheck(
                        "dew point above temperature", ValidationRules::dewPointBelowTemperature));
    }

    private static boolean dewPointBelowTemperature(NormalizedRecord record) {
        WeatherObservation w = (WeatherObservation) record;
        if (w.getDewPoint2mC() == null || w.getTemperature2mC() == null) return true;
        // Reported values are rounded to 0.1 °C
        return w.getDewPoint2mC() <= w.getTemperature2mC() + 0.1;
    }

    // ── Grid ──────────────────────────────────────────────────────────────────

    private static ValidationRulesBuilder grid() {
        return ValidationRules.builder()
                .requiredField("load_actual_mw")
                .bound("load_actual_mw", new Range(0, 200000))
                .bound("load_forecast_mw", new Range(0, 200000))
                .bound("solar_generation_actual_mw", new Range(0, 200000))
                .bound("wind_onshore_generation_actual_mw", new Range(0, 200000))
                .bound("wind_offshore_generation_actual_mw", new Range(0, 200000))
                .bound("hydro_generation_actual_mw", new Range(0, 200000))
                .bound("nuclear_generation_actual_mw", new Range(0, 200000))
                .bound("fossil_generation_actual_mw", new Range(0, 200000))
                .bound("other_renewable_generation_mw", new Range(0, 200000))
                .bound("total_generation_mw", new Range(0, 300000))
                .bound("net_import_export_mw", new Range(-100000, 100000))
                .bound("price_day_ahead_eur_mwh", new Range(-500, 3000))
                .consistencyCheck(new ConsistencyCheck(
                        "generation components exceed total generation", ValidationRules::componentsWithinTotal));
    }

    private static boolean componentsWithinTotal(NormalizedRecord record) {
        GridOperation g = (GridOperation) record;
        if (g.getTotalGenerationMw() == null) return true;
        double components = 0;
        for (Double v : new Double[]{
                g.getSolarGenerationActualMw(), g.getWindOnshoreGenerationActualMw(),
                g.getWindOffshoreGenerationActualMw(), g.getHydroGenerationActualMw(),
                g.getNuclearGenerationActualMw(), g.getFossilGenerationActualMw(),
                g.getOtherRenewableGenerationMw()}) {
            if (v != null) components += v;
        }
        return g.getTotalGenerationMw() + SUM_TOLERANCE >= components;
    }
}
