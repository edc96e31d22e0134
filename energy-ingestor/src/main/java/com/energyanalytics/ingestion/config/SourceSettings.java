package com.energyanalytics.ingestion.config;

import com.energyanalytics.ingestion.model.SyntheticQuality;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-source endpoints, fallback behaviour, cadence and validation thresholds.
 */
@Data
public class SourceSettings {

    private boolean enabled = true;

    // ── Endpoints ───────────────────────────────────────────────────────────
    private String primaryUrl;

    /** Tried in declared order once the primary endpoint has failed */
    private List<String> fallbackUrls = new ArrayList<>();

    private Duration requestTimeout = Duration.ofSeconds(60);

    // ── Synthetic fallback ──────────────────────────────────────────────────
    private boolean syntheticFallback = true;
    private SyntheticQuality syntheticQuality = SyntheticQuality.STANDARD;

    /** Seed for generated data, mixed with the window start; the source ordinal is used when unset */
    private Long syntheticSeed;

    // ── Scheduling ──────────────────────────────────────────────────────────
    private Duration cadence = Duration.ofHours(1);
    private Duration initialDelay = Duration.ZERO;

    /** Width of the window an incremental run asks for, ending at "now" */
    private Duration lookback = Duration.ofDays(1);

    // ── Validation thresholds ───────────────────────────────────────────────
    private Duration stalenessThreshold = Duration.ofHours(3);
    private double completenessMinimum = 0.95;

    // ── Source specific ─────────────────────────────────────────────────────
    /** Household: meter identifier stamped on every reading */
    private String householdId;

    /** Weather: historical reanalysis endpoint, preferred for windows older than archiveLag */
    private String archiveUrl;
    private Duration archiveLag = Duration.ofDays(5);
    private List<WeatherLocation> locations = new ArrayList<>();

    /** Grid: ISO country codes to extract */
    private List<String> countries = new ArrayList<>();

    public List<String> orderedEndpoints() {
        List<String> endpoints = new ArrayList<>();
        if (primaryUrl != null && !primaryUrl.isBlank()) {
            endpoints.add(primaryUrl);
        }
        fallbackUrls.stream()
                .filter(url -> url != null && !url.isBlank())
                .forEach(endpoints::add);
        return endpoints;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WeatherLocation {
        private String locationId;
        private double latitude;
        private double longitude;
    }

    // ── Defaults mirroring the production configuration ──────────────────────

    public static SourceSettings householdDefaults() {
        SourceSettings s = new SourceSettings();
        s.setPrimaryUrl("https://archive.ics.uci.edu/static/public/235/individual+household+electric+power+consumption.zip");
        s.setHouseholdId("uci_france_001");
        s.setCadence(Duration.ofMinutes(15));
        s.setLookback(Duration.ofHours(6));
        s.setStalenessThreshold(Duration.ofHours(168));
        return s;
    }

    public static SourceSettings weatherDefaults() {
        SourceSettings s = new SourceSettings();
        s.setPrimaryUrl("https://api.open-meteo.com/v1/forecast");
        s.setArchiveUrl("https://archive-api.open-meteo.com/v1/era5");
        s.setCadence(Duration.ofHours(1));
        s.setLookback(Duration.ofDays(1));
        s.setStalenessThreshold(Duration.ofHours(3));
        s.setLocations(new ArrayList<>(List.of(
                new WeatherLocation("paris_fr_001", 48.8566, 2.3522),
                new WeatherLocation("berlin_de_001", 52.5200, 13.4050),
                new WeatherLocation("madrid_es_001", 40.4168, -3.7038))));
        return s;
    }

    public static SourceSettings gridDefaults() {
        SourceSettings s = new SourceSettings();
        s.setPrimaryUrl("https://data.open-power-system-data.org/time_series/latest/time_series_60min_singleindex.csv");
        s.setFallbackUrls(new ArrayList<>(List.of(
                "https://data.open-power-system-data.org/time_series/2020-10-06/time_series_60min_singleindex.csv",
                "https://data.open-power-system-data.org/time_series/2019-06-05/time_series_60min_singleindex.csv")));
        s.setSyntheticQuality(SyntheticQuality.HIGH);
        s.setCadence(Duration.ofMinutes(15));
        s.setLookback(Duration.ofDays(1));
        s.setStalenessThreshold(Duration.ofHours(2));
        s.setCountries(new ArrayList<>(List.of("FR", "DE", "ES")));
        return s;
    }
}
