package com.energyanalytics.ingestion.source;

import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.exception.SourceUnavailableException;
import com.energyanalytics.ingestion.model.FetchResult;
import com.energyanalytics.ingestion.model.TimeWindow;
import com.energyanalytics.ingestion.model.WeatherObservation;
import com.energyanalytics.ingestion.source.synthetic.WeatherSyntheticGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WeatherSourceClient Tests")
class WeatherSourceClientTest {

    private static final TimeWindow WINDOW = new TimeWindow(
            Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-01T02:00:00Z"));

    private static final String FORECAST = "https://api.open-meteo.com/v1/forecast";
    private static final String ARCHIVE = "https://archive-api.open-meteo.com/v1/era5";

    private WeatherSourceClient client(Instant now) {
        return new WeatherSourceClient(
                new RestTemplate(),
                new RemoteResourceFetcher(HttpClient.newHttpClient()),
                new ObjectMapper(),
                new OpenMeteoMapper(),
                Clock.fixed(now, ZoneOffset.UTC),
                new WeatherSyntheticGenerator());
    }

    private static String fixtureDir() throws Exception {
        return Path.of(WeatherSourceClientTest.class.getResource("/fixtures").toURI()).toUri().toString();
    }

    private SourceSettings parisOnly(String primaryUrl) {
        SourceSettings settings = SourceSettings.weatherDefaults();
        settings.setPrimaryUrl(primaryUrl);
        settings.setArchiveUrl(null);
        settings.setSyntheticFallback(false);
        settings.setLocations(List.of(new SourceSettings.WeatherLocation("paris_fr_001", 48.8566, 2.3522)));
        return settings;
    }

    @Test
    @DisplayName("Maps the hourly arrays of a stored response, keeping only the window")
    void testStoredResponse() throws Exception {
        String url = fixtureDir() + "open-meteo-{locationId}.json";

        FetchResult result = client(Instant.parse("2024-03-01T03:00:00Z")).fetch(WINDOW, parisOnly(url));

        assertEquals(3, result.size());
        WeatherObservation first = (WeatherObservation) result.records().get(0);
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), first.getTimestamp());
        assertEquals("paris_fr_001", first.getLocationId());
        assertEquals(7.9, first.getTemperature2mC());
        assertEquals(86.0, first.getRelativeHumidity2mPct());
        assertEquals(1003.2, first.getSurfacePressureHpa());
        assertEquals(48.8566, first.getLatitude());
        assertNull(first.getVisibilityM());
    }

    @Test
    @DisplayName("Response without hourly block is a permanent failure")
    void testMalformedResponse() throws Exception {
        String url = fixtureDir() + "open-meteo-broken.json";

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> client(Instant.parse("2024-03-01T03:00:00Z")).fetch(WINDOW, parisOnly(url)));
        assertFalse(e.isRetryable());
    }

    @Test
    @DisplayName("Recent windows try the forecast endpoint before the archive")
    void testRecentWindowOrder() {
        SourceSettings settings = SourceSettings.weatherDefaults();
        List<String> order = client(Instant.parse("2024-03-02T00:00:00Z")).endpointsFor(WINDOW, settings);
        assertEquals(List.of(FORECAST, ARCHIVE), order);
    }

    @Test
    @DisplayName("Historical windows try the archive first")
    void testHistoricalWindowOrder() {
        SourceSettings settings = SourceSettings.weatherDefaults();
        List<String> order = client(Instant.parse("2024-04-01T00:00:00Z")).endpointsFor(WINDOW, settings);
        assertEquals(List.of(ARCHIVE, FORECAST), order);
    }

    @Test
    @DisplayName("Synthetic observations cover every location and hour")
    void testSyntheticFallback() throws Exception {
        SourceSettings settings = SourceSettings.weatherDefaults();
        settings.setPrimaryUrl(fixtureDir() + "does-not-exist.json");
        settings.setArchiveUrl(null);

        FetchResult result = client(Instant.parse("2024-03-01T03:00:00Z")).fetch(WINDOW, settings);

        assertTrue(result.synthetic());
        assertEquals(3 * 3, result.size());
    }

    @Test
    @DisplayName("A response with an impossible UTC offset moves on to the fallback")
    void testBadOffsetFallsBack() throws Exception {
        SourceSettings settings = parisOnly(fixtureDir() + "open-meteo-bad-offset.json");
        settings.setFallbackUrls(List.of(fixtureDir() + "open-meteo-{locationId}.json"));
        settings.setSyntheticFallback(true);

        FetchResult result = client(Instant.parse("2024-03-01T03:00:00Z")).fetch(WINDOW, settings);

        assertFalse(result.synthetic());
        assertEquals(fixtureDir() + "open-meteo-{locationId}.json", result.origin());
        assertEquals(3, result.size());
    }

    @Test
    @DisplayName("A malformed endpoint URL is a permanent failure of that endpoint only")
    void testMalformedUrlFallsBack() throws Exception {
        SourceSettings settings = parisOnly("not a url");
        settings.setFallbackUrls(List.of(fixtureDir() + "open-meteo-{locationId}.json"));

        FetchResult result = client(Instant.parse("2024-03-01T03:00:00Z")).fetch(WINDOW, settings);

        assertEquals(3, result.size());
    }
}
