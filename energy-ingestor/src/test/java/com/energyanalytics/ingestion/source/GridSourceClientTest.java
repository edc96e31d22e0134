package com.energyanalytics.ingestion.source;

import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.exception.SourceUnavailableException;
import com.energyanalytics.ingestion.model.FetchResult;
import com.energyanalytics.ingestion.model.GridOperation;
import com.energyanalytics.ingestion.model.NormalizedRecord;
import com.energyanalytics.ingestion.model.TimeWindow;
import com.energyanalytics.ingestion.source.synthetic.GridSyntheticGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GridSourceClient Tests")
class GridSourceClientTest {

    private static final TimeWindow WINDOW = new TimeWindow(
            Instant.parse("2019-01-01T00:00:00Z"), Instant.parse("2019-01-01T02:00:00Z"));

    private final GridSourceClient client = new GridSourceClient(
            new RemoteResourceFetcher(HttpClient.newHttpClient()),
            new OpsdCsvParser(),
            new GridSyntheticGenerator());

    @TempDir
    Path tempDir;

    private static Path fixture() throws Exception {
        return Path.of(GridSourceClientTest.class.getResource("/fixtures/time_series_60min_singleindex.csv").toURI());
    }

    private SourceSettings settings(String primaryUrl) {
        SourceSettings settings = SourceSettings.gridDefaults();
        settings.setPrimaryUrl(primaryUrl);
        settings.setFallbackUrls(List.of());
        settings.setSyntheticFallback(false);
        return settings;
    }

    private GridOperation find(List<NormalizedRecord> records, String country, String timestamp) {
        return records.stream()
                .map(GridOperation.class::cast)
                .filter(g -> g.getCountryCode().equals(country) && g.getTimestamp().equals(Instant.parse(timestamp)))
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("Extracts one record per country and hour, skipping all-blank rows")
    void testParseCountries() throws Exception {
        FetchResult result = client.fetch(WINDOW, settings(fixture().toUri().toString()));

        // DE has three rows in the window, FR two (its 02:00 row is blank), ES has no columns
        assertEquals(5, result.size());
        GridOperation fr = find(result.records(), "FR", "2019-01-01T00:00:00Z");
        assertEquals(60000.0, fr.getLoadActualMw());
        assertEquals(45000.0, fr.getNuclearGenerationActualMw());
        assertEquals(51.2, fr.getPriceDayAheadEurMwh());
        assertEquals(49000.0, fr.getTotalGenerationMw());
        assertEquals(11000.0, fr.getNetImportExportMw());
        assertEquals("FR", fr.getRegionCode());
    }

    @Test
    @DisplayName("Blank cells become missing values")
    void testBlankCells() throws Exception {
        FetchResult result = client.fetch(WINDOW, settings(fixture().toUri().toString()));

        GridOperation de = find(result.records(), "DE", "2019-01-01T02:00:00Z");
        assertEquals(39000.0, de.getLoadActualMw());
        assertNull(de.getLoadForecastMw());
        assertNull(de.getPriceDayAheadEurMwh());
    }

    @Test
    @DisplayName("Reads gzip-compressed dumps")
    void testGzip() throws Exception {
        Path gz = tempDir.resolve("opsd.csv.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(gz))) {
            out.write(Files.readAllBytes(fixture()));
        }

        FetchResult result = client.fetch(WINDOW, settings(gz.toUri().toString()));

        assertEquals(5, result.size());
    }

    @Test
    @DisplayName("CSV without a timestamp column is a permanent failure")
    void testMissingTimestampColumn() throws Exception {
        Path csv = tempDir.resolve("no-time.csv");
        Files.writeString(csv, "FR_load_actual_entsoe_transparency\n50000\n");

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> client.fetch(WINDOW, settings(csv.toUri().toString())));
        assertFalse(e.isRetryable());
    }

    @Test
    @DisplayName("Unterminated quoting is not retried")
    void testUnterminatedQuote() throws Exception {
        Path broken = tempDir.resolve("broken.csv");
        Files.writeString(broken, "utc_timestamp,FR_load_actual_entsoe_transparency\n"
                + "2019-01-01T00:00:00Z,60000\n"
                + "\"2019-01-01T01:00:00Z,61000\n");

        SourceUnavailableException e = assertThrows(SourceUnavailableException.class,
                () -> client.fetch(WINDOW, settings(broken.toUri().toString())));
        assertFalse(e.isRetryable());
    }
}
