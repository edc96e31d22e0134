package com.energyanalytics.ingestion.source;

import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.exception.FetchException;
import com.energyanalytics.ingestion.model.HouseholdReading;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.TimeWindow;
import com.energyanalytics.ingestion.source.synthetic.HouseholdSyntheticGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Household consumption from the UCI dataset.
 *
 * The published artefact is a ZIP holding one semicolon-separated text file; mirrors
 * may serve the text file directly (optionally gzipped). Both are accepted.
 */
@Component
@Slf4j
public class HouseholdSourceClient extends FallbackSourceClient {

    private static final String DEFAULT_HOUSEHOLD_ID = "uci_france_001";

    private final RemoteResourceFetcher fetcher;
    private final UciHouseholdParser parser;

    public HouseholdSourceClient(RemoteResourceFetcher fetcher,
                                 UciHouseholdParser parser,
                                 HouseholdSyntheticGenerator syntheticGenerator) {
        super(syntheticGenerator);
        this.fetcher = fetcher;
        this.parser = parser;
    }

    @Override
    public SourceType sourceType() {
        return SourceType.HOUSEHOLD;
    }

    @Override
    protected List<HouseholdReading> fetchFrom(String url, TimeWindow window, SourceSettings settings) {
        String householdId = settings.getHouseholdId() != null ? settings.getHouseholdId() : DEFAULT_HOUSEHOLD_ID;

        try (InputStream raw = new BufferedInputStream(fetcher.open(url, settings.getRequestTimeout()))) {
            if (isZip(raw)) {
                return parseZip(raw, url, householdId, window);
            }
            return parser.parse(new InputStreamReader(raw, StandardCharsets.UTF_8), householdId, fileName(url), window);
        } catch (IOException e) {
            throw FetchFailures.fromIo(e, url);
        }
    }

    private List<HouseholdReading> parseZip(InputStream raw, String url, String householdId, TimeWindow window) throws IOException {
        ZipInputStream zip = new ZipInputStream(raw);
        ZipEntry entry;
        while ((entry = zip.getNextEntry()) != null) {
            String name = entry.getName();
            String lower = name.toLowerCase(Locale.ROOT);
            if (!entry.isDirectory() && (lower.endsWith(".txt") || lower.endsWith(".csv"))) {
                log.info("Reading archive entry {} ({})", name, url);
                return parser.parse(new InputStreamReader(zip, StandardCharsets.UTF_8), householdId, name, window);
            }
        }
        throw FetchFailures.malformed(url, "archive contains no .txt or .csv entry");
    }

    /** Peek at the local-file-header magic "PK\3\4" without consuming it. */
    private boolean isZip(InputStream in) throws IOException {
        in.mark(4);
        byte[] magic = in.readNBytes(4);
        in.reset();
        return magic.length == 4 && magic[0] == 'P' && magic[1] == 'K' && magic[2] == 3 && magic[3] == 4;
    }

    private String fileName(String url) {
        int slash = url.lastIndexOf('/');
        return slash >= 0 ? url.substring(slash + 1) : url;
    }
}
