package com.energyanalytics.ingestion.source;

import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.model.GridOperation;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.TimeWindow;
import com.energyanalytics.ingestion.source.synthetic.GridSyntheticGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Grid load, generation and price from the Open Power System Data bulk CSV.
 * The primary "latest" package is tried first, then the dated releases in declared order.
 */
@Component
public class GridSourceClient extends FallbackSourceClient {

    private final RemoteResourceFetcher fetcher;
    private final OpsdCsvParser parser;

    public GridSourceClient(RemoteResourceFetcher fetcher,
                            OpsdCsvParser parser,
                            GridSyntheticGenerator syntheticGenerator) {
        super(syntheticGenerator);
        this.fetcher = fetcher;
        this.parser = parser;
    }

    @Override
    public SourceType sourceType() {
        return SourceType.GRID;
    }

    @Override
    protected List<GridOperation> fetchFrom(String url, TimeWindow window, SourceSettings settings) {
        if (settings.getCountries().isEmpty()) {
            throw FetchFailures.malformed(url, "no grid countries configured");
        }
        try (InputStream in = fetcher.open(url, settings.getRequestTimeout())) {
            return parser.parse(new InputStreamReader(in, StandardCharsets.UTF_8), settings.getCountries(), window, url);
        } catch (IOException e) {
            throw FetchFailures.fromIo(e, url);
        }
    }
}
