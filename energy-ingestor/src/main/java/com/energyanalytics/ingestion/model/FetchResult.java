package com.energyanalytics.ingestion.model;

import java.util.List;

/**
 * Normalised records returned by a source client together with where they came from.
 *
 * @param records   the batch, never null
 * @param origin    URL that served the batch, or "synthetic:TIER"
 * @param synthetic true when every endpoint failed and the generator produced the batch
 */
public record FetchResult(List<NormalizedRecord> records, String origin, boolean synthetic) {

    public FetchResult {
        records = List.copyOf(records);
    }

    public static FetchResult fromEndpoint(List<? extends NormalizedRecord> records, String url) {
        return new FetchResult(List.copyOf(records), url, false);
    }

    public static FetchResult fromGenerator(List<? extends NormalizedRecord> records, SyntheticQuality quality) {
        return new FetchResult(List.copyOf(records), "synthetic:" + quality, true);
    }

    public int size() {
        return records.size();
    }
}
