package com.energyanalytics.ingestion.source;

import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.model.FetchResult;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.TimeWindow;

/**
 * Produces normalised records for one source and time window. Read-only with respect to the store.
 */
public interface SourceClient {

    SourceType sourceType();

    /**
     * @throws com.energyanalytics.ingestion.exception.FetchException when no batch could be produced
     */
    FetchResult fetch(TimeWindow window, SourceSettings settings);
}
