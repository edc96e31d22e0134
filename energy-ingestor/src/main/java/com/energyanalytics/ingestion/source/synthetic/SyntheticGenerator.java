package com.energyanalytics.ingestion.source.synthetic;

import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.model.NormalizedRecord;
import com.energyanalytics.ingestion.model.SyntheticQuality;
import com.energyanalytics.ingestion.model.TimeWindow;

import java.util.List;
import java.util.Random;

/**
 * Last link of a source's fallback chain. Produces plausible records at the source's
 * granularity for every aligned timestamp in the window. All values stay within the
 * physical bounds the validator enforces.
 *
 * Implementations draw all randomness from {@code random}, so a fixed seed gives a
 * reproducible batch.
 */
public interface SyntheticGenerator {

    List<? extends NormalizedRecord> generate(TimeWindow window, SourceSettings settings,
                                              SyntheticQuality quality, Random random);
}
