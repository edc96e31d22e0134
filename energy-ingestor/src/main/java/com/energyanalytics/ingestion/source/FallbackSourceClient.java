package com.energyanalytics.ingestion.source;

import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.exception.FetchException;
import com.energyanalytics.ingestion.exception.PermanentFetchException;
import com.energyanalytics.ingestion.exception.SourceUnavailableException;
import com.energyanalytics.ingestion.model.FetchResult;
import com.energyanalytics.ingestion.model.NormalizedRecord;
import com.energyanalytics.ingestion.model.SyntheticQuality;
import com.energyanalytics.ingestion.model.TimeWindow;
import com.energyanalytics.ingestion.source.synthetic.SyntheticGenerator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Fallback chain shared by every source: primary endpoint, then each fallback URL in
 * declared order, then (if enabled) the source's synthetic generator.
 *
 * Subclasses only know how to read one endpoint.
 */
@Slf4j
public abstract class FallbackSourceClient implements SourceClient {

    private final SyntheticGenerator syntheticGenerator;

    protected FallbackSourceClient(SyntheticGenerator syntheticGenerator) {
        this.syntheticGenerator = syntheticGenerator;
    }

    /**
     * Read and normalise the records of {@code window} from one endpoint.
     *
     * @throws FetchException on network errors, non-2xx responses or malformed payloads
     */
    protected abstract List<? extends NormalizedRecord> fetchFrom(String url, TimeWindow window, SourceSettings settings);

    /** Endpoint order for this window. Defaults to primary followed by the declared fallbacks. */
    protected List<String> endpointsFor(TimeWindow window, SourceSettings settings) {
        return settings.orderedEndpoints();
    }

    @Override
    public FetchResult fetch(TimeWindow window, SourceSettings settings) {
        List<FetchException> failures = new ArrayList<>();

        for (String url : endpointsFor(window, settings)) {
            try {
                List<? extends NormalizedRecord> records = fetchFrom(url, window, settings);
                if (records.isEmpty()) {
                    log.warn("{}: {} returned no records for {}", sourceType(), url, window);
                    failures.add(new PermanentFetchException("No records for " + window + " from " + url));
                    continue;
                }
                log.info("{}: fetched {} records from {}", sourceType(), records.size(), url);
                return FetchResult.fromEndpoint(records, url);
            } catch (FetchException e) {
                log.warn("{}: endpoint {} failed ({}): {}", sourceType(), url,
                        e.isRetryable() ? "transient" : "permanent", e.getMessage());
                failures.add(e);
            } catch (RuntimeException e) {
                log.error("{}: endpoint {} failed unexpectedly: {}", sourceType(), url, e.getMessage(), e);
                failures.add(FetchFailures.malformed(url, e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }

        if (settings.isSyntheticFallback()) {
            SyntheticQuality quality = settings.getSyntheticQuality();
            log.warn("{}: all {} endpoints failed, generating {} synthetic data for {}",
                    sourceType(), failures.size(), quality, window);
            try {
                List<? extends NormalizedRecord> generated =
                        syntheticGenerator.generate(window, settings, quality, seededRandom(window, settings));
                return FetchResult.fromGenerator(generated, quality);
            } catch (RuntimeException e) {
                log.error("{}: synthetic generation failed: {}", sourceType(), e.getMessage(), e);
                failures.add(new PermanentFetchException("Synthetic generation failed: " + e.getMessage(), e));
            }
        }

        throw new SourceUnavailableException(
                sourceType() + " unavailable: " + failures.size() + " attempt(s) failed, last: "
                        + (failures.isEmpty() ? "no endpoints configured" : failures.get(failures.size() - 1).getMessage()),
                failures);
    }

    /**
     * Same window and seed always yield the same synthetic batch, so re-running a window is a no-op on the store.
     */
    private Random seededRandom(TimeWindow window, SourceSettings settings) {
        long seed = settings.getSyntheticSeed() != null ? settings.getSyntheticSeed() : sourceType().ordinal();
        return new Random(seed * 31 + window.start().getEpochSecond());
    }
}
