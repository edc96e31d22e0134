package com.energyanalytics.ingestion.exception;

import java.util.List;

/**
 * Primary and every fallback endpoint failed and synthetic fallback is disabled or failed too.
 *
 * <p>Retryable only when every endpoint failure was transient: an outage may clear up,
 * a rejected credential will not.
 */
public class SourceUnavailableException extends FetchException {

    private final List<FetchException> endpointFailures;

    public SourceUnavailableException(String message, List<FetchException> endpointFailures) {
        super(message, endpointFailures.isEmpty() ? null : endpointFailures.get(endpointFailures.size() - 1));
        this.endpointFailures = List.copyOf(endpointFailures);
    }

    public List<FetchException> getEndpointFailures() {
        return endpointFailures;
    }

    @Override
    public boolean isRetryable() {
        return !endpointFailures.isEmpty() && endpointFailures.stream().allMatch(FetchException::isRetryable);
    }
}
