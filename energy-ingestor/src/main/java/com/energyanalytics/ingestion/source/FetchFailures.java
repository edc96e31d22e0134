package com.energyanalytics.ingestion.source;

import com.energyanalytics.ingestion.exception.FetchException;
import com.energyanalytics.ingestion.exception.PermanentFetchException;
import com.energyanalytics.ingestion.exception.TransientFetchException;
import com.opencsv.exceptions.CsvMalformedLineException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.io.IOException;

/**
 * Sorts fetch failures into retryable and non-retryable.
 *
 * Transient: I/O errors, timeouts, 408, 429 and 5xx.
 * Permanent: 401/403, any other 4xx, payloads we cannot parse (including broken CSV quoting).
 */
public final class FetchFailures {

    private FetchFailures() {
    }

    public static FetchException fromStatus(int status, String url) {
        String message = "HTTP " + status + " from " + url;
        if (status == 408 || status == 429 || status >= 500) {
            return new TransientFetchException(message);
        }
        if (status == 401 || status == 403) {
            return new PermanentFetchException("Authentication rejected: " + message);
        }
        return new PermanentFetchException(message);
    }

    public static FetchException fromIo(IOException e, String url) {
        // OpenCSV reports broken quoting as an IOException; the payload will not parse on a retry either
        if (e instanceof CsvMalformedLineException malformedLine) {
            return new PermanentFetchException("Malformed payload from " + url + " at line "
                    + malformedLine.getLineNumber() + ": " + e.getMessage(), e);
        }
        return new TransientFetchException("I/O failure reading " + url + ": " + e.getMessage(), e);
    }

    public static FetchException fromRestClient(RestClientException e, String url) {
        if (e instanceof HttpStatusCodeException statusException) {
            return fromStatus(statusException.getStatusCode().value(), url);
        }
        if (e instanceof ResourceAccessException) {
            return new TransientFetchException("Could not reach " + url + ": " + e.getMessage(), e);
        }
        // Anything else is a conversion problem: the payload did not match the schema we expect
        return new PermanentFetchException("Unreadable response from " + url + ": " + e.getMessage(), e);
    }

    public static FetchException malformed(String url, String detail) {
        return new PermanentFetchException("Malformed payload from " + url + ": " + detail);
    }

    public static FetchException interrupted(String url) {
        Thread.currentThread().interrupt();
        return new TransientFetchException("Interrupted while fetching " + url);
    }
}
