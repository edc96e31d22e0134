package com.energyanalytics.ingestion.source;

import com.energyanalytics.ingestion.exception.FetchException;
import com.energyanalytics.ingestion.exception.PermanentFetchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.zip.GZIPInputStream;

/**
 * Opens bulk downloads (CSV dumps, ZIP archives) as streams.
 *
 * http(s) URLs are streamed with the JDK HttpClient; file: URLs read local copies,
 * which is how pre-downloaded dumps and mirrors are plugged in as fallbacks.
 * Gzip-compressed bodies are unwrapped transparently.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RemoteResourceFetcher {

    private static final int BUFFER_SIZE = 65536;

    private final HttpClient httpClient;

    /**
     * Open the resource. The caller owns the returned stream and must close it.
     *
     * @throws FetchException classified as transient or permanent
     */
    public InputStream open(String url, Duration timeout) {
        URI uri = URI.create(url);
        InputStream raw = "file".equalsIgnoreCase(uri.getScheme())
                ? openFile(uri)
                : openHttp(uri, url, timeout);
        try {
            return unwrapGzip(new BufferedInputStream(raw, BUFFER_SIZE));
        } catch (IOException e) {
            closeQuietly(raw);
            throw FetchFailures.fromIo(e, url);
        }
    }

    private InputStream openFile(URI uri) {
        Path path = Path.of(uri);
        if (!Files.isReadable(path)) {
            throw new PermanentFetchException("Local file not readable: " + path);
        }
        try {
            log.info("Reading local dump: {}", path);
            return Files.newInputStream(path);
        } catch (IOException e) {
            throw FetchFailures.fromIo(e, uri.toString());
        }
    }

    private InputStream openHttp(URI uri, String url, Duration timeout) {
        log.info("Downloading: {}", url);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .build();
        try {
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() != 200) {
                closeQuietly(response.body());
                throw FetchFailures.fromStatus(response.statusCode(), url);
            }
            return response.body();
        } catch (IOException e) {
            throw FetchFailures.fromIo(e, url);
        } catch (InterruptedException e) {
            throw FetchFailures.interrupted(url);
        }
    }

    private InputStream unwrapGzip(BufferedInputStream in) throws IOException {
        in.mark(2);
        int b1 = in.read();
        int b2 = in.read();
        in.reset();
        if (b1 == 0x1f && b2 == 0x8b) {
            return new GZIPInputStream(in, BUFFER_SIZE);
        }
        return in;
    }

    private void closeQuietly(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Ignoring failure closing stream: {}", e.getMessage());
        }
    }
}
