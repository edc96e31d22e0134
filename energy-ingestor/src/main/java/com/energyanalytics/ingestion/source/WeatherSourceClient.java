package com.energyanalytics.ingestion.source;

import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.config.SourceSettings.WeatherLocation;
import com.energyanalytics.ingestion.model.OpenMeteoResponse;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.TimeWindow;
import com.energyanalytics.ingestion.model.WeatherObservation;
import com.energyanalytics.ingestion.source.synthetic.WeatherSyntheticGenerator;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Hourly weather for every configured location from the Open-Meteo REST API.
 *
 * Windows ending more than {@code archiveLag} ago go to the ERA5 archive first, since
 * the forecast endpoint only keeps a few days of history. An endpoint counts as failed
 * when any location fails on it.
 *
 * file: endpoints read a stored response; a {@code {locationId}} placeholder in the
 * path is replaced per location.
 */
@Component
@Slf4j
public class WeatherSourceClient extends FallbackSourceClient {

    private final RestTemplate restTemplate;
    private final RemoteResourceFetcher fetcher;
    private final ObjectMapper objectMapper;
    private final OpenMeteoMapper mapper;
    private final Clock clock;

    public WeatherSourceClient(RestTemplate restTemplate,
                               RemoteResourceFetcher fetcher,
                               ObjectMapper objectMapper,
                               OpenMeteoMapper mapper,
                               Clock clock,
                               WeatherSyntheticGenerator syntheticGenerator) {
        super(syntheticGenerator);
        this.restTemplate = restTemplate;
        this.fetcher = fetcher;
        this.objectMapper = objectMapper;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public SourceType sourceType() {
        return SourceType.WEATHER;
    }

    @Override
    protected List<String> endpointsFor(TimeWindow window, SourceSettings settings) {
        List<String> endpoints = new ArrayList<>(settings.orderedEndpoints());
        String archive = settings.getArchiveUrl();
        if (archive == null || archive.isBlank()) {
            return endpoints;
        }
        endpoints.remove(archive);
        boolean historical = window.end().isBefore(clock.instant().minus(settings.getArchiveLag()));
        if (historical) {
            endpoints.add(0, archive);
        } else {
            endpoints.add(archive);
        }
        return endpoints;
    }

    @Override
    protected List<WeatherObservation> fetchFrom(String url, TimeWindow window, SourceSettings settings) {
        if (settings.getLocations().isEmpty()) {
            throw FetchFailures.malformed(url, "no weather locations configured");
        }
        String provider = providerName(url, settings);
        List<WeatherObservation> all = new ArrayList<>();
        for (WeatherLocation location : settings.getLocations()) {
            OpenMeteoResponse response = url.startsWith("file:")
                    ? readStored(url.replace("{locationId}", location.getLocationId()), settings)
                    : callApi(url, location, window, provider);
            List<WeatherObservation> observations = mapper.toObservations(response, location, window, provider, url);
            log.debug("{}: {} observations for {}", provider, observations.size(), location.getLocationId());
            all.addAll(observations);
        }
        return all;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private OpenMeteoResponse callApi(String baseUrl, WeatherLocation location, TimeWindow window, String provider) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("latitude", location.getLatitude())
                .queryParam("longitude", location.getLongitude())
                .queryParam("start_date", LocalDate.ofInstant(window.start(), ZoneOffset.UTC))
                .queryParam("end_date", LocalDate.ofInstant(window.end(), ZoneOffset.UTC))
                .queryParam("hourly", OpenMeteoMapper.HOURLY_VARIABLES)
                .queryParam("timezone", "UTC");
        if (provider.endsWith("ERA5")) {
            builder.queryParam("models", "era5");
        }
        String url = builder.toUriString();

        log.debug("Calling Open-Meteo: {}", url);
        try {
            return restTemplate.getForObject(url, OpenMeteoResponse.class);
        } catch (RestClientException e) {
            throw FetchFailures.fromRestClient(e, baseUrl);
        }
    }

    private OpenMeteoResponse readStored(String url, SourceSettings settings) {
        try (InputStream in = fetcher.open(url, settings.getRequestTimeout())) {
            return objectMapper.readValue(in, OpenMeteoResponse.class);
        } catch (JacksonException e) {
            throw FetchFailures.malformed(url, e.getOriginalMessage());
        } catch (IOException e) {
            throw FetchFailures.fromIo(e, url);
        }
    }

    private String providerName(String url, SourceSettings settings) {
        if (url.equals(settings.getArchiveUrl())) return "Open-Meteo ERA5";
        if (url.startsWith("file:")) return "Open-Meteo (stored)";
        return "Open-Meteo Forecast";
    }
}
