package com.energyanalytics.ingestion.source;

import com.energyanalytics.ingestion.config.SourceSettings.WeatherLocation;
import com.energyanalytics.ingestion.model.OpenMeteoResponse;
import com.energyanalytics.ingestion.model.TimeWindow;
import com.energyanalytics.ingestion.model.WeatherObservation;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps the Open-Meteo DTO to our domain model.
 * Kept separate from the client so the JSON shape can be tested without HTTP.
 */
@Component
public class OpenMeteoMapper {

    /** Query parameter value listing every hourly variable we store */
    public static final String HOURLY_VARIABLES = String.join(",",
            "temperature_2m", "relative_humidity_2m", "dew_point_2m", "apparent_temperature",
            "rain", "shortwave_radiation", "wind_speed_10m", "wind_direction_10m",
            "wind_gusts_10m", "cloud_cover", "surface_pressure", "visibility");

    /**
     * @throws com.energyanalytics.ingestion.exception.FetchException permanent when the hourly block is missing
     *         or the UTC offset is out of range
     */
    public List<WeatherObservation> toObservations(OpenMeteoResponse response, WeatherLocation location,
                                                   TimeWindow window, String provider, String url) {
        if (response == null || response.getHourly() == null || response.getHourly().getTime() == null) {
            throw FetchFailures.malformed(url, "response has no hourly.time block");
        }
        OpenMeteoResponse.Hourly h = response.getHourly();
        ZoneOffset offset = offset(response, url);

        List<WeatherObservation> observations = new ArrayList<>();
        for (int i = 0; i < h.getTime().size(); i++) {
            Instant timestamp = parseTime(h.getTime().get(i), offset);
            if (timestamp == null || !window.contains(timestamp)) continue;

            observations.add(WeatherObservation.builder()
                    .timestamp(timestamp)
                    .locationId(location.getLocationId())
                    .latitude(location.getLatitude())
                    .longitude(location.getLongitude())
                    .temperature2mC(at(h.getTemperature2m(), i))
                    .relativeHumidity2mPct(at(h.getRelativeHumidity2m(), i))
                    .dewPoint2mC(at(h.getDewPoint2m(), i))
                    .apparentTemperatureC(at(h.getApparentTemperature(), i))
                    .rainMm(at(h.getRain(), i))
                    .shortwaveRadiationWm2(at(h.getShortwaveRadiation(), i))
                    .windSpeed10mKmh(at(h.getWindSpeed10m(), i))
                    .windDirection10mDeg(at(h.getWindDirection10m(), i))
                    .windGusts10mKmh(at(h.getWindGusts10m(), i))
                    .cloudCoverPct(at(h.getCloudCover(), i))
                    .surfacePressureHpa(at(h.getSurfacePressure(), i))
                    .visibilityM(at(h.getVisibility(), i))
                    .dataProvider(provider)
                    .build());
        }
        return observations;
    }

    private ZoneOffset offset(OpenMeteoResponse response, String url) {
        int seconds = response.getUtcOffsetSeconds() != null ? response.getUtcOffsetSeconds() : 0;
        try {
            return ZoneOffset.ofTotalSeconds(seconds);
        } catch (DateTimeException e) {
            throw FetchFailures.malformed(url, "utc_offset_seconds " + seconds + " out of range");
        }
    }

    private Instant parseTime(String value, ZoneOffset offset) {
        if (value == null) return null;
        try {
            return LocalDateTime.parse(value).toInstant(offset);
        } catch (DateTimeException e) {
            return null;
        }
    }

    // Variables the endpoint does not serve (ERA5 has no visibility) arrive as absent arrays
    private Double at(List<Double> values, int i) {
        return values != null && i < values.size() ? values.get(i) : null;
    }
}
