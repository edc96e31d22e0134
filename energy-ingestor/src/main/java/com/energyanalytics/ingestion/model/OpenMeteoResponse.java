package com.energyanalytics.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO matching the Open-Meteo forecast / ERA5 archive JSON structure.
 * Hourly values are parallel arrays indexed like {@code hourly.time}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OpenMeteoResponse {

    private Double latitude;
    private Double longitude;
    private String timezone;

    @JsonProperty("utc_offset_seconds")
    private Integer utcOffsetSeconds;

    private Hourly hourly;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Hourly {

        /** ISO local date-times without offset, e.g. "2024-01-01T00:00" */
        private List<String> time;

        @JsonProperty("temperature_2m")
        private List<Double> temperature2m;

        @JsonProperty("relative_humidity_2m")
        private List<Double> relativeHumidity2m;

        @JsonProperty("dew_point_2m")
        private List<Double> dewPoint2m;

        @JsonProperty("apparent_temperature")
        private List<Double> apparentTemperature;

        private List<Double> rain;

        @JsonProperty("shortwave_radiation")
        private List<Double> shortwaveRadiation;

        @JsonProperty("wind_speed_10m")
        private List<Double> windSpeed10m;

        @JsonProperty("wind_direction_10m")
        private List<Double> windDirection10m;

        @JsonProperty("wind_gusts_10m")
        private List<Double> windGusts10m;

        @JsonProperty("cloud_cover")
        private List<Double> cloudCover;

        @JsonProperty("surface_pressure")
        private List<Double> surfacePressure;

        private List<Double> visibility;
    }
}
