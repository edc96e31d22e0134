package com.energyanalytics.ingestion.source.synthetic;

import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.config.SourceSettings.WeatherLocation;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.SyntheticQuality;
import com.energyanalytics.ingestion.model.TimeWindow;
import com.energyanalytics.ingestion.model.WeatherObservation;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.alignedTimestamps;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.clamp;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.dayOfYear;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.exponential;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.hourOfDay;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.round;

/**
 * Hourly weather for each configured location.
 *
 * Temperature combines a latitude-dependent annual mean, a seasonal cycle bottoming out
 * mid-January and a daily cycle peaking mid-afternoon. Humidity moves against temperature;
 * solar radiation follows the sun and is dimmed by cloud cover; rain only falls under
 * heavy cloud. Dew point is derived so it never exceeds the air temperature.
 */
@Component
public class WeatherSyntheticGenerator implements SyntheticGenerator {

    static final String PROVIDER = "Synthetic Generator";

    @Override
    public List<WeatherObservation> generate(TimeWindow window, SourceSettings settings,
                                             SyntheticQuality quality, Random random) {
        List<WeatherObservation> observations = new ArrayList<>();
        for (WeatherLocation location : settings.getLocations()) {
            SyntheticSupport.Noise noise = new SyntheticSupport.Noise(random, quality);
            double cloud = 50;
            for (Instant ts : alignedTimestamps(window.start(), window.end(), SourceType.WEATHER.getGranularity())) {
                observations.add(observe(ts, location, quality, random, noise, cloud));
                cloud = observations.get(observations.size() - 1).getCloudCoverPct();
            }
        }
        return observations;
    }

    private WeatherObservation observe(Instant ts, WeatherLocation location, SyntheticQuality quality,
                                       Random random, SyntheticSupport.Noise noise, double previousCloud) {
        double hour = hourOfDay(ts);
        int doy = dayOfYear(ts);
        double lat = Math.abs(location.getLatitude());

        double annualMean = 30 - 0.4 * lat;
        double seasonal = -8 * Math.cos(2 * Math.PI * (doy - 15) / 365.25);
        double daily = 5 * Math.cos(2 * Math.PI * (hour - 15) / 24.0);
        double temperature = clamp(annualMean + seasonal + daily + noise.next() * 25, -40, 50);

        double humidity = clamp(70 - 2 * daily + random.nextGaussian() * 100 * quality.getNoiseRatio(), 15, 100);
        // Magnus-type approximation, valid for humid air; clamped below temperature
        double dewPoint = Math.min(temperature, temperature - (100 - humidity) / 5.0);

        // Cloud cover random-walks between hours
        double cloud = clamp(previousCloud + random.nextGaussian() * 15, 0, 100);

        double sunElevation = Math.sin(Math.PI * (hour - 6) / 12.0);
        double seasonalSun = 0.6 + 0.4 * Math.sin(2 * Math.PI * (doy - 80) / 365.25);
        double radiation = hour >= 6 && hour <= 18
                ? clamp(900 * sunElevation * seasonalSun * (1 - cloud / 150.0), 0, 1200)
                : 0;

        double rain = cloud > 80 && random.nextDouble() < 0.5 ? clamp(exponential(random, 0.8), 0, 30) : 0;
        double wind = clamp(12 + exponential(random, 6) * (1 + 3 * quality.getNoiseRatio()), 0, 120);
        double gusts = clamp(wind * (1.3 + random.nextDouble() * 0.4), wind, 180);
        double pressure = clamp(1013 + random.nextGaussian() * 8, 960, 1050);
        double visibility = clamp(30000 - cloud * 150 - rain * 2000, 500, 50000);
        double apparent = temperature - 0.15 * wind + (humidity > 70 && temperature > 20 ? 2 : 0);

        return WeatherObservation.builder()
                .timestamp(ts)
                .locationId(location.getLocationId())
                .latitude(location.getLatitude())
                .longitude(location.getLongitude())
                .temperature2mC(round(temperature, 1))
                .relativeHumidity2mPct(round(humidity, 0))
                .dewPoint2mC(round(Math.min(dewPoint, round(temperature, 1)), 1))
                .apparentTemperatureC(round(clamp(apparent, -55, 55), 1))
                .rainMm(round(rain, 1))
                .shortwaveRadiationWm2(round(radiation, 0))
                .windSpeed10mKmh(round(wind, 1))
                .windDirection10mDeg(round(random.nextDouble() * 360, 0))
                .windGusts10mKmh(round(gusts, 1))
                .cloudCoverPct(round(cloud, 0))
                .surfacePressureHpa(round(pressure, 1))
                .visibilityM(round(visibility, 0))
                .dataProvider(PROVIDER)
                .syntheticQuality(quality)
                .build();
    }
}
