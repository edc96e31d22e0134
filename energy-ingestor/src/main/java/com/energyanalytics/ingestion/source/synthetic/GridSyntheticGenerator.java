package com.energyanalytics.ingestion.source.synthetic;

import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.model.GridOperation;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.SyntheticQuality;
import com.energyanalytics.ingestion.model.TimeWindow;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.alignedTimestamps;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.clamp;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.dayOfYear;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.diurnal;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.exponential;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.hourOfDay;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.isWeekend;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.round;

/**
 * Hourly national load, generation mix and day-ahead price.
 *
 * Load = base load x daily factor (evening peak) x weekly factor (weekends 30% lower) with
 * tier noise. Solar runs 06:00-18:00, wind is exponentially distributed, hydro and nuclear
 * are fixed shares of base load, fossil covers the remainder. Total generation is the
 * sum of the components; the difference to load is the net import.
 */
@Component
public class GridSyntheticGenerator implements SyntheticGenerator {

    static final String SOURCE_NAME = "Synthetic Generator";

    private static final Map<String, Double> BASE_LOAD_MW = Map.of(
            "FR", 50000.0,
            "DE", 60000.0,
            "ES", 35000.0);

    private static final double DEFAULT_BASE_LOAD_MW = 40000.0;

    @Override
    public List<GridOperation> generate(TimeWindow window, SourceSettings settings,
                                        SyntheticQuality quality, Random random) {
        List<GridOperation> operations = new ArrayList<>();
        for (String country : settings.getCountries()) {
            String code = country.toUpperCase(Locale.ROOT);
            double baseLoad = BASE_LOAD_MW.getOrDefault(code, DEFAULT_BASE_LOAD_MW);
            SyntheticSupport.Noise noise = new SyntheticSupport.Noise(random, quality);

            for (Instant ts : alignedTimestamps(window.start(), window.end(), SourceType.GRID.getGranularity())) {
                operations.add(operation(ts, code, baseLoad, quality, random, noise));
            }
        }
        return operations;
    }

    private GridOperation operation(Instant ts, String country, double baseLoad, SyntheticQuality quality,
                                    Random random, SyntheticSupport.Noise noise) {
        double hour = hourOfDay(ts);
        double dailyFactor = 0.8 + 0.2 * diurnal(hour, 19);
        double weeklyFactor = isWeekend(ts) ? 0.7 : 0.9;
        double seasonalFactor = quality == SyntheticQuality.HIGH
                ? 1 + 0.1 * Math.cos(2 * Math.PI * (dayOfYear(ts) - 15) / 365.25)
                : 1;

        double load = clamp(noise.apply(baseLoad * dailyFactor * weeklyFactor * seasonalFactor), 0, 200000);
        double forecast = load * (1 + random.nextGaussian() * 0.02);

        double solar = hour >= 6 && hour <= 18
                ? clamp(3000 + random.nextGaussian() * 1000, 0, 60000) * Math.sin(Math.PI * (hour - 6) / 12.0)
                : 0;
        double onshore = clamp(exponential(random, 8000), 0, 60000);
        double offshore = clamp(exponential(random, 4000), 0, 30000);
        double hydro = baseLoad * 0.1;
        double nuclear = baseLoad * 0.7;
        double otherRenewable = clamp(1000 + random.nextGaussian() * 300, 0, 5000);
        double fossil = Math.max(0, load - solar - onshore - offshore - hydro - nuclear - otherRenewable);
        double total = solar + onshore + offshore + hydro + nuclear + fossil + otherRenewable;

        double price = clamp(50 + 40 * (dailyFactor - 1) + random.nextGaussian() * 20 * quality.getNoiseRatio() / 0.04,
                -500, 3000);

        return GridOperation.builder()
                .timestamp(ts)
                .countryCode(country)
                .regionCode(country)
                .loadActualMw(round(load, 1))
                .loadForecastMw(round(forecast, 1))
                .solarGenerationActualMw(round(solar, 1))
                .windOnshoreGenerationActualMw(round(onshore, 1))
                .windOffshoreGenerationActualMw(round(offshore, 1))
                .hydroGenerationActualMw(round(hydro, 1))
                .nuclearGenerationActualMw(round(nuclear, 1))
                .fossilGenerationActualMw(round(fossil, 1))
                .otherRenewableGenerationMw(round(otherRenewable, 1))
                .totalGenerationMw(round(total, 1))
                .netImportExportMw(round(load - total, 1))
                .priceDayAheadEurMwh(round(price, 2))
                .source(SOURCE_NAME)
                .syntheticQuality(quality)
                .build();
    }
}
