package com.energyanalytics.ingestion.source.synthetic;

import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.model.HouseholdReading;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.SyntheticQuality;
import com.energyanalytics.ingestion.model.TimeWindow;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.alignedTimestamps;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.clamp;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.diurnal;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.hourOfDay;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.isWeekend;
import static com.energyanalytics.ingestion.source.synthetic.SyntheticSupport.round;

/**
 * Minute-level household consumption.
 *
 * Base load follows an evening-peaking daily curve. From STANDARD up, kitchen, laundry
 * and water-heater sub-meters switch on with time-of-day dependent probability and their
 * draw is added to the total. HIGH adds correlated noise and a weekend uplift.
 * Sub-meter energy never exceeds the minute's active energy.
 */
@Component
public class HouseholdSyntheticGenerator implements SyntheticGenerator {

    static final String SOURCE_FILE = "synthetic";

    private static final double MAX_POWER_KW = 20.0;
    private static final double NOMINAL_VOLTAGE = 240.0;

    @Override
    public List<HouseholdReading> generate(TimeWindow window, SourceSettings settings,
                                           SyntheticQuality quality, Random random) {
        String householdId = settings.getHouseholdId() != null ? settings.getHouseholdId() : "synthetic_household";
        SyntheticSupport.Noise noise = new SyntheticSupport.Noise(random, quality);

        List<HouseholdReading> readings = new ArrayList<>();
        for (Instant ts : alignedTimestamps(window.start(), window.end(), SourceType.HOUSEHOLD.getGranularity())) {
            double hour = hourOfDay(ts);
            double base = 0.5 + 0.3 * diurnal(hour, 19);
            if (quality == SyntheticQuality.HIGH && isWeekend(ts)) {
                base *= 1.15;
            }

            // Sub-meters in Wh for the minute
            double kitchen = 0;
            double laundry = 0;
            double heater = 0;
            if (quality != SyntheticQuality.BASIC) {
                kitchen = applianceDraw(random, mealTime(hour) ? 0.35 : 0.03, 20, 38);
                laundry = applianceDraw(random, hour >= 9 && hour < 21 ? 0.08 : 0.01, 15, 30)
                        + (random.nextDouble() < 0.3 ? 1 : 0); // fridge compressor
                heater = applianceDraw(random, hour < 6 || (hour >= 17 && hour < 20) ? 0.6 : 0.1, 16, 19);
            }
            double appliancesKw = (kitchen + laundry + heater) * 60.0 / 1000.0;

            double power = clamp(noise.apply(base) + appliancesKw, appliancesKw + 0.05, MAX_POWER_KW);
            double voltage = clamp(NOMINAL_VOLTAGE + random.nextGaussian() * 5 * quality.getNoiseRatio() / 0.04, 225, 255);
            double reactive = clamp(power * 0.1 * (1 + random.nextGaussian() * quality.getNoiseRatio()), 0, 1.5);

            readings.add(HouseholdReading.builder()
                    .timestamp(ts)
                    .householdId(householdId)
                    .globalActivePower(round(power, 3))
                    .globalReactivePower(round(reactive, 3))
                    .voltage(round(voltage, 2))
                    .globalIntensity(round(power * 1000.0 / voltage, 1))
                    .subMetering1(Math.floor(kitchen))
                    .subMetering2(Math.floor(laundry))
                    .subMetering3(Math.floor(heater))
                    .sourceFile(SOURCE_FILE)
                    .syntheticQuality(quality)
                    .build());
        }
        return readings;
    }

    private boolean mealTime(double hour) {
        return (hour >= 6.5 && hour < 8.5) || (hour >= 11.5 && hour < 13.5) || (hour >= 18 && hour < 20.5);
    }

    private double applianceDraw(Random random, double probability, double min, double max) {
        if (random.nextDouble() >= probability) return 0;
        return min + random.nextDouble() * (max - min);
    }
}
