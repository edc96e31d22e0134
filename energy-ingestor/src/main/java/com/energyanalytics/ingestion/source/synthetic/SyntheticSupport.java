package com.energyanalytics.ingestion.source.synthetic;

import com.energyanalytics.ingestion.model.SyntheticQuality;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Shared building blocks for the generators: timestamp grids, curves and noise.
 */
final class SyntheticSupport {

    private SyntheticSupport() {
    }

    /** Every multiple of {@code step} (since the epoch) inside [start, end]. */
    static List<Instant> alignedTimestamps(Instant start, Instant end, Duration step) {
        long stepSeconds = step.getSeconds();
        long first = Math.floorDiv(start.getEpochSecond() + stepSeconds - 1, stepSeconds) * stepSeconds;
        List<Instant> timestamps = new ArrayList<>();
        for (long t = first; t <= end.getEpochSecond(); t += stepSeconds) {
            timestamps.add(Instant.ofEpochSecond(t));
        }
        return timestamps;
    }

    /** Fractional hour of day in UTC, 0 <= h < 24. */
    static double hourOfDay(Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        return utc.getHour() + utc.getMinute() / 60.0;
    }

    static int dayOfYear(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).getDayOfYear();
    }

    static boolean isWeekend(Instant instant) {
        int dow = instant.atZone(ZoneOffset.UTC).getDayOfWeek().getValue();
        return dow >= 6;
    }

    /** Cosine curve between 0 and 2 peaking at {@code peakHour}. */
    static double diurnal(double hour, double peakHour) {
        return 1 + Math.cos(2 * Math.PI * (hour - peakHour) / 24.0);
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }

    static double exponential(Random random, double mean) {
        return -mean * Math.log(1.0 - random.nextDouble());
    }

    /**
     * Multiplicative noise source. Independent draws for the lower tiers, an AR(1)
     * process for correlated tiers so consecutive values drift rather than jitter.
     */
    static final class Noise {

        private static final double PERSISTENCE = 0.8;

        private final Random random;
        private final SyntheticQuality quality;
        private double state;

        Noise(Random random, SyntheticQuality quality) {
            this.random = random;
            this.quality = quality;
        }

        /** Next relative deviation, mean 0, standard deviation about the tier's noise ratio. */
        double next() {
            double shock = random.nextGaussian() * quality.getNoiseRatio();
            if (!quality.isCorrelatedNoise()) {
                return shock;
            }
            state = PERSISTENCE * state + Math.sqrt(1 - PERSISTENCE * PERSISTENCE) * shock;
            return state;
        }

        double apply(double value) {
            return value * (1 + next());
        }
    }
}
