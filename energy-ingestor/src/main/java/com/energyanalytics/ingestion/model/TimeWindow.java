package com.energyanalytics.ingestion.model;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Closed time interval [start, end] in UTC.
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
    }

    public static TimeWindow endingAt(Instant end, Duration lookback) {
        return new TimeWindow(end.minus(lookback), end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    /**
     * Split into consecutive day-sized windows, used for backfills. The last slice may be shorter.
     */
    public List<TimeWindow> splitByDay() {
        List<TimeWindow> slices = new ArrayList<>();
        Instant cursor = start;
        while (cursor.isBefore(end)) {
            Instant next = cursor.plus(1, ChronoUnit.DAYS);
            Instant sliceEnd = next.isAfter(end) ? end : next.minusSeconds(1);
            slices.add(new TimeWindow(cursor, sliceEnd));
            cursor = next;
        }
        if (slices.isEmpty()) {
            slices.add(this);
        }
        return slices;
    }

    @Override
    public String toString() {
        return "[" + start + " .. " + end + "]";
    }
}
