package com.energyanalytics.ingestion.orchestration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Records requested pauses instead of sleeping.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> pauses = new ArrayList<>();

    @Override
    public synchronized void sleep(Duration duration) {
        pauses.add(duration);
    }

    public synchronized List<Duration> getPauses() {
        return new ArrayList<>(pauses);
    }
}
