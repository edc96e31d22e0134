package com.energyanalytics.ingestion.orchestration;

import com.energyanalytics.ingestion.model.IngestionJob;
import com.energyanalytics.ingestion.model.JobStatus;
import com.energyanalytics.ingestion.model.RunMode;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.TimeWindow;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives every source on its own cadence.
 *
 * Each source is scheduled with a fixed delay, so a run starts only after the previous
 * run of the same source has finished. Sources run on separate pool threads; a slow or
 * failing source does not hold up the others.
 */
@Slf4j
public class StreamingManager {

    /**
     * One source's schedule.
     *
     * @param lookback width of the window each run asks for, ending at the tick time
     */
    public record Stream(IngestionOrchestrator orchestrator, Duration cadence, Duration initialDelay, Duration lookback) {

        public SourceType source() {
            return orchestrator.getSourceType();
        }
    }

    public record SourceStatus(long runs, long failures, JobStatus lastStatus, Instant lastRunAt) {
    }

    public record StreamingStatus(boolean running, Map<SourceType, SourceStatus> sources) {
    }

    private final List<Stream> streams;
    private final Clock clock;
    private final Map<SourceType, Counters> counters = new EnumMap<>(SourceType.class);

    private ScheduledExecutorService executor;
    private volatile boolean running;

    public StreamingManager(List<Stream> streams, Clock clock) {
        this.streams = List.copyOf(streams);
        this.clock = clock;
        for (Stream stream : this.streams) {
            counters.put(stream.source(), new Counters());
        }
    }

    public synchronized void start() {
        if (running) {
            log.warn("Streaming already running");
            return;
        }
        AtomicLong threadIndex = new AtomicLong();
        executor = Executors.newScheduledThreadPool(Math.max(1, streams.size()), runnable -> {
            Thread thread = new Thread(runnable, "ingest-stream-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        for (Stream stream : streams) {
            executor.scheduleWithFixedDelay(() -> tick(stream),
                    stream.initialDelay().toMillis(), stream.cadence().toMillis(), TimeUnit.MILLISECONDS);
            log.info("Streaming {} every {} (lookback {})", stream.source(), stream.cadence(), stream.lookback());
        }
        running = true;
    }

    /**
     * Stop scheduling new runs, let in-flight runs finish for up to {@code drainTimeout},
     * then interrupt whatever is left.
     *
     * @return true if every in-flight run finished within the drain timeout
     */
    public synchronized boolean stop(Duration drainTimeout) {
        if (!running) return true;
        running = false;
        executor.shutdown();
        try {
            if (executor.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("Streaming stopped, all runs drained");
                return true;
            }
            log.warn("Drain timeout {} exceeded, cancelling in-flight runs", drainTimeout);
            executor.shutdownNow();
            executor.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return false;
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public StreamingStatus status() {
        Map<SourceType, SourceStatus> sources = new EnumMap<>(SourceType.class);
        counters.forEach((source, c) -> sources.put(source, c.snapshot()));
        return new StreamingStatus(running, sources);
    }

    private void tick(Stream stream) {
        Counters c = counters.get(stream.source());
        try {
            TimeWindow window = TimeWindow.endingAt(clock.instant(), stream.lookback());
            IngestionJob job = stream.orchestrator().run(window, RunMode.INCREMENTAL);
            c.record(job.getStatus(), clock.instant());
        } catch (Throwable t) {
            // An exception escaping here would silently cancel the schedule
            log.error("Streaming tick for {} failed: {}", stream.source().name().toLowerCase(Locale.ROOT), t.getMessage(), t);
            c.record(JobStatus.FAILED, clock.instant());
        }
    }

    private static final class Counters {
        private long runs;
        private long failures;
        private JobStatus lastStatus;
        private Instant lastRunAt;

        synchronized void record(JobStatus status, Instant at) {
            runs++;
            if (status == JobStatus.FAILED) failures++;
            lastStatus = status;
            lastRunAt = at;
        }

        synchronized SourceStatus snapshot() {
            return new SourceStatus(runs, failures, lastStatus, lastRunAt);
        }
    }
}
