package com.energyanalytics.ingestion.orchestration;

import com.energyanalytics.ingestion.TestRecords;
import com.energyanalytics.ingestion.config.EnergyIngestionProperties;
import com.energyanalytics.ingestion.config.SourceSettings;
import com.energyanalytics.ingestion.exception.TransientFetchException;
import com.energyanalytics.ingestion.model.FetchResult;
import com.energyanalytics.ingestion.model.JobStatus;
import com.energyanalytics.ingestion.model.NormalizedRecord;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.persistence.InMemoryChunkWriter;
import com.energyanalytics.ingestion.persistence.Upserter;
import com.energyanalytics.ingestion.tracking.InMemoryJobTracker;
import com.energyanalytics.ingestion.validation.RecordValidator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StreamingManager Tests")
class StreamingManagerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final Duration CADENCE = Duration.ofMillis(20);

    private final InMemoryChunkWriter writer = new InMemoryChunkWriter();
    private final InMemoryJobTracker tracker = new InMemoryJobTracker(CLOCK);
    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final CountDownLatch release = new CountDownLatch(1);

    private StreamingManager manager;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (manager != null) {
            manager.stop(Duration.ofSeconds(2));
        }
    }

    private StreamingManager.Stream stream(ScriptedSourceClient client, SourceSettings settings) {
        IngestionOrchestrator orchestrator = IngestionOrchestrator.builder()
                .client(client)
                .settings(settings)
                .validator(new RecordValidator(CLOCK))
                .validationConfig(new EnergyIngestionProperties.Validation())
                .upserter(new Upserter(writer, 100, 0, Duration.ZERO, sleeper))
                .jobTracker(tracker)
                .retryPolicy(RetryPolicy.fixed(2, Duration.ZERO))
                .sleeper(sleeper)
                .clock(CLOCK)
                .build();
        return new StreamingManager.Stream(orchestrator, CADENCE, Duration.ZERO, Duration.ofHours(3));
    }

    private ScriptedSourceClient healthyWeather() {
        List<NormalizedRecord> records = List.of(
                TestRecords.weather(NOW.minusSeconds(3600), "paris_fr_001", 8.0),
                TestRecords.weather(NOW, "paris_fr_001", 9.5));
        return new ScriptedSourceClient(SourceType.WEATHER).thenReturn(records);
    }

    /** Grid client whose fetch blocks until {@link #release} opens. */
    private ScriptedSourceClient blockingGrid() {
        return new ScriptedSourceClient(SourceType.GRID).thenAnswer(window -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientFetchException("interrupted");
            }
            return FetchResult.fromEndpoint(TestRecords.hourlyGrid(NOW, "FR", 2), "http://grid");
        });
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    private StreamingManager.SourceStatus status(SourceType source) {
        return manager.status().sources().get(source);
    }

    // ============================================================================
    // Isolation
    // ============================================================================

    @Test
    @DisplayName("A failing source does not stop the others")
    void testFailingSourceIsIsolated() throws InterruptedException {
        ScriptedSourceClient grid = new ScriptedSourceClient(SourceType.GRID)
                .thenThrow(new IllegalStateException("parser bug"));
        manager = new StreamingManager(List.of(
                stream(grid, SourceSettings.gridDefaults()),
                stream(healthyWeather(), SourceSettings.weatherDefaults())), CLOCK);

        manager.start();
        await(() -> status(SourceType.WEATHER).runs() >= 3 && status(SourceType.GRID).runs() >= 3);

        assertEquals(0, status(SourceType.WEATHER).failures());
        assertEquals(JobStatus.SUCCESS, status(SourceType.WEATHER).lastStatus());
        StreamingManager.SourceStatus gridStatus = status(SourceType.GRID);
        assertEquals(gridStatus.runs(), gridStatus.failures());
        assertEquals(JobStatus.FAILED, gridStatus.lastStatus());
        assertEquals(2, writer.rowCount(SourceType.WEATHER));
    }

    @Test
    @DisplayName("A hanging source does not delay the others")
    void testSlowSourceIsIsolated() throws InterruptedException {
        ScriptedSourceClient grid = blockingGrid();
        manager = new StreamingManager(List.of(
                stream(grid, SourceSettings.gridDefaults()),
                stream(healthyWeather(), SourceSettings.weatherDefaults())), CLOCK);

        manager.start();
        await(() -> status(SourceType.WEATHER).runs() >= 5);

        assertEquals(1, grid.getCalls());
        assertEquals(0, status(SourceType.GRID).runs());
    }

    // ============================================================================
    // Lifecycle
    // ============================================================================

    @Test
    @DisplayName("Stopping drains in-flight runs")
    void testStopDrains() throws InterruptedException {
        ScriptedSourceClient grid = blockingGrid();
        manager = new StreamingManager(List.of(stream(grid, SourceSettings.gridDefaults())), CLOCK);
        manager.start();
        await(() -> grid.getCalls() == 1);

        release.countDown();
        boolean drained = manager.stop(Duration.ofSeconds(5));

        assertTrue(drained);
        assertFalse(manager.isRunning());
        assertEquals(JobStatus.SUCCESS, status(SourceType.GRID).lastStatus());
    }

    @Test
    @DisplayName("Runs still in flight after the drain timeout are cancelled")
    void testStopCancelsAfterTimeout() throws InterruptedException {
        ScriptedSourceClient grid = blockingGrid();
        manager = new StreamingManager(List.of(stream(grid, SourceSettings.gridDefaults())), CLOCK);
        manager.start();
        await(() -> grid.getCalls() == 1);

        boolean drained = manager.stop(Duration.ofMillis(100));

        assertFalse(drained);
        await(() -> status(SourceType.GRID).runs() == 1);
        assertEquals(JobStatus.FAILED, status(SourceType.GRID).lastStatus());
    }

    @Test
    @DisplayName("Start is idempotent and stop without start is a no-op")
    void testLifecycleIdempotence() {
        manager = new StreamingManager(List.of(stream(healthyWeather(), SourceSettings.weatherDefaults())), CLOCK);

        assertTrue(manager.stop(Duration.ofSeconds(1)));
        assertFalse(manager.status().running());
        assertEquals(0, status(SourceType.WEATHER).runs());
        assertNull(status(SourceType.WEATHER).lastRunAt());

        manager.start();
        manager.start();

        assertTrue(manager.isRunning());
        assertTrue(manager.stop(Duration.ofSeconds(2)));
    }
}
