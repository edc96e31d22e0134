package com.energyanalytics.ingestion.persistence;

import com.energyanalytics.ingestion.TestRecords;
import com.energyanalytics.ingestion.model.GridOperation;
import com.energyanalytics.ingestion.model.NaturalKey;
import com.energyanalytics.ingestion.model.NormalizedRecord;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.WriteResult;
import com.energyanalytics.ingestion.orchestration.RecordingSleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Upserter Tests")
class UpserterTest {

    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private final InMemoryChunkWriter writer = new InMemoryChunkWriter();
    private final RecordingSleeper sleeper = new RecordingSleeper();

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private Upserter upserter(int batchSize, int chunkRetries) {
        return new Upserter(writer, batchSize, chunkRetries, Duration.ofSeconds(1), sleeper);
    }

    @Test
    @DisplayName("Writing the same batch twice leaves the store unchanged")
    void testIdempotentRewrite() {
        List<NormalizedRecord> batch = TestRecords.hourlyGrid(T0, "FR", 25);
        Upserter upserter = upserter(10, 0);

        WriteResult first = upserter.write(batch, 1L);
        Map<NaturalKey, Map<String, Object>> afterFirst = writer.rows(SourceType.GRID);
        WriteResult second = upserter.write(batch, 2L);

        assertEquals(25, first.inserted());
        assertEquals(0, first.updated());
        assertEquals(0, second.inserted());
        assertEquals(25, second.updated());
        assertEquals(afterFirst, writer.rows(SourceType.GRID));
        assertTrue(second.isComplete());
    }

    @Test
    @DisplayName("Splits the batch into chunks of the configured size")
    void testChunking() {
        upserter(10, 0).write(TestRecords.hourlyGrid(T0, "DE", 25), 1L);
        assertEquals(List.of(10, 10, 5), writer.getChunkSizes());
    }

    @Test
    @DisplayName("Duplicate natural keys collapse to the last occurrence")
    void testDuplicateKeysLastWins() {
        List<NormalizedRecord> batch = new ArrayList<>();
        batch.add(TestRecords.grid(T0, "FR", 40000));
        batch.add(TestRecords.grid(T0, "FR", 41000));

        WriteResult result = upserter(10, 0).write(batch, 1L);

        assertEquals(1, result.inserted());
        Map<String, Object> row = writer.rows(SourceType.GRID).get(new NaturalKey(T0, "FR"));
        assertEquals(41000.0, row.get("load_actual_mw"));
    }

    @Test
    @DisplayName("A chunk that keeps failing stops the write and keeps earlier chunks")
    void testPartialWrite() {
        writer.failAlwaysAfter(1);
        WriteResult result = upserter(10, 2).write(TestRecords.hourlyGrid(T0, "FR", 25), 7L);

        assertEquals(10, result.inserted());
        assertEquals(15, result.failed());
        assertEquals(2, result.failedChunk());
        assertFalse(result.cancelled());
        assertFalse(result.isComplete());
        assertNotNull(result.errorMessage());
        assertEquals(10, writer.rowCount(SourceType.GRID));
        // first chunk once, second chunk 1 + 2 retries
        assertEquals(4, writer.getCalls());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1)), sleeper.getPauses());
    }

    @Test
    @DisplayName("A chunk that fails once succeeds on retry")
    void testChunkRetrySucceeds() {
        writer.failOnCall(2);
        WriteResult result = upserter(10, 1).write(TestRecords.hourlyGrid(T0, "FR", 25), 1L);

        assertTrue(result.isComplete());
        assertEquals(25, result.inserted());
        assertEquals(1, sleeper.getPauses().size());
    }

    @Test
    @DisplayName("Interrupt before writing cancels without touching the store")
    void testCancelledBeforeFirstChunk() {
        Thread.currentThread().interrupt();
        WriteResult result = upserter(10, 0).write(TestRecords.hourlyGrid(T0, "FR", 5), 1L);

        assertTrue(result.cancelled());
        assertEquals(0, result.committed());
        assertEquals(5, result.failed());
        assertEquals(0, writer.getCalls());
    }

    @Test
    @DisplayName("Empty batch writes nothing")
    void testEmptyBatch() {
        WriteResult result = upserter(10, 0).write(List.of(), 1L);
        assertEquals(WriteResult.empty(), result);
        assertEquals(0, writer.getCalls());
    }

    @Test
    @DisplayName("Rejects a non-positive batch size")
    void testInvalidBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> upserter(0, 0));
    }

    @Test
    @DisplayName("Updates replace measurement values")
    void testUpdateReplacesValues() {
        Upserter upserter = upserter(10, 0);
        upserter.write(List.of(TestRecords.grid(T0, "ES", 30000)), 1L);
        GridOperation changed = TestRecords.grid(T0, "ES", 31000);
        WriteResult result = upserter.write(List.of(changed), 2L);

        assertEquals(1, result.updated());
        assertEquals(31000.0, writer.rows(SourceType.GRID).get(new NaturalKey(T0, "ES")).get("load_actual_mw"));
    }

    @Test
    @DisplayName("An oversized batch size is capped to what one statement can bind")
    void testChunkCappedByBindLimit() {
        List<NormalizedRecord> batch = TestRecords.hourlyGrid(T0, "FR", 5000);
        int limit = UpsertStatementBuilder.maxRowsPerStatement(batch.get(0).columnValues().size());

        WriteResult result = upserter(100_000, 0).write(batch, 1L);

        assertTrue(result.isComplete());
        assertEquals(5000, result.inserted());
        assertEquals(List.of(limit, 5000 - limit), writer.getChunkSizes());
    }
}
