package com.energyanalytics.ingestion.persistence;

import com.energyanalytics.ingestion.config.EnergyIngestionProperties;
import com.energyanalytics.ingestion.model.NaturalKey;
import com.energyanalytics.ingestion.model.NormalizedRecord;
import com.energyanalytics.ingestion.model.SourceType;
import com.energyanalytics.ingestion.model.WriteResult;
import com.energyanalytics.ingestion.orchestration.Sleeper;
import com.energyanalytics.ingestion.persistence.ChunkWriter.ChunkCounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Idempotent chunked writer. Records are keyed on (timestamp, entity); writing the same
 * batch again replaces the same rows with the same values.
 *
 * A failing chunk is retried {@code chunkRetries} times. When it still fails the write
 * stops: chunks committed so far stay committed and the result reports the failed chunk.
 * A thread interrupt is honoured between chunks. Chunks are capped below the configured
 * batch size when a row's column count would push one statement past the bind parameter limit.
 */
@Component
@Slf4j
public class Upserter {

    private final ChunkWriter chunkWriter;
    private final int batchSize;
    private final int chunkRetries;
    private final Duration chunkRetryDelay;
    private final Sleeper sleeper;

    @Autowired
    public Upserter(ChunkWriter chunkWriter, EnergyIngestionProperties properties, Sleeper sleeper) {
        this(chunkWriter,
                properties.getIngestion().getBatchSize(),
                properties.getIngestion().getChunkRetries(),
                properties.getIngestion().getChunkRetryDelay(),
                sleeper);
    }

    public Upserter(ChunkWriter chunkWriter, int batchSize, int chunkRetries, Duration chunkRetryDelay, Sleeper sleeper) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.chunkWriter = chunkWriter;
        this.batchSize = batchSize;
        this.chunkRetries = Math.max(0, chunkRetries);
        this.chunkRetryDelay = chunkRetryDelay;
        this.sleeper = sleeper;
    }

    public WriteResult write(List<NormalizedRecord> records, Long jobId) {
        if (records.isEmpty()) return WriteResult.empty();

        SourceType type = records.get(0).getSourceType();
        List<NormalizedRecord> unique = lastOccurrencePerKey(records);
        int total = unique.size();
        int chunkSize = chunkSizeFor(type, unique.get(0));
        int chunkCount = (total + chunkSize - 1) / chunkSize;
        log.info("Job {}: writing {} {} records in {} chunks of up to {}",
                jobId, total, type, chunkCount, chunkSize);

        int inserted = 0;
        int updated = 0;

        for (int c = 0; c < chunkCount; c++) {
            int from = c * chunkSize;
            int chunkNumber = c + 1;

            if (Thread.currentThread().isInterrupted()) {
                log.warn("Job {}: cancelled before chunk {}/{}, {} records committed",
                        jobId, chunkNumber, chunkCount, inserted + updated);
                return new WriteResult(inserted, updated, total - from, null, true, "cancelled");
            }

            List<NormalizedRecord> chunk = unique.subList(from, Math.min(from + chunkSize, total));
            RuntimeException lastError = null;

            for (int attempt = 1; attempt <= chunkRetries + 1; attempt++) {
                try {
                    ChunkCounts counts = chunkWriter.upsertChunk(type, chunk);
                    inserted += counts.inserted();
                    updated += counts.updated();
                    lastError = null;
                    log.debug("Job {}: chunk {}/{} committed ({} inserted, {} updated)",
                            jobId, chunkNumber, chunkCount, counts.inserted(), counts.updated());
                    break;
                } catch (RuntimeException e) {
                    lastError = e;
                    log.warn("Job {}: chunk {}/{} attempt {}/{} failed: {}",
                            jobId, chunkNumber, chunkCount, attempt, chunkRetries + 1, e.getMessage());
                    if (attempt <= chunkRetries) {
                        try {
                            sleeper.sleep(chunkRetryDelay);
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            return new WriteResult(inserted, updated, total - from, null, true, "cancelled");
                        }
                    }
                }
            }

            if (lastError != null) {
                log.error("Job {}: chunk {}/{} failed after {} attempts, stopping write with {} records committed",
                        jobId, chunkNumber, chunkCount, chunkRetries + 1, inserted + updated, lastError);
                return new WriteResult(inserted, updated, total - from, chunkNumber, false, lastError.getMessage());
            }
        }

        log.info("Job {}: wrote {} {} records ({} inserted, {} updated)", jobId, total, type, inserted, updated);
        return new WriteResult(inserted, updated, 0, null, false, null);
    }

    private int chunkSizeFor(SourceType type, NormalizedRecord sample) {
        int limit = UpsertStatementBuilder.maxRowsPerStatement(sample.columnValues().size());
        if (batchSize > limit) {
            log.warn("Batch size {} exceeds the {} rows a {} upsert can bind, using {}", batchSize, limit, type, limit);
            return limit;
        }
        return batchSize;
    }

    private List<NormalizedRecord> lastOccurrencePerKey(List<NormalizedRecord> records) {
        Map<NaturalKey, NormalizedRecord> byKey = new LinkedHashMap<>();
        for (NormalizedRecord record : records) {
            byKey.remove(record.naturalKey());
            byKey.put(record.naturalKey(), record);
        }
        return new ArrayList<>(byKey.values());
    }
}
