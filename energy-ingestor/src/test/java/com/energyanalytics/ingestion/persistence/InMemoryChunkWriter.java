package com.energyanalytics.ingestion.persistence;

import com.energyanalytics.ingestion.model.NaturalKey;
import com.energyanalytics.ingestion.model.NormalizedRecord;
import com.energyanalytics.ingestion.model.SourceType;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Chunk writer backed by maps, with the same conflict semantics as the SQL upsert:
 * one row per natural key, last write wins, a failing chunk leaves nothing behind.
 */
public class InMemoryChunkWriter implements ChunkWriter {

    private final Map<SourceType, Map<NaturalKey, Map<String, Object>>> tables = new EnumMap<>(SourceType.class);
    private final Set<Integer> failingCalls = new HashSet<>();
    private final List<Integer> chunkSizes = new ArrayList<>();
    private int calls;
    private int failAfter = Integer.MAX_VALUE;

    /** Make the n-th call (1-based) throw. */
    public InMemoryChunkWriter failOnCall(int... callNumbers) {
        for (int n : callNumbers) failingCalls.add(n);
        return this;
    }

    /** Let the first {@code n} calls succeed and fail every call after them. */
    public InMemoryChunkWriter failAlwaysAfter(int n) {
        failAfter = n;
        return this;
    }

    @Override
    public synchronized ChunkCounts upsertChunk(SourceType type, List<NormalizedRecord> chunk) {
        calls++;
        chunkSizes.add(chunk.size());
        if (calls > failAfter || failingCalls.contains(calls)) {
            throw new DataAccessResourceFailureException("simulated failure on call " + calls);
        }
        Map<NaturalKey, Map<String, Object>> table = tables.computeIfAbsent(type, t -> new LinkedHashMap<>());
        int inserted = 0;
        int updated = 0;
        for (NormalizedRecord record : chunk) {
            if (table.put(record.naturalKey(), new HashMap<>(record.columnValues())) == null) {
                inserted++;
            } else {
                updated++;
            }
        }
        return new ChunkCounts(inserted, updated);
    }

    public synchronized Map<NaturalKey, Map<String, Object>> rows(SourceType type) {
        return new LinkedHashMap<>(tables.getOrDefault(type, Map.of()));
    }

    public synchronized int rowCount(SourceType type) {
        return tables.getOrDefault(type, Map.of()).size();
    }

    public synchronized int getCalls() {
        return calls;
    }

    public synchronized List<Integer> getChunkSizes() {
        return new ArrayList<>(chunkSizes);
    }
}
