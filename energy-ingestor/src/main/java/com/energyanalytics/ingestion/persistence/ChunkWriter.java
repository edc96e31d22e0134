package com.energyanalytics.ingestion.persistence;

import com.energyanalytics.ingestion.model.NormalizedRecord;
import com.energyanalytics.ingestion.model.SourceType;

import java.util.List;

/**
 * Writes one chunk of records atomically: either every row is committed or none is.
 */
public interface ChunkWriter {

    /**
     * @param chunk records of {@code type} with unique natural keys
     * @return how many rows were new and how many replaced an existing row
     * @throws org.springframework.dao.DataAccessException when the chunk was rolled back
     */
    ChunkCounts upsertChunk(SourceType type, List<NormalizedRecord> chunk);

    record ChunkCounts(int inserted, int updated) {
    }
}
