package com.energyanalytics.ingestion.exception;

import com.energyanalytics.ingestion.model.WriteResult;

/**
 * At least one chunk could not be committed after its retries were exhausted,
 * or the write was cancelled part-way. Chunks committed before stay committed.
 */
public class PartialWriteException extends IngestionException {

    private final transient WriteResult result;

    public PartialWriteException(WriteResult result) {
        super(describe(result));
        this.result = result;
    }

    public WriteResult getResult() {
        return result;
    }

    private static String describe(WriteResult result) {
        if (result.cancelled()) {
            return String.format("Write cancelled: %d records committed, %d not written",
                    result.committed(), result.failed());
        }
        return String.format("Chunk %d failed after retries: %d records committed, %d not written (%s)",
                result.failedChunk(), result.committed(), result.failed(), result.errorMessage());
    }
}
