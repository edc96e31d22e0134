package com.energyanalytics.ingestion.model;

/**
 * Outcome of a chunked upsert.
 *
 * @param inserted     rows that did not exist before
 * @param updated      rows whose natural key already existed and were overwritten
 * @param failed       records that were not committed (failed chunk plus everything after it)
 * @param failedChunk  1-based index of the chunk that gave up, null when nothing failed
 * @param cancelled    the write stopped because the run was cancelled
 * @param errorMessage cause of the failure, null on full success
 */
public record WriteResult(int inserted,
                          int updated,
                          int failed,
                          Integer failedChunk,
                          boolean cancelled,
                          String errorMessage) {

    public static WriteResult empty() {
        return new WriteResult(0, 0, 0, null, false, null);
    }

    public int committed() {
        return inserted + updated;
    }

    public boolean isComplete() {
        return failed == 0 && !cancelled;
    }
}
