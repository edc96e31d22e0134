package com.energyanalytics.ingestion.model;

import java.util.List;

/**
 * Result of validating one batch. Consumed by the orchestrator immediately, never persisted.
 *
 * @param acceptedRecords records that passed, with their quality score attached
 * @param totalCount      size of the batch handed to the validator
 * @param rejectedCount   records dropped by a hard check (or the whole batch when stale in strict mode)
 * @param duplicateCount  earlier occurrences of a repeated natural key, dropped in favour of the last one
 * @param warnings        human readable issues, in the order they were found
 * @param acceptable      whether the orchestrator may proceed to write
 */
public record ValidationOutcome(List<NormalizedRecord> acceptedRecords,
                                int totalCount,
                                int rejectedCount,
                                int duplicateCount,
                                List<String> warnings,
                                boolean acceptable) {

    public ValidationOutcome {
        acceptedRecords = List.copyOf(acceptedRecords);
        warnings = List.copyOf(warnings);
    }

    public int acceptedCount() {
        return acceptedRecords.size();
    }

    public double rejectionRatio() {
        return totalCount == 0 ? 0.0 : (double) rejectedCount / totalCount;
    }

    public String summary() {
        StringBuilder sb = new StringBuilder()
                .append(rejectedCount).append('/').append(totalCount).append(" records rejected");
        if (!warnings.isEmpty()) {
            sb.append(": ").append(String.join("; ", warnings));
        }
        return sb.toString();
    }
}
