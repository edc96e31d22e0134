package com.energyanalytics.ingestion.model;

import java.time.Instant;

/**
 * (timestamp, entity) pair that identifies a row for upsert conflict resolution.
 */
public record NaturalKey(Instant timestamp, String entityKey) {
}
