package com.energyanalytics.ingestion.model;

import java.time.Instant;
import java.util.Map;

/**
 * A source record after normalisation, ready for validation and persistence.
 */
public interface NormalizedRecord {

    SourceType getSourceType();

    Instant getTimestamp();

    String getEntityKey();

    /** Numeric measurement columns in table order. Values may be null. */
    Map<String, Double> measurements();

    /** Every persisted column, natural key first, in table order. */
    Map<String, Object> columnValues();

    Double getDataQualityScore();

    void setDataQualityScore(Double dataQualityScore);

    /** Tier of the generator that produced this record, null for real data. */
    SyntheticQuality getSyntheticQuality();

    default NaturalKey naturalKey() {
        return new NaturalKey(getTimestamp(), getEntityKey());
    }

    default boolean isSynthetic() {
        return getSyntheticQuality() != null;
    }
}
