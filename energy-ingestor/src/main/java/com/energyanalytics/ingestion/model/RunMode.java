package com.energyanalytics.ingestion.model;

/**
 * INCREMENTAL runs cover the most recent window and are held to the freshness check.
 * BACKFILL runs replay historical windows, where freshness is meaningless.
 */
public enum RunMode {
    INCREMENTAL,
    BACKFILL
}
