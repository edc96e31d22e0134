package com.energyanalytics.ingestion.orchestration;

/**
 * Where an orchestrator is in its current (or last) run.
 */
public enum RunState {
    IDLE,
    RUNNING,
    SUCCEEDED,
    PARTIALLY_SUCCEEDED,
    FAILED
}
