package com.energyanalytics.ingestion.validation;

import com.energyanalytics.ingestion.config.EnergyIngestionProperties;
import com.energyanalytics.ingestion.config.EnergyIngestionProperties.Validation.QualityWeights;
import com.energyanalytics.ingestion.model.RunMode;

/**
 * How strictly one run's batch is judged.
 *
 * @param strict             reject the batch on any rejected record or stale data
 * @param rejectionTolerance highest accepted rejected/total ratio, 0 when strict
 * @param checkFreshness     false for backfills of historical windows
 * @param weights            weights of the four quality ratios in the record score
 * @param rules              source-specific checks
 */
public record ValidationPolicy(boolean strict,
                               double rejectionTolerance,
                               boolean checkFreshness,
                               QualityWeights weights,
                               ValidationRules rules) {

    public static ValidationPolicy of(EnergyIngestionProperties.Validation config, ValidationRules rules, RunMode mode) {
        return new ValidationPolicy(
                config.isStrict(),
                config.isStrict() ? 0.0 : config.getRejectionTolerance(),
                mode == RunMode.INCREMENTAL,
                config.getWeights(),
                rules);
    }
}
