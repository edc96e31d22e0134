package com.energyanalytics.ingestion.model;

/**
 * Realism tier of generated fallback data. The tier controls the generator's noise
 * amplitude and the quality-score band its records are placed in after validation.
 */
public enum SyntheticQuality {

    BASIC(0.30, 0.50, 0.15),
    STANDARD(0.50, 0.70, 0.08),
    HIGH(0.70, 0.85, 0.04);

    private final double scoreFloor;
    private final double scoreCeiling;
    private final double noiseRatio;

    SyntheticQuality(double scoreFloor, double scoreCeiling, double noiseRatio) {
        this.scoreFloor = scoreFloor;
        this.scoreCeiling = scoreCeiling;
        this.noiseRatio = noiseRatio;
    }

    public double getScoreFloor() {
        return scoreFloor;
    }

    public double getScoreCeiling() {
        return scoreCeiling;
    }

    /** Relative standard deviation of the noise added on top of the model curve. */
    public double getNoiseRatio() {
        return noiseRatio;
    }

    public boolean isCorrelatedNoise() {
        return this == HIGH;
    }

    /** Map a raw 0..1 check score into this tier's band. */
    public double scale(double rawScore) {
        double clamped = Math.max(0.0, Math.min(1.0, rawScore));
        return scoreFloor + (scoreCeiling - scoreFloor) * clamped;
    }
}
