/* (C)2026 */
package com.ammann.calibration.enumeration;

/**
 * Severity of parameter drift between two versions of a calibration layer.
 *
 * <p>Each level defines the minimum drift ratio it covers. A ratio is classified into
 * the highest level whose threshold it meets; any non-zero ratio is at least MINOR.
 */
public enum DriftSeverity {
    NONE(0.0),
    /** Drift below 10%. */
    MINOR(0.0),
    /** Drift from 10% to 30%. */
    MODERATE(0.10),
    /** Drift from 30% to 50%. */
    SIGNIFICANT(0.30),
    /** Drift of 50% or more; requires immediate review. */
    CRITICAL(0.50);

    private final double threshold;

    DriftSeverity(double threshold) {
        this.threshold = threshold;
    }

    /**
     * Returns the severity corresponding to a drift ratio.
     *
     * @param driftRatio non-negative relative change
     * @return the classified severity
     */
    public static DriftSeverity fromRatio(double driftRatio) {
        if (driftRatio >= CRITICAL.threshold) return CRITICAL;
        if (driftRatio >= SIGNIFICANT.threshold) return SIGNIFICANT;
        if (driftRatio >= MODERATE.threshold) return MODERATE;
        if (driftRatio > 0.0) return MINOR;
        return NONE;
    }

    /** Whether this severity is SIGNIFICANT or worse. */
    public boolean isSignificant() {
        return this == SIGNIFICANT || this == CRITICAL;
    }

    public double getThreshold() { return threshold; }
}
