/* (C)2026 */
package com.ammann.calibration.exception;

/**
 * A fusion weight set is not a valid normalized capacity: weights are negative,
 * missing, or do not sum to one within tolerance.
 */
public class WeightNormalizationException extends CalibrationException {

    public WeightNormalizationException(String message) {
        super(message);
    }

    /**
     * Creates the exception for a weight set whose total deviates from 1.0.
     */
    public static WeightNormalizationException unnormalized(
            String role, double linearSum, double interactionSum, double tolerance) {
        return new WeightNormalizationException(String.format(
                "Weights for role %s sum to %.9f (linear %.9f + interaction %.9f), expected 1.0 +/- %s",
                role, linearSum + interactionSum, linearSum, interactionSum, tolerance));
    }
}
