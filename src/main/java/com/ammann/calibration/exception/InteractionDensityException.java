/* (C)2026 */
package com.ammann.calibration.exception;

/**
 * The interaction share of a fusion weight set exceeds the configured cap.
 */
public class InteractionDensityException extends CalibrationException {

    public InteractionDensityException(String role, double interactionShare, double cap) {
        super(String.format(
                "Interaction weights for role %s total %.6f, above the allowed share %.6f",
                role, interactionShare, cap));
    }
}
