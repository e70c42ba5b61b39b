/* (C)2026 */
package com.ammann.calibration.exception;

/**
 * Fatal construction-time error: the calibration itself is malformed.
 *
 * <p>These errors are never recovered. Raised while the calibration is loaded, they
 * abort startup before any evaluation is served. Subclasses name the exact offending item.
 */
public class CalibrationException extends ApiException {

    public CalibrationException(String message) {
        super(message);
    }

    public CalibrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
