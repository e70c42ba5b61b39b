/* (C)2026 */
package com.ammann.calibration.exception;

/**
 * Base unchecked exception for all application-level errors of the calibration engine.
 *
 * <p>Subclasses separate fatal calibration errors ({@link CalibrationException}) from
 * per-call input rejections ({@link ValidationException}). All of them are mapped to
 * structured responses by {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }
}
