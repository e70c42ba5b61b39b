/* (C)2026 */
package com.ammann.calibration.exception;

/**
 * A bounded parameter was constructed with a value outside its closed interval.
 * Values are never clamped into range.
 */
public class OutOfBoundsException extends CalibrationException {

    private final String parameterName;

    public OutOfBoundsException(String parameterName, double value, double lower, double upper) {
        super(String.format(
                "Parameter '%s' = %s is outside its bounds [%s, %s]",
                parameterName, value, lower, upper));
        this.parameterName = parameterName;
    }

    public OutOfBoundsException(String message) {
        super(message);
        this.parameterName = null;
    }

    public String getParameterName() {
        return parameterName;
    }
}
