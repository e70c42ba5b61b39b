/* (C)2026 */
package com.ammann.calibration.exception;

/**
 * Per-call input rejection. Rejects only the offending call, never the process.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}. Every factory
 * method names the offending field together with what was expected, and the field name
 * is also exposed through {@link #getField()}.
 */
public class ValidationException extends ApiException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /** Name of the rejected input field. */
    public String getField() {
        return field;
    }

    /**
     * Creates validation exception for a required field that was not supplied.
     */
    public static ValidationException missingField(String fieldName) {
        return new ValidationException(
                fieldName, String.format("Missing required field '%s'", fieldName));
    }

    /**
     * Creates validation exception for a field that is not part of the closed input schema.
     */
    public static ValidationException unexpectedField(String fieldName, String expected) {
        return new ValidationException(
                fieldName,
                String.format("Unexpected field '%s': expected only %s", fieldName, expected));
    }

    /**
     * Creates validation exception for a numeric field outside its closed range.
     */
    public static ValidationException outOfRange(
            String fieldName, double value, double lower, double upper) {
        return new ValidationException(
                fieldName,
                String.format(
                        "Field '%s' out of range: got %s, expected a value in [%s, %s]",
                        fieldName, value, lower, upper));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                paramName,
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
