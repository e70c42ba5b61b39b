/* (C)2026 */
package com.ammann.calibration.exception;

/**
 * Generic internal error for unexpected failures (I/O, serialization) that do not fit
 * a more specific exception category.
 *
 * <p>Mapped to HTTP 500 (Internal Server Error) by {@link GlobalExceptionHandler}.
 */
public class SomeThingWentWrongException extends ApiException
{
    public SomeThingWentWrongException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
