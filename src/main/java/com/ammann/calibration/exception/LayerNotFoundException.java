/* (C)2026 */
package com.ammann.calibration.exception;

/**
 * Raised when a calibration layer or one of its versions does not exist.
 *
 * <p>Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 */
public class LayerNotFoundException extends ApiException {

    public LayerNotFoundException(String layerId) {
        super(String.format("Calibration layer '%s' not found", layerId));
    }

    public LayerNotFoundException(String layerId, String version) {
        super(String.format("Calibration layer '%s' has no version '%s'", layerId, version));
    }
}
