/* (C)2026 */
package com.ammann.calibration.exception;

/**
 * A calibration layer lacks a rationale or evidence, or cites evidence outside the
 * accepted source namespaces.
 */
public class IncompleteProvenanceException extends CalibrationException {

    private final String layerId;

    public IncompleteProvenanceException(String layerId, String message) {
        super(String.format("Layer '%s' has incomplete provenance: %s", layerId, message));
        this.layerId = layerId;
    }

    public IncompleteProvenanceException(String message) {
        super(message);
        this.layerId = null;
    }

    public String getLayerId() {
        return layerId;
    }
}
