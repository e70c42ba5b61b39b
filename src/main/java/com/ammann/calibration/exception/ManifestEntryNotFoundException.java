/* (C)2026 */
package com.ammann.calibration.exception;

/**
 * Raised when an auditor asks for a manifest sequence number that was never recorded.
 *
 * <p>Mapped to HTTP 404 by {@link GlobalExceptionHandler}.
 */
public class ManifestEntryNotFoundException extends ApiException {

    public ManifestEntryNotFoundException(long sequence, int size) {
        super(String.format(
                "Manifest entry %d not found: the trail holds sequences 0 to %d", sequence, size - 1));
    }
}
