/* (C)2026 */
package com.ammann.calibration.model;

/**
 * Result of walking the whole manifest trail.
 *
 * @param firstInvalidSequence first entry that failed verification, or {@code null}
 */
public record ChainVerification(
        int entriesChecked, boolean valid, Long firstInvalidSequence, String headHash, String message) {}
