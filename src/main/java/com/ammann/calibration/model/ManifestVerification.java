/* (C)2026 */
package com.ammann.calibration.model;

import java.util.List;

/**
 * Result of re-checking one manifest entry.
 *
 * @param hashValid the inputs hash matches the retained canonical inputs
 * @param chainValid the predecessor link and entry hash recompute correctly
 * @param signatureValid {@code null} when the entry is unsigned or no key is configured
 * @param problems human-readable findings, empty when the entry is intact
 */
public record ManifestVerification(
        long sequence, boolean hashValid, boolean chainValid, Boolean signatureValid, List<String> problems) {

    public ManifestVerification {
        problems = List.copyOf(problems);
    }

    public boolean valid() {
        return hashValid && chainValid && !Boolean.FALSE.equals(signatureValid);
    }
}
