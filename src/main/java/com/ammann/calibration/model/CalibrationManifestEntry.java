/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.enumeration.DecisionStatus;
import java.time.Instant;
import java.util.Optional;

/**
 * Immutable, hash-chained audit record of one fusion decision.
 *
 * @param sequence zero-based position in the trail
 * @param inputs the decision inputs and outcome
 * @param canonicalInputs canonical JSON of {@code inputs}, kept so auditors can recompute the digest
 * @param inputsHash SHA-256 of {@code canonicalInputs}
 * @param previousHash entry hash of the predecessor, or the genesis hash
 * @param entryHash SHA-256 of {@code previousHash|inputsHash|sequence}
 * @param signature HMAC-SHA256 over the canonical inputs and hashes, {@code null} when unsigned
 */
public record CalibrationManifestEntry(
        long sequence,
        ManifestInputs inputs,
        String canonicalInputs,
        String inputsHash,
        String previousHash,
        String entryHash,
        Instant timestamp,
        String signature) {

    public String unitId() {
        return inputs.unitId();
    }

    public String weightSetId() {
        return inputs.weightSetId();
    }

    public Double score() {
        return inputs.score();
    }

    public Optional<VetoResult> veto() {
        return Optional.ofNullable(inputs.veto());
    }

    public DecisionStatus status() {
        return inputs.status();
    }

    public boolean isSigned() {
        return signature != null;
    }
}
