/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.enumeration.DecisionStatus;
import com.ammann.calibration.enumeration.FusionRole;
import java.util.Optional;

/**
 * Outcome of evaluating one unit: either a fused score with its breakdown, or the veto
 * that replaced fusion. Always carries the manifest entry that recorded it.
 */
public record FusionDecision(
        String unitId,
        FusionRole role,
        Double score,
        VetoResult veto,
        FusionBreakdown breakdown,
        CalibrationManifestEntry manifestEntry) {

    public DecisionStatus status() {
        return veto == null ? DecisionStatus.FUSED : DecisionStatus.VETOED;
    }

    public Optional<VetoResult> optionalVeto() {
        return Optional.ofNullable(veto);
    }

    public boolean isVetoed() {
        return veto != null;
    }
}
