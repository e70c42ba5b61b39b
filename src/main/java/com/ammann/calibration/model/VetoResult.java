/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.exception.ValidationException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one layer's veto gate for an evaluated unit.
 *
 * @param layerId layer that produced the result
 * @param triggered whether the gate fired
 * @param specificityScore how specific the gate is to this unit, in {@code [0, 1]}
 * @param reason human-readable reason, required when {@code triggered}
 */
public record VetoResult(LayerId layerId, boolean triggered, double specificityScore, String reason)
        implements CanonicalForm {

    /**
     * Specificity descending, then layer priority ascending. Results still tied after that
     * put triggered before passed and then order by reason, so the order is total.
     */
    public static final Comparator<VetoResult> CASCADE_ORDER =
            Comparator.comparingDouble(VetoResult::specificityScore)
                    .reversed()
                    .thenComparingInt(v -> v.layerId().priority())
                    .thenComparing(VetoResult::triggered, Comparator.reverseOrder())
                    .thenComparing(VetoResult::reason);

    public VetoResult {
        if (layerId == null) {
            throw ValidationException.missingField("veto.layer_id");
        }
        if (!Double.isFinite(specificityScore) || specificityScore < 0.0 || specificityScore > 1.0) {
            throw ValidationException.outOfRange("veto.specificity_score", specificityScore, 0.0, 1.0);
        }
        if (triggered && (reason == null || reason.isBlank())) {
            throw ValidationException.missingField("veto.reason");
        }
        reason = reason == null ? "" : reason;
    }

    public static VetoResult triggered(LayerId layerId, double specificityScore, String reason) {
        return new VetoResult(layerId, true, specificityScore, reason);
    }

    public static VetoResult passed(LayerId layerId, double specificityScore) {
        return new VetoResult(layerId, false, specificityScore, "");
    }

    @Override
    public Map<String, Object> canonicalForm() {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("layer_id", layerId.symbol());
        form.put("triggered", triggered);
        form.put("specificity_score", specificityScore);
        form.put("reason", reason);
        return form;
    }
}
