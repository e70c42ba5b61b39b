/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import com.ammann.calibration.enumeration.DecisionStatus;
import com.ammann.calibration.enumeration.FusionRole;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything that determines one fusion decision: the unit, its inputs, the calibration
 * state it was evaluated against and the outcome. This is the value that is
 * canonicalized and hashed into a manifest entry. The timestamp is not
 * part of it.
 *
 * @param score fused score, {@code null} when vetoed
 * @param veto the veto that short-circuited fusion, {@code null} when fused
 */
public record ManifestInputs(
        String unitId,
        FusionRole role,
        String weightSetId,
        LayerScoreVector scores,
        List<VetoResult> vetoes,
        String calibrationFingerprint,
        Double score,
        VetoResult veto) implements CanonicalForm {

    public ManifestInputs {
        vetoes = vetoes == null ? List.of() : List.copyOf(vetoes);
    }

    public DecisionStatus status() {
        return veto == null ? DecisionStatus.FUSED : DecisionStatus.VETOED;
    }

    @Override
    public Map<String, Object> canonicalForm() {
        Map<String, Object> decision = new LinkedHashMap<>();
        decision.put("status", status());
        decision.put("score", score);
        decision.put("veto", veto);

        Map<String, Object> form = new LinkedHashMap<>();
        form.put("unit_id", unitId);
        form.put("role", role);
        form.put("weight_set_id", weightSetId);
        form.put("scores", scores);
        List<VetoResult> ordered = new ArrayList<>(vetoes);
        ordered.sort(VetoResult.CASCADE_ORDER);
        form.put("vetoes", ordered);
        form.put("calibration_fingerprint", calibrationFingerprint);
        form.put("decision", decision);
        return form;
    }
}
