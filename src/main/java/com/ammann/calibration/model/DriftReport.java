/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.enumeration.DriftSeverity;
import java.util.List;

/**
 * Parameter drift between two versions of one calibration layer.
 *
 * @param drifts parameters present in both versions whose value changed
 * @param addedParameters names present only in the newer version
 * @param removedParameters names present only in the older version
 * @param overallSeverity highest severity among {@code drifts}
 * @param dispersed whether at least 40% of the changed parameters drifted significantly
 */
public record DriftReport(
        String layerId,
        String fromVersion,
        String toVersion,
        List<ParameterDrift> drifts,
        List<String> addedParameters,
        List<String> removedParameters,
        DriftSeverity overallSeverity,
        boolean dispersed,
        List<String> recommendations) {

    public DriftReport {
        drifts = List.copyOf(drifts);
        addedParameters = List.copyOf(addedParameters);
        removedParameters = List.copyOf(removedParameters);
        recommendations = List.copyOf(recommendations);
    }

    public boolean hasDrift() {
        return overallSeverity != DriftSeverity.NONE
                || !addedParameters.isEmpty()
                || !removedParameters.isEmpty();
    }
}
