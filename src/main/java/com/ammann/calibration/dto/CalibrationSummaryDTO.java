/* (C)2026 */
package com.ammann.calibration.dto;

import com.ammann.calibration.model.CalibrationContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Overview of the loaded calibration.
 *
 * @param fingerprint SHA-256 of the canonical calibration state
 * @param topologicalOrder dependency graph nodes in evaluation order
 */
@Schema(description = "Loaded calibration cohort, weights and governance state")
public record CalibrationSummaryDTO(
        @JsonProperty("cohort") String cohort,
        @JsonProperty("version") String version,
        @JsonProperty("fingerprint") String fingerprint,
        @JsonProperty("weight_sets") List<WeightSetDTO> weightSets,
        @JsonProperty("layers") List<String> layers,
        @JsonProperty("topological_order") List<String> topologicalOrder,
        @JsonProperty("product_min") double productMin,
        @JsonProperty("product_max") double productMax) {

    public static CalibrationSummaryDTO from(CalibrationContext context) {
        return new CalibrationSummaryDTO(
                context.cohort(),
                context.version(),
                context.fingerprint(),
                context.weightSets().values().stream().map(WeightSetDTO::from).toList(),
                List.copyOf(context.currentLayers().keySet()),
                context.topologicalOrder(),
                context.multiplicativeBounds().min(),
                context.multiplicativeBounds().max());
    }
}
