/* (C)2026 */
package com.ammann.calibration.dto;

import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.model.FusionBreakdown;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Per-term contributions of a fused score")
public record FusionBreakdownDTO(
        @Schema(description = "weight * score per layer symbol") @JsonProperty("linear") Map<String, Double> linear,
        @Schema(description = "weight * min(pair) per interaction pair")
                @JsonProperty("interactions")
                Map<String, Double> interactions) {

    public static FusionBreakdownDTO from(FusionBreakdown breakdown) {
        if (breakdown == null) {
            return null;
        }
        Map<String, Double> linear = new LinkedHashMap<>();
        for (LayerId layer : LayerId.values()) {
            linear.put(layer.symbol(), breakdown.linearContributions().get(layer));
        }
        Map<String, Double> interactions = new LinkedHashMap<>();
        breakdown.interactionContributions().entrySet().stream()
                .sorted(Comparator.comparing(e -> e.getKey().key()))
                .forEach(e -> interactions.put(e.getKey().key(), e.getValue()));
        return new FusionBreakdownDTO(linear, interactions);
    }
}
