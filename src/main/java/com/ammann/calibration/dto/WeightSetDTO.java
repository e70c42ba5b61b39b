/* (C)2026 */
package com.ammann.calibration.dto;

import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.model.FusionWeightSet;
import com.ammann.calibration.model.InteractionTerm;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Normalized fusion weights of one role")
public record WeightSetDTO(
        @JsonProperty("id") String id,
        @JsonProperty("role") String role,
        @JsonProperty("linear") Map<String, Double> linear,
        @Schema(description = "Interaction weights keyed by layer pair, e.g. @chain,@u")
                @JsonProperty("interactions")
                Map<String, Double> interactions,
        @JsonProperty("interaction_share") double interactionShare) {

    public static WeightSetDTO from(FusionWeightSet weights) {
        Map<String, Double> linear = new LinkedHashMap<>();
        for (LayerId layer : LayerId.values()) {
            linear.put(layer.symbol(), weights.linearWeight(layer));
        }
        Map<String, Double> interactions = new LinkedHashMap<>();
        for (InteractionTerm term : weights.interactions()) {
            interactions.put(term.pair().key(), term.weight());
        }
        return new WeightSetDTO(
                weights.id(), weights.role().name(), linear, interactions, weights.interactionSum());
    }
}
