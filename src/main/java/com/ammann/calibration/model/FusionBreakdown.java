/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.enumeration.LayerId;
import java.util.Map;

/**
 * Per-term contributions of one Choquet evaluation. The contributions sum to
 * {@link #total()}.
 *
 * @param linearContributions {@code weight * score} per layer
 * @param interactionContributions {@code weight * min(pair)} per interaction pair
 * @param total the fused score
 */
public record FusionBreakdown(
        Map<LayerId, Double> linearContributions,
        Map<LayerPair, Double> interactionContributions,
        double total) {

    public FusionBreakdown {
        linearContributions = Map.copyOf(linearContributions);
        interactionContributions = Map.copyOf(interactionContributions);
    }

    public double linearTotal() {
        return linearContributions.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public double interactionTotal() {
        return interactionContributions.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
