/* (C)2026 */
package com.ammann.calibration.service;

import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.model.FusionBreakdown;
import com.ammann.calibration.model.FusionWeightSet;
import com.ammann.calibration.model.InteractionTerm;
import com.ammann.calibration.model.LayerPair;
import com.ammann.calibration.model.LayerScoreVector;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 2-additive Choquet integral over the eight layer scores.
 *
 * <pre>
 *   result = sum(linear[l] * score[l]) + sum(interaction[(l, k)] * min(score[l], score[k]))
 * </pre>
 *
 * <p>Both inputs are validated at construction, so evaluation has no failure path. With
 * normalized non-negative weights the result lies in {@code [0, 1]} and is monotone in
 * every layer. A zero on either side of an interaction pair removes that pair's
 * contribution entirely.
 *
 * <p>Stateless and safe for concurrent use. Results are never rounded or clamped.
 */
@ApplicationScoped
public class ChoquetFusionEvaluator {

    /**
     * Fuses a score vector with the weight set of its role.
     *
     * @param scores validated layer scores
     * @param weights normalized weight set
     * @return fused score in {@code [0, 1]}
     */
    public double evaluate(LayerScoreVector scores, FusionWeightSet weights) {
        double result = 0.0;
        for (LayerId layer : LayerId.values()) {
            result += weights.linearWeight(layer) * scores.get(layer);
        }
        for (InteractionTerm term : weights.interactions()) {
            result += term.weight() * pairMinimum(scores, term.pair());
        }
        return result;
    }

    /**
     * Same computation as {@link #evaluate}, itemized per term.
     */
    public FusionBreakdown explain(LayerScoreVector scores, FusionWeightSet weights) {
        Map<LayerId, Double> linear = new EnumMap<>(LayerId.class);
        Map<LayerPair, Double> interactions = new LinkedHashMap<>();
        double total = 0.0;
        for (LayerId layer : LayerId.values()) {
            double contribution = weights.linearWeight(layer) * scores.get(layer);
            linear.put(layer, contribution);
            total += contribution;
        }
        for (InteractionTerm term : weights.interactions()) {
            double contribution = term.weight() * pairMinimum(scores, term.pair());
            interactions.put(term.pair(), contribution);
            total += contribution;
        }
        return new FusionBreakdown(linear, interactions, total);
    }

    private static double pairMinimum(LayerScoreVector scores, LayerPair pair) {
        return Math.min(scores.get(pair.first()), scores.get(pair.second()));
    }
}
