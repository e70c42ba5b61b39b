/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import java.util.List;
import java.util.Map;

/**
 * Pairwise interaction weight of a 2-additive capacity.
 *
 * @param pair the two interacting layers
 * @param weight non-negative weight applied to {@code min(score(first), score(second))}
 */
public record InteractionTerm(LayerPair pair, double weight) implements CanonicalForm {

    @Override
    public Map<String, Object> canonicalForm() {
        return Map.of(
                "layers", List.of(pair.first().symbol(), pair.second().symbol()),
                "weight", weight);
    }
}
