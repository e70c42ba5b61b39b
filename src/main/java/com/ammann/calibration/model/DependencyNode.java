/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import com.ammann.calibration.enumeration.EpistemicTier;
import com.ammann.calibration.exception.CalibrationException;
import java.util.Map;
import java.util.Objects;

/**
 * Calibration component in the dependency graph, tagged with its epistemic tier.
 */
public record DependencyNode(String id, EpistemicTier tier) implements CanonicalForm {

    public DependencyNode {
        if (id == null || id.isBlank()) {
            throw new CalibrationException("Dependency node requires a non-blank id");
        }
        Objects.requireNonNull(tier, "tier");
    }

    @Override
    public Map<String, Object> canonicalForm() {
        return Map.of("id", id, "tier", tier);
    }
}
