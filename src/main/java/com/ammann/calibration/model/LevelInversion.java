/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.enumeration.EpistemicTier;

/**
 * A primary edge whose source sits in a higher tier than its target.
 */
public record LevelInversion(DependencyEdge edge, EpistemicTier fromTier, EpistemicTier toTier) {

    public String describe() {
        return String.format("%s [%s -> %s]", edge.describe(), fromTier, toTier);
    }
}
