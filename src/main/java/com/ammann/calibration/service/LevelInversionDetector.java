/* (C)2026 */
package com.ammann.calibration.service;

import com.ammann.calibration.enumeration.DependencyKind;
import com.ammann.calibration.enumeration.EpistemicTier;
import com.ammann.calibration.model.DependencyEdge;
import com.ammann.calibration.model.DependencyGraph;
import com.ammann.calibration.model.LevelInversion;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds primary edges that feed a higher-tier value into a lower-tier computation.
 * Veto edges are audit gates and may point downward.
 */
final class LevelInversionDetector {

    List<LevelInversion> detect(DependencyGraph graph) {
        List<LevelInversion> inversions = new ArrayList<>();
        for (DependencyEdge edge : graph.edges()) {
            if (edge.kind() != DependencyKind.PRIMARY) {
                continue;
            }
            EpistemicTier from = graph.tierOf(edge.from());
            EpistemicTier to = graph.tierOf(edge.to());
            if (from.isAbove(to)) {
                inversions.add(new LevelInversion(edge, from, to));
            }
        }
        return inversions;
    }
}
