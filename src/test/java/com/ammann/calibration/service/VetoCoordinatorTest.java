/* (C)2026 */
package com.ammann.calibration.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.model.VetoResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class VetoCoordinatorTest {

    private final VetoCoordinator coordinator = new VetoCoordinator();

    @Test
    void noResultsMeansNoVeto() {
        assertThat(coordinator.executeVetoCascade(List.of())).isEmpty();
        assertThat(coordinator.executeVetoCascade(null)).isEmpty();
    }

    @Test
    void untriggeredResultsNeverVeto() {
        List<VetoResult> results = List.of(
                VetoResult.passed(LayerId.CONGRUENCE, 0.99), VetoResult.passed(LayerId.META, 0.5));

        assertThat(coordinator.executeVetoCascade(results)).isEmpty();
    }

    @Test
    void mostSpecificTriggeredResultWins() {
        VetoResult broad = VetoResult.triggered(LayerId.META, 0.4, "governance metadata incomplete");
        VetoResult specific = VetoResult.triggered(LayerId.CONGRUENCE, 0.9, "contradicts contract clause 4");
        VetoResult passedButSpecific = VetoResult.passed(LayerId.BASE, 1.0);

        assertThat(coordinator.executeVetoCascade(List.of(broad, passedButSpecific, specific)))
                .contains(specific);
    }

    @Test
    void equalSpecificityFallsBackToLayerPriority() {
        VetoResult policy = VetoResult.triggered(LayerId.POLICY, 0.7, "policy area mismatch");
        VetoResult chain = VetoResult.triggered(LayerId.CHAIN, 0.7, "missing upstream input");

        assertThat(coordinator.executeVetoCascade(List.of(policy, chain))).contains(chain);
        assertThat(coordinator.executeVetoCascade(List.of(chain, policy))).contains(chain);
    }

    @Test
    void cascadeIsIndependentOfInputOrder() {
        List<VetoResult> results = new ArrayList<>(List.of(
                VetoResult.triggered(LayerId.UNIT, 0.5, "unit too short"),
                VetoResult.triggered(LayerId.QUESTION, 0.8, "question unanswerable"),
                VetoResult.passed(LayerId.DIMENSION, 0.95),
                VetoResult.triggered(LayerId.BASE, 0.8, "method deprecated"),
                VetoResult.passed(LayerId.META, 0.1)));
        VetoResult expected = coordinator.executeVetoCascade(results).orElseThrow();

        Random random = new Random(7);
        for (int i = 0; i < 50; i++) {
            Collections.shuffle(results, random);
            assertThat(coordinator.executeVetoCascade(results)).contains(expected);
        }
        assertThat(expected.layerId()).isEqualTo(LayerId.BASE);
    }

    @Test
    void sameLayerWithEqualSpecificityIsResolvedByReason() {
        VetoResult first = VetoResult.triggered(LayerId.CHAIN, 0.7, "a");
        VetoResult second = VetoResult.triggered(LayerId.CHAIN, 0.7, "b");

        assertThat(coordinator.executeVetoCascade(List.of(first, second))).contains(first);
        assertThat(coordinator.executeVetoCascade(List.of(second, first))).contains(first);
    }

    @Test
    void triggeredResultOutranksPassedResultOfSameLayer() {
        VetoResult passed = VetoResult.passed(LayerId.CHAIN, 0.7);
        VetoResult triggered = VetoResult.triggered(LayerId.CHAIN, 0.7, "broken chain");

        assertThat(coordinator.order(List.of(passed, triggered))).containsExactly(triggered, passed);
        assertThat(coordinator.order(List.of(triggered, passed))).containsExactly(triggered, passed);
    }

    @Test
    void reSortingSortedSequenceSelectsSameVeto() {
        List<VetoResult> results = List.of(
                VetoResult.triggered(LayerId.META, 0.3, "stale"),
                VetoResult.triggered(LayerId.CONGRUENCE, 0.6, "contradiction"),
                VetoResult.passed(LayerId.BASE, 0.9));

        List<VetoResult> sorted = coordinator.order(results);

        assertThat(coordinator.order(sorted)).isEqualTo(sorted);
        assertThat(coordinator.executeVetoCascade(sorted)).isEqualTo(coordinator.executeVetoCascade(results));
    }
}
