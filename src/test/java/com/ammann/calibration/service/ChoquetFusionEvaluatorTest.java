/* (C)2026 */
package com.ammann.calibration.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ammann.calibration.CalibrationFixtures;
import com.ammann.calibration.enumeration.FusionRole;
import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.model.FusionBreakdown;
import com.ammann.calibration.model.FusionWeightSet;
import com.ammann.calibration.model.LayerPair;
import com.ammann.calibration.model.LayerScoreVector;
import java.util.Map;
import java.util.Random;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Unit tests for {@link ChoquetFusionEvaluator}.
 *
 * <p>Covers the reference EXECUTOR scenarios, boundedness over random inputs,
 * monotonicity in every layer and the weakest-link behaviour of interaction terms.
 */
class ChoquetFusionEvaluatorTest {

    private final ChoquetFusionEvaluator evaluator = new ChoquetFusionEvaluator();
    private final FusionWeightSet weights = CalibrationFixtures.executorWeights();

    static Stream<Arguments> referenceScenarios() {
        LayerScoreVector reference = CalibrationFixtures.referenceScores();
        return Stream.of(
                Arguments.of("reference unit", reference, 0.8869),
                Arguments.of("weak unit layer", reference.with(LayerId.UNIT, 0.40), 0.8257),
                Arguments.of("chain collapsed", reference.with(LayerId.CHAIN, 0.0), 0.5641));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("referenceScenarios")
    @DisplayName("EXECUTOR reference scenarios")
    void evaluatesReferenceScenarios(String name, LayerScoreVector scores, double expected) {
        assertThat(evaluator.evaluate(scores, weights)).isCloseTo(expected, within(1e-9));
    }

    @Test
    void weakUnitLayerPenalizesThroughUnitChainInteraction() {
        LayerScoreVector reference = CalibrationFixtures.referenceScores();
        double drop = evaluator.evaluate(reference, weights)
                - evaluator.evaluate(reference.with(LayerId.UNIT, 0.40), weights);

        // linear 0.04 * 0.36 plus interaction 0.13 * 0.36
        assertThat(drop).isCloseTo(0.17 * 0.36, within(1e-9));
    }

    @Test
    void zeroChainRemovesEveryInteractionTouchingChain() {
        FusionBreakdown breakdown =
                evaluator.explain(CalibrationFixtures.referenceScores().with(LayerId.CHAIN, 0.0), weights);

        assertThat(breakdown.interactionContributions().get(LayerPair.of(LayerId.UNIT, LayerId.CHAIN)))
                .isZero();
        assertThat(breakdown.interactionContributions().get(LayerPair.of(LayerId.CHAIN, LayerId.CONGRUENCE)))
                .isZero();
        assertThat(breakdown.interactionContributions().get(LayerPair.of(LayerId.QUESTION, LayerId.DIMENSION)))
                .isCloseTo(0.10 * 0.91, within(1e-12));
    }

    @Test
    void allOnesAndAllZerosHitTheBounds() {
        assertThat(evaluator.evaluate(CalibrationFixtures.uniform(1.0), weights)).isCloseTo(1.0, within(1e-9));
        assertThat(evaluator.evaluate(CalibrationFixtures.uniform(0.0), weights)).isZero();
    }

    @ParameterizedTest
    @ValueSource(doubles = {9e-7, 3e-7, -9e-7})
    void allOnesNeverExceedsOneAtToleranceEdge(double offset) {
        Map<LayerId, Double> linear = CalibrationFixtures.executorLinearWeights();
        linear.put(LayerId.BASE, linear.get(LayerId.BASE) + offset);
        FusionWeightSet edge = new FusionWeightSet(
                "EDGE", FusionRole.EXECUTOR, linear, CalibrationFixtures.executorInteractions());

        double result = evaluator.evaluate(CalibrationFixtures.uniform(1.0), edge);

        assertThat(result).isLessThanOrEqualTo(1.0).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void explainSumsToEvaluate() {
        LayerScoreVector scores = CalibrationFixtures.referenceScores();
        FusionBreakdown breakdown = evaluator.explain(scores, weights);

        assertThat(breakdown.total()).isEqualTo(evaluator.evaluate(scores, weights));
        assertThat(breakdown.linearTotal() + breakdown.interactionTotal())
                .isCloseTo(breakdown.total(), within(1e-12));
        assertThat(breakdown.linearContributions()).hasSize(8);
        assertThat(breakdown.interactionContributions()).hasSize(3);
    }

    @Test
    void resultStaysInUnitIntervalForRandomInputs() {
        Random random = new Random(42);
        for (int i = 0; i < 5_000; i++) {
            LayerScoreVector scores = randomScores(random);

            assertThat(evaluator.evaluate(scores, weights)).isBetween(0.0, 1.0);
        }
    }

    @ParameterizedTest
    @EnumSource(LayerId.class)
    void increasingOneLayerNeverDecreasesResult(LayerId layer) {
        Random random = new Random(layer.ordinal());
        for (int i = 0; i < 1_000; i++) {
            LayerScoreVector scores = randomScores(random);
            double current = scores.get(layer);
            double raised = current + random.nextDouble() * (1.0 - current);

            assertThat(evaluator.evaluate(scores.with(layer, raised), weights))
                    .isGreaterThanOrEqualTo(evaluator.evaluate(scores, weights));
        }
    }

    @Test
    void evaluationIsDeterministic() {
        LayerScoreVector scores = CalibrationFixtures.referenceScores();

        assertThat(evaluator.evaluate(scores, weights)).isEqualTo(evaluator.evaluate(scores, weights));
    }

    private static LayerScoreVector randomScores(Random random) {
        return new LayerScoreVector(
                random.nextDouble(), random.nextDouble(), random.nextDouble(), random.nextDouble(),
                random.nextDouble(), random.nextDouble(), random.nextDouble(), random.nextDouble());
    }
}
