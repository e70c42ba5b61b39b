/* (C)2026 */
package com.ammann.calibration.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.calibration.CalibrationFixtures;
import com.ammann.calibration.enumeration.EpistemicTier;
import com.ammann.calibration.enumeration.FusionRole;
import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.exception.CyclicDependencyException;
import com.ammann.calibration.exception.InteractionDensityException;
import com.ammann.calibration.exception.LevelInversionException;
import com.ammann.calibration.exception.ValidationException;
import com.ammann.calibration.model.ClampResult;
import com.ammann.calibration.model.DependencyEdge;
import com.ammann.calibration.model.DependencyGraph;
import com.ammann.calibration.model.DependencyNode;
import com.ammann.calibration.model.FusionWeightSet;
import com.ammann.calibration.model.InteractionTerm;
import com.ammann.calibration.model.LayerPair;
import com.ammann.calibration.model.LevelInversion;
import com.ammann.calibration.model.MultiplicativeBounds;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InteractionGovernorTest {

    private InteractionGovernor governor;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        governor = new InteractionGovernor();
        governor.meterRegistry = registry;
        governor.initMetrics();
    }

    @Nested
    class GraphValidation {

        @Test
        void rejectsThreeNodeCycleWithClosedPath() {
            DependencyGraph graph = new DependencyGraph(
                    List.of(node("a"), node("b"), node("c")),
                    List.of(DependencyEdge.primary("a", "b"),
                            DependencyEdge.primary("b", "c"),
                            DependencyEdge.primary("c", "a")));

            assertThatThrownBy(() -> governor.validate(graph))
                    .isInstanceOf(CyclicDependencyException.class)
                    .satisfies(e -> assertThat(((CyclicDependencyException) e).getCycle())
                            .containsExactly("a", "b", "c", "a"))
                    .hasMessageContaining("a -> b -> c -> a");
        }

        @Test
        void rejectsSelfLoop() {
            DependencyGraph graph = new DependencyGraph(
                    List.of(node("a"), node("b")),
                    List.of(DependencyEdge.primary("a", "b"), DependencyEdge.primary("b", "b")));

            assertThatThrownBy(() -> governor.validate(graph))
                    .isInstanceOf(CyclicDependencyException.class)
                    .satisfies(e -> assertThat(((CyclicDependencyException) e).getCycle())
                            .containsExactly("b", "b"));
        }

        @Test
        void vetoEdgesAlsoCloseCycles() {
            DependencyGraph graph = new DependencyGraph(
                    List.of(node("a"), node("b")),
                    List.of(DependencyEdge.primary("a", "b"), DependencyEdge.veto("b", "a")));

            assertThatThrownBy(() -> governor.validate(graph)).isInstanceOf(CyclicDependencyException.class);
        }

        @Test
        void rejectsPrimaryEdgeFromAuditIntoEmpirical() {
            DependencyGraph graph = new DependencyGraph(
                    List.of(new DependencyNode("@b", EpistemicTier.EMPIRICAL),
                            new DependencyNode("@C", EpistemicTier.AUDIT),
                            new DependencyNode("@q", EpistemicTier.INFERENTIAL)),
                    List.of(DependencyEdge.primary("@C", "@b"), DependencyEdge.primary("@b", "@q")));

            assertThatThrownBy(() -> governor.validate(graph))
                    .isInstanceOf(LevelInversionException.class)
                    .hasMessageContaining("@C -> @b")
                    .satisfies(e -> {
                        List<LevelInversion> inversions = ((LevelInversionException) e).getInversions();
                        assertThat(inversions).hasSize(1);
                        assertThat(inversions.get(0).fromTier()).isEqualTo(EpistemicTier.AUDIT);
                        assertThat(inversions.get(0).toTier()).isEqualTo(EpistemicTier.EMPIRICAL);
                    });
        }

        @Test
        void cycleIsReportedBeforeInversion() {
            DependencyGraph graph = new DependencyGraph(
                    List.of(new DependencyNode("low", EpistemicTier.EMPIRICAL),
                            new DependencyNode("high", EpistemicTier.AUDIT)),
                    List.of(DependencyEdge.primary("low", "high"), DependencyEdge.primary("high", "low")));

            assertThatThrownBy(() -> governor.validate(graph)).isInstanceOf(CyclicDependencyException.class);
        }

        @Test
        void downwardVetoEdgeIsAllowed() {
            DependencyGraph graph = new DependencyGraph(
                    List.of(new DependencyNode("@p", EpistemicTier.INFERENTIAL),
                            new DependencyNode("@C", EpistemicTier.AUDIT)),
                    List.of(DependencyEdge.veto("@C", "@p")));

            assertThat(governor.validate(graph)).containsExactly("@C", "@p");
        }

        @Test
        void sameTierAndUpwardEdgesAreAccepted() {
            DependencyGraph graph = new DependencyGraph(
                    List.of(new DependencyNode("x", EpistemicTier.EMPIRICAL),
                            new DependencyNode("y", EpistemicTier.EMPIRICAL),
                            new DependencyNode("z", EpistemicTier.AUDIT)),
                    List.of(DependencyEdge.primary("x", "y"), DependencyEdge.primary("y", "z")));

            assertThat(governor.validate(graph)).containsExactly("x", "y", "z");
        }

        @Test
        void emptyGraphHasEmptyOrder() {
            assertThat(governor.validate(new DependencyGraph(List.of(), List.of()))).isEmpty();
        }

        private DependencyNode node(String id) {
            return new DependencyNode(id, EpistemicTier.INFERENTIAL);
        }
    }

    @Nested
    class DensityCap {

        @Test
        void executorWeightsAreCertified() {
            governor.certify(CalibrationFixtures.executorWeights());
        }

        @Test
        void rejectsInteractionShareAboveCap() {
            Map<LayerId, Double> linear = new EnumMap<>(LayerId.class);
            for (LayerId layer : LayerId.values()) {
                linear.put(layer, 0.05);
            }
            FusionWeightSet dense = new FusionWeightSet(
                    "dense", FusionRole.AGGREGATE, linear,
                    List.of(new InteractionTerm(LayerPair.of(LayerId.BASE, LayerId.UNIT), 0.60)));

            assertThatThrownBy(() -> governor.certify(dense))
                    .isInstanceOf(InteractionDensityException.class)
                    .hasMessageContaining("AGGREGATE");
        }

        @Test
        void capIsConfigurable() {
            governor.maxInteractionShare = 0.2;

            assertThatThrownBy(() -> governor.certify(CalibrationFixtures.executorWeights()))
                    .isInstanceOf(InteractionDensityException.class);
        }
    }

    @Nested
    class BoundedProduct {

        @Test
        void productInsideBoundsIsUnchanged() {
            ClampResult result = governor.boundedProduct(2.0, 1.5);

            assertThat(result.clamped()).isFalse();
            assertThat(result.value()).isCloseTo(3.0, within(1e-12));
            assertThat(result.rawProduct()).isEqualTo(result.value());
            assertThat(registry.counter("governor_product_clamps_total").count()).isZero();
        }

        @Test
        void productAboveUpperBoundIsClampedAndCounted() {
            ClampResult result = governor.boundedProduct(5.0, 5.0);

            assertThat(result.clamped()).isTrue();
            assertThat(result.rawProduct()).isCloseTo(25.0, within(1e-12));
            assertThat(result.value()).isEqualTo(10.0);
            assertThat(registry.counter("governor_product_clamps_total").count()).isEqualTo(1.0);
        }

        @Test
        void zeroFactorIsLiftedToLowerBound() {
            ClampResult result = governor.boundedProduct(0.0, 3.0);

            assertThat(result.clamped()).isTrue();
            assertThat(result.value()).isEqualTo(0.01);
            assertThat(result.lower()).isEqualTo(0.01);
            assertThat(result.upper()).isEqualTo(10.0);
        }

        @Test
        void explicitBoundsOverrideConfiguration() {
            ClampResult result = governor.boundedProduct(new MultiplicativeBounds(0.5, 2.0), 3.0);

            assertThat(result.value()).isEqualTo(2.0);
        }

        @Test
        void configuredBoundsFollowFields() {
            governor.minProduct = 0.1;
            governor.maxProduct = 5.0;

            assertThat(governor.configuredBounds()).isEqualTo(new MultiplicativeBounds(0.1, 5.0));
        }

        @Test
        void rejectsMissingOrInvalidFactors() {
            assertThatThrownBy(() -> governor.boundedProduct())
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getField())
                    .isEqualTo("factors");
            assertThatThrownBy(() -> governor.boundedProduct(1.0, -2.0))
                    .isInstanceOf(ValidationException.class)
                    .extracting(e -> ((ValidationException) e).getField())
                    .isEqualTo("factors[1]");
            assertThatThrownBy(() -> governor.boundedProduct(Double.NaN))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void worksWithoutMeterRegistry() {
            InteractionGovernor bare = new InteractionGovernor();
            bare.initMetrics();

            assertThat(bare.boundedProduct(100.0).clamped()).isTrue();
        }
    }
}
