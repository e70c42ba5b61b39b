/* (C)2026 */
package com.ammann.calibration.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.calibration.CalibrationFixtures;
import com.ammann.calibration.enumeration.EpistemicTier;
import com.ammann.calibration.enumeration.FusionRole;
import com.ammann.calibration.exception.CalibrationException;
import com.ammann.calibration.exception.ValidationException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class CalibrationContextTest {

    private static final DependencyGraph GRAPH =
            new DependencyGraph(List.of(new DependencyNode("@b", EpistemicTier.EMPIRICAL)), List.of());

    @Test
    void currentLayerIsLatestByCreationTime() {
        CalibrationLayer v1 = CalibrationFixtures.layer(
                "@b", "v1", Instant.parse("2024-01-15T00:00:00Z"), BoundedParameter.of("w", 0.4, 0, 1));
        CalibrationLayer v2 = CalibrationFixtures.layer(
                "@b", "v2", Instant.parse("2024-06-01T00:00:00Z"), BoundedParameter.of("w", 0.5, 0, 1));

        CalibrationContext context = context(List.of(v2, v1));

        assertThat(context.layer("@b")).contains(v2);
        assertThat(context.layerHistory("@b")).containsExactly(v1, v2);
        assertThat(context.layerVersion("@b", "v1")).contains(v1);
        assertThat(context.layerVersion("@b", "v3")).isEmpty();
    }

    @Test
    void rejectsDuplicateLayerVersion() {
        Instant at = Instant.parse("2024-01-15T00:00:00Z");
        CalibrationLayer first = CalibrationFixtures.layer("@b", "v1", at, BoundedParameter.of("w", 0.4, 0, 1));
        CalibrationLayer second = CalibrationFixtures.layer("@b", "v1", at, BoundedParameter.of("w", 0.5, 0, 1));

        assertThatThrownBy(() -> context(List.of(first, second)))
                .isInstanceOf(CalibrationException.class)
                .hasMessageContaining("'@b' version 'v1'");
    }

    @Test
    void unknownRoleIsPerCallRejection() {
        CalibrationContext context = context(List.of());

        assertThat(context.requireWeightSet(FusionRole.EXECUTOR).id()).isEqualTo("COHORT_2024/EXECUTOR");
        assertThatThrownBy(() -> context.requireWeightSet(FusionRole.REPORT))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("role"));
    }

    @Test
    void fingerprintIsStableAcrossConstruction() {
        assertThat(context(List.of()).fingerprint()).isEqualTo(context(List.of()).fingerprint());
    }

    @Test
    void fingerprintChangesWithBounds() {
        CalibrationContext defaults = context(List.of());
        CalibrationContext narrow = new CalibrationContext(
                "COHORT_2024",
                "1.0.0",
                List.of(CalibrationFixtures.executorWeights()),
                List.of(),
                GRAPH,
                List.of("@b"),
                new MultiplicativeBounds(0.1, 5.0));

        assertThat(narrow.fingerprint()).isNotEqualTo(defaults.fingerprint());
    }

    @Test
    void rejectsInvalidProductBounds() {
        assertThatThrownBy(() -> new MultiplicativeBounds(0.0, 10.0)).isInstanceOf(CalibrationException.class);
        assertThatThrownBy(() -> new MultiplicativeBounds(2.0, 1.0)).isInstanceOf(CalibrationException.class);
    }

    private static CalibrationContext context(List<CalibrationLayer> layers) {
        return new CalibrationContext(
                "COHORT_2024",
                "1.0.0",
                List.of(CalibrationFixtures.executorWeights()),
                layers,
                GRAPH,
                List.of("@b"),
                null);
    }
}
