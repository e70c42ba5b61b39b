/* (C)2026 */
package com.ammann.calibration.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.calibration.CalibrationFixtures;
import com.ammann.calibration.config.CalibrationLoader;
import com.ammann.calibration.dto.EvaluationRequestDTO;
import com.ammann.calibration.dto.VetoResultDTO;
import com.ammann.calibration.enumeration.DecisionStatus;
import com.ammann.calibration.enumeration.FusionRole;
import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.exception.ValidationException;
import com.ammann.calibration.model.CalibrationContext;
import com.ammann.calibration.model.FusionDecision;
import com.ammann.calibration.model.VetoResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FusionDecisionServiceTest {

    private static CalibrationContext context;

    private FusionDecisionService service;
    private CalibrationManifestService manifest;
    private SimpleMeterRegistry registry;

    @BeforeAll
    static void loadCohort() {
        context = new CalibrationLoader(new InteractionGovernor()).load(CalibrationFixtures.DEFAULT_LOCATION);
    }

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        manifest = new CalibrationManifestService();
        manifest.meterRegistry = registry;
        manifest.init();

        service = new FusionDecisionService();
        service.context = context;
        service.evaluator = new ChoquetFusionEvaluator();
        service.vetoCoordinator = new VetoCoordinator();
        service.manifest = manifest;
        service.meterRegistry = registry;
    }

    @Test
    void fusesAndRecordsReferenceUnit() {
        FusionDecision decision = service.evaluate(request("Q001-PA01", "executor", List.of()));

        assertThat(decision.status()).isEqualTo(DecisionStatus.FUSED);
        assertThat(decision.score()).isCloseTo(0.8869, within(1e-9));
        assertThat(decision.breakdown()).isNotNull();
        assertThat(decision.manifestEntry().sequence()).isZero();
        assertThat(decision.manifestEntry().weightSetId()).isEqualTo("COHORT_2024/EXECUTOR");
        assertThat(decision.manifestEntry().canonicalInputs()).contains(context.fingerprint());
        assertThat(registry.counter("fusion_evaluations_total", "role", "EXECUTOR").count()).isEqualTo(1.0);
    }

    @Test
    void triggeredVetoReplacesFusion() {
        List<VetoResultDTO> vetoes = List.of(
                new VetoResultDTO("@m", true, 0.3, "governance metadata stale"),
                new VetoResultDTO("@C", true, 0.9, "contradicts contract clause 4"),
                new VetoResultDTO("@b", false, 1.0, null));

        FusionDecision decision = service.evaluate(request("Q002-PA01", "EXECUTOR", vetoes));

        assertThat(decision.isVetoed()).isTrue();
        assertThat(decision.score()).isNull();
        assertThat(decision.breakdown()).isNull();
        assertThat(decision.veto().layerId()).isEqualTo(LayerId.CONGRUENCE);
        assertThat(decision.manifestEntry().status()).isEqualTo(DecisionStatus.VETOED);
        assertThat(registry.counter("fusion_vetoes_total", "layer", "@C").count()).isEqualTo(1.0);
    }

    @Test
    void untriggeredVetoesStillFuse() {
        FusionDecision decision = service.decide(
                "Q003-PA02",
                FusionRole.EXECUTOR,
                CalibrationFixtures.referenceScores(),
                List.of(VetoResult.passed(LayerId.CONGRUENCE, 0.9)));

        assertThat(decision.status()).isEqualTo(DecisionStatus.FUSED);
        assertThat(decision.optionalVeto()).isEmpty();
    }

    @Test
    void rejectedRequestIsNotRecorded() {
        Map<String, Double> scores = CalibrationFixtures.referenceScoreMap();
        scores.put("@p", 1.2);

        assertThatThrownBy(() -> service.evaluate(new EvaluationRequestDTO("Q004", "EXECUTOR", scores, null)))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getField())
                .isEqualTo("scores.@p");
        assertThat(manifest.size()).isZero();
        assertThat(registry.counter("fusion_rejections_total").count()).isEqualTo(1.0);
    }

    @Test
    void missingFieldsAreNamed() {
        assertThatThrownBy(() -> service.evaluate(request(null, "EXECUTOR", List.of())))
                .extracting(e -> ((ValidationException) e).getField())
                .isEqualTo("unit_id");
        assertThatThrownBy(() -> service.evaluate(request("Q005", "auditor", List.of())))
                .extracting(e -> ((ValidationException) e).getField())
                .isEqualTo("role");
        assertThatThrownBy(() -> service.evaluate(null))
                .extracting(e -> ((ValidationException) e).getField())
                .isEqualTo("body");
    }

    @Test
    void roleWithoutWeightSetIsRejected() {
        assertThatThrownBy(() -> service.evaluate(request("Q006", "REPORT", List.of())))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("REPORT");
        assertThat(manifest.size()).isZero();
        assertThat(registry.counter("fusion_rejections_total").count()).isEqualTo(1.0);
    }

    @Test
    void decisionsChainInCallOrder() {
        FusionDecision first = service.evaluate(request("Q007", "EXECUTOR", List.of()));
        FusionDecision second = service.evaluate(request("Q008", "CLUSTER", List.of()));

        assertThat(second.manifestEntry().previousHash()).isEqualTo(first.manifestEntry().entryHash());
        assertThat(manifest.verifyChain().valid()).isTrue();
    }

    private static EvaluationRequestDTO request(String unitId, String role, List<VetoResultDTO> vetoes) {
        return new EvaluationRequestDTO(unitId, role, CalibrationFixtures.referenceScoreMap(), vetoes);
    }
}
