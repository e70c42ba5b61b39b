/* (C)2026 */
package com.ammann.calibration.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.calibration.CalibrationFixtures;
import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.exception.ValidationException;
import com.ammann.calibration.model.VetoResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EvaluationRequestDTOTest {

    @Test
    void convertsCompleteRequest() {
        EvaluationRequestDTO request = new EvaluationRequestDTO(
                "Q001-PA01",
                "executor",
                CalibrationFixtures.referenceScoreMap(),
                List.of(new VetoResultDTO("@C", true, 0.9, "contradicts contract clause 4")));

        List<VetoResult> vetoes = request.toVetoResults();

        assertThat(request.requireUnitId()).isEqualTo("Q001-PA01");
        assertThat(request.toScoreVector()).isEqualTo(CalibrationFixtures.referenceScores());
        assertThat(vetoes).containsExactly(
                VetoResult.triggered(LayerId.CONGRUENCE, 0.9, "contradicts contract clause 4"));
    }

    @Test
    void missingVetoesMeanNone() {
        EvaluationRequestDTO request =
                new EvaluationRequestDTO("Q001", "EXECUTOR", CalibrationFixtures.referenceScoreMap(), null);

        assertThat(request.toVetoResults()).isEmpty();
    }

    @Test
    void blankUnitIdIsRejected() {
        EvaluationRequestDTO request =
                new EvaluationRequestDTO("  ", "EXECUTOR", CalibrationFixtures.referenceScoreMap(), null);

        assertThat(field(request::requireUnitId)).isEqualTo("unit_id");
    }

    @Test
    void scoreErrorsNameTheLayer() {
        Map<String, Double> missing = CalibrationFixtures.referenceScoreMap();
        missing.remove("@m");
        Map<String, Double> extra = CalibrationFixtures.referenceScoreMap();
        extra.put("@x", 0.5);

        assertThat(field(() -> new EvaluationRequestDTO("Q", "EXECUTOR", missing, null).toScoreVector()))
                .isEqualTo("scores.@m");
        assertThat(field(() -> new EvaluationRequestDTO("Q", "EXECUTOR", extra, null).toScoreVector()))
                .isEqualTo("scores.@x");
        assertThat(field(() -> new EvaluationRequestDTO("Q", "EXECUTOR", null, null).toScoreVector()))
                .isEqualTo("scores");
    }

    @Test
    void vetoErrorsCarryTheirIndex() {
        List<VetoResultDTO> vetoes = new ArrayList<>();
        vetoes.add(new VetoResultDTO("@C", false, 0.5, null));
        vetoes.add(new VetoResultDTO("@m", true, 0.5, " "));

        assertThat(field(() -> request(vetoes).toVetoResults())).isEqualTo("vetoes[1].reason");

        vetoes.set(1, new VetoResultDTO("@zz", false, 0.5, null));
        assertThat(field(() -> request(vetoes).toVetoResults())).isEqualTo("vetoes[1].layer_id");

        vetoes.set(1, new VetoResultDTO("@m", false, 1.5, null));
        assertThat(field(() -> request(vetoes).toVetoResults())).isEqualTo("vetoes[1].specificity_score");

        vetoes.set(1, new VetoResultDTO("@m", null, 0.5, null));
        assertThat(field(() -> request(vetoes).toVetoResults())).isEqualTo("vetoes[1].triggered");

        vetoes.set(1, null);
        assertThat(field(() -> request(vetoes).toVetoResults())).isEqualTo("vetoes[1]");
    }

    private static EvaluationRequestDTO request(List<VetoResultDTO> vetoes) {
        return new EvaluationRequestDTO("Q", "EXECUTOR", CalibrationFixtures.referenceScoreMap(), vetoes);
    }

    private static String field(Runnable call) {
        try {
            call.run();
        } catch (ValidationException e) {
            return e.getField();
        }
        throw new AssertionError("Expected a ValidationException");
    }
}
