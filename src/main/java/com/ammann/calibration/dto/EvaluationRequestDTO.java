/* (C)2026 */
package com.ammann.calibration.dto;

import com.ammann.calibration.enumeration.FusionRole;
import com.ammann.calibration.exception.ValidationException;
import com.ammann.calibration.model.LayerScoreVector;
import com.ammann.calibration.model.VetoResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * One evaluated unit as submitted by an upstream producer.
 */
@Schema(description = "Layer scores and veto results for one evaluated unit")
public record EvaluationRequestDTO(
        @Schema(description = "Identifier of the evaluated unit", example = "Q001-PA01")
                @JsonProperty("unit_id")
                String unitId,
        @Schema(description = "Evaluation role selecting the weight set", example = "EXECUTOR")
                @JsonProperty("role")
                String role,
        @Schema(description = "Exactly eight layer scores in [0, 1], keyed by layer symbol")
                @JsonProperty("scores")
                Map<String, Double> scores,
        @Schema(description = "Optional veto results") @JsonProperty("vetoes") List<VetoResultDTO> vetoes) {

    public String requireUnitId() {
        if (unitId == null || unitId.isBlank()) {
            throw ValidationException.missingField("unit_id");
        }
        return unitId;
    }

    public FusionRole toRole() {
        return FusionRole.parse(role);
    }

    public LayerScoreVector toScoreVector() {
        return LayerScoreVector.fromSymbols(scores);
    }

    public List<VetoResult> toVetoResults() {
        List<VetoResult> results = new ArrayList<>();
        if (vetoes == null) {
            return results;
        }
        for (int i = 0; i < vetoes.size(); i++) {
            VetoResultDTO veto = vetoes.get(i);
            if (veto == null) {
                throw ValidationException.missingField("vetoes[" + i + "]");
            }
            results.add(veto.toVetoResult(i));
        }
        return results;
    }
}
