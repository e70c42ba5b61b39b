/* (C)2026 */
package com.ammann.calibration.dto;

import com.ammann.calibration.enumeration.DecisionStatus;
import com.ammann.calibration.model.FusionDecision;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Decision for one evaluated unit.
 *
 * @param score full-precision fused score, absent when vetoed
 * @param displayScore {@code score} rounded to three decimals for presentation only
 */
@Schema(description = "Fused score or veto for one unit, with its manifest entry")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvaluationResponseDTO(
        @JsonProperty("unit_id") String unitId,
        @JsonProperty("role") String role,
        @Schema(description = "FUSED or VETOED") @JsonProperty("status") DecisionStatus status,
        @JsonProperty("score") Double score,
        @JsonProperty("display_score") String displayScore,
        @Schema(description = "Veto that replaced fusion") @JsonProperty("veto") VetoResultDTO veto,
        @JsonProperty("breakdown") FusionBreakdownDTO breakdown,
        @JsonProperty("manifest") ManifestEntryDTO manifest) {

    public static EvaluationResponseDTO from(FusionDecision decision) {
        Double score = decision.score();
        return new EvaluationResponseDTO(
                decision.unitId(),
                decision.role().name(),
                decision.status(),
                score,
                score == null ? null : BigDecimal.valueOf(score).setScale(3, RoundingMode.HALF_UP).toPlainString(),
                VetoResultDTO.from(decision.veto()),
                FusionBreakdownDTO.from(decision.breakdown()),
                ManifestEntryDTO.from(decision.manifestEntry()));
    }
}
