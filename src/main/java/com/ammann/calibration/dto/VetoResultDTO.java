/* (C)2026 */
package com.ammann.calibration.dto;

import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.exception.ValidationException;
import com.ammann.calibration.model.VetoResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Wire form of a layer veto result.
 *
 * @param layerId layer symbol such as {@code @C}
 * @param triggered whether the veto gate fired
 * @param specificityScore specificity in {@code [0, 1]}
 * @param reason required when triggered
 */
@Schema(description = "Veto result reported by one layer")
public record VetoResultDTO(
        @Schema(description = "Layer symbol", example = "@C") @JsonProperty("layer_id") String layerId,
        @Schema(description = "Whether the veto fired") @JsonProperty("triggered") Boolean triggered,
        @Schema(description = "Specificity of the veto in [0, 1]") @JsonProperty("specificity_score")
                Double specificityScore,
        @Schema(description = "Reason, required when triggered") @JsonProperty("reason") String reason) {

    public static VetoResultDTO from(VetoResult veto) {
        if (veto == null) {
            return null;
        }
        return new VetoResultDTO(
                veto.layerId().symbol(), veto.triggered(), veto.specificityScore(), veto.reason());
    }

    /**
     * Converts to the domain type, naming the offending field with its position in the
     * request on rejection.
     *
     * @param index position in the request's {@code vetoes} array
     * @throws ValidationException on a missing or invalid field
     */
    public VetoResult toVetoResult(int index) {
        String prefix = "vetoes[" + index + "].";
        if (layerId == null || layerId.isBlank()) {
            throw ValidationException.missingField(prefix + "layer_id");
        }
        LayerId layer = LayerId.fromSymbol(layerId)
                .orElseThrow(() -> ValidationException.invalidParameter(
                        prefix + "layer_id", layerId, "a layer symbol such as @b or @chain"));
        if (triggered == null) {
            throw ValidationException.missingField(prefix + "triggered");
        }
        if (specificityScore == null) {
            throw ValidationException.missingField(prefix + "specificity_score");
        }
        if (!Double.isFinite(specificityScore) || specificityScore < 0.0 || specificityScore > 1.0) {
            throw ValidationException.outOfRange(prefix + "specificity_score", specificityScore, 0.0, 1.0);
        }
        if (triggered && (reason == null || reason.isBlank())) {
            throw ValidationException.missingField(prefix + "reason");
        }
        return new VetoResult(layer, triggered, specificityScore, reason);
    }
}
