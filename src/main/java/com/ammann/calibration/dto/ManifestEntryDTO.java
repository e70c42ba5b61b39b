/* (C)2026 */
package com.ammann.calibration.dto;

import com.ammann.calibration.enumeration.DecisionStatus;
import com.ammann.calibration.model.CalibrationManifestEntry;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Hash-chained audit record of one fusion decision")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManifestEntryDTO(
        @Schema(description = "Zero-based position in the trail") @JsonProperty("sequence") long sequence,
        @JsonProperty("unit_id") String unitId,
        @JsonProperty("weight_set_id") String weightSetId,
        @JsonProperty("status") DecisionStatus status,
        @Schema(description = "Fused score, absent when vetoed") @JsonProperty("score") Double score,
        @JsonProperty("veto") VetoResultDTO veto,
        @Schema(description = "SHA-256 of the canonical inputs") @JsonProperty("inputs_hash") String inputsHash,
        @JsonProperty("previous_hash") String previousHash,
        @JsonProperty("entry_hash") String entryHash,
        @JsonProperty("timestamp") Instant timestamp,
        @Schema(description = "HMAC-SHA256 signature, absent when unsigned") @JsonProperty("signature")
                String signature,
        @Schema(description = "Canonical JSON the inputs hash was computed over")
                @JsonProperty("canonical_inputs")
                String canonicalInputs) {

    public static ManifestEntryDTO from(CalibrationManifestEntry entry) {
        return new ManifestEntryDTO(
                entry.sequence(),
                entry.unitId(),
                entry.weightSetId(),
                entry.status(),
                entry.score(),
                entry.veto().map(VetoResultDTO::from).orElse(null),
                entry.inputsHash(),
                entry.previousHash(),
                entry.entryHash(),
                entry.timestamp(),
                entry.signature(),
                entry.canonicalInputs());
    }
}
