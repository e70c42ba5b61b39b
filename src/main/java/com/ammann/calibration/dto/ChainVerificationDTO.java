/* (C)2026 */
package com.ammann.calibration.dto;

import com.ammann.calibration.model.ChainVerification;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Verification result for the whole manifest chain")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChainVerificationDTO(
        @JsonProperty("entries_checked") int entriesChecked,
        @JsonProperty("valid") boolean valid,
        @JsonProperty("first_invalid_sequence") Long firstInvalidSequence,
        @JsonProperty("head_hash") String headHash,
        @JsonProperty("message") String message) {

    public static ChainVerificationDTO from(ChainVerification verification) {
        return new ChainVerificationDTO(
                verification.entriesChecked(),
                verification.valid(),
                verification.firstInvalidSequence(),
                verification.headHash(),
                verification.message());
    }
}
