/* (C)2026 */
package com.ammann.calibration.dto;

import com.ammann.calibration.model.ManifestVerification;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Verification result for one manifest entry")
public record ManifestVerificationDTO(
        @JsonProperty("sequence") long sequence,
        @JsonProperty("valid") boolean valid,
        @JsonProperty("hash_valid") boolean hashValid,
        @JsonProperty("chain_valid") boolean chainValid,
        @Schema(description = "Null when the entry is unsigned") @JsonProperty("signature_valid")
                Boolean signatureValid,
        @JsonProperty("problems") List<String> problems) {

    public static ManifestVerificationDTO from(ManifestVerification verification) {
        return new ManifestVerificationDTO(
                verification.sequence(),
                verification.valid(),
                verification.hashValid(),
                verification.chainValid(),
                verification.signatureValid(),
                verification.problems());
    }
}
