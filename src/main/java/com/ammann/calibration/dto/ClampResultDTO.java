/* (C)2026 */
package com.ammann.calibration.dto;

import com.ammann.calibration.model.ClampResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Bounded multiplicative product")
public record ClampResultDTO(
        @JsonProperty("raw_product") double rawProduct,
        @JsonProperty("value") double value,
        @JsonProperty("clamped") boolean clamped,
        @JsonProperty("lower") double lower,
        @JsonProperty("upper") double upper) {

    public static ClampResultDTO from(ClampResult result) {
        return new ClampResultDTO(
                result.rawProduct(), result.value(), result.clamped(), result.lower(), result.upper());
    }
}
