/* (C)2026 */
package com.ammann.calibration.dto;

import com.ammann.calibration.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Factors of a multiplicative combination to certify")
public record BoundedProductRequestDTO(
        @Schema(description = "Finite, non-negative factors") @JsonProperty("factors") List<Double> factors) {

    public double[] toFactors() {
        if (factors == null || factors.isEmpty()) {
            throw ValidationException.missingField("factors");
        }
        double[] values = new double[factors.size()];
        for (int i = 0; i < values.length; i++) {
            Double factor = factors.get(i);
            if (factor == null) {
                throw ValidationException.missingField("factors[" + i + "]");
            }
            values[i] = factor;
        }
        return values;
    }
}
