/* (C)2026 */
package com.ammann.calibration.dto;

import com.ammann.calibration.model.BoundedParameter;
import com.ammann.calibration.model.CalibrationLayer;
import com.ammann.calibration.model.EvidenceReference;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Current version of a calibration layer with its provenance")
public record CalibrationLayerDTO(
        @JsonProperty("layer_id") String layerId,
        @JsonProperty("version") String version,
        @JsonProperty("rationale") String rationale,
        @JsonProperty("created_at") Instant createdAt,
        @Schema(description = "SHA-256 of the layer's canonical form") @JsonProperty("content_hash")
                String contentHash,
        @JsonProperty("parameters") List<ParameterDTO> parameters,
        @JsonProperty("evidence") List<EvidenceDTO> evidence,
        @Schema(description = "Older versions kept for drift audits") @JsonProperty("superseded_versions")
                List<String> supersededVersions) {

    @Schema(description = "Bounded calibration parameter")
    public record ParameterDTO(
            @JsonProperty("name") String name,
            @JsonProperty("value") double value,
            @JsonProperty("lower") double lower,
            @JsonProperty("upper") double upper) {

        static ParameterDTO from(BoundedParameter parameter) {
            return new ParameterDTO(
                    parameter.name(), parameter.value(), parameter.bounds().lower(), parameter.bounds().upper());
        }
    }

    @Schema(description = "Evidence reference")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EvidenceDTO(
            @JsonProperty("locator") String locator, @JsonProperty("content_id") String contentId) {

        static EvidenceDTO from(EvidenceReference evidence) {
            return new EvidenceDTO(evidence.locator(), evidence.contentId());
        }
    }

    public static CalibrationLayerDTO from(CalibrationLayer layer, List<CalibrationLayer> history) {
        return new CalibrationLayerDTO(
                layer.layerId(),
                layer.version(),
                layer.rationale(),
                layer.createdAt(),
                layer.contentHash(),
                layer.parameters().values().stream().map(ParameterDTO::from).toList(),
                layer.evidence().stream().map(EvidenceDTO::from).toList(),
                history.stream()
                        .map(CalibrationLayer::version)
                        .filter(v -> !v.equals(layer.version()))
                        .toList());
    }
}
