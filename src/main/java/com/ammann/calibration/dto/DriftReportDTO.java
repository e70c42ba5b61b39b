/* (C)2026 */
package com.ammann.calibration.dto;

import com.ammann.calibration.enumeration.DriftSeverity;
import com.ammann.calibration.model.DriftReport;
import com.ammann.calibration.model.ParameterDrift;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Parameter drift between two versions of a calibration layer")
public record DriftReportDTO(
        @JsonProperty("layer_id") String layerId,
        @JsonProperty("from_version") String fromVersion,
        @JsonProperty("to_version") String toVersion,
        @JsonProperty("overall_severity") DriftSeverity overallSeverity,
        @Schema(description = "At least 40% of changed parameters drifted significantly")
                @JsonProperty("dispersed")
                boolean dispersed,
        @JsonProperty("drifts") List<ParameterDriftDTO> drifts,
        @JsonProperty("added_parameters") List<String> addedParameters,
        @JsonProperty("removed_parameters") List<String> removedParameters,
        @JsonProperty("recommendations") List<String> recommendations) {

    @Schema(description = "Drift of one parameter")
    public record ParameterDriftDTO(
            @JsonProperty("name") String name,
            @JsonProperty("previous_value") double previousValue,
            @JsonProperty("current_value") double currentValue,
            @JsonProperty("drift_ratio") double driftRatio,
            @JsonProperty("severity") DriftSeverity severity) {

        static ParameterDriftDTO from(ParameterDrift drift) {
            return new ParameterDriftDTO(
                    drift.name(), drift.previousValue(), drift.currentValue(), drift.driftRatio(), drift.severity());
        }
    }

    public static DriftReportDTO from(DriftReport report) {
        return new DriftReportDTO(
                report.layerId(),
                report.fromVersion(),
                report.toVersion(),
                report.overallSeverity(),
                report.dispersed(),
                report.drifts().stream().map(ParameterDriftDTO::from).toList(),
                report.addedParameters(),
                report.removedParameters(),
                report.recommendations());
    }
}
