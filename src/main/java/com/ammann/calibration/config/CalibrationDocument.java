/* (C)2026 */
package com.ammann.calibration.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * File format of a calibration cohort. Pure data binding; every invariant is checked
 * when the domain objects are built from it by {@link CalibrationLoader}.
 */
public record CalibrationDocument(
        @JsonProperty("cohort") String cohort,
        @JsonProperty("version") String version,
        @JsonProperty("fusion_weights") Map<String, WeightSetEntry> fusionWeights,
        @JsonProperty("layers") List<LayerEntry> layers,
        @JsonProperty("dependency_graph") GraphEntry dependencyGraph,
        @JsonProperty("multiplicative_bounds") BoundsEntry multiplicativeBounds) {

    public record WeightSetEntry(
            @JsonProperty("linear") Map<String, Double> linear,
            @JsonProperty("interactions") List<InteractionEntry> interactions) {}

    public record InteractionEntry(
            @JsonProperty("layers") List<String> layers, @JsonProperty("weight") Double weight) {}

    public record LayerEntry(
            @JsonProperty("layer_id") String layerId,
            @JsonProperty("version") String version,
            @JsonProperty("rationale") String rationale,
            @JsonProperty("created_at") String createdAt,
            @JsonProperty("evidence") List<EvidenceEntry> evidence,
            @JsonProperty("parameters") List<ParameterEntry> parameters) {}

    public record EvidenceEntry(
            @JsonProperty("locator") String locator, @JsonProperty("content_id") String contentId) {}

    public record ParameterEntry(
            @JsonProperty("name") String name,
            @JsonProperty("value") Double value,
            @JsonProperty("lower") Double lower,
            @JsonProperty("upper") Double upper) {}

    public record GraphEntry(
            @JsonProperty("nodes") List<NodeEntry> nodes, @JsonProperty("edges") List<EdgeEntry> edges) {}

    public record NodeEntry(@JsonProperty("id") String id, @JsonProperty("tier") String tier) {}

    public record EdgeEntry(
            @JsonProperty("from") String from,
            @JsonProperty("to") String to,
            @JsonProperty("kind") String kind) {}

    public record BoundsEntry(@JsonProperty("min") Double min, @JsonProperty("max") Double max) {}
}
