/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import com.ammann.calibration.canonical.CanonicalJson;
import com.ammann.calibration.exception.CalibrationException;
import com.ammann.calibration.exception.IncompleteProvenanceException;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named, versioned and immutable set of bounded parameters with its provenance.
 *
 * <p>A layer is a fact about the system at a point in time. There is no update
 * operation: recalibration produces a new layer with a new version tag and the old one
 * is kept as superseded history.
 */
public final class CalibrationLayer implements CanonicalForm {

    private final String layerId;
    private final String version;
    private final Map<String, BoundedParameter> parameters;
    private final String rationale;
    private final List<EvidenceReference> evidence;
    private final Instant createdAt;
    private final String contentHash;

    public CalibrationLayer(
            String layerId,
            String version,
            Collection<BoundedParameter> parameters,
            String rationale,
            List<EvidenceReference> evidence,
            Instant createdAt) {
        if (layerId == null || layerId.isBlank()) {
            throw new CalibrationException("Calibration layer requires a non-blank layer_id");
        }
        if (version == null || version.isBlank()) {
            throw new CalibrationException("Calibration layer '" + layerId + "' requires a version");
        }
        if (rationale == null || rationale.isBlank()) {
            throw new IncompleteProvenanceException(layerId, "rationale is empty");
        }
        if (evidence == null || evidence.isEmpty()) {
            throw new IncompleteProvenanceException(layerId, "no evidence references");
        }
        this.layerId = layerId;
        this.version = version;
        this.rationale = rationale;
        this.evidence = List.copyOf(evidence);
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");

        Map<String, BoundedParameter> byName = new LinkedHashMap<>();
        for (BoundedParameter parameter : parameters == null ? List.<BoundedParameter>of() : parameters) {
            if (byName.putIfAbsent(parameter.name(), parameter) != null) {
                throw new CalibrationException(String.format(
                        "Layer '%s' declares parameter '%s' more than once", layerId, parameter.name()));
            }
        }
        this.parameters = Collections.unmodifiableMap(byName);
        this.contentHash = CanonicalJson.digest(this);
    }

    public String layerId() {
        return layerId;
    }

    public String version() {
        return version;
    }

    public Map<String, BoundedParameter> parameters() {
        return parameters;
    }

    public Optional<BoundedParameter> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public String rationale() {
        return rationale;
    }

    public List<EvidenceReference> evidence() {
        return evidence;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** SHA-256 of the canonical form of this layer. */
    public String contentHash() {
        return contentHash;
    }

    @Override
    public Map<String, Object> canonicalForm() {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("layer_id", layerId);
        form.put("version", version);
        form.put("parameters", parameters);
        form.put("rationale", rationale);
        form.put("evidence", evidence);
        form.put("created_at", createdAt);
        return form;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CalibrationLayer other)) return false;
        return contentHash.equals(other.contentHash);
    }

    @Override
    public int hashCode() {
        return contentHash.hashCode();
    }

    @Override
    public String toString() {
        return "CalibrationLayer[" + layerId + "@" + version + ", " + parameters.size() + " parameters]";
    }
}
