/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import com.ammann.calibration.canonical.CanonicalJson;
import com.ammann.calibration.enumeration.FusionRole;
import com.ammann.calibration.exception.CalibrationException;
import com.ammann.calibration.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * The complete, validated calibration state of one cohort and version.
 *
 * <p>Built once at startup after the interaction governor has accepted the dependency
 * graph and every weight set, then shared read-only by reference. It is never mutated
 * and never rebuilt while the process runs.
 */
public final class CalibrationContext implements CanonicalForm {

    private static final Comparator<CalibrationLayer> HISTORY_ORDER =
            Comparator.comparing(CalibrationLayer::createdAt).thenComparing(CalibrationLayer::version);

    private final String cohort;
    private final String version;
    private final Map<FusionRole, FusionWeightSet> weightSets;
    private final Map<String, List<CalibrationLayer>> layerHistory;
    private final DependencyGraph dependencyGraph;
    private final List<String> topologicalOrder;
    private final MultiplicativeBounds multiplicativeBounds;
    private final String fingerprint;

    public CalibrationContext(
            String cohort,
            String version,
            Collection<FusionWeightSet> weightSets,
            Collection<CalibrationLayer> layers,
            DependencyGraph dependencyGraph,
            List<String> topologicalOrder,
            MultiplicativeBounds multiplicativeBounds) {
        if (cohort == null || cohort.isBlank()) {
            throw new CalibrationException("Calibration requires a cohort name");
        }
        if (version == null || version.isBlank()) {
            throw new CalibrationException("Calibration " + cohort + " requires a version");
        }
        this.cohort = cohort;
        this.version = version;

        EnumMap<FusionRole, FusionWeightSet> byRole = new EnumMap<>(FusionRole.class);
        for (FusionWeightSet set : weightSets) {
            if (byRole.putIfAbsent(set.role(), set) != null) {
                throw new CalibrationException("Role " + set.role() + " has more than one weight set");
            }
        }
        if (byRole.isEmpty()) {
            throw new CalibrationException("Calibration " + cohort + " defines no fusion weight sets");
        }
        this.weightSets = Collections.unmodifiableMap(byRole);

        Map<String, List<CalibrationLayer>> history = new TreeMap<>();
        for (CalibrationLayer layer : layers) {
            List<CalibrationLayer> versions = history.computeIfAbsent(layer.layerId(), k -> new ArrayList<>());
            if (versions.stream().anyMatch(l -> l.version().equals(layer.version()))) {
                throw new CalibrationException(String.format(
                        "Layer '%s' version '%s' is declared more than once", layer.layerId(), layer.version()));
            }
            versions.add(layer);
        }
        Map<String, List<CalibrationLayer>> frozen = new LinkedHashMap<>();
        history.forEach((id, versions) -> {
            versions.sort(HISTORY_ORDER);
            frozen.put(id, List.copyOf(versions));
        });
        this.layerHistory = Collections.unmodifiableMap(frozen);

        this.dependencyGraph = dependencyGraph;
        this.topologicalOrder = List.copyOf(topologicalOrder);
        this.multiplicativeBounds = multiplicativeBounds == null ? MultiplicativeBounds.DEFAULT : multiplicativeBounds;
        this.fingerprint = CanonicalJson.digest(this);
    }

    public String cohort() {
        return cohort;
    }

    public String version() {
        return version;
    }

    public Map<FusionRole, FusionWeightSet> weightSets() {
        return weightSets;
    }

    public Optional<FusionWeightSet> weightSet(FusionRole role) {
        return Optional.ofNullable(weightSets.get(role));
    }

    /**
     * Weight set for {@code role}.
     *
     * @throws ValidationException if this calibration has no weight set for the role
     */
    public FusionWeightSet requireWeightSet(FusionRole role) {
        return weightSet(role)
                .orElseThrow(() -> ValidationException.invalidParameter(
                        "role", role, "one of " + weightSets.keySet()));
    }

    /** Latest version of every layer, keyed by layer id. */
    public Map<String, CalibrationLayer> currentLayers() {
        Map<String, CalibrationLayer> current = new LinkedHashMap<>();
        layerHistory.forEach((id, versions) -> current.put(id, versions.get(versions.size() - 1)));
        return current;
    }

    public Optional<CalibrationLayer> layer(String layerId) {
        return Optional.ofNullable(currentLayers().get(layerId));
    }

    public Optional<CalibrationLayer> layerVersion(String layerId, String layerVersion) {
        return layerHistory.getOrDefault(layerId, List.of()).stream()
                .filter(l -> l.version().equals(layerVersion))
                .findFirst();
    }

    /** All versions of a layer, oldest first. */
    public List<CalibrationLayer> layerHistory(String layerId) {
        return layerHistory.getOrDefault(layerId, List.of());
    }

    public List<CalibrationLayer> allLayers() {
        return layerHistory.values().stream().flatMap(List::stream).collect(Collectors.toList());
    }

    public DependencyGraph dependencyGraph() {
        return dependencyGraph;
    }

    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    public MultiplicativeBounds multiplicativeBounds() {
        return multiplicativeBounds;
    }

    /** SHA-256 of the canonical form of the whole calibration state. */
    public String fingerprint() {
        return fingerprint;
    }

    @Override
    public Map<String, Object> canonicalForm() {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("cohort", cohort);
        form.put("version", version);
        form.put("fusion_weights", weightSets);
        form.put("layers", allLayers());
        form.put("dependency_graph", dependencyGraph);
        form.put("multiplicative_bounds", multiplicativeBounds);
        return form;
    }
}
