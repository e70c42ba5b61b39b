/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import com.ammann.calibration.enumeration.DependencyKind;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;

/**
 * Directed edge {@code from -> to}: the value of {@code from} flows into {@code to}.
 */
public record DependencyEdge(String from, String to, DependencyKind kind) implements CanonicalForm {

    /** By source, then target, then kind. */
    public static final Comparator<DependencyEdge> ORDER = Comparator.comparing(DependencyEdge::from)
            .thenComparing(DependencyEdge::to)
            .thenComparing(DependencyEdge::kind);

    public DependencyEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        kind = kind == null ? DependencyKind.PRIMARY : kind;
    }

    public static DependencyEdge primary(String from, String to) {
        return new DependencyEdge(from, to, DependencyKind.PRIMARY);
    }

    public static DependencyEdge veto(String from, String to) {
        return new DependencyEdge(from, to, DependencyKind.VETO);
    }

    public boolean isSelfLoop() {
        return from.equals(to);
    }

    public String describe() {
        return from + " -> " + to + (kind == DependencyKind.VETO ? " (veto)" : "");
    }

    @Override
    public Map<String, Object> canonicalForm() {
        return Map.of("from", from, "to", to, "kind", kind);
    }
}
