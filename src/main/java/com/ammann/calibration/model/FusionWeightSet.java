/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import com.ammann.calibration.enumeration.FusionRole;
import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.exception.WeightNormalizationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Normalized 2-additive capacity for one role: eight linear weights plus a small set of
 * pairwise interaction weights.
 *
 * <p>All weights are finite and non-negative and the declared total must be 1.0 within
 * {@link #TOLERANCE}. Accepted weights are rescaled by that total, so fusing an
 * all-ones vector never exceeds 1.0. Normalization is checked once here, never per
 * evaluation. Interaction terms are kept in {@link LayerPair#ORDER}, independent of
 * declaration order.
 */
public final class FusionWeightSet implements CanonicalForm {

    public static final double TOLERANCE = 1e-6;

    private final String id;
    private final FusionRole role;
    private final Map<LayerId, Double> linearWeights;
    private final List<InteractionTerm> interactions;
    private final double linearSum;
    private final double interactionSum;

    public FusionWeightSet(
            String id,
            FusionRole role,
            Map<LayerId, Double> linearWeights,
            List<InteractionTerm> interactions) {
        this.role = Objects.requireNonNull(role, "role");
        this.id = id == null || id.isBlank() ? role.name() : id;

        EnumMap<LayerId, Double> linear = new EnumMap<>(LayerId.class);
        double linearTotal = 0.0;
        for (LayerId layer : LayerId.values()) {
            Double weight = linearWeights == null ? null : linearWeights.get(layer);
            if (weight == null) {
                throw new WeightNormalizationException(String.format(
                        "Role %s has no linear weight for layer %s", role, layer.symbol()));
            }
            requireNonNegative(weight, "linear weight " + layer.symbol());
            linear.put(layer, weight);
            linearTotal += weight;
        }

        List<InteractionTerm> terms = new ArrayList<>();
        Set<LayerPair> seen = new HashSet<>();
        double interactionTotal = 0.0;
        for (InteractionTerm term : interactions == null ? List.<InteractionTerm>of() : interactions) {
            if (!seen.add(term.pair())) {
                throw new WeightNormalizationException(String.format(
                        "Role %s declares interaction %s more than once", role, term.pair()));
            }
            requireNonNegative(term.weight(), "interaction weight " + term.pair());
            terms.add(term);
            interactionTotal += term.weight();
        }

        double total = linearTotal + interactionTotal;
        if (Math.abs(total - 1.0) > TOLERANCE) {
            throw WeightNormalizationException.unnormalized(
                    role.name(), linearTotal, interactionTotal, TOLERANCE);
        }

        terms.sort(Comparator.comparing(InteractionTerm::pair, LayerPair.ORDER));
        rescale(linear, terms, total);

        this.linearWeights = Collections.unmodifiableMap(linear);
        this.interactions = List.copyOf(terms);
        this.linearSum = linear.values().stream().mapToDouble(Double::doubleValue).sum();
        this.interactionSum = terms.stream().mapToDouble(InteractionTerm::weight).sum();
    }

    /** Identifier recorded in manifest entries, e.g. {@code COHORT_2024/EXECUTOR}. */
    public String id() {
        return id;
    }

    public FusionRole role() {
        return role;
    }

    public double linearWeight(LayerId layer) {
        return linearWeights.get(layer);
    }

    public Map<LayerId, Double> linearWeights() {
        return linearWeights;
    }

    public List<InteractionTerm> interactions() {
        return interactions;
    }

    public double linearSum() {
        return linearSum;
    }

    public double interactionSum() {
        return interactionSum;
    }

    @Override
    public Map<String, Object> canonicalForm() {
        Map<String, Object> linear = new LinkedHashMap<>();
        linearWeights.forEach((layer, weight) -> linear.put(layer.symbol(), weight));
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("id", id);
        form.put("role", role);
        form.put("linear", linear);
        Map<String, Object> pairs = new LinkedHashMap<>();
        interactions.forEach(term -> pairs.put(term.pair().key(), term.weight()));
        form.put("interactions", pairs);
        return form;
    }

    @Override
    public String toString() {
        return "FusionWeightSet[" + id + ", " + interactions.size() + " interactions]";
    }

    private void requireNonNegative(double weight, String what) {
        if (!Double.isFinite(weight) || weight < 0.0) {
            throw new WeightNormalizationException(String.format(
                    "Role %s has invalid %s = %s, expected a finite value >= 0", role, what, weight));
        }
    }

    /**
     * Divides every weight by {@code total} so the stored capacity sums to at most 1.0 when
     * added in evaluation order. Any rounding excess left after the division is taken off
     * the largest weight one ulp at a time.
     */
    private static void rescale(Map<LayerId, Double> linear, List<InteractionTerm> terms, double total) {
        if (total != 1.0) {
            linear.replaceAll((layer, weight) -> weight / total);
            terms.replaceAll(term -> new InteractionTerm(term.pair(), term.weight() / total));
        }
        while (evaluationOrderSum(linear, terms) > 1.0) {
            LayerId largestLayer = LayerId.BASE;
            for (LayerId layer : LayerId.values()) {
                if (linear.get(layer) > linear.get(largestLayer)) {
                    largestLayer = layer;
                }
            }
            int largestTerm = -1;
            for (int i = 0; i < terms.size(); i++) {
                double current = largestTerm < 0 ? linear.get(largestLayer) : terms.get(largestTerm).weight();
                if (terms.get(i).weight() > current) {
                    largestTerm = i;
                }
            }
            if (largestTerm < 0) {
                linear.put(largestLayer, Math.nextDown(linear.get(largestLayer)));
            } else {
                InteractionTerm term = terms.get(largestTerm);
                terms.set(largestTerm, new InteractionTerm(term.pair(), Math.nextDown(term.weight())));
            }
        }
    }

    private static double evaluationOrderSum(Map<LayerId, Double> linear, List<InteractionTerm> terms) {
        double sum = 0.0;
        for (LayerId layer : LayerId.values()) {
            sum += linear.get(layer);
        }
        for (InteractionTerm term : terms) {
            sum += term.weight();
        }
        return sum;
    }
}
