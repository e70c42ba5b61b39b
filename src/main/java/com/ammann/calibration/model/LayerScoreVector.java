/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.exception.ValidationException;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Closed vector of the eight layer scores for one evaluated unit.
 *
 * <p>Every component lies in {@code [0, 1]}. Out-of-range or non-finite values are
 * rejected with a {@link ValidationException} naming the layer; nothing is clamped or
 * defaulted.
 */
public record LayerScoreVector(
        double base,
        double chain,
        double unit,
        double question,
        double dimension,
        double policy,
        double congruence,
        double meta) implements CanonicalForm {

    static final String FIELD = "scores";

    public LayerScoreVector {
        check(LayerId.BASE, base);
        check(LayerId.CHAIN, chain);
        check(LayerId.UNIT, unit);
        check(LayerId.QUESTION, question);
        check(LayerId.DIMENSION, dimension);
        check(LayerId.POLICY, policy);
        check(LayerId.CONGRUENCE, congruence);
        check(LayerId.META, meta);
    }

    /**
     * Builds a vector from a symbol-keyed map received at the service boundary.
     *
     * @param scores map from layer symbol (e.g. {@code @chain}) to score
     * @return validated vector
     * @throws ValidationException on a missing, unknown, null or out-of-range entry
     */
    public static LayerScoreVector fromSymbols(Map<String, Double> scores) {
        if (scores == null) {
            throw ValidationException.missingField(FIELD);
        }
        for (String key : scores.keySet()) {
            if (LayerId.fromSymbol(key).isEmpty()) {
                throw ValidationException.unexpectedField(fieldName(key), symbols());
            }
        }
        EnumMap<LayerId, Double> byLayer = new EnumMap<>(LayerId.class);
        for (LayerId layer : LayerId.values()) {
            Double value = scores.get(layer.symbol());
            if (value == null) {
                throw ValidationException.missingField(fieldName(layer.symbol()));
            }
            byLayer.put(layer, value);
        }
        return fromLayers(byLayer);
    }

    /**
     * Builds a vector from a complete layer map.
     *
     * @throws ValidationException if a layer is missing or out of range
     */
    public static LayerScoreVector fromLayers(Map<LayerId, Double> scores) {
        for (LayerId layer : LayerId.values()) {
            if (scores.get(layer) == null) {
                throw ValidationException.missingField(fieldName(layer.symbol()));
            }
        }
        return new LayerScoreVector(
                scores.get(LayerId.BASE),
                scores.get(LayerId.CHAIN),
                scores.get(LayerId.UNIT),
                scores.get(LayerId.QUESTION),
                scores.get(LayerId.DIMENSION),
                scores.get(LayerId.POLICY),
                scores.get(LayerId.CONGRUENCE),
                scores.get(LayerId.META));
    }

    public double get(LayerId layer) {
        return switch (layer) {
            case BASE -> base;
            case CHAIN -> chain;
            case UNIT -> unit;
            case QUESTION -> question;
            case DIMENSION -> dimension;
            case POLICY -> policy;
            case CONGRUENCE -> congruence;
            case META -> meta;
        };
    }

    /** Copy of this vector with one layer replaced. */
    public LayerScoreVector with(LayerId layer, double value) {
        EnumMap<LayerId, Double> copy = asMap();
        copy.put(layer, value);
        return fromLayers(copy);
    }

    public EnumMap<LayerId, Double> asMap() {
        EnumMap<LayerId, Double> map = new EnumMap<>(LayerId.class);
        for (LayerId layer : LayerId.values()) {
            map.put(layer, get(layer));
        }
        return map;
    }

    /** Scores keyed by wire symbol, in layer priority order. */
    public Map<String, Double> bySymbol() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (LayerId layer : LayerId.values()) {
            map.put(layer.symbol(), get(layer));
        }
        return map;
    }

    @Override
    public Map<String, Object> canonicalForm() {
        return new LinkedHashMap<>(bySymbol());
    }

    private static void check(LayerId layer, double value) {
        if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
            throw ValidationException.outOfRange(fieldName(layer.symbol()), value, 0.0, 1.0);
        }
    }

    private static String fieldName(String symbol) {
        return FIELD + "." + symbol;
    }

    private static String symbols() {
        return Arrays.stream(LayerId.values())
                .map(LayerId::symbol)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
