/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.enumeration.LayerId;
import com.ammann.calibration.exception.WeightNormalizationException;
import java.util.Comparator;
import java.util.Objects;

/**
 * Unordered pair of distinct layers. Stored with the higher-priority layer first so
 * that {@code (a, b)} and {@code (b, a)} are equal.
 */
public record LayerPair(LayerId first, LayerId second) {

    /** By first layer priority, then second. */
    public static final Comparator<LayerPair> ORDER =
            Comparator.comparingInt((LayerPair p) -> p.first().priority())
                    .thenComparingInt(p -> p.second().priority());

    public LayerPair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first == second) {
            throw new WeightNormalizationException(
                    "Interaction pair must join two distinct layers, got " + first.symbol() + " twice");
        }
        if (first.priority() > second.priority()) {
            LayerId swap = first;
            first = second;
            second = swap;
        }
    }

    public static LayerPair of(LayerId a, LayerId b) {
        return new LayerPair(a, b);
    }

    public boolean contains(LayerId layer) {
        return first == layer || second == layer;
    }

    /** Wire key such as {@code @chain,@u}. */
    public String key() {
        return first.symbol() + "," + second.symbol();
    }

    @Override
    public String toString() {
        return "(" + key() + ")";
    }
}
