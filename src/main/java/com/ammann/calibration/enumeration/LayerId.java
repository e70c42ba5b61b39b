/* (C)2026 */
package com.ammann.calibration.enumeration;

import java.util.Arrays;
import java.util.Optional;

/**
 * The eight quality layers that contribute to a fused calibration score.
 *
 * <p>Declaration order is the fixed layer priority used to break ties between veto
 * results of equal specificity: earlier constants win.
 */
public enum LayerId {
    /** Intrinsic base quality of a method (theory, implementation, deployment). */
    BASE("@b"),
    /** Compatibility of a method with its position in the processing chain. */
    CHAIN("@chain"),
    /** Quality of the unit of analysis (document coverage and structure). */
    UNIT("@u"),
    /** Appropriateness of the method for the question being answered. */
    QUESTION("@q"),
    /** Alignment with the analytical dimension. */
    DIMENSION("@d"),
    /** Fit with the policy area. */
    POLICY("@p"),
    /** Congruence with the governing contract. */
    CONGRUENCE("@C"),
    /** Meta/governance quality. */
    META("@m");

    private final String symbol;

    LayerId(String symbol) {
        this.symbol = symbol;
    }

    /** Wire symbol of the layer, e.g. {@code @chain}. */
    public String symbol() {
        return symbol;
    }

    /**
     * Tie-break priority for veto ordering. Lower values take precedence.
     *
     * @return zero-based priority rank
     */
    public int priority() {
        return ordinal();
    }

    /**
     * Resolves a layer from its wire symbol. Matching is exact: {@code @C} and
     * {@code @c} are different symbols.
     *
     * @param symbol layer symbol such as {@code @b}
     * @return the matching layer, or empty when the symbol is unknown
     */
    public static Optional<LayerId> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(l -> l.symbol.equals(symbol)).findFirst();
    }
}
