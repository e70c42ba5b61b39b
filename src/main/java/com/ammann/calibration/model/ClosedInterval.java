/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import com.ammann.calibration.exception.OutOfBoundsException;
import java.util.Map;

/**
 * Closed real interval {@code [lower, upper]}.
 *
 * @param lower inclusive lower bound
 * @param upper inclusive upper bound, never below {@code lower}
 */
public record ClosedInterval(double lower, double upper) implements CanonicalForm {

    /** The unit interval {@code [0, 1]}. */
    public static final ClosedInterval UNIT = new ClosedInterval(0.0, 1.0);

    public ClosedInterval {
        if (!Double.isFinite(lower) || !Double.isFinite(upper)) {
            throw new OutOfBoundsException(
                    String.format("Interval bounds must be finite, got [%s, %s]", lower, upper));
        }
        if (lower > upper) {
            throw new OutOfBoundsException(
                    String.format("Interval lower bound %s exceeds upper bound %s", lower, upper));
        }
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    @Override
    public Map<String, Object> canonicalForm() {
        return Map.of("lower", lower, "upper", upper);
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + "]";
    }
}
