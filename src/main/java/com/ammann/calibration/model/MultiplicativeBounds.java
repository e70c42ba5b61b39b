/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import com.ammann.calibration.exception.OutOfBoundsException;
import java.util.Map;

/**
 * Closed interval {@code [min, max]} that every certified multiplicative combination is
 * clamped into. Both bounds are strictly positive.
 */
public record MultiplicativeBounds(double min, double max) implements CanonicalForm {

    public static final MultiplicativeBounds DEFAULT = new MultiplicativeBounds(0.01, 10.0);

    public MultiplicativeBounds {
        if (!Double.isFinite(min) || !Double.isFinite(max) || min <= 0.0 || min > max) {
            throw new OutOfBoundsException(String.format(
                    "Multiplicative bounds [%s, %s] must satisfy 0 < min <= max", min, max));
        }
    }

    @Override
    public Map<String, Object> canonicalForm() {
        return Map.of("min", min, "max", max);
    }
}
