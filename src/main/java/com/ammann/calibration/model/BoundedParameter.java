/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.canonical.CanonicalForm;
import com.ammann.calibration.exception.CalibrationException;
import com.ammann.calibration.exception.OutOfBoundsException;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable calibrated scalar that must lie inside its closed interval.
 *
 * <p>A value outside the bounds is a construction error. It is never clamped.
 *
 * @param name parameter name, unique within its layer
 * @param value calibrated value
 * @param bounds admissible interval for {@code value}
 */
public record BoundedParameter(String name, double value, ClosedInterval bounds)
        implements CanonicalForm {

    public BoundedParameter {
        if (name == null || name.isBlank()) {
            throw new CalibrationException("Bounded parameter requires a non-blank name");
        }
        Objects.requireNonNull(bounds, "bounds");
        if (Double.isNaN(value) || !bounds.contains(value)) {
            throw new OutOfBoundsException(name, value, bounds.lower(), bounds.upper());
        }
    }

    public static BoundedParameter of(String name, double value, double lower, double upper) {
        return new BoundedParameter(name, value, new ClosedInterval(lower, upper));
    }

    @Override
    public Map<String, Object> canonicalForm() {
        return Map.of("name", name, "value", value, "bounds", bounds);
    }
}
