/* (C)2026 */
package com.ammann.calibration.enumeration;

import com.ammann.calibration.exception.ValidationException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Closed set of evaluation roles. Each role selects exactly one fusion weight set.
 */
public enum FusionRole {
    /** Question-level executors producing micro scores. */
    EXECUTOR,
    /** Policy-area clusters aggregating executor outputs. */
    CLUSTER,
    /** Dimension-level aggregation steps. */
    AGGREGATE,
    /** Report assembly steps. */
    REPORT;

    /**
     * Parses a role identifier received from a caller.
     *
     * @param value role name, case-insensitive
     * @return the matching role
     * @throws ValidationException if the value does not name a role
     */
    public static FusionRole parse(String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingField("role");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ValidationException.invalidParameter("role", value, "one of " + names());
        }
    }

    static String names() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", ", "[", "]"));
    }
}
