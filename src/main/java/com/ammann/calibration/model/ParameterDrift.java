/* (C)2026 */
package com.ammann.calibration.model;

import com.ammann.calibration.enumeration.DriftSeverity;

/**
 * Change of one parameter between two versions of a layer.
 *
 * @param driftRatio {@code |new - old| / |old|}, or the absolute difference when
 *     {@code old} is close to zero
 */
public record ParameterDrift(
        String name, double previousValue, double currentValue, double driftRatio, DriftSeverity severity) {}
