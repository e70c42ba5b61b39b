/* (C)2026 */
package com.ammann.calibration.model;

/**
 * Result of a bounded multiplicative combination.
 *
 * @param rawProduct product of the factors before clamping
 * @param value product clamped into {@code [lower, upper]}
 * @param clamped whether {@code value} differs from {@code rawProduct}
 */
public record ClampResult(double rawProduct, double value, boolean clamped, double lower, double upper) {}
