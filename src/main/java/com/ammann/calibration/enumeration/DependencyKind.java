/* (C)2026 */
package com.ammann.calibration.enumeration;

/**
 * Nature of a dependency edge in the calibration dependency graph.
 */
public enum DependencyKind {
    /** The source value is consumed by the target's primary computation. */
    PRIMARY,
    /** The source is an audit gate allowed to veto the target; its value is not consumed. */
    VETO
}
