/* (C)2026 */
package com.ammann.calibration.enumeration;

/**
 * Final status of one evaluated unit.
 */
public enum DecisionStatus {
    /** The Choquet fusion produced a score. */
    FUSED,
    /** A triggered veto short-circuited fusion. */
    VETOED
}
