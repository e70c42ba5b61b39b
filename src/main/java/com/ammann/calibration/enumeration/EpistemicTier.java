/* (C)2026 */
package com.ammann.calibration.enumeration;

/**
 * Epistemic tiers of nodes in the dependency graph, ordered from raw observation to audit.
 *
 * <p>A value may flow from a lower tier into the primary computation of the same or a
 * higher tier. The reverse direction is a level inversion.
 */
public enum EpistemicTier {
    /** Observable facts extracted without interpretation. */
    EMPIRICAL(0),
    /** Probabilistic knowledge derived from empirical facts. */
    INFERENTIAL(1),
    /** Falsification and audit gates over the lower tiers. */
    AUDIT(2);

    private final int rank;

    EpistemicTier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Whether this tier sits strictly above {@code other} in the fixed ordering.
     *
     * @param other tier to compare against
     * @return {@code true} if this tier is more audited than {@code other}
     */
    public boolean isAbove(EpistemicTier other) {
        return rank > other.rank;
    }
}
