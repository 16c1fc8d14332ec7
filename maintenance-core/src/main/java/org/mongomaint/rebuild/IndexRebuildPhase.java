package org.mongomaint.rebuild;

/**
 * Steps of a single index rebuild. {@link #FAILED} is reachable from every other phase.
 */
public enum IndexRebuildPhase {
    /** Deriving the covering key, name and options. */
    PLANNING,
    /** Creating (or validating a leftover) covering index. */
    COVERING,
    /** Covering index verified; the original may now be dropped. */
    COVERED,
    /** Original dropped, final index being built. */
    SWAPPING,
    SWAPPED,
    /** Checking the final index, then dropping the covering index. */
    VERIFYING,
    DONE,
    FAILED
}
