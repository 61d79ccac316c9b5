// file: src/main/java/io/trielite/core/CausalOrder.java
package io.trielite.core;

/**
 * Partial order between two vector clocks.
 * <p>
 * Interpretation for A.compare(B):
 *  - EQUAL:      A and B have identical counters (absent = 0).
 *  - BEFORE:     A happened before B: every counter of A is <= B's and at
 *                least one is strictly smaller.
 *  - AFTER:      symmetric to BEFORE.
 *  - CONCURRENT: neither dominates the other (independent writes).
 */
public enum CausalOrder {
    EQUAL, BEFORE, AFTER, CONCURRENT;

    /**
     * Return the "perspective" if we swap the left/right arguments.
     * Useful in tests to assert symmetry.
     */
    public CausalOrder swap() {
        return switch (this) {
            case BEFORE -> AFTER;
            case AFTER -> BEFORE;
            default -> this;
        };
    }
}
