// file: src/main/java/io/trielite/core/VectorClock.java
package io.trielite.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable vector clock: a mapping from replicaId -> counter.
 * <p>
 * This is the causal metadata used to:
 *  - decide whether one version happened-before another,
 *  - detect concurrent writes from independent replicas, and
 *  - join the histories of two replicas during a merge.
 * <p>
 * Design:
 *  - Immutable: internal map is copied and wrapped as unmodifiable.
 *  - Missing entries count as 0, so {@code {}} and {@code {r1:0}} are equal.
 *  - Thread safe by construction (no internal mutation).
 */
public final class VectorClock {

    private static final VectorClock EMPTY = new VectorClock(Map.of());

    // Sorted so toString() and serialized forms are stable.
    private final Map<String, Integer> vv;

    /**
     * Create a new vector clock from the provided entries.
     * The input map is copied into a sorted, unmodifiable map.
     *
     * @throws IllegalArgumentException if any counter is negative
     */
    public VectorClock(Map<String, Integer> vv) {
        Objects.requireNonNull(vv, "vv");
        var copy = new TreeMap<String, Integer>();
        for (var e : vv.entrySet()) {
            String id = Objects.requireNonNull(e.getKey(), "replicaId");
            Integer counter = Objects.requireNonNull(e.getValue(), "counter");
            if (counter < 0) {
                throw new IllegalArgumentException("counter for " + id + " must be >= 0, got " + counter);
            }
            copy.put(id, counter);
        }
        this.vv = Collections.unmodifiableMap(copy);
    }

    /** Empty clock. */
    public static VectorClock empty() { return EMPTY; }

    /** Single-entry clock. */
    public static VectorClock of(String replicaId, int counter) {
        return new VectorClock(Map.of(replicaId, counter));
    }

    /** Current entries (read-only view, sorted by replica id). */
    public Map<String, Integer> entries() { return vv; }

    /** Counter for {@code replicaId}, 0 when absent. */
    public int get(String replicaId) { return vv.getOrDefault(replicaId, 0); }

    /**
     * Return a new VectorClock where {@code replicaId}'s counter is incremented by 1.
     * If the replica is not present yet, it is treated as 0 and becomes 1.
     */
    public VectorClock increment(String replicaId) {
        Objects.requireNonNull(replicaId, "replicaId");
        var m = new HashMap<>(vv);
        m.put(replicaId, m.getOrDefault(replicaId, 0) + 1);
        return new VectorClock(m);
    }

    /**
     * Pointwise maximum over the union of replica ids.
     * Commutative, associative and idempotent.
     */
    public VectorClock merge(VectorClock other) {
        Objects.requireNonNull(other, "other");
        if (other == this) return this;
        var m = new HashMap<>(vv);
        for (var e : other.vv.entrySet()) {
            m.merge(e.getKey(), e.getValue(), Math::max);
        }
        return new VectorClock(m);
    }

    /**
     * Compare this clock (A) to another clock (B) under the standard vector-clock order.
     * <p>
     * Missing entries are treated as 0. Intuition:
     *  - If A <= B elementwise and A != B, then B has seen everything A has
     *    plus at least one more event, so A happened before B.
     *  - If A is ahead on some entry and B on another, neither dominates and
     *    the clocks are concurrent.
     */
    public CausalOrder compare(VectorClock other) {
        Objects.requireNonNull(other, "other");
        boolean aGreater = false;
        boolean bGreater = false;

        var ids = new HashSet<String>(vv.keySet());
        ids.addAll(other.vv.keySet());

        for (var id : ids) {
            int a = get(id);
            int b = other.get(id);
            if (a > b) aGreater = true;
            if (a < b) bGreater = true;
            // Early exit: once both sides are ahead somewhere, it is concurrent
            if (aGreater && bGreater) return CausalOrder.CONCURRENT;
        }

        if (!aGreater && !bGreater) return CausalOrder.EQUAL;
        if (aGreater) return CausalOrder.AFTER;
        return CausalOrder.BEFORE;
    }

    /** Strict happens-before. */
    public boolean happensBefore(VectorClock other) {
        return compare(other) == CausalOrder.BEFORE;
    }

    public boolean concurrentWith(VectorClock other) {
        return compare(other) == CausalOrder.CONCURRENT;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VectorClock vc)) return false;
        return compare(vc) == CausalOrder.EQUAL;
    }

    @Override public int hashCode() {
        // Zero entries are ignored so equal clocks hash alike.
        int h = 0;
        for (var e : vv.entrySet()) {
            if (e.getValue() != 0) h += e.getKey().hashCode() ^ e.getValue();
        }
        return h;
    }

    @Override public String toString() { return vv.toString(); }
}
