// file: src/main/java/io/trielite/core/trie/TrieNode.java
package io.trielite.core.trie;

import io.trielite.core.VectorClock;
import io.trielite.core.codec.TrieValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Structural unit of the persistent trie.
 * <p>
 * A node is one of:
 *  - Branch:    segment -> child node.
 *  - Leaf:      an immutable scalar with no causal metadata. Two leaves with
 *               equal payloads are interchangeable.
 *  - Versioned: scalar versions, each with the vector clock of the write that
 *               produced it. This is what concurrent replicas reconcile against;
 *               a version without a payload is a tombstone.
 * <p>
 * Invariants:
 *  - Nodes are never mutated after construction. Every write allocates new
 *    ancestors and reuses untouched children by reference, so any number of
 *    roots can share subtrees and be read without locking.
 *  - Equality is structural.
 */
public sealed interface TrieNode permits TrieNode.Branch, TrieNode.Leaf, TrieNode.Versioned {

    boolean isLeaf();

    /** Interior node. Children are kept sorted by segment for stable iteration. */
    record Branch(SortedMap<String, TrieNode> children) implements TrieNode {

        /** Canonical empty tree. */
        public static final Branch EMPTY = new Branch(new TreeMap<>());

        public Branch {
            Objects.requireNonNull(children, "children");
            children = Collections.unmodifiableSortedMap(new TreeMap<>(children));
        }

        @Override public boolean isLeaf() { return false; }

        public boolean isEmpty() { return children.isEmpty(); }

        /** Child at {@code segment}, or null. */
        public TrieNode child(String segment) { return children.get(segment); }

        public Branch with(String segment, TrieNode child) {
            Objects.requireNonNull(segment, "segment");
            Objects.requireNonNull(child, "child");
            if (children.get(segment) == child) return this;
            var next = new TreeMap<>(children);
            next.put(segment, child);
            return new Branch(next);
        }

        public Branch without(String segment) {
            if (!children.containsKey(segment)) return this;
            var next = new TreeMap<>(children);
            next.remove(segment);
            return next.isEmpty() ? EMPTY : new Branch(next);
        }

        /**
         * True if at least one value is reachable from here.
         * A branch without any is what removeValue leaves behind.
         */
        public boolean hasValue() {
            for (TrieNode child : children.values()) {
                if (child instanceof Leaf) return true;
                if (child instanceof Versioned v && v.hasValue()) return true;
                if (child instanceof Branch b && b.hasValue()) return true;
            }
            return false;
        }

        @Override public String toString() { return "Branch" + children; }
    }

    record Leaf(TrieValue.Scalar value) implements TrieNode {
        public Leaf {
            Objects.requireNonNull(value, "value");
        }

        @Override public boolean isLeaf() { return true; }
    }

    /**
     * Causally tracked leaf: one or more mutually concurrent versions.
     * <p>
     * Usually a single sibling. Merging two leaves whose clocks are concurrent
     * keeps both, the way a key keeps siblings in a Dynamo-style store, so a
     * later write that has seen one of them can still supersede exactly that
     * one. A reader collapses the siblings with a {@link ConflictResolver}; the
     * next {@code updateValue} replaces them all.
     * <p>
     * Invariants:
     *  - Non-empty; no sibling's clock dominates another's.
     *  - Siblings are kept in {@link ConflictResolver.ReplicaOrder} order, so
     *    equal sibling sets give equal nodes.
     */
    record Versioned(List<Sibling> siblings) implements TrieNode {
        public Versioned {
            Objects.requireNonNull(siblings, "siblings");
            if (siblings.isEmpty()) throw new IllegalArgumentException("siblings must not be empty");
            var sorted = new ArrayList<>(siblings);
            sorted.sort(ConflictResolver.ReplicaOrder.PRECEDENCE);
            siblings = List.copyOf(sorted);
        }

        public Versioned(TrieValue.Scalar value, VectorClock version) {
            this(List.of(new Sibling(Objects.requireNonNull(value, "value"), version)));
        }

        /** Removal marker that replicates like a write. */
        public static Versioned tombstone(VectorClock version) {
            return new Versioned(List.of(new Sibling(null, version)));
        }

        @Override public boolean isLeaf() { return true; }

        /** Join of every sibling's clock. */
        public VectorClock version() {
            VectorClock joined = siblings.get(0).version();
            for (int i = 1; i < siblings.size(); i++) {
                joined = joined.merge(siblings.get(i).version());
            }
            return joined;
        }

        public boolean isConflicted() { return siblings.size() > 1; }

        /** True unless every sibling is a tombstone. */
        public boolean hasValue() {
            for (Sibling s : siblings) {
                if (!s.isTombstone()) return true;
            }
            return false;
        }

        /** Value picked by the default resolver; empty if that pick is a tombstone. */
        public Optional<TrieValue.Scalar> value() {
            return Optional.ofNullable(ConflictResolver.DEFAULT.choose(siblings).value());
        }
    }

    /**
     * One version of a versioned leaf.
     *
     * @param value   payload, null when this version is a tombstone
     * @param version clock of the write that produced it
     */
    record Sibling(TrieValue.Scalar value, VectorClock version) {
        public Sibling {
            Objects.requireNonNull(version, "version");
        }

        public boolean isTombstone() { return value == null; }
    }
}
