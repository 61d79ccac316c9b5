// file: src/main/java/io/trielite/core/merge/TrieMerger.java
package io.trielite.core.merge;

import io.trielite.core.CausalOrder;
import io.trielite.core.Container;
import io.trielite.core.VectorClock;
import io.trielite.core.trie.ConflictResolver;
import io.trielite.core.trie.TrieNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Reconciles two tries, or two containers, into one.
 * <p>
 * Rules, applied recursively from the roots:
 *  - One side absent: the other side, as-is.
 *  - Branch/Branch:   union of segments; shared segments merge recursively.
 *  - Versioned/Versioned: the siblings of both sides are pooled and only the
 *                     maximal ones kept, i.e. those whose clock no other
 *                     sibling dominates. Tombstones take part like values.
 *                     Two versions with equal clocks but different payloads
 *                     keep the one {@link ConflictResolver.ReplicaOrder} ranks first.
 *  - Leaf/Leaf:       equal payloads are interchangeable; otherwise the
 *                     {@link ValueConflictPolicy} decides (order dependent).
 *  - Mixed kinds:     a side holding a value beats a side holding none; between
 *                     two valued sides a branch beats a leaf and a versioned
 *                     leaf beats a plain one; between two valueless sides a
 *                     tombstone beats an empty branch, since it carries a clock.
 * <p>
 * Keeping the maximal siblings is a set union followed by a dominance filter,
 * so merging tries of branches and versioned leaves is commutative,
 * associative and idempotent. Subtrees only one side has, and subtrees a
 * merge leaves unchanged, are reused by reference.
 */
public final class TrieMerger {
    private static final Logger log = Logger.getLogger(TrieMerger.class.getName());

    private final MergeConfig config;

    public TrieMerger() {
        this(MergeConfig.defaults());
    }

    public TrieMerger(MergeConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public MergeConfig config() {
        return config;
    }

    /** Merge two tries; either may be null (absent). */
    public TrieNode merge(TrieNode left, TrieNode right) {
        return merge(left, right, new ArrayList<>());
    }

    /**
     * Merge two containers.
     * <p>
     *  - Same id: the not-BEFORE side is returned as-is. A concurrent pair means
     *    the replica was forked; it is merged structurally and a warning logged.
     *  - Different ids: clocks joined, tries merged, the left (initiating) id kept.
     */
    public Container merge(Container left, Container right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");

        if (left.id().equals(right.id())) {
            CausalOrder order = left.version().compare(right.version());
            switch (order) {
                case BEFORE -> { return right; }
                case AFTER, EQUAL -> { return left; }
                default -> log.warning(String.format(
                        "replica %s has concurrent versions %s and %s; merging structurally",
                        left.id(), left.version(), right.version()));
            }
        }

        VectorClock version = left.version().merge(right.version());
        TrieNode root = merge(left.root(), right.root());
        return new Container(left.id(), root, version);
    }

    // ----------------- recursion -----------------

    private TrieNode merge(TrieNode a, TrieNode b, List<String> path) {
        if (a == null) return b;
        if (b == null || a == b) return a;

        if (a instanceof TrieNode.Branch ba && b instanceof TrieNode.Branch bb) {
            return mergeBranches(ba, bb, path);
        }
        if (a instanceof TrieNode.Versioned va && b instanceof TrieNode.Versioned vb) {
            return mergeVersioned(va, vb, path);
        }
        if (a instanceof TrieNode.Leaf la && b instanceof TrieNode.Leaf lb) {
            if (la.equals(lb)) return a;
            TrieNode chosen = config.valuePolicy().choose(la, lb);
            report(path, MergeConflict.Kind.VALUE, a, b, chosen);
            return chosen;
        }
        return mergeMixed(a, b, path);
    }

    private TrieNode mergeBranches(TrieNode.Branch a, TrieNode.Branch b, List<String> path) {
        var children = new TreeMap<>(a.children());
        boolean changed = false;
        for (var e : b.children().entrySet()) {
            String segment = e.getKey();
            TrieNode mine = a.child(segment);
            path.add(segment);
            TrieNode merged = merge(mine, e.getValue(), path);
            path.remove(path.size() - 1);
            if (merged != mine) {
                children.put(segment, merged);
                changed = true;
            }
        }
        if (!changed) return a;
        if (sameChildren(children, b)) return b;
        return new TrieNode.Branch(children);
    }

    private TrieNode mergeVersioned(TrieNode.Versioned a, TrieNode.Versioned b, List<String> path) {
        var candidates = new ArrayList<>(a.siblings());
        for (TrieNode.Sibling s : b.siblings()) {
            if (!candidates.contains(s)) candidates.add(s);
        }

        // Keep the maximal siblings under the vector-clock order.
        var maximal = new ArrayList<TrieNode.Sibling>(candidates.size());
        boolean sameClockClash = false;
        outer:
        for (int i = 0; i < candidates.size(); i++) {
            var si = candidates.get(i);
            for (int j = 0; j < candidates.size(); j++) {
                if (i == j) continue;
                var sj = candidates.get(j);
                CausalOrder order = sj.version().compare(si.version());
                if (order == CausalOrder.AFTER) continue outer;
                if (order == CausalOrder.EQUAL) {
                    sameClockClash = true;
                    if (ConflictResolver.ReplicaOrder.PRECEDENCE.compare(sj, si) < 0) continue outer;
                }
            }
            maximal.add(si);
        }

        var merged = new TrieNode.Versioned(maximal);
        TrieNode result = merged.equals(a) ? a : merged.equals(b) ? b : merged;
        if (sameClockClash) {
            report(path, MergeConflict.Kind.VALUE, a, b, result);
        } else if (result == merged && merged.isConflicted()) {
            report(path, MergeConflict.Kind.CONCURRENT, a, b, merged);
        }
        return result;
    }

    private TrieNode mergeMixed(TrieNode a, TrieNode b, List<String> path) {
        boolean aValued = holdsValue(a);
        boolean bValued = holdsValue(b);
        // One side holds nothing (a removeValue result): nothing is lost either way.
        if (aValued != bValued) return aValued ? a : b;
        if (!aValued) return a instanceof TrieNode.Versioned ? a : b;

        TrieNode chosen = rank(a) > rank(b) ? a : b;
        report(path, MergeConflict.Kind.STRUCTURAL, a, b, chosen);
        return chosen;
    }

    private static boolean holdsValue(TrieNode node) {
        if (node instanceof TrieNode.Branch branch) return branch.hasValue();
        if (node instanceof TrieNode.Versioned v) return v.hasValue();
        return true;
    }

    private static int rank(TrieNode node) {
        if (node instanceof TrieNode.Branch) return 2;
        if (node instanceof TrieNode.Versioned) return 1;
        return 0;
    }

    private static boolean sameChildren(TreeMap<String, TrieNode> children, TrieNode.Branch b) {
        if (children.size() != b.children().size()) return false;
        for (var e : children.entrySet()) {
            if (b.child(e.getKey()) != e.getValue()) return false;
        }
        return true;
    }

    private void report(List<String> path, MergeConflict.Kind kind, TrieNode a, TrieNode b, TrieNode chosen) {
        config.listener().onConflict(new MergeConflict(path, kind, a, b, chosen));
    }
}
