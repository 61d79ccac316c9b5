// file: src/main/java/io/trielite/core/trie/Tries.java
package io.trielite.core.trie;

import io.trielite.core.VectorClock;
import io.trielite.core.codec.TrieValue;
import io.trielite.core.codec.ValueCodec;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Path-addressed operations over immutable trie roots.
 * <p>
 * All functions are pure: they take a root and return a new root, leaving the
 * input untouched. A write rebuilds only the branches along its path (O(depth)
 * new nodes); every sibling subtree is carried over by reference.
 * <p>
 * Payloads are plain Java values or {@link TrieValue}s. Compound payloads are
 * decomposed by {@link ValueCodec} so each element gets its own path.
 */
public final class Tries {

    private Tries() {
        // utility
    }

    /** Canonical empty tree. */
    public static TrieNode empty() {
        return TrieNode.Branch.EMPTY;
    }

    /**
     * Node at {@code path}, walking branch children segment by segment.
     * Empty if a segment is missing or an intermediate node is a leaf.
     */
    public static Optional<TrieNode> get(TrieNode root, List<String> path) {
        Objects.requireNonNull(path, "path");
        TrieNode node = root;
        for (String segment : path) {
            if (!(node instanceof TrieNode.Branch branch)) return Optional.empty();
            node = branch.child(segment);
            if (node == null) return Optional.empty();
        }
        return Optional.ofNullable(node);
    }

    /**
     * True iff a node (leaf or branch, valued or not) exists at {@code path}.
     * For the empty path this asks whether the tree holds anything at all.
     */
    public static boolean has(TrieNode root, List<String> path) {
        if (path.isEmpty()) {
            return !(root instanceof TrieNode.Branch b && b.isEmpty());
        }
        return get(root, path).isPresent();
    }

    /** Reconstruct the value at {@code path}; empty if absent or valueless. */
    public static Optional<TrieValue> valueAt(TrieNode root, List<String> path) {
        return valueAt(root, path, ConflictResolver.DEFAULT);
    }

    /** As {@link #valueAt(TrieNode, List)}, collapsing sibling versions with {@code resolver}. */
    public static Optional<TrieValue> valueAt(TrieNode root, List<String> path, ConflictResolver resolver) {
        return get(root, path).flatMap(node -> ValueCodec.toValue(node, resolver));
    }

    public static Optional<TrieValue> toValue(TrieNode node) {
        return ValueCodec.toValue(node);
    }

    /**
     * Write {@code payload} at {@code path} as plain, unversioned leaves.
     *
     * @throws PathThroughLeafException if an ancestor of {@code path} is a leaf
     */
    public static TrieNode setValue(TrieNode root, List<String> path, Object payload) {
        TrieValue value = TrieValue.of(payload);
        return rewrite(root, path, 0, existing -> ValueCodec.decompose(value, TrieNode.Leaf::new));
    }

    /**
     * Write {@code payload} at {@code path} as versioned leaves starting a fresh
     * causal history: every leaf gets version {replicaId: 1}.
     *
     * @throws PathThroughLeafException if an ancestor of {@code path} is a leaf
     */
    public static TrieNode setContainer(TrieNode root, List<String> path, Object payload, String replicaId) {
        Objects.requireNonNull(replicaId, "replicaId");
        TrieValue value = TrieValue.of(payload);
        VectorClock fresh = VectorClock.of(replicaId, 1);
        return rewrite(root, path, 0, existing -> versioned(value, fresh));
    }

    /**
     * Replace the versioned content at {@code path} and advance its version at
     * {@code replicaId}.
     * <p>
     * Cases:
     *  - absent or valueless: behaves like {@link #setContainer}.
     *  - Versioned leaf:      version = old.increment(replicaId), where old joins
     *                         every sibling (tombstones included), so the write
     *                         supersedes them all.
     *  - Branch of versioned leaves (a decomposed compound): version is the merge
     *    of all leaf versions, incremented at {@code replicaId}.
     *
     * @throws TypeMismatchException if the target is, or contains, a plain leaf
     * @throws PathThroughLeafException if an ancestor of {@code path} is a leaf
     */
    public static TrieNode updateValue(TrieNode root, List<String> path, Object payload, String replicaId) {
        Objects.requireNonNull(replicaId, "replicaId");
        TrieValue value = TrieValue.of(payload);
        return rewrite(root, path, 0, existing -> {
            VectorClock base = existingVersion(existing, path);
            VectorClock next = base == null ? VectorClock.of(replicaId, 1) : base.increment(replicaId);
            return versioned(value, next);
        });
    }

    /**
     * Clear every value at and below {@code path} while keeping the structure,
     * so the path stays addressable but reconstructs to no value. Absent paths
     * are a no-op.
     * <p>
     * Plain leaves become empty branches. Versioned leaves become tombstones
     * whose clock is the removed leaf's clock incremented at {@code replicaId},
     * so the removal supersedes exactly the versions it has seen when replicas
     * merge.
     */
    public static TrieNode removeValue(TrieNode root, List<String> path, String replicaId) {
        Objects.requireNonNull(replicaId, "replicaId");
        if (get(root, path).isEmpty()) return root;
        return rewrite(root, path, 0, existing -> clearValues(existing, replicaId));
    }

    /**
     * Remove the node at {@code path} and prune every ancestor branch that is
     * left empty. Absent paths are a no-op; removing everything yields
     * {@link #empty()}.
     */
    public static TrieNode removePath(TrieNode root, List<String> path) {
        if (get(root, path).isEmpty()) return root;
        if (path.isEmpty()) return empty();
        TrieNode pruned = prune((TrieNode.Branch) root, path, 0);
        return pruned == null ? empty() : pruned;
    }

    // ----------------- helpers -----------------

    private static TrieNode rewrite(TrieNode node, List<String> path, int depth, UnaryOperator<TrieNode> change) {
        if (depth == path.size()) return change.apply(node);
        // A tombstone holds nothing to descend into; writing below it replaces it.
        if (node == null || node instanceof TrieNode.Versioned v && !v.hasValue()) node = TrieNode.Branch.EMPTY;
        if (!(node instanceof TrieNode.Branch branch)) {
            throw new PathThroughLeafException(path, depth);
        }
        String segment = Objects.requireNonNull(path.get(depth), "path segment");
        return branch.with(segment, rewrite(branch.child(segment), path, depth + 1, change));
    }

    // Returns null when the branch ends up empty so the caller drops it too.
    private static TrieNode prune(TrieNode.Branch branch, List<String> path, int depth) {
        String segment = path.get(depth);
        TrieNode.Branch next;
        if (depth == path.size() - 1) {
            next = branch.without(segment);
        } else {
            TrieNode child = prune((TrieNode.Branch) branch.child(segment), path, depth + 1);
            next = child == null ? branch.without(segment) : branch.with(segment, child);
        }
        return next.isEmpty() ? null : next;
    }

    private static TrieNode clearValues(TrieNode node, String replicaId) {
        if (node instanceof TrieNode.Leaf) return TrieNode.Branch.EMPTY;
        if (node instanceof TrieNode.Versioned v) {
            return v.hasValue() ? TrieNode.Versioned.tombstone(v.version().increment(replicaId)) : v;
        }
        var branch = (TrieNode.Branch) node;
        if (!branch.hasValue()) return branch;
        var children = new TreeMap<String, TrieNode>();
        branch.children().forEach((segment, child) -> children.put(segment, clearValues(child, replicaId)));
        return new TrieNode.Branch(children);
    }

    private static TrieNode versioned(TrieValue value, VectorClock version) {
        return ValueCodec.decompose(value, s -> new TrieNode.Versioned(s, version));
    }

    // Joined version of the versioned content under node, or null when there is none.
    private static VectorClock existingVersion(TrieNode node, List<String> path) {
        if (node == null) return null;
        if (node instanceof TrieNode.Versioned v) return v.version();
        if (node instanceof TrieNode.Leaf) {
            throw new TypeMismatchException(path, "an unversioned value");
        }
        VectorClock joined = null;
        for (TrieNode child : ((TrieNode.Branch) node).children().values()) {
            VectorClock c = existingVersion(child, path);
            if (c != null) joined = joined == null ? c : joined.merge(c);
        }
        return joined;
    }
}
