// file: src/main/java/io/trielite/core/Container.java
package io.trielite.core;

import io.trielite.core.codec.TrieValue;
import io.trielite.core.merge.MergeConfig;
import io.trielite.core.merge.TrieMerger;
import io.trielite.core.trie.ConflictResolver;
import io.trielite.core.trie.TrieNode;
import io.trielite.core.trie.Tries;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One replica's view of the shared state: a trie root plus the replica's vector clock.
 * <p>
 * This is the unit replicas exchange and merge.
 * <p>
 * Invariants:
 *  - Immutable. Every local write returns a new Container whose version is the
 *    old one incremented by exactly 1 at {@link #id()}; the old Container stays
 *    valid for whoever still holds it (history, in-flight exchange).
 *  - A replica only ever increments its own clock entry.
 *  - Versioned leaves (and tombstones) written through a Container use its
 *    id as replica id.
 */
public final class Container {

    private final String id;
    private final TrieNode root;
    private final VectorClock version;

    public Container(String id, TrieNode root, VectorClock version) {
        this.id = Objects.requireNonNull(id, "id");
        this.root = Objects.requireNonNull(root, "root");
        this.version = Objects.requireNonNull(version, "version");
        if (id.isBlank()) throw new IllegalArgumentException("id must not be blank");
    }

    /** Fresh container: empty root, version {id: 0}. */
    public static Container create(String id) {
        return new Container(id, Tries.empty(), VectorClock.of(id, 0));
    }

    public String id() { return id; }

    public TrieNode root() { return root; }

    public VectorClock version() { return version; }

    // ----------------- reads -----------------

    public Optional<TrieNode> get(List<String> path) {
        return Tries.get(root, path);
    }

    public boolean has(List<String> path) {
        return Tries.has(root, path);
    }

    /** Value reconstructed at {@code path}, empty if absent or valueless. */
    public Optional<TrieValue> valueAt(List<String> path) {
        return Tries.valueAt(root, path);
    }

    public Optional<TrieValue> valueAt(List<String> path, ConflictResolver resolver) {
        return Tries.valueAt(root, path, resolver);
    }

    /** Whole state reconstructed as one value. */
    public Optional<TrieValue> toValue() {
        return Tries.toValue(root);
    }

    // ----------------- local writes -----------------

    public Container setValue(List<String> path, Object payload) {
        return next(Tries.setValue(root, path, payload));
    }

    public Container setContainer(List<String> path, Object payload) {
        return next(Tries.setContainer(root, path, payload, id));
    }

    public Container updateValue(List<String> path, Object payload) {
        return next(Tries.updateValue(root, path, payload, id));
    }

    public Container removeValue(List<String> path) {
        return next(Tries.removeValue(root, path, id));
    }

    public Container removePath(List<String> path) {
        return next(Tries.removePath(root, path));
    }

    // ----------------- merge -----------------

    /** Merge with default config; see {@link TrieMerger#merge(Container, Container)}. */
    public Container merge(Container other) {
        return new TrieMerger().merge(this, other);
    }

    public Container merge(Container other, MergeConfig config) {
        return new TrieMerger(config).merge(this, other);
    }

    /** Same root and version, ignoring which replica owns the view. */
    public boolean sameState(Container other) {
        return other != null && root.equals(other.root) && version.equals(other.version);
    }

    private Container next(TrieNode newRoot) {
        return new Container(id, newRoot, version.increment(id));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Container c)) return false;
        return id.equals(c.id) && sameState(c);
    }

    @Override public int hashCode() { return Objects.hash(id, root, version); }

    @Override public String toString() {
        return "Container{id=" + id + ", version=" + version + ", root=" + root + "}";
    }
}
