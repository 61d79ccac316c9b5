// file: src/main/java/io/trielite/core/codec/ValueCodec.java
package io.trielite.core.codec;

import io.trielite.core.trie.ConflictResolver;
import io.trielite.core.trie.TrieNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Decomposes compound values into nested trie paths and recomposes them.
 * <p>
 * Layout:
 *  - Scalar   -> one leaf, built by the caller-supplied leaf factory
 *                (plain or versioned).
 *  - Sequence -> Branch with segments "0".."n-1".
 *  - Mapping  -> Branch with one segment per key.
 * <p>
 * Reconstruction walks a branch bottom-up, drops children that hold no value
 * (emptied branches, versioned leaves resolving to a tombstone), and reads the
 * remaining children back as a Sequence when their segments are exactly
 * "0".."n-1", or as a Mapping otherwise.
 * A branch with nothing left reconstructs to "no value", not to an empty
 * mapping; presence is a separate question answered by {@code Tries.has}.
 */
public final class ValueCodec {

    private ValueCodec() {
        // utility
    }

    /**
     * Build the subtree for {@code value}.
     *
     * @param leaf factory used for every scalar reached
     */
    public static TrieNode decompose(TrieValue value, Function<TrieValue.Scalar, TrieNode> leaf) {
        if (value instanceof TrieValue.Scalar s) {
            return leaf.apply(s);
        }
        var children = new TreeMap<String, TrieNode>();
        if (value instanceof TrieValue.Sequence seq) {
            List<TrieValue> elements = seq.elements();
            for (int i = 0; i < elements.size(); i++) {
                children.put(Integer.toString(i), decompose(elements.get(i), leaf));
            }
        } else {
            ((TrieValue.Mapping) value).fields()
                    .forEach((k, v) -> children.put(k, decompose(v, leaf)));
        }
        return children.isEmpty() ? TrieNode.Branch.EMPTY : new TrieNode.Branch(children);
    }

    /** Reconstruct the value stored at {@code node}; empty when nothing is stored. */
    public static Optional<TrieValue> toValue(TrieNode node) {
        return toValue(node, ConflictResolver.DEFAULT);
    }

    /**
     * Reconstruct the value stored at {@code node}, collapsing the siblings of
     * every versioned leaf with {@code resolver}.
     */
    public static Optional<TrieValue> toValue(TrieNode node, ConflictResolver resolver) {
        if (node == null) return Optional.empty();
        if (node instanceof TrieNode.Leaf leaf) return Optional.of(leaf.value());
        if (node instanceof TrieNode.Versioned v) {
            return Optional.ofNullable(resolver.choose(v.siblings()).value());
        }

        var branch = (TrieNode.Branch) node;
        var present = new TreeMap<String, TrieValue>();
        branch.children().forEach((segment, child) ->
                toValue(child, resolver).ifPresent(v -> present.put(segment, v)));
        if (present.isEmpty()) return Optional.empty();

        if (isIndexRun(present)) {
            var elements = new ArrayList<TrieValue>(present.size());
            for (int i = 0; i < present.size(); i++) {
                elements.add(present.get(Integer.toString(i)));
            }
            return Optional.of(new TrieValue.Sequence(elements));
        }
        return Optional.of(new TrieValue.Mapping(present));
    }

    // Segments "0".."n-1" with no gaps and no alternative spellings such as "01".
    private static boolean isIndexRun(Map<String, TrieValue> present) {
        for (int i = 0; i < present.size(); i++) {
            if (!present.containsKey(Integer.toString(i))) return false;
        }
        return true;
    }
}
