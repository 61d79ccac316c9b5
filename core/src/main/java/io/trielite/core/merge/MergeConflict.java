package io.trielite.core.merge;

import io.trielite.core.trie.TrieNode;

import java.util.List;

/**
 * Soft conflict observed while merging two tries.
 * <p>
 * The merge has already resolved it deterministically by the time a listener
 * sees it; this is a side channel for audit and telemetry, never an error.
 *
 * @param path   location of the conflicting nodes
 * @param kind   what kind of disagreement it was
 * @param left   node from the left (existing) side
 * @param right  node from the right (incoming) side
 * @param chosen node that ended up in the merged tree
 */
public record MergeConflict(List<String> path, Kind kind, TrieNode left, TrieNode right, TrieNode chosen) {

    public MergeConflict {
        path = List.copyOf(path);
    }

    public enum Kind {
        /** Two unversioned leaves, or two versions with equal clocks, carrying different payloads. */
        VALUE,
        /** Versions with concurrent clocks from both sides, now kept as siblings. */
        CONCURRENT,
        /** A leaf on one side and a branch, or a different leaf kind, on the other. */
        STRUCTURAL
    }
}
