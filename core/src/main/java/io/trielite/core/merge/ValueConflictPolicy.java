package io.trielite.core.merge;

import io.trielite.core.trie.TrieNode;

/**
 * Resolution for two unversioned leaves that disagree.
 * <p>
 * Plain leaves carry no causal metadata, so whichever policy is picked the
 * result depends on argument order: merge(a, b) and merge(b, a) can differ.
 * Keep data that must converge under arbitrary exchange order in versioned leaves.
 */
public enum ValueConflictPolicy {

    /** The right-hand (incoming) argument wins. */
    INCOMING_WINS,

    /** The left-hand (existing) argument wins. */
    EXISTING_WINS;

    TrieNode.Leaf choose(TrieNode.Leaf existing, TrieNode.Leaf incoming) {
        return this == INCOMING_WINS ? incoming : existing;
    }
}
