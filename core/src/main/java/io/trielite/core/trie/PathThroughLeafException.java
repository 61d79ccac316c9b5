package io.trielite.core.trie;

import java.util.List;

/**
 * A write tried to descend through an existing leaf as if it were a branch.
 * The caller must overwrite the leaf first or pick a different path.
 */
public final class PathThroughLeafException extends TrieException {

    private final int leafDepth;

    public PathThroughLeafException(List<String> path, int leafDepth) {
        super("cannot descend through leaf at " + path.subList(0, leafDepth) + " while writing " + path, path);
        this.leafDepth = leafDepth;
    }

    /** Number of leading segments that address the blocking leaf. */
    public int leafDepth() { return leafDepth; }

    public List<String> leafPath() { return path().subList(0, leafDepth); }
}
