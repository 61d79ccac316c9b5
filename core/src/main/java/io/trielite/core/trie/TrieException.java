package io.trielite.core.trie;

import java.util.List;

/**
 * Base type for errors raised by trie operations.
 * <p>
 * Every operation either returns a complete new root or throws before
 * producing one, so the input tree is always left valid.
 */
public class TrieException extends RuntimeException {

    private final List<String> path;

    public TrieException(String message, List<String> path) {
        super(message);
        this.path = List.copyOf(path);
    }

    /** Path the failing operation was addressed to. */
    public List<String> path() { return path; }
}
