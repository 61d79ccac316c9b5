package io.trielite.core.trie;

import java.util.List;

/**
 * updateValue was pointed at content that carries no version to advance
 * (a plain leaf, or a subtree holding one).
 */
public final class TypeMismatchException extends TrieException {

    public TypeMismatchException(List<String> path, String found) {
        super("expected versioned content at " + path + " but found " + found, path);
    }
}
