// file: src/main/java/io/trielite/core/trie/PersistentArray.java
package io.trielite.core.trie;

import io.trielite.core.codec.TrieValue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * Immutable array on top of the trie: element i lives at segment "i" of a
 * branch, so a trie holding a sequence and a PersistentArray share one layout
 * and {@link #root()} can be written into a container as-is.
 * <p>
 * Every update returns a new array that shares all untouched elements with
 * the old one. Elements are plain (unversioned) values; a compound element is
 * decomposed like any other trie value.
 * <p>
 * Invariants:
 *  - Indices 0..size-1 are all present; there are no holes.
 *  - Elements are never empty compounds, which would read back as a hole.
 */
public final class PersistentArray implements Iterable<TrieValue> {

    private static final PersistentArray EMPTY = new PersistentArray(Tries.empty(), 0);

    private final TrieNode root;
    private final int size;

    private PersistentArray(TrieNode root, int size) {
        this.root = root;
        this.size = size;
    }

    public static PersistentArray empty() {
        return EMPTY;
    }

    /** Array of {@code items} in iteration order; each item is classified by {@link TrieValue#of}. */
    public static PersistentArray from(Iterable<?> items) {
        Objects.requireNonNull(items, "items");
        PersistentArray out = EMPTY;
        for (Object item : items) out = out.append(item);
        return out;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /** Element at {@code index}; empty when the index is out of range. */
    public Optional<TrieValue> get(int index) {
        if (index < 0 || index >= size) return Optional.empty();
        return Tries.valueAt(root, List.of(Integer.toString(index)));
    }

    /**
     * Replace the element at {@code index}, or append when {@code index == size()}.
     *
     * @throws IndexOutOfBoundsException if {@code index} is negative or past the end
     * @throws IllegalArgumentException  if {@code value} is an empty list or map
     */
    public PersistentArray set(int index, Object value) {
        if (index < 0 || index > size) {
            throw new IndexOutOfBoundsException("index " + index + " out of bounds for size " + size);
        }
        TrieValue element = TrieValue.of(value);
        if (element instanceof TrieValue.Sequence seq && seq.size() == 0
                || element instanceof TrieValue.Mapping m && m.fields().isEmpty()) {
            throw new IllegalArgumentException("empty compounds cannot be array elements");
        }
        TrieNode next = Tries.setValue(root, List.of(Integer.toString(index)), element);
        return new PersistentArray(next, Math.max(size, index + 1));
    }

    public PersistentArray append(Object value) {
        return set(size, value);
    }

    /** New array of {@code fn(element, index)} for every element. */
    public PersistentArray map(BiFunction<TrieValue, Integer, ?> fn) {
        PersistentArray out = EMPTY;
        for (int i = 0; i < size; i++) out = out.append(fn.apply(element(i), i));
        return out;
    }

    /** New array of the elements matching {@code predicate}, renumbered from 0. */
    public PersistentArray filter(BiPredicate<TrieValue, Integer> predicate) {
        PersistentArray out = EMPTY;
        for (int i = 0; i < size; i++) {
            TrieValue e = element(i);
            if (predicate.test(e, i)) out = out.append(e);
        }
        return out;
    }

    public <U> U reduce(U initial, BiFunction<U, TrieValue, U> fn) {
        U acc = initial;
        for (int i = 0; i < size; i++) acc = fn.apply(acc, element(i));
        return acc;
    }

    /** Elements {@code from} (inclusive) to {@code to} (exclusive); both are clamped to the array. */
    public PersistentArray slice(int from, int to) {
        int start = Math.max(0, from);
        int end = Math.min(size, to);
        PersistentArray out = EMPTY;
        for (int i = start; i < end; i++) out = out.append(element(i));
        return out;
    }

    public List<TrieValue> toList() {
        var out = new ArrayList<TrieValue>(size);
        for (TrieValue e : this) out.add(e);
        return out;
    }

    /** The whole array as one value: a sequence, empty for an empty array. */
    public TrieValue toValue() {
        return new TrieValue.Sequence(toList());
    }

    /** Underlying trie: a branch with segments "0".."size-1". */
    public TrieNode root() {
        return root;
    }

    @Override
    public Iterator<TrieValue> iterator() {
        return new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return next < size;
            }

            @Override
            public TrieValue next() {
                if (next >= size) throw new NoSuchElementException();
                return element(next++);
            }
        };
    }

    private TrieValue element(int index) {
        return get(index).orElseThrow();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistentArray other)) return false;
        return size == other.size && root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, size);
    }

    @Override
    public String toString() {
        return toValue().canonical();
    }
}
