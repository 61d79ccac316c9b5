package io.trielite.core.trie;

import io.trielite.core.VectorClock;
import io.trielite.core.codec.TrieValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Path operations over immutable roots: writes return new roots, old roots stay
 * valid, and untouched subtrees are shared by reference.
 */
class TriesTest {

    private static Optional<TrieValue> value(TrieNode root, String... path) {
        return Tries.valueAt(root, List.of(path));
    }

    @Test
    void empty_trie_has_nothing() {
        TrieNode t = Tries.empty();
        assertTrue(Tries.toValue(t).isEmpty());
        assertFalse(Tries.has(t, List.of()));
        assertFalse(Tries.has(t, List.of("a")));
    }

    @Test
    void set_then_get_leaves_original_unchanged() {
        TrieNode t1 = Tries.empty();
        TrieNode t2 = Tries.setValue(t1, List.of("a", "b", "c"), 42);

        assertEquals(TrieValue.of(42), value(t2, "a", "b", "c").orElseThrow());
        assertEquals(TrieValue.of(Map.of("a", Map.of("b", Map.of("c", 42)))), Tries.toValue(t2).orElseThrow());
        assertTrue(Tries.get(t1, List.of("a", "b", "c")).isEmpty());
        assertTrue(Tries.has(t2, List.of()));
    }

    @Test
    void multiple_paths_coexist() {
        TrieNode t2 = Tries.setValue(Tries.empty(), List.of("a", "b"), 1);
        TrieNode t3 = Tries.setValue(t2, List.of("a", "c"), 2);

        assertEquals(TrieValue.of(1), value(t3, "a", "b").orElseThrow());
        assertEquals(TrieValue.of(2), value(t3, "a", "c").orElseThrow());
        assertTrue(Tries.get(t2, List.of("a", "c")).isEmpty());
    }

    @Test
    void sibling_subtrees_are_shared_by_reference() {
        TrieNode t1 = Tries.setValue(Tries.empty(), List.of("a", "b"), 1);
        t1 = Tries.setValue(t1, List.of("c", "d"), Map.of("x", 1, "y", 2));

        TrieNode t2 = Tries.setValue(t1, List.of("a", "e"), 3);

        assertSame(Tries.get(t1, List.of("c")).orElseThrow(), Tries.get(t2, List.of("c")).orElseThrow());
        assertSame(Tries.get(t1, List.of("a", "b")).orElseThrow(), Tries.get(t2, List.of("a", "b")).orElseThrow());
        assertNotSame(Tries.get(t1, List.of("a")).orElseThrow(), Tries.get(t2, List.of("a")).orElseThrow());
    }

    @Test
    void writing_inside_a_decomposed_value_rebuilds_only_that_path() {
        TrieNode t2 = Tries.setValue(Tries.empty(), List.of("data"), Map.of("array", List.of(1, 2, 3), "value", 42));
        TrieNode t3 = Tries.setValue(t2, List.of("data", "array", "1"), 99);

        assertEquals(TrieValue.of(Map.of("array", List.of(1, 2, 3), "value", 42)), value(t2, "data").orElseThrow());
        assertEquals(TrieValue.of(List.of(1, 99, 3)), value(t3, "data", "array").orElseThrow());
        assertSame(Tries.get(t2, List.of("data", "value")).orElseThrow(), Tries.get(t3, List.of("data", "value")).orElseThrow());
    }

    @Test
    void get_through_a_leaf_is_absent_but_set_through_a_leaf_fails() {
        TrieNode t = Tries.setValue(Tries.empty(), List.of("a"), 1);

        assertTrue(Tries.get(t, List.of("a", "b")).isEmpty());

        var ex = assertThrows(PathThroughLeafException.class,
                () -> Tries.setValue(t, List.of("a", "b", "c"), 2));
        assertEquals(1, ex.leafDepth());
        assertEquals(List.of("a"), ex.leafPath());
        assertEquals(List.of("a", "b", "c"), ex.path());
    }

    @Test
    void overwriting_an_existing_leaf_or_branch_replaces_it() {
        TrieNode t = Tries.setValue(Tries.empty(), List.of("a"), Map.of("x", 1));
        t = Tries.setValue(t, List.of("a"), "flat");
        assertEquals(TrieValue.of("flat"), value(t, "a").orElseThrow());

        t = Tries.setValue(t, List.of("a"), List.of(7));
        assertEquals(TrieValue.of(List.of(7)), value(t, "a").orElseThrow());
    }

    @Test
    void remove_value_keeps_structure_and_remove_path_prunes_it() {
        TrieNode t = Tries.setValue(Tries.setValue(Tries.empty(), List.of("a", "c"), 2), List.of("a", "b"), 1);

        TrieNode afterValue = Tries.removeValue(t, List.of("a", "b"), "r1");
        assertTrue(Tries.has(afterValue, List.of("a", "b")));
        assertTrue(value(afterValue, "a", "b").isEmpty());
        assertEquals(TrieValue.of(Map.of("a", Map.of("c", 2))), Tries.toValue(afterValue).orElseThrow());

        TrieNode afterPath = Tries.removePath(t, List.of("a", "b"));
        assertFalse(Tries.has(afterPath, List.of("a", "b")));
        assertEquals(TrieValue.of(Map.of("a", Map.of("c", 2))), Tries.toValue(afterPath).orElseThrow());

        // Removing the last value leaves an addressable but valueless structure.
        TrieNode allValuesGone = Tries.removeValue(afterValue, List.of("a", "c"), "r1");
        assertTrue(Tries.toValue(allValuesGone).isEmpty());
        assertTrue(Tries.has(allValuesGone, List.of("a")));
        assertTrue(Tries.has(allValuesGone, List.of("a", "c")));

        // Removing the last path prunes everything back to the canonical empty tree.
        TrieNode allPathsGone = Tries.removePath(afterPath, List.of("a", "c"));
        assertSame(Tries.empty(), allPathsGone);
    }

    @Test
    void remove_value_on_a_branch_clears_every_leaf_below_it() {
        TrieNode t = Tries.setValue(Tries.empty(), List.of("cfg"), Map.of("a", 1, "b", Map.of("c", 2)));

        TrieNode cleared = Tries.removeValue(t, List.of("cfg"), "r1");

        assertTrue(Tries.has(cleared, List.of("cfg", "b", "c")));
        assertTrue(value(cleared, "cfg").isEmpty());
        assertEquals(TrieNode.Branch.EMPTY, Tries.get(cleared, List.of("cfg", "a")).orElseThrow());
    }

    @Test
    void remove_path_prunes_only_ancestors_that_become_empty() {
        TrieNode t = Tries.setValue(Tries.empty(), List.of("x", "y", "z"), 1);
        t = Tries.setValue(t, List.of("x", "w"), 2);

        TrieNode pruned = Tries.removePath(t, List.of("x", "y", "z"));

        assertFalse(Tries.has(pruned, List.of("x", "y")));
        assertTrue(Tries.has(pruned, List.of("x", "w")));
    }

    @Test
    void removing_an_absent_path_is_a_no_op() {
        TrieNode t = Tries.setValue(Tries.empty(), List.of("a"), 1);

        assertSame(t, Tries.removeValue(t, List.of("missing"), "r1"));
        assertSame(t, Tries.removePath(t, List.of("a", "deeper")));
    }

    @Test
    void remove_value_on_versioned_content_leaves_clocked_tombstones() {
        TrieNode t = Tries.setContainer(Tries.empty(), List.of("pos"), Map.of("x", 1, "y", 2), "r1");
        t = Tries.updateValue(t, List.of("pos", "x"), 5, "r2");

        TrieNode removed = Tries.removeValue(t, List.of("pos"), "r3");

        var x = (TrieNode.Versioned) Tries.get(removed, List.of("pos", "x")).orElseThrow();
        var y = (TrieNode.Versioned) Tries.get(removed, List.of("pos", "y")).orElseThrow();
        assertFalse(x.hasValue());
        assertEquals(new VectorClock(Map.of("r1", 1, "r2", 1, "r3", 1)), x.version());
        assertEquals(new VectorClock(Map.of("r1", 1, "r3", 1)), y.version());
        assertTrue(value(removed, "pos").isEmpty());
        assertSame(removed, Tries.removeValue(removed, List.of("pos"), "r3"), "tombstones are not re-stamped");
    }

    @Test
    void writes_pass_through_a_tombstone() {
        TrieNode t = Tries.setContainer(Tries.empty(), List.of("a"), 1, "r1");
        t = Tries.removeValue(t, List.of("a"), "r1");

        TrieNode below = Tries.setValue(t, List.of("a", "b"), 2);
        assertEquals(TrieValue.of(Map.of("b", 2)), value(below, "a").orElseThrow());

        TrieNode revived = Tries.updateValue(t, List.of("a"), 3, "r1");
        var leaf = (TrieNode.Versioned) Tries.get(revived, List.of("a")).orElseThrow();
        assertEquals(VectorClock.of("r1", 3), leaf.version(), "the write supersedes the tombstone");
        assertEquals(TrieValue.of(3), leaf.value().orElseThrow());
    }

    @Test
    void set_container_starts_a_fresh_causal_history() {
        TrieNode t = Tries.setContainer(Tries.empty(), List.of("temperature"), 72, "sensor1");

        var leaf = (TrieNode.Versioned) Tries.get(t, List.of("temperature")).orElseThrow();
        assertEquals(VectorClock.of("sensor1", 1), leaf.version());
        assertEquals(TrieValue.of(72), leaf.value().orElseThrow());
    }

    @Test
    void update_value_advances_version_and_tracks_causality() {
        TrieNode c1 = Tries.setContainer(Tries.empty(), List.of("t"), 72, "r1");
        TrieNode c2 = Tries.updateValue(c1, List.of("t"), 73, "r2");

        var v1 = ((TrieNode.Versioned) Tries.get(c1, List.of("t")).orElseThrow()).version();
        var v2 = ((TrieNode.Versioned) Tries.get(c2, List.of("t")).orElseThrow()).version();

        assertTrue(v1.happensBefore(v2));
        assertFalse(v2.happensBefore(v1));
        assertEquals(TrieValue.of(72), value(c1, "t").orElseThrow());
        assertEquals(TrieValue.of(73), value(c2, "t").orElseThrow());
    }

    @Test
    void update_value_on_absent_path_creates_a_fresh_container() {
        TrieNode t = Tries.updateValue(Tries.empty(), List.of("n"), 1, "r9");

        var leaf = (TrieNode.Versioned) Tries.get(t, List.of("n")).orElseThrow();
        assertEquals(VectorClock.of("r9", 1), leaf.version());
    }

    @Test
    void update_value_on_a_plain_value_is_a_type_mismatch() {
        TrieNode t = Tries.setValue(Tries.empty(), List.of("config"), Map.of("units", "F"));

        assertThrows(TypeMismatchException.class, () -> Tries.updateValue(t, List.of("config", "units"), "C", "r1"));
        assertThrows(TypeMismatchException.class, () -> Tries.updateValue(t, List.of("config"), "C", "r1"));
    }

    @Test
    void update_value_on_a_decomposed_container_joins_leaf_versions() {
        TrieNode t = Tries.setContainer(Tries.empty(), List.of("pos"), Map.of("x", 1, "y", 2), "r1");
        t = Tries.updateValue(t, List.of("pos", "x"), 5, "r2");

        TrieNode updated = Tries.updateValue(t, List.of("pos"), Map.of("x", 6, "y", 7), "r3");

        var x = (TrieNode.Versioned) Tries.get(updated, List.of("pos", "x")).orElseThrow();
        var y = (TrieNode.Versioned) Tries.get(updated, List.of("pos", "y")).orElseThrow();
        var expected = new VectorClock(Map.of("r1", 1, "r2", 1, "r3", 1));
        assertEquals(expected, x.version());
        assertEquals(expected, y.version());
        assertEquals(TrieValue.of(Map.of("x", 6, "y", 7)), value(updated, "pos").orElseThrow());
    }

    @Test
    void failed_writes_leave_the_input_root_intact() {
        TrieNode t = Tries.setValue(Tries.empty(), List.of("a"), 1);
        TrieNode before = t;

        assertThrows(TrieException.class, () -> Tries.setContainer(t, List.of("a", "b"), 2, "r1"));
        assertSame(before, t);
        assertEquals(TrieValue.of(1), value(t, "a").orElseThrow());
    }
}
