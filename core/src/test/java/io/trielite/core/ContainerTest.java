package io.trielite.core;

import io.trielite.core.codec.TrieValue;
import io.trielite.core.trie.Tries;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Container is the root state boundary: every local write bumps the owner's
 * clock entry by one and never disturbs the previous Container.
 */
class ContainerTest {

    @Test
    void create_starts_with_empty_root_and_zero_counter() {
        var c = Container.create("r1");

        assertSame(Tries.empty(), c.root());
        assertEquals(Map.of("r1", 0), c.version().entries());
        assertTrue(c.toValue().isEmpty());
        assertFalse(c.has(List.of()));
    }

    @Test
    void every_local_write_increments_own_entry_by_exactly_one() {
        var c0 = Container.create("r1");

        var c1 = c0.setValue(List.of("config", "units"), "F");
        var c2 = c1.setContainer(List.of("readings", "current"), 72);
        var c3 = c2.updateValue(List.of("readings", "current"), 73);
        var c4 = c3.removeValue(List.of("config"));
        var c5 = c4.removePath(List.of("config"));

        assertEquals(1, c1.version().get("r1"));
        assertEquals(2, c2.version().get("r1"));
        assertEquals(3, c3.version().get("r1"));
        assertEquals(4, c4.version().get("r1"));
        assertEquals(5, c5.version().get("r1"));
        assertEquals(1, c5.version().entries().size(), "only the owner's entry moves");

        // Earlier containers stay valid and unchanged.
        assertEquals(0, c0.version().get("r1"));
        assertTrue(c0.toValue().isEmpty());
        assertEquals(TrieValue.of(72L), c2.valueAt(List.of("readings", "current")).orElseThrow());
    }

    @Test
    void versioned_leaves_use_the_container_id_as_replica() {
        var c = Container.create("sensor1")
                .setContainer(List.of("temperature"), 72)
                .updateValue(List.of("temperature"), 73);

        var leaf = (io.trielite.core.trie.TrieNode.Versioned) c.get(List.of("temperature")).orElseThrow();
        assertEquals(Map.of("sensor1", 2), leaf.version().entries());
    }

    @Test
    void whole_state_reconstructs_mixed_plain_and_versioned_content() {
        var c = Container.create("sensor1")
                .setValue(List.of("config"), Map.of("units", "F", "name", "Temp1"))
                .setContainer(List.of("readings", "current"), 72)
                .setContainer(List.of("readings", "previous"), 71)
                .updateValue(List.of("readings", "current"), 73);

        var expected = TrieValue.of(Map.of(
                "config", Map.of("units", "F", "name", "Temp1"),
                "readings", Map.of("current", 73, "previous", 71)
        ));
        assertEquals(expected, c.toValue().orElseThrow());
    }

    @Test
    void blank_id_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Container.create(" "));
        assertThrows(NullPointerException.class, () -> Container.create(null));
    }
}
