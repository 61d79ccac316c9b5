package io.trielite.cli;

import io.trielite.core.Container;
import io.trielite.core.trie.TrieNode;
import io.trielite.exchange.ContainerJson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        outBytes.reset();
        errBytes.reset();
        return Cli.run(args,
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8).trim();
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void init_put_and_get_round_trip_through_file() {
        String file = dir.resolve("r1.json").toString();

        assertEquals(0, run("init", file, "r1"));
        assertEquals(0, run("put", file, "72", "readings", "temperature"));
        assertEquals(0, run("get", file, "readings", "temperature"));
        assertEquals("72", out());

        Container stored = ContainerJson.readFile(Path.of(file));
        assertEquals("r1", stored.id());
        assertEquals(1, stored.version().get("r1"));
    }

    @Test
    void compound_payload_is_decomposed_and_reassembled() {
        String file = dir.resolve("doc.json").toString();
        run("init", file, "r1");

        assertEquals(0, run("set", file, "{\"b\":[1,2],\"a\":true}", "doc"));
        assertEquals(0, run("get", file, "doc", "b", "1"));
        assertEquals("2", out());

        assertEquals(0, run("get", file, "doc"));
        assertEquals("{\"a\":true,\"b\":[1,2]}", out());
    }

    @Test
    void non_json_payload_is_stored_as_text() {
        String file = dir.resolve("r1.json").toString();
        run("init", file, "r1");

        assertEquals(0, run("set", file, "hello world", "greeting"));
        run("get", file, "greeting");

        assertEquals("\"hello world\"", out());
    }

    @Test
    void update_advances_leaf_version() {
        String file = dir.resolve("r1.json").toString();
        run("init", file, "r1");
        run("put", file, "1", "counter");

        assertEquals(0, run("update", file, "2", "counter"));

        Container stored = ContainerJson.readFile(Path.of(file));
        assertEquals(2, stored.version().get("r1"));
        var leaf = (TrieNode.Versioned) stored.get(List.of("counter")).orElseThrow();
        assertEquals(2, leaf.version().get("r1"));
    }

    @Test
    void rm_keeps_path_while_prune_drops_it() {
        String file = dir.resolve("r1.json").toString();
        run("init", file, "r1");
        run("set", file, "{\"x\":1}", "a");
        run("set", file, "{\"y\":2}", "b");

        assertEquals(0, run("rm", file, "a"));
        run("get", file, "a");
        assertEquals("(no value)", out());

        assertEquals(0, run("prune", file, "b", "y"));
        run("get", file, "b");
        assertEquals("(not found)", out());
    }

    @Test
    void merge_combines_two_replica_files() {
        String left = dir.resolve("r1.json").toString();
        String right = dir.resolve("r2.json").toString();
        String merged = dir.resolve("merged.json").toString();
        run("init", left, "r1");
        run("init", right, "r2");
        run("put", left, "72", "temperature");
        run("put", right, "40", "humidity");

        assertEquals(0, run("merge", left, right, "--out", merged));

        Container result = ContainerJson.readFile(Path.of(merged));
        assertEquals("r1", result.id());
        assertEquals(1, result.version().get("r1"));
        assertEquals(1, result.version().get("r2"));

        run("get", merged, "humidity");
        assertEquals("40", out());
        run("get", merged, "temperature");
        assertEquals("72", out());
    }

    @Test
    void merge_without_out_prints_container_json() {
        String left = dir.resolve("r1.json").toString();
        String right = dir.resolve("r2.json").toString();
        run("init", left, "r1");
        run("init", right, "r2");
        run("put", right, "\"on\"", "switch");

        assertEquals(0, run("merge", left, right));

        Container printed = ContainerJson.read(out());
        assertEquals("on", printed.valueAt(List.of("switch")).orElseThrow().toJava());
    }

    @Test
    void merge_applies_a_config_file() throws Exception {
        String left = dir.resolve("r1.json").toString();
        String right = dir.resolve("r2.json").toString();
        String merged = dir.resolve("merged.json").toString();
        Path config = dir.resolve("merge.json");
        Files.writeString(config, "{\"valuePolicy\": \"existing_wins\", \"logConflicts\": false}");
        run("init", left, "r1");
        run("init", right, "r2");
        run("set", left, "\"mine\"", "mode");
        run("set", right, "\"theirs\"", "mode");

        assertEquals(0, run("merge", left, right, "--config", config.toString(), "--out", merged));

        run("get", merged, "mode");
        assertEquals("\"mine\"", out());
    }

    @Test
    void unreadable_merge_config_is_a_user_error() {
        String left = dir.resolve("r1.json").toString();
        String right = dir.resolve("r2.json").toString();
        run("init", left, "r1");
        run("init", right, "r2");

        assertEquals(1, run("merge", left, right, "--config", dir.resolve("absent.json").toString()));
        assertTrue(err().contains("absent.json"));
    }

    @Test
    void get_reads_one_value_from_concurrent_versions() {
        String left = dir.resolve("r1.json").toString();
        String right = dir.resolve("r2.json").toString();
        String merged = dir.resolve("merged.json").toString();
        run("init", left, "r1");
        run("init", right, "r2");
        run("put", left, "10", "t");
        run("put", right, "20", "t");

        assertEquals(0, run("merge", left, right, "--out", merged));
        run("get", merged, "t");
        assertEquals("20", out());

        assertEquals(0, run("update", merged, "30", "t"));
        run("get", merged, "t");
        assertEquals("30", out());
    }

    @Test
    void compare_reports_causal_order() {
        String older = dir.resolve("old.json").toString();
        String newer = dir.resolve("new.json").toString();
        run("init", older, "r1");
        run("put", older, "1", "x");
        run("merge", older, older, "--out", newer);
        run("update", newer, "2", "x");

        assertEquals(0, run("compare", older, newer));
        assertEquals("BEFORE", out());

        assertEquals(0, run("compare", newer, older));
        assertEquals("AFTER", out());
    }

    @Test
    void usage_errors_exit_with_one() {
        assertEquals(1, run());
        assertTrue(err().contains("missing command"));

        assertEquals(1, run("frobnicate"));
        assertTrue(err().contains("unknown command"));
        assertTrue(err().contains("Usage:"));

        assertEquals(1, run("set", "only-a-file"));
    }

    @Test
    void init_refuses_to_overwrite() {
        String file = dir.resolve("r1.json").toString();
        assertEquals(0, run("init", file, "r1"));

        assertEquals(1, run("init", file, "r2"));
        assertEquals("r1", ContainerJson.readFile(Path.of(file)).id());
    }

    @Test
    void writing_through_a_leaf_is_reported() {
        String file = dir.resolve("r1.json").toString();
        run("init", file, "r1");
        run("set", file, "1", "a");

        assertEquals(1, run("set", file, "2", "a", "b"));
        assertTrue(err().startsWith("error:"));
    }

    @Test
    void missing_file_is_reported() {
        assertEquals(1, run("get", dir.resolve("nope.json").toString()));
        assertTrue(err().contains("nope.json"));
    }
}
