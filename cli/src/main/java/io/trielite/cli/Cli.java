// file: cli/src/main/java/io/trielite/cli/Cli.java
package io.trielite.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trielite.core.Container;
import io.trielite.core.merge.MergeConfig;
import io.trielite.core.trie.TrieException;
import io.trielite.exchange.ContainerJson;
import io.trielite.exchange.ExchangeFormatException;
import io.trielite.exchange.JsonValues;
import io.trielite.exchange.MergeConfigLoader;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * Command-line tool over container files in the exchange format.
 *
 * Usage:
 *   trie-cli init    <file> <replicaId>
 *   trie-cli set     <file> <json> <segment...>   plain value
 *   trie-cli put     <file> <json> <segment...>   versioned value, fresh history
 *   trie-cli update  <file> <json> <segment...>   versioned value, advances version
 *   trie-cli rm      <file> <segment...>          clear values, keep structure
 *   trie-cli prune   <file> <segment...>          remove path and empty ancestors
 *   trie-cli get     <file> [segment...]
 *   trie-cli merge   <left> <right> [--out <file>] [--config <merge.json>]
 *   trie-cli compare <left> <right>
 *
 * Examples:
 *   trie-cli init r1.json r1
 *   trie-cli put r1.json 72 readings temperature
 *   trie-cli merge r1.json r2.json --out r1.json
 *
 * A {@code <json>} argument that does not parse as JSON is taken as a plain string.
 */
public final class Cli {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final PrintStream out;

    private Cli(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Execute one command; returns the process exit code. */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            if (args.length == 0) {
                throw new CliException("missing command");
            }
            Cli cli = new Cli(out);
            String cmd = args[0];
            String[] rest = Arrays.copyOfRange(args, 1, args.length);

            switch (cmd) {
                case "init" -> {
                    requireArgs(rest, 2, 2, "init requires <file> <replicaId>");
                    cli.init(Path.of(rest[0]), rest[1]);
                }
                case "set" -> cli.write(rest, "set", (c, a) -> c.setValue(a.path, a.payload));
                case "put" -> cli.write(rest, "put", (c, a) -> c.setContainer(a.path, a.payload));
                case "update" -> cli.write(rest, "update", (c, a) -> c.updateValue(a.path, a.payload));
                case "rm" -> {
                    requireArgs(rest, 2, Integer.MAX_VALUE, "rm requires <file> <segment...>");
                    cli.rewrite(Path.of(rest[0]), c -> c.removeValue(segments(rest, 1)));
                }
                case "prune" -> {
                    requireArgs(rest, 2, Integer.MAX_VALUE, "prune requires <file> <segment...>");
                    cli.rewrite(Path.of(rest[0]), c -> c.removePath(segments(rest, 1)));
                }
                case "get" -> {
                    requireArgs(rest, 1, Integer.MAX_VALUE, "get requires <file> [segment...]");
                    cli.get(Path.of(rest[0]), segments(rest, 1));
                }
                case "merge" -> cli.merge(rest);
                case "compare" -> {
                    requireArgs(rest, 2, 2, "compare requires <left> <right>");
                    cli.compare(Path.of(rest[0]), Path.of(rest[1]));
                }
                default -> throw new CliException("unknown command: " + cmd);
            }
            return 0;
        } catch (CliException | TrieException | ExchangeFormatException | IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            if (e instanceof CliException) printUsage(err);
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    // ----------------- commands -----------------

    private void init(Path file, String replicaId) {
        if (Files.exists(file)) {
            throw new CliException(file + " already exists");
        }
        ContainerJson.writeFile(Container.create(replicaId), file);
        out.println("OK");
    }

    private void write(String[] rest, String cmd, BiFunction<Container, WriteArgs, Container> op) {
        requireArgs(rest, 3, Integer.MAX_VALUE, cmd + " requires <file> <json> <segment...>");
        var a = new WriteArgs(segments(rest, 2), parsePayload(rest[1]));
        rewrite(Path.of(rest[0]), c -> op.apply(c, a));
    }

    private void rewrite(Path file, UnaryOperator<Container> op) {
        Container next = op.apply(ContainerJson.readFile(file));
        ContainerJson.writeFile(next, file);
        out.println("OK " + next.version());
    }

    private void get(Path file, List<String> path) {
        Container c = ContainerJson.readFile(file);
        if (!c.has(path)) {
            out.println("(not found)");
            return;
        }
        c.valueAt(path).ifPresentOrElse(
                v -> out.println(JsonValues.toJson(v).toString()),
                () -> out.println("(no value)")
        );
    }

    private void merge(String[] rest) {
        requireArgs(rest, 2, 6, "merge requires <left> <right>");
        Path outFile = null;
        MergeConfig config = MergeConfig.defaults();
        for (int i = 2; i < rest.length; i++) {
            switch (rest[i]) {
                case "--out", "-o" -> {
                    ensureValue(rest, i);
                    outFile = Path.of(rest[++i]);
                }
                case "--config", "-c" -> {
                    ensureValue(rest, i);
                    config = MergeConfigLoader.fromJsonFile(Path.of(rest[++i]));
                }
                default -> throw new CliException("unknown option: " + rest[i]);
            }
        }

        Container merged = ContainerJson.readFile(Path.of(rest[0]))
                .merge(ContainerJson.readFile(Path.of(rest[1])), config);
        if (outFile == null) {
            out.println(ContainerJson.write(merged, true));
        } else {
            ContainerJson.writeFile(merged, outFile);
            out.println("OK " + merged.version());
        }
    }

    private void compare(Path left, Path right) {
        var l = ContainerJson.readFile(left);
        var r = ContainerJson.readFile(right);
        out.println(l.version().compare(r.version()));
    }

    // ----------------- helpers -----------------

    private record WriteArgs(List<String> path, Object payload) {}

    static Object parsePayload(String raw) {
        try {
            JsonNode node = JSON.readTree(raw);
            if (node == null || node.isMissingNode()) return raw;
            return JsonValues.toTrieValue(node);
        } catch (JsonProcessingException e) {
            // Not JSON: store the text as-is.
            return raw;
        }
    }

    private static List<String> segments(String[] rest, int from) {
        return List.of(Arrays.copyOfRange(rest, from, rest.length));
    }

    private static void requireArgs(String[] rest, int min, int max, String message) {
        if (rest.length < min || rest.length > max) {
            throw new CliException(message);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new CliException("missing value for option: " + args[i]);
        }
    }

    private static void printUsage(PrintStream err) {
        err.println("""
                Usage:
                  trie-cli init    <file> <replicaId>
                  trie-cli set     <file> <json> <segment...>
                  trie-cli put     <file> <json> <segment...>
                  trie-cli update  <file> <json> <segment...>
                  trie-cli rm      <file> <segment...>
                  trie-cli prune   <file> <segment...>
                  trie-cli get     <file> [segment...]
                  trie-cli merge   <left> <right> [--out <file>] [--config <merge.json>]
                  trie-cli compare <left> <right>
                """);
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
