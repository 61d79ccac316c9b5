// file: src/main/java/io/trielite/exchange/ContainerJson.java
package io.trielite.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.trielite.core.Container;
import io.trielite.core.VectorClock;
import io.trielite.core.trie.TrieNode;
import io.trielite.exchange.dto.ContainerDto;
import io.trielite.exchange.dto.NodeDto;
import io.trielite.exchange.dto.SiblingDto;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;

/**
 * Container exchange format: the logical shape replicas ship to each other.
 * <p>
 * Encoding is a recursive walk: branches become segment -> node maps, leaves
 * become a tag plus scalar payload, versioned leaves also carry their clock
 * (or their list of concurrent versions and tombstones).
 * Shared subtrees are written once per reference; the receiving side gets an
 * equal, unshared tree.
 */
public final class ContainerJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ContainerJson() {
        // utility
    }

    public static String write(Container container) {
        return write(container, false);
    }

    public static String write(Container container, boolean pretty) {
        try {
            return (pretty ? PRETTY : MAPPER).writeValueAsString(toDto(container));
        } catch (JsonProcessingException e) {
            throw new ExchangeFormatException("Failed to encode container " + container.id(), e);
        }
    }

    public static Container read(String json) {
        try {
            return fromDto(MAPPER.readValue(json, ContainerDto.class));
        } catch (JsonProcessingException e) {
            throw new ExchangeFormatException("Failed to decode container JSON", e);
        }
    }

    /** Write to {@code file} through a temp file and an atomic rename. */
    public static void writeFile(Container container, Path file) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, write(container, true));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ExchangeFormatException("Failed to write container to " + file, e);
        }
    }

    public static Container readFile(Path file) {
        try {
            return fromDto(MAPPER.readValue(file.toFile(), ContainerDto.class));
        } catch (IOException e) {
            throw new ExchangeFormatException("Failed to read container from " + file, e);
        }
    }

    // ----------------- dto mapping -----------------

    public static ContainerDto toDto(Container container) {
        var dto = new ContainerDto();
        dto.id = container.id();
        dto.version = container.version().entries();
        dto.root = toDto(container.root());
        return dto;
    }

    public static NodeDto toDto(TrieNode node) {
        var dto = new NodeDto();
        if (node instanceof TrieNode.Branch branch) {
            dto.type = NodeDto.BRANCH;
            dto.children = new TreeMap<>();
            branch.children().forEach((segment, child) -> dto.children.put(segment, toDto(child)));
        } else if (node instanceof TrieNode.Versioned v) {
            dto.type = NodeDto.CONTAINER;
            TrieNode.Sibling only = v.siblings().get(0);
            if (!v.isConflicted() && !only.isTombstone()) {
                dto.value = JsonValues.toJson(only.value());
                dto.version = only.version().entries();
            } else {
                dto.siblings = new ArrayList<>();
                for (TrieNode.Sibling s : v.siblings()) dto.siblings.add(toDto(s));
            }
        } else {
            dto.type = NodeDto.VALUE;
            dto.value = JsonValues.toJson(((TrieNode.Leaf) node).value());
        }
        return dto;
    }

    public static Container fromDto(ContainerDto dto) {
        if (dto == null) throw new ExchangeFormatException("container is missing");
        if (dto.id == null || dto.id.isBlank()) throw new ExchangeFormatException("container id is missing");
        if (dto.root == null) throw new ExchangeFormatException("container root is missing");
        return new Container(dto.id, fromDto(dto.root), clock(dto.version));
    }

    public static TrieNode fromDto(NodeDto dto) {
        if (dto == null || dto.type == null) {
            throw new ExchangeFormatException("node type is missing");
        }
        switch (dto.type) {
            case NodeDto.BRANCH -> {
                if (dto.children == null || dto.children.isEmpty()) return TrieNode.Branch.EMPTY;
                var children = new TreeMap<String, TrieNode>();
                dto.children.forEach((segment, child) -> children.put(segment, fromDto(child)));
                return new TrieNode.Branch(children);
            }
            case NodeDto.VALUE -> {
                return new TrieNode.Leaf(JsonValues.toScalar(dto.value));
            }
            case NodeDto.CONTAINER -> {
                if (dto.siblings == null) {
                    return new TrieNode.Versioned(JsonValues.toScalar(dto.value), clock(dto.version));
                }
                if (dto.siblings.isEmpty()) throw new ExchangeFormatException("container node has no siblings");
                var siblings = new ArrayList<TrieNode.Sibling>(dto.siblings.size());
                for (SiblingDto s : dto.siblings) siblings.add(fromDto(s));
                return new TrieNode.Versioned(siblings);
            }
            default -> throw new ExchangeFormatException("unknown node type: " + dto.type);
        }
    }

    private static SiblingDto toDto(TrieNode.Sibling sibling) {
        var dto = new SiblingDto();
        if (sibling.isTombstone()) {
            dto.deleted = true;
        } else {
            dto.value = JsonValues.toJson(sibling.value());
        }
        dto.version = sibling.version().entries();
        return dto;
    }

    private static TrieNode.Sibling fromDto(SiblingDto dto) {
        if (dto == null) throw new ExchangeFormatException("sibling is missing");
        if (Boolean.TRUE.equals(dto.deleted)) return new TrieNode.Sibling(null, clock(dto.version));
        return new TrieNode.Sibling(JsonValues.toScalar(dto.value), clock(dto.version));
    }

    private static VectorClock clock(Map<String, Integer> entries) {
        if (entries == null) return VectorClock.empty();
        try {
            return new VectorClock(entries);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ExchangeFormatException("invalid version " + entries, e);
        }
    }
}
