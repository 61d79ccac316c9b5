package io.trielite.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trielite.core.codec.TrieValue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts between Jackson trees and {@link TrieValue}.
 * <p>
 * Numbers: integral JSON numbers become long (BigInteger past long range),
 * fractional ones become double. Both directions are exact for every scalar a
 * trie can hold, so a container reads back equal to what was written.
 */
public final class JsonValues {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonValues() {
        // utility
    }

    public static TrieValue toTrieValue(JsonNode json) {
        if (json == null || json.isNull() || json.isMissingNode()) return TrieValue.Scalar.NULL;
        if (json.isArray()) {
            var elements = new ArrayList<TrieValue>(json.size());
            json.forEach(e -> elements.add(toTrieValue(e)));
            return new TrieValue.Sequence(elements);
        }
        if (json.isObject()) {
            var fields = new TreeMap<String, TrieValue>();
            json.fields().forEachRemaining(e -> fields.put(e.getKey(), toTrieValue(e.getValue())));
            return new TrieValue.Mapping(fields);
        }
        return toScalar(json);
    }

    /**
     * @throws ExchangeFormatException if {@code json} is an array or object
     */
    public static TrieValue.Scalar toScalar(JsonNode json) {
        if (json == null || json.isNull()) return TrieValue.Scalar.NULL;
        if (json.isTextual()) return TrieValue.scalar(json.textValue());
        if (json.isBoolean()) return TrieValue.scalar(json.booleanValue());
        if (json.isIntegralNumber()) {
            return json.canConvertToLong()
                    ? TrieValue.scalar(json.longValue())
                    : TrieValue.scalar(json.bigIntegerValue());
        }
        if (json.isNumber()) {
            try {
                return TrieValue.scalar(json.doubleValue());
            } catch (IllegalArgumentException e) {
                throw new ExchangeFormatException("number out of range: " + json.asText(), e);
            }
        }
        throw new ExchangeFormatException("expected a scalar but found " + json.getNodeType());
    }

    public static JsonNode toJson(TrieValue value) {
        if (value instanceof TrieValue.Sequence seq) {
            ArrayNode arr = NODES.arrayNode();
            seq.elements().forEach(e -> arr.add(toJson(e)));
            return arr;
        }
        if (value instanceof TrieValue.Mapping mapping) {
            ObjectNode obj = NODES.objectNode();
            for (Map.Entry<String, TrieValue> e : mapping.fields().entrySet()) {
                obj.set(e.getKey(), toJson(e.getValue()));
            }
            return obj;
        }
        Object raw = ((TrieValue.Scalar) value).value();
        if (raw == null) return NODES.nullNode();
        if (raw instanceof String s) return NODES.textNode(s);
        if (raw instanceof Boolean b) return NODES.booleanNode(b);
        if (raw instanceof Long l) return NODES.numberNode(l);
        if (raw instanceof Double d) return NODES.numberNode(d);
        return NODES.numberNode((BigInteger) raw);
    }
}
