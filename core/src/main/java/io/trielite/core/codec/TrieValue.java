package io.trielite.core.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Closed model of the values a trie can hold.
 * <p>
 * Plain Java input (maps, lists, arrays, strings, numbers, booleans, null) is
 * classified exactly once by {@link #of(Object)}; everything downstream works
 * on the three variants only:
 *  - Scalar:   a single atomic payload, stored as one leaf.
 *  - Sequence: an ordered list, stored as a branch keyed "0".."n-1".
 *  - Mapping:  a string-keyed record, stored as a branch with one segment per key.
 */
public sealed interface TrieValue permits TrieValue.Scalar, TrieValue.Sequence, TrieValue.Mapping {

    /** Render back to plain Java: List, LinkedHashMap, boxed scalars or null. */
    Object toJava();

    /**
     * Stable text form: JSON-like, mapping keys sorted.
     * Two values are equal iff their canonical forms are equal.
     */
    String canonical();

    /**
     * Classify plain Java input into the closed variant.
     *
     * @throws IllegalArgumentException for unsupported types or cyclic input
     */
    static TrieValue of(Object raw) {
        return classify(raw, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    static Scalar scalar(Object raw) {
        return new Scalar(raw);
    }

    private static TrieValue classify(Object raw, Set<Object> onPath) {
        if (raw instanceof TrieValue tv) return tv;
        if (raw instanceof Map<?, ?> || raw instanceof List<?> || raw instanceof Object[]) {
            if (!onPath.add(raw)) {
                throw new IllegalArgumentException("cyclic value graphs cannot be stored in a trie");
            }
            try {
                if (raw instanceof Map<?, ?> m) {
                    var fields = new TreeMap<String, TrieValue>();
                    for (var e : m.entrySet()) {
                        if (!(e.getKey() instanceof String key)) {
                            throw new IllegalArgumentException("mapping keys must be strings, got " + e.getKey());
                        }
                        fields.put(key, classify(e.getValue(), onPath));
                    }
                    return new Mapping(fields);
                }
                List<?> items = raw instanceof Object[] arr ? java.util.Arrays.asList(arr) : (List<?>) raw;
                var elements = new ArrayList<TrieValue>(items.size());
                for (Object item : items) {
                    elements.add(classify(item, onPath));
                }
                return new Sequence(elements);
            } finally {
                onPath.remove(raw);
            }
        }
        return new Scalar(raw);
    }

    /**
     * Atomic payload. Integral numbers are widened to Long (a BigInteger only when
     * it does not fit), floating ones to Double. NaN, the infinities and BigDecimal
     * are rejected: none of them survives a JSON round trip unchanged.
     * A null payload is JSON null.
     */
    record Scalar(Object value) implements TrieValue {

        public static final Scalar NULL = new Scalar(null);

        public Scalar {
            value = normalize(value);
        }

        private static Object normalize(Object v) {
            if (v == null || v instanceof String || v instanceof Boolean || v instanceof Long) {
                return v;
            }
            if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
                return ((Number) v).longValue();
            }
            if (v instanceof BigInteger bi) {
                return bi.bitLength() < Long.SIZE ? (Object) bi.longValue() : bi;
            }
            if (v instanceof Double || v instanceof Float) {
                double d = ((Number) v).doubleValue();
                if (!Double.isFinite(d)) {
                    throw new IllegalArgumentException("non-finite number cannot be stored: " + d);
                }
                return d;
            }
            if (v instanceof BigDecimal) {
                throw new IllegalArgumentException("BigDecimal is not supported, use Double or BigInteger: " + v);
            }
            if (v instanceof Character c) return c.toString();
            throw new IllegalArgumentException("unsupported scalar type: " + v.getClass().getName());
        }

        public boolean isNull() { return value == null; }

        @Override public Object toJava() { return value; }

        @Override public String canonical() {
            if (value instanceof String s) return quote(s);
            return String.valueOf(value);
        }

        @Override public String toString() { return canonical(); }
    }

    record Sequence(List<TrieValue> elements) implements TrieValue {

        public Sequence {
            elements = List.copyOf(elements);
        }

        public int size() { return elements.size(); }

        @Override public Object toJava() {
            var out = new ArrayList<Object>(elements.size());
            for (TrieValue e : elements) out.add(e.toJava());
            return out;
        }

        @Override public String canonical() {
            var sb = new StringBuilder("[");
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) sb.append(',');
                sb.append(elements.get(i).canonical());
            }
            return sb.append(']').toString();
        }

        @Override public String toString() { return canonical(); }
    }

    record Mapping(Map<String, TrieValue> fields) implements TrieValue {

        public Mapping {
            Objects.requireNonNull(fields, "fields");
            fields = Collections.unmodifiableMap(new TreeMap<>(fields));
        }

        @Override public Object toJava() {
            var out = new LinkedHashMap<String, Object>();
            fields.forEach((k, v) -> out.put(k, v.toJava()));
            return out;
        }

        @Override public String canonical() {
            var sb = new StringBuilder("{");
            boolean first = true;
            for (var e : fields.entrySet()) {
                if (!first) sb.append(',');
                first = false;
                sb.append(quote(e.getKey())).append(':').append(e.getValue().canonical());
            }
            return sb.append('}').toString();
        }

        @Override public String toString() { return canonical(); }
    }

    private static String quote(String s) {
        var sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
                }
            }
        }
        return sb.append('"').toString();
    }
}
