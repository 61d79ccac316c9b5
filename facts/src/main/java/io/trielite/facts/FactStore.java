// file: src/main/java/io/trielite/facts/FactStore.java
package io.trielite.facts;

import io.trielite.core.Container;
import io.trielite.core.codec.TrieValue;
import io.trielite.core.merge.MergeConfig;
import io.trielite.core.trie.TrieNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entity-attribute-value facts kept in a {@link Container}.
 * <p>
 * Layout: the fact (e, a, v) lives at path [e, a] as versioned content, so two
 * replicas asserting different attributes of the same entity merge cleanly and
 * concurrent assertions of the same attribute resolve like any versioned leaf.
 * Retractions leave tombstones, so they replicate like assertions.
 * <p>
 * Immutable: every operation returns a new store and counts as one local
 * transaction. A store links back to the store it was derived from, which is
 * what {@link #history} and {@link #asOf} read; that chain is local and is not
 * part of the container that replicas exchange.
 */
public final class FactStore {

    private final Container container;
    private final long transaction;
    private final List<FactChange> changes;
    private final FactStore previous;

    /** Store over {@code container}, as transaction 0 with no history. */
    public FactStore(Container container) {
        this(container, 0, List.of(), null);
    }

    private FactStore(Container container, long transaction, List<FactChange> changes, FactStore previous) {
        this.container = Objects.requireNonNull(container, "container");
        this.transaction = transaction;
        this.changes = changes;
        this.previous = previous;
    }

    public static FactStore create(String replicaId) {
        return new FactStore(Container.create(replicaId));
    }

    public Container container() {
        return container;
    }

    /** Number of local transactions behind this store. */
    public long transaction() {
        return transaction;
    }

    /** Assert (or re-assert) {@code attribute} of {@code entity}. */
    public FactStore assertFact(String entity, String attribute, Object value) {
        return assertFacts(entity, Map.of(checked(attribute, "attribute"), TrieValue.of(value)));
    }

    /** Assert several attributes of one entity in a single transaction. */
    public FactStore assertFacts(String entity, Map<String, ?> attributes) {
        long tx = transaction + 1;
        Container next = container;
        var made = new ArrayList<FactChange>(attributes.size());
        for (var e : attributes.entrySet()) {
            TrieValue value = TrieValue.of(e.getValue());
            next = next.updateValue(path(entity, e.getKey()), value);
            made.add(new FactChange(entity, e.getKey(), value, tx, true));
        }
        return next(next, made);
    }

    public FactStore retract(String entity, String attribute) {
        var made = new ArrayList<FactChange>(1);
        value(entity, attribute).ifPresent(v -> made.add(new FactChange(entity, attribute, v, transaction + 1, false)));
        return next(container.removeValue(path(entity, attribute)), made);
    }

    public FactStore retractEntity(String entity) {
        var made = new ArrayList<FactChange>();
        entity(entity).forEach((attribute, v) -> made.add(new FactChange(entity, attribute, v, transaction + 1, false)));
        return next(container.removeValue(List.of(checked(entity, "entity"))), made);
    }

    /**
     * Every assertion and retraction of {@code attribute} of {@code entity}
     * made through this store's chain, oldest first. Facts that arrived by
     * merge are recorded as changes of the merging transaction.
     */
    public List<FactChange> history(String entity, String attribute) {
        path(entity, attribute);
        var newestFirst = new ArrayDeque<FactStore>();
        for (FactStore s = this; s != null; s = s.previous) newestFirst.push(s);
        var out = new ArrayList<FactChange>();
        for (FactStore s : newestFirst) {
            for (FactChange c : s.changes) {
                if (c.entity().equals(entity) && c.attribute().equals(attribute)) out.add(c);
            }
        }
        return out;
    }

    /**
     * The store as it was right after {@code transaction}. Later transactions
     * return this store; transactions before the start of the chain return
     * its first store.
     */
    public FactStore asOf(long transaction) {
        if (transaction < 0) throw new IllegalArgumentException("transaction must be >= 0: " + transaction);
        FactStore s = this;
        while (s.transaction > transaction && s.previous != null) s = s.previous;
        return s;
    }

    public Optional<TrieValue> value(String entity, String attribute) {
        return container.valueAt(path(entity, attribute));
    }

    /** Current attributes of {@code entity}, attribute -> value. */
    public Map<String, TrieValue> entity(String entity) {
        var out = new LinkedHashMap<String, TrieValue>();
        container.get(List.of(checked(entity, "entity"))).ifPresent(node -> {
            if (node instanceof TrieNode.Branch branch) {
                branch.children().forEach((attribute, child) ->
                        container.valueAt(List.of(entity, attribute)).ifPresent(v -> out.put(attribute, v)));
            }
        });
        return out;
    }

    public boolean entityExists(String entity) {
        return !entity(entity).isEmpty();
    }

    /** Entities whose current {@code attribute} equals {@code value}. */
    public List<String> findEntities(String attribute, Object value) {
        TrieValue wanted = TrieValue.of(value);
        var out = new ArrayList<String>();
        for (Fact f : facts()) {
            if (f.attribute().equals(attribute) && f.value().equals(wanted)) out.add(f.entity());
        }
        return out;
    }

    /** Every current fact, ordered by entity then attribute. */
    public List<Fact> facts() {
        var out = new ArrayList<Fact>();
        if (!(container.root() instanceof TrieNode.Branch root)) return out;
        for (String entity : root.children().keySet()) {
            entity(entity).forEach((attribute, value) -> out.add(new Fact(entity, attribute, value)));
        }
        return out;
    }

    public FactStore merge(FactStore other) {
        return merge(other, MergeConfig.defaults());
    }

    /** Merge the other store's container; its history is not carried over. */
    public FactStore merge(FactStore other, MergeConfig config) {
        Container merged = container.merge(other.container, config);
        if (merged == container) return this;
        return next(merged, diff(facts(), new FactStore(merged).facts(), transaction + 1));
    }

    private FactStore next(Container next, List<FactChange> made) {
        return new FactStore(next, transaction + 1, List.copyOf(made), this);
    }

    // Changes that turn the "before" facts into the "after" facts.
    private static List<FactChange> diff(List<Fact> before, List<Fact> after, long tx) {
        var old = new LinkedHashMap<List<String>, TrieValue>();
        before.forEach(f -> old.put(List.of(f.entity(), f.attribute()), f.value()));
        var out = new ArrayList<FactChange>();
        for (Fact f : after) {
            TrieValue was = old.remove(List.of(f.entity(), f.attribute()));
            if (!f.value().equals(was)) out.add(new FactChange(f.entity(), f.attribute(), f.value(), tx, true));
        }
        old.forEach((key, v) -> out.add(new FactChange(key.get(0), key.get(1), v, tx, false)));
        return out;
    }

    private static List<String> path(String entity, String attribute) {
        return List.of(checked(entity, "entity"), checked(attribute, "attribute"));
    }

    private static String checked(String s, String what) {
        Objects.requireNonNull(s, what);
        if (s.isBlank()) throw new IllegalArgumentException(what + " must not be blank");
        return s;
    }
}
