package io.trielite.facts;

import io.trielite.core.codec.TrieValue;

import java.util.Objects;

/**
 * One entry of a fact's history.
 *
 * @param transaction local transaction that made the change, counting from 1
 * @param added       true for an assertion, false for a retraction (whose
 *                    value is the one retracted)
 */
public record FactChange(String entity, String attribute, TrieValue value, long transaction, boolean added) {
    public FactChange {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(value, "value");
    }
}
