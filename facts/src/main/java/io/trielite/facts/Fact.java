package io.trielite.facts;

import io.trielite.core.codec.TrieValue;

import java.util.Objects;

/**
 * One current entity-attribute-value fact.
 */
public record Fact(String entity, String attribute, TrieValue value) {
    public Fact {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(value, "value");
    }
}
