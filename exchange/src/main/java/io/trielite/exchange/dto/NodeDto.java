package io.trielite.exchange.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * JSON shape of one trie node. Exactly one of three forms:
 *   { "type": "branch",    "children": { "seg": node, ... } }
 *   { "type": "value",     "value": 42 }
 *   { "type": "container", "value": 42, "version": { "r1": 2 } }
 * A versioned leaf holding concurrent versions, or a tombstone, lists them:
 *   { "type": "container", "siblings": [ sibling, ... ] }
 * Leaf values are always scalars; compound values travel decomposed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeDto {
    public static final String BRANCH = "branch";
    public static final String VALUE = "value";
    public static final String CONTAINER = "container";

    public String type;
    public Map<String, NodeDto> children;
    public JsonNode value;
    public Map<String, Integer> version;
    public List<SiblingDto> siblings;
}
