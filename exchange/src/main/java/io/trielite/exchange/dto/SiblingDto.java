package io.trielite.exchange.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * JSON shape of one version of a versioned leaf:
 *   { "value": 42, "version": { "r1": 2 } }
 *   { "deleted": true, "version": { "r1": 3 } }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SiblingDto {
    public JsonNode value;
    public Boolean deleted;
    public Map<String, Integer> version;
}
