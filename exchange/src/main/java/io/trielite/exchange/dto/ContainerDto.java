package io.trielite.exchange.dto;

import java.util.Map;

/**
 * JSON shape of a container on the wire:
 *   {
 *     "id": "r1",
 *     "version": { "r1": 3, "r2": 1 },
 *     "root": { "type": "branch", "children": { ... } }
 *   }
 */
public class ContainerDto {
    public String id;
    public Map<String, Integer> version;
    public NodeDto root;
}
