package com.updates.dtree.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.Data;

/**
 * POJO representation of a persisted decision tree document.
 *
 * <pre>
 * {"tree": {"name": ..., "version": ..., "root": "0",
 *           "nodes": [{"id": ..., "type": ..., "description": ..., "state": {...}}]}}
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private TreeInfo tree;

    /** Meta-information about the tree plus its nodes, in order. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class TreeInfo {
        private String name, version, root;
        private List<NodeDef> nodes;
    }

    /** One node; {@code description} is informational and ignored on read. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeDef {
        private String id, type, description;
        private JsonNode state;
    }
}
