package com.updates.dtree.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.updates.dtree.api.DecodingException;
import com.updates.dtree.api.NodeId;

import java.util.Objects;

/**
 * One persisted node: id, variant tag and the variant's constructor
 * parameters as a JSON object.
 *
 * The three parts map one-to-one onto storage columns ({@code node_id},
 * {@code node_type}, {@code node_state}); {@link #of(String, String, String)}
 * and {@link #stateJson()} convert from and to such a row.
 */
public record NodeRecord(NodeId id, String type, JsonNode state) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public NodeRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(state, "state");
    }

    /**
     * Reads a storage row.
     *
     * @throws DecodingException if the id is empty or the state is not valid
     *                           JSON
     */
    public static NodeRecord of(String id, String type, String stateJson) {
        if (id == null || id.isEmpty())
            throw new DecodingException(null, "Record has no node id");
        if (type == null)
            throw new DecodingException(id, "Record has no node type");
        if (stateJson == null)
            throw new DecodingException(id, "Record has no node state");
        try {
            return new NodeRecord(NodeId.of(id), type, MAPPER.readTree(stateJson));
        } catch (JsonProcessingException e) {
            throw new DecodingException(id, "Malformed node state JSON", e);
        }
    }

    public String stateJson() {
        return state.toString();
    }
}
