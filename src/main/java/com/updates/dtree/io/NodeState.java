package com.updates.dtree.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.updates.dtree.api.DecodingException;
import com.updates.dtree.api.NodeId;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed, validating view over a node's JSON state during decoding. Every
 * accessor throws {@link DecodingException} naming the node and key when the
 * payload does not have the expected shape.
 */
public final class NodeState {
    private final String nodeId;
    private final JsonNode state;

    NodeState(String nodeId, JsonNode state) {
        this.nodeId = nodeId;
        this.state = state;
    }

    public String nodeId() {
        return nodeId;
    }

    public String text(String key) {
        JsonNode v = require(key);
        if (!v.isTextual())
            throw malformed(key, "a string", v);
        return v.textValue();
    }

    public double number(String key) {
        JsonNode v = require(key);
        if (!v.isNumber())
            throw malformed(key, "a number", v);
        return v.doubleValue();
    }

    /** A string, integer or boolean. */
    public Object scalar(String key) {
        return toScalar(key, require(key));
    }

    public List<Object> scalars(String key) {
        List<Object> out = new ArrayList<>();
        for (JsonNode element : array(key))
            out.add(toScalar(key, element));
        return out;
    }

    /** Node ids may be written as strings or integers. */
    public NodeId nodeId(String key) {
        return toNodeId(key, require(key));
    }

    public JsonNode array(String key) {
        JsonNode v = require(key);
        if (!v.isArray())
            throw malformed(key, "an array", v);
        return v;
    }

    /** Nested object view, for array elements such as enumerated cases. */
    public NodeState nested(String key, JsonNode element) {
        if (!element.isObject())
            throw malformed(key, "an object", element);
        return new NodeState(nodeId, element);
    }

    Object toScalar(String key, JsonNode v) {
        if (v.isTextual())
            return v.textValue();
        if (v.isBoolean())
            return v.booleanValue();
        if (v.isIntegralNumber() && v.canConvertToLong())
            return v.longValue();
        throw malformed(key, "a string, integer or boolean", v);
    }

    NodeId toNodeId(String key, JsonNode v) {
        if (v.isTextual() && !v.textValue().isEmpty())
            return NodeId.of(v.textValue());
        if (v.isIntegralNumber() && v.canConvertToLong())
            return NodeId.of(v.longValue());
        throw malformed(key, "a node id", v);
    }

    private JsonNode require(String key) {
        JsonNode v = state.get(key);
        if (v == null || v.isNull())
            throw new DecodingException(nodeId, "Missing '" + key + "' in node state");
        return v;
    }

    private DecodingException malformed(String key, String expected, JsonNode actual) {
        return new DecodingException(nodeId, "'" + key + "' must be " + expected + " but was " + actual);
    }
}
