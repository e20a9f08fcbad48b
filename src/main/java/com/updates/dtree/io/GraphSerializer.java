package com.updates.dtree.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.updates.dtree.api.DecodingException;
import com.updates.dtree.api.NodeId;
import com.updates.dtree.api.NodeType;
import com.updates.dtree.engine.DecisionGraph;
import com.updates.dtree.node.DecisionNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Converts a {@link DecisionGraph} to and from its persisted forms.
 *
 * <p>
 * The core contract is the ordered record sequence:
 * {@code deserialize(serialize(g)).equals(g)} for every graph. The root's
 * record always comes first, so the sequence needs no separate root field.
 * On top of it sits a JSON document ({@link GraphDefinition}) that also
 * records the root, name and version.
 *
 * <p>
 * Decoding fails with {@link DecodingException} for an unknown variant tag,
 * a malformed payload, a duplicate id or malformed JSON. A well-formed record
 * set describing an invalid graph fails with the graph's own validation
 * errors.
 */
public final class GraphSerializer {
    private static final Logger log = LogManager.getLogger(GraphSerializer.class);

    private final ObjectMapper mapper;
    private final NodeRegistry registry = new NodeRegistry();

    public GraphSerializer() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public GraphSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // ── Record sequence ─────────────────────────────────────────────

    /** Encodes every node, root first, then the rest in graph order. */
    public List<NodeRecord> serialize(DecisionGraph graph) {
        List<NodeRecord> records = new ArrayList<>(graph.size());
        records.add(encode(graph.root(), graph.node(graph.root())));
        for (Map.Entry<NodeId, DecisionNode> e : graph.nodes().entrySet())
            if (!e.getKey().equals(graph.root()))
                records.add(encode(e.getKey(), e.getValue()));
        return records;
    }

    public NodeRecord encode(NodeId id, DecisionNode node) {
        ObjectNode state = mapper.createObjectNode();
        registry.codec(node.type()).encoder().encode(node, state);
        return new NodeRecord(id, node.type().tag(), state);
    }

    /** Rebuilds a graph rooted at the first record. */
    public DecisionGraph deserialize(List<NodeRecord> records) {
        if (records.isEmpty())
            throw new DecodingException(null, "No node records");
        return deserialize(records, records.get(0).id());
    }

    public DecisionGraph deserialize(List<NodeRecord> records, NodeId root) {
        DecisionGraph.Builder builder = DecisionGraph.builder().root(root);
        Set<NodeId> seen = new HashSet<>();
        for (NodeRecord record : records) {
            if (!seen.add(record.id()))
                throw new DecodingException(record.id().value(), "Duplicate node id");
            builder.node(record.id(), decode(record));
        }
        DecisionGraph graph = builder.build();
        log.debug("Decoded {} node records", records.size());
        return graph;
    }

    public DecisionNode decode(NodeRecord record) {
        String id = record.id().value();
        NodeType type;
        try {
            type = NodeType.fromString(record.type());
        } catch (IllegalArgumentException e) {
            throw new DecodingException(id, "Unknown node type '" + record.type() + "'", e);
        }
        if (!record.state().isObject())
            throw new DecodingException(id, "Node state must be a JSON object but was " + record.state());

        try {
            DecisionNode node = registry.codec(type).decoder().decode(new NodeState(id, record.state()));
            log.debug("Decoded node {} as {}", id, type);
            return node;
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new DecodingException(id, "Invalid " + type + " parameters: " + e.getMessage(), e);
        }
    }

    // ── JSON document ───────────────────────────────────────────────

    public GraphDefinition toDefinition(DecisionGraph graph, String name, String version) {
        List<GraphDefinition.NodeDef> defs = new ArrayList<>(graph.size());
        for (Map.Entry<NodeId, DecisionNode> e : graph.nodes().entrySet()) {
            NodeRecord record = encode(e.getKey(), e.getValue());
            GraphDefinition.NodeDef nd = new GraphDefinition.NodeDef();
            nd.setId(record.id().value());
            nd.setType(record.type());
            nd.setDescription(e.getValue().displayLabel());
            nd.setState(record.state());
            defs.add(nd);
        }
        GraphDefinition.TreeInfo info = new GraphDefinition.TreeInfo();
        info.setName(name);
        info.setVersion(version);
        info.setRoot(graph.root().value());
        info.setNodes(defs);
        GraphDefinition def = new GraphDefinition();
        def.setTree(info);
        return def;
    }

    public DecisionGraph fromDefinition(GraphDefinition def) {
        GraphDefinition.TreeInfo info = def.getTree();
        if (info == null)
            throw new DecodingException(null, "Missing 'tree' key");
        if (info.getNodes() == null || info.getNodes().isEmpty())
            throw new DecodingException(null, "Tree '" + info.getName() + "' has no nodes");

        List<NodeRecord> records = new ArrayList<>(info.getNodes().size());
        for (GraphDefinition.NodeDef nd : info.getNodes()) {
            if (nd.getId() == null || nd.getId().isEmpty())
                throw new DecodingException(null, "Node without id in tree '" + info.getName() + "'");
            if (nd.getType() == null)
                throw new DecodingException(nd.getId(), "Missing 'type'");
            if (nd.getState() == null)
                throw new DecodingException(nd.getId(), "Missing 'state'");
            records.add(new NodeRecord(NodeId.of(nd.getId()), nd.getType(), nd.getState()));
        }
        NodeId root = info.getRoot() == null ? NodeId.ROOT : NodeId.of(info.getRoot());
        DecisionGraph graph = deserialize(records, root);
        log.info("Loaded decision tree '{}' version {} with {} nodes", info.getName(), info.getVersion(),
                graph.size());
        return graph;
    }

    public String toJson(DecisionGraph graph) {
        return toJson(graph, null, null);
    }

    public String toJson(DecisionGraph graph, String name, String version) {
        try {
            return mapper.writeValueAsString(toDefinition(graph, name, version));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write decision tree as JSON", e);
        }
    }

    public DecisionGraph fromJson(String json) {
        GraphDefinition def;
        try {
            def = mapper.readValue(json, GraphDefinition.class);
        } catch (JsonProcessingException e) {
            throw new DecodingException(null, "Malformed decision tree document", e);
        }
        return fromDefinition(def);
    }

    /** Parses a JSON document file. */
    public DecisionGraph read(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    public DecisionGraph read(InputStream in) throws IOException {
        return fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }

    public void write(DecisionGraph graph, String name, String version, Path path) throws IOException {
        Files.writeString(path, toJson(graph, name, version));
        log.info("Decision tree '{}' saved to {}", name, path);
    }
}
