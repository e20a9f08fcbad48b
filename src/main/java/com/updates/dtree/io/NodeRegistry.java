package com.updates.dtree.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.updates.dtree.api.DecodingException;
import com.updates.dtree.api.NodeId;
import com.updates.dtree.api.NodeType;
import com.updates.dtree.node.DecisionNode;
import com.updates.dtree.node.EnumeratedNode;
import com.updates.dtree.node.EqualsBranchNode;
import com.updates.dtree.node.OrderedCutoffNode;
import com.updates.dtree.node.ProbabilisticNode;
import com.updates.dtree.node.SetMembershipNode;
import com.updates.dtree.node.TerminalNode;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Registry mapping each {@link NodeType} to the codec that writes and reads
 * its state.
 *
 * <p>
 * The registry is closed: built-ins are registered in code and construction
 * fails if any variant lacks a codec.
 */
public final class NodeRegistry {

    /** Writes a node's constructor parameters into its state object. */
    @FunctionalInterface
    public interface NodeEncoder {
        void encode(DecisionNode node, ObjectNode state);
    }

    /** Rebuilds a node from its state. */
    @FunctionalInterface
    public interface NodeDecoder {
        DecisionNode decode(NodeState state);
    }

    /** Codec for one variant. */
    public record NodeCodec(NodeEncoder encoder, NodeDecoder decoder) {
    }

    private final Map<NodeType, NodeCodec> registry = new EnumMap<>(NodeType.class);

    public NodeRegistry() {
        registerBuiltIns();
        for (NodeType type : NodeType.values()) {
            if (!registry.containsKey(type))
                throw new IllegalStateException("No codec registered for node type " + type);
        }
    }

    public NodeCodec codec(NodeType type) {
        return registry.get(type);
    }

    // ── Built-in Codecs ──────────────────────────────────────────────

    private void registerBuiltIns() {
        register(NodeType.TERMINAL, TerminalNode.class,
                (n, s) -> putScalar(s, "value", n.value()),
                s -> new TerminalNode(s.scalar("value")));

        register(NodeType.EQUALS_BRANCH, EqualsBranchNode.class,
                (n, s) -> {
                    s.put("field", n.field());
                    putScalar(s, "value", n.value());
                    s.put("success", n.success().value());
                    s.put("failure", n.failure().value());
                },
                s -> new EqualsBranchNode(s.text("field"), s.scalar("value"),
                        s.nodeId("success"), s.nodeId("failure")));

        register(NodeType.ORDERED_CUTOFF, OrderedCutoffNode.class,
                (n, s) -> {
                    s.put("field", n.field());
                    putScalar(s, "cutoff", n.cutoff());
                    s.put("less", n.less().value());
                    s.put("greater_or_equal", n.greaterOrEqual().value());
                },
                s -> new OrderedCutoffNode(s.text("field"), s.scalar("cutoff"),
                        s.nodeId("less"), s.nodeId("greater_or_equal")));

        register(NodeType.SET_MEMBERSHIP, SetMembershipNode.class,
                (n, s) -> {
                    s.put("field", n.field());
                    ArrayNode values = s.putArray("values");
                    for (Object v : n.values())
                        addScalar(values, v);
                    s.put("in", n.in().value());
                    s.put("not_in", n.notIn().value());
                },
                s -> new SetMembershipNode(s.text("field"), new HashSet<>(s.scalars("values")),
                        s.nodeId("in"), s.nodeId("not_in")));

        register(NodeType.ENUMERATED, EnumeratedNode.class,
                (n, s) -> {
                    s.put("field", n.field());
                    ArrayNode cases = s.putArray("cases");
                    for (Map.Entry<Object, NodeId> e : n.cases().entrySet()) {
                        ObjectNode c = cases.addObject();
                        putScalar(c, "value", e.getKey());
                        c.put("target", e.getValue().value());
                    }
                    s.put("default", n.fallback().value());
                },
                s -> {
                    Map<Object, NodeId> cases = new LinkedHashMap<>();
                    for (JsonNode element : s.array("cases")) {
                        NodeState c = s.nested("cases", element);
                        Object value = c.scalar("value");
                        if (cases.put(value, c.nodeId("target")) != null)
                            throw new DecodingException(s.nodeId(), "Duplicate enumerated case " + value);
                    }
                    return new EnumeratedNode(s.text("field"), cases, s.nodeId("default"));
                });

        register(NodeType.PROBABILISTIC, ProbabilisticNode.class,
                (n, s) -> {
                    s.put("threshold", n.threshold());
                    s.put("inside", n.inside().value());
                    s.put("outside", n.outside().value());
                },
                s -> new ProbabilisticNode(s.number("threshold"), s.nodeId("inside"), s.nodeId("outside")));
    }

    private <N extends DecisionNode> void register(NodeType type, Class<N> nodeClass,
            BiConsumer<N, ObjectNode> encoder, NodeDecoder decoder) {
        NodeEncoder typed = (node, state) -> encoder.accept(nodeClass.cast(node), state);
        registry.put(type, new NodeCodec(typed, decoder));
    }

    // ── Scalar helpers ──────────────────────────────────────────────

    static void putScalar(ObjectNode target, String key, Object value) {
        if (value instanceof String s)
            target.put(key, s);
        else if (value instanceof Long l)
            target.put(key, l);
        else if (value instanceof Boolean b)
            target.put(key, b);
        else
            throw new IllegalArgumentException("Not a scalar: " + value);
    }

    static void addScalar(ArrayNode target, Object value) {
        if (value instanceof String s)
            target.add(s);
        else if (value instanceof Long l)
            target.add(l);
        else if (value instanceof Boolean b)
            target.add(b);
        else
            throw new IllegalArgumentException("Not a scalar: " + value);
    }
}
