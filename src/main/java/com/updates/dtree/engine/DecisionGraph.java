package com.updates.dtree.engine;

import com.updates.dtree.api.CycleDetectedException;
import com.updates.dtree.api.DanglingReferenceException;
import com.updates.dtree.api.NodeId;
import com.updates.dtree.node.DecisionNode;
import com.updates.dtree.node.Edge;
import com.updates.dtree.node.TerminalNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * An immutable decision graph: node id to node, plus the designated root.
 *
 * <p>
 * Every graph is validated when built:
 * <ul>
 * <li>the root exists,</li>
 * <li>every edge target exists ({@link DanglingReferenceException}),</li>
 * <li>there is no cycle ({@link CycleDetectedException}), so evaluation always
 * terminates.</li>
 * </ul>
 * Unreachable nodes are allowed but logged.
 *
 * <p>
 * Edits never mutate: {@link #replace} and {@link #withNode} return a new
 * graph that shares every untouched node with this one. Iteration follows
 * insertion order, which keeps serialization reproducible.
 */
@Log4j2
public final class DecisionGraph {
    private final NodeId root;
    private final Map<NodeId, DecisionNode> nodes;

    private DecisionGraph(NodeId root, Map<NodeId, DecisionNode> nodes) {
        this.root = root;
        this.nodes = Collections.unmodifiableMap(nodes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public NodeId root() {
        return root;
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(NodeId id) {
        return nodes.containsKey(id);
    }

    /** Resolves a node id. */
    public DecisionNode node(NodeId id) {
        DecisionNode node = nodes.get(id);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return node;
    }

    /** All nodes in insertion order. */
    public Map<NodeId, DecisionNode> nodes() {
        return nodes;
    }

    /** Terminal nodes in insertion order. */
    public Map<NodeId, TerminalNode> terminals() {
        Map<NodeId, TerminalNode> out = new LinkedHashMap<>();
        for (Map.Entry<NodeId, DecisionNode> e : nodes.entrySet())
            if (e.getValue() instanceof TerminalNode t)
                out.put(e.getKey(), t);
        return out;
    }

    /**
     * Returns a graph with the node at {@code id} swapped for {@code node}.
     * This graph is unchanged.
     */
    public DecisionGraph replace(NodeId id, DecisionNode node) {
        if (!nodes.containsKey(id))
            throw new IllegalArgumentException("Cannot replace unknown node: " + id);
        Map<NodeId, DecisionNode> copy = new LinkedHashMap<>(nodes);
        copy.put(id, Objects.requireNonNull(node, "node"));
        return create(root, copy);
    }

    /** Returns a graph with one extra node. This graph is unchanged. */
    public DecisionGraph withNode(NodeId id, DecisionNode node) {
        if (nodes.containsKey(id))
            throw new IllegalArgumentException("Duplicate node id: " + id);
        Map<NodeId, DecisionNode> copy = new LinkedHashMap<>(nodes);
        copy.put(id, Objects.requireNonNull(node, "node"));
        return create(root, copy);
    }

    public Builder toBuilder() {
        Builder b = new Builder().root(root);
        for (Map.Entry<NodeId, DecisionNode> e : nodes.entrySet())
            b.node(e.getKey(), e.getValue());
        return b;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DecisionGraph g && root.equals(g.root) && nodes.equals(g.nodes);
    }

    @Override
    public int hashCode() {
        return 31 * root.hashCode() + nodes.hashCode();
    }

    @Override
    public String toString() {
        return "DecisionGraph(root=" + root + ", " + nodes.size() + " nodes)";
    }

    private static DecisionGraph create(NodeId root, Map<NodeId, DecisionNode> nodes) {
        validate(root, nodes);
        return new DecisionGraph(root, nodes);
    }

    /**
     * Checks references, then runs Kahn's algorithm over the edges: any node
     * whose in-degree never drops to zero sits on or behind a cycle.
     */
    private static void validate(NodeId root, Map<NodeId, DecisionNode> nodes) {
        if (!nodes.containsKey(root))
            throw new DanglingReferenceException(null, root);

        Map<NodeId, Integer> inDegree = new HashMap<>(nodes.size() * 2);
        for (NodeId id : nodes.keySet())
            inDegree.put(id, 0);
        for (Map.Entry<NodeId, DecisionNode> e : nodes.entrySet()) {
            for (Edge edge : e.getValue().edges()) {
                if (!nodes.containsKey(edge.target()))
                    throw new DanglingReferenceException(e.getKey(), edge.target());
                inDegree.merge(edge.target(), 1, Integer::sum);
            }
        }

        Deque<NodeId> queue = new ArrayDeque<>();
        for (Map.Entry<NodeId, Integer> e : inDegree.entrySet())
            if (e.getValue() == 0)
                queue.add(e.getKey());
        int processed = 0;
        while (!queue.isEmpty()) {
            NodeId curr = queue.poll();
            processed++;
            for (Edge edge : nodes.get(curr).edges())
                if (inDegree.merge(edge.target(), -1, Integer::sum) == 0)
                    queue.add(edge.target());
        }
        if (processed != nodes.size()) {
            List<NodeId> unresolved = new ArrayList<>();
            for (NodeId id : nodes.keySet())
                if (inDegree.get(id) > 0)
                    unresolved.add(id);
            throw new CycleDetectedException(unresolved);
        }

        Set<NodeId> reachable = new HashSet<>();
        Deque<NodeId> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            NodeId id = pending.pop();
            if (reachable.add(id))
                for (Edge edge : nodes.get(id).edges())
                    pending.push(edge.target());
        }
        if (reachable.size() < nodes.size()) {
            List<NodeId> orphans = new ArrayList<>();
            for (NodeId id : nodes.keySet())
                if (!reachable.contains(id))
                    orphans.add(id);
            log.warn("Nodes unreachable from root {}: {}", root, orphans);
        }
        log.debug("Validated decision graph: root={}, {} nodes", root, nodes.size());
    }

    /**
     * Collects nodes and validates them into a {@link DecisionGraph}.
     */
    public static final class Builder {
        private NodeId root = NodeId.ROOT;
        private final Map<NodeId, DecisionNode> nodes = new LinkedHashMap<>();

        public Builder root(NodeId root) {
            this.root = Objects.requireNonNull(root, "root");
            return this;
        }

        public Builder node(NodeId id, DecisionNode node) {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(node, "node");
            if (nodes.containsKey(id))
                throw new IllegalArgumentException("Duplicate node id: " + id);
            nodes.put(id, node);
            return this;
        }

        public Builder node(long id, DecisionNode node) {
            return node(NodeId.of(id), node);
        }

        public Builder node(String id, DecisionNode node) {
            return node(NodeId.of(id), node);
        }

        public DecisionGraph build() {
            return create(root, new LinkedHashMap<>(nodes));
        }
    }
}
