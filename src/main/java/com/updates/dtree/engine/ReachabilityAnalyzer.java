package com.updates.dtree.engine;

import com.updates.dtree.api.NodeId;
import com.updates.dtree.api.SearchDepthExceededException;
import com.updates.dtree.constraint.ConstraintQuery;
import com.updates.dtree.constraint.QueryRegions;
import com.updates.dtree.node.Edge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Explains which queries reach a node.
 *
 * <p>
 * Depth-first search over simple paths from the root. Each path carries the
 * intersection of the edge constraints taken so far; an edge whose
 * constraint makes that intersection unsatisfiable is pruned, and an edge
 * back onto the current path is skipped. Reaching a target emits the
 * accumulated region and stops that path.
 *
 * <p>
 * The union of the emitted regions is exactly the set of queries the
 * {@link TreeEvaluator} routes through the target. Regions are not merged, so
 * equivalent regions may appear more than once.
 *
 * <p>
 * The search uses an explicit stack bounded by {@code maxDepth} edges, so
 * very deep graphs fail with {@link SearchDepthExceededException} rather than
 * overflowing the thread stack.
 */
@Log4j2
public final class ReachabilityAnalyzer {
    public static final int DEFAULT_MAX_DEPTH = 1024;

    private final DecisionGraph graph;
    private final int maxDepth;

    public ReachabilityAnalyzer(DecisionGraph graph) {
        this(graph, DEFAULT_MAX_DEPTH);
    }

    public ReachabilityAnalyzer(DecisionGraph graph, int maxDepth) {
        if (maxDepth <= 0)
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.graph = graph;
        this.maxDepth = maxDepth;
    }

    /** Regions of the query space routed to {@code target}. */
    public QueryRegions findQueriesFor(NodeId target) {
        if (!graph.contains(target))
            throw new IllegalArgumentException("Unknown node: " + target);
        QueryRegions regions = search(Set.of(target)).getOrDefault(target, QueryRegions.EMPTY);
        log.debug("{} region(s) reach node {}", regions.size(), target);
        return regions;
    }

    /**
     * Regions for every terminal node, in graph order. Terminals nothing can
     * reach map to {@link QueryRegions#EMPTY}.
     */
    public Map<NodeId, QueryRegions> outcomeRegions() {
        Set<NodeId> terminals = graph.terminals().keySet();
        Map<NodeId, QueryRegions> found = search(terminals);
        Map<NodeId, QueryRegions> out = new LinkedHashMap<>();
        for (NodeId id : terminals)
            out.put(id, found.getOrDefault(id, QueryRegions.EMPTY));
        return out;
    }

    private Map<NodeId, QueryRegions> search(Set<NodeId> targets) {
        Map<NodeId, List<ConstraintQuery>> found = new LinkedHashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(graph.root(), ConstraintQuery.ANY, null, 0));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (targets.contains(frame.node)) {
                found.computeIfAbsent(frame.node, k -> new ArrayList<>()).add(frame.region);
                continue;
            }
            List<Edge> edges = graph.node(frame.node).edges();
            if (!edges.isEmpty() && frame.depth >= maxDepth)
                throw new SearchDepthExceededException(maxDepth, frame.node);
            // Reverse push keeps declaration order on pop.
            for (int i = edges.size() - 1; i >= 0; i--) {
                Edge edge = edges.get(i);
                if (frame.onPath(edge.target()))
                    continue;
                Optional<ConstraintQuery> narrowed = edge.narrow(frame.region);
                if (narrowed.isEmpty())
                    continue;
                stack.push(new Frame(edge.target(), narrowed.get(), frame, frame.depth + 1));
            }
        }

        Map<NodeId, QueryRegions> out = new LinkedHashMap<>();
        found.forEach((id, regions) -> out.put(id, QueryRegions.of(regions)));
        return out;
    }

    /** One step of a path: the node reached and the region that reaches it. */
    private static final class Frame {
        final NodeId node;
        final ConstraintQuery region;
        final Frame parent;
        final int depth;

        Frame(NodeId node, ConstraintQuery region, Frame parent, int depth) {
            this.node = node;
            this.region = region;
            this.parent = parent;
            this.depth = depth;
        }

        boolean onPath(NodeId id) {
            for (Frame f = this; f != null; f = f.parent)
                if (f.node.equals(id))
                    return true;
            return false;
        }
    }
}
