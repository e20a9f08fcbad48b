package com.updates.dtree.util;

import com.updates.dtree.api.NodeId;
import com.updates.dtree.constraint.ConstraintQuery;
import com.updates.dtree.constraint.QueryRegions;
import com.updates.dtree.engine.DecisionGraph;
import com.updates.dtree.engine.DiffEntry;
import com.updates.dtree.engine.ReachabilityAnalyzer;
import com.updates.dtree.node.DecisionNode;
import com.updates.dtree.node.Edge;

import java.util.List;
import java.util.Map;

/**
 * Diagnostic utility for inspecting a decision graph.
 *
 * <p>
 * Produces human-readable text: the node list with display labels, edge
 * labels and terminal flags (what a diagram renderer needs), the query
 * regions behind each outcome, and diff reports.
 *
 * <p>
 * <b>Usage:</b> debugging, logging and review tooling. Allocates freely.
 */
public final class GraphExplain {
    private final DecisionGraph graph;
    private final ReachabilityAnalyzer analyzer;

    public GraphExplain(DecisionGraph graph) {
        this(graph, new ReachabilityAnalyzer(graph));
    }

    public GraphExplain(DecisionGraph graph, ReachabilityAnalyzer analyzer) {
        this.graph = graph;
        this.analyzer = analyzer;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(NodeId id) {
        DecisionNode node = graph.node(id);
        List<Edge> edges = node.edges();
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(id).append('\n')
                .append("  Type: ").append(node.type()).append('\n')
                .append("  Label: ").append(node.displayLabel()).append('\n')
                .append("  Terminal: ").append(node.isTerminal()).append('\n')
                .append("  Root: ").append(id.equals(graph.root())).append('\n')
                .append("  Edges (").append(edges.size()).append("): ");
        appendEdges(sb, edges);
        return sb.append('\n').toString();
    }

    /**
     * Dumps the whole graph, one node per line, in graph order.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.size()).append(" nodes, root ").append(graph.root()).append("):\n");
        for (Map.Entry<NodeId, DecisionNode> e : graph.nodes().entrySet()) {
            DecisionNode node = e.getValue();
            sb.append("  [").append(e.getKey()).append("] ").append(node.displayLabel());
            if (node.isTerminal()) {
                sb.append(" (OUTCOME)");
            } else {
                sb.append(" -> ");
                appendEdges(sb, node.edges());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /** Lists the query regions that end at {@code target}. */
    public String explainOutcome(NodeId target) {
        DecisionNode node = graph.node(target);
        QueryRegions regions = analyzer.findQueriesFor(target);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Queries reaching [").append(target).append("] ").append(node.displayLabel())
                .append(" (").append(regions.size()).append(" region(s)):\n");
        appendRegions(sb, regions);
        return sb.toString();
    }

    /** {@link #explainOutcome} for every terminal. */
    public String explainOutcomes() {
        StringBuilder sb = new StringBuilder(1024);
        for (Map.Entry<NodeId, QueryRegions> e : analyzer.outcomeRegions().entrySet()) {
            sb.append('[').append(e.getKey()).append("] ")
                    .append(graph.node(e.getKey()).displayLabel()).append(":\n");
            appendRegions(sb, e.getValue());
        }
        return sb.toString();
    }

    /** Renders a diff report. */
    public static String explainDiff(List<DiffEntry> entries) {
        if (entries.isEmpty())
            return "No changes.\n";
        StringBuilder sb = new StringBuilder(512);
        for (DiffEntry entry : entries) {
            if (entry.isLoss())
                sb.append("- lost ").append(entry.oldValue());
            else
                sb.append("+ gained ").append(entry.newValue());
            sb.append(":\n");
            appendRegions(sb, entry.regions());
        }
        return sb.toString();
    }

    private static void appendEdges(StringBuilder sb, List<Edge> edges) {
        for (int i = 0; i < edges.size(); i++) {
            Edge edge = edges.get(i);
            sb.append(edge.label()).append(": ").append(edge.target());
            if (i < edges.size() - 1)
                sb.append(", ");
        }
    }

    private static void appendRegions(StringBuilder sb, QueryRegions regions) {
        if (regions.isEmpty()) {
            sb.append("    (unreachable)\n");
            return;
        }
        for (ConstraintQuery region : regions)
            sb.append("    ").append(region).append('\n');
    }
}
