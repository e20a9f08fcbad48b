package com.updates.dtree.engine;

import com.updates.dtree.api.NodeId;
import com.updates.dtree.constraint.QueryRegions;
import com.updates.dtree.node.TerminalNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reports which populations gain or lose each outcome between two versions
 * of a graph.
 *
 * <p>
 * For every outcome the reachability regions are computed in both versions;
 * {@code old - new} is reported as a loss and {@code new - old} as a gain.
 * Outcomes whose regions are unchanged produce no entry.
 *
 * <p>
 * With {@link TerminalMatching#BY_NODE_ID} a terminal whose value changed in
 * place counts as a different outcome: its whole old population loses the old
 * value and its whole new population gains the new one.
 */
public final class TreeDiffer {
    private static final Logger log = LogManager.getLogger(TreeDiffer.class);

    private final TerminalMatching matching;
    private final int maxDepth;

    public TreeDiffer() {
        this(TerminalMatching.BY_NODE_ID);
    }

    public TreeDiffer(TerminalMatching matching) {
        this(matching, ReachabilityAnalyzer.DEFAULT_MAX_DEPTH);
    }

    public TreeDiffer(TerminalMatching matching, int maxDepth) {
        this.matching = Objects.requireNonNull(matching, "matching");
        this.maxDepth = maxDepth;
    }

    public List<DiffEntry> diff(DecisionGraph before, DecisionGraph after) {
        Map<NodeId, QueryRegions> oldRegions = new ReachabilityAnalyzer(before, maxDepth).outcomeRegions();
        Map<NodeId, QueryRegions> newRegions = new ReachabilityAnalyzer(after, maxDepth).outcomeRegions();

        List<DiffEntry> entries = matching == TerminalMatching.BY_VALUE
                ? diffByValue(before.terminals(), oldRegions, after.terminals(), newRegions)
                : diffByNodeId(before.terminals(), oldRegions, after.terminals(), newRegions);
        log.info("Diff produced {} entries ({} matching)", entries.size(), matching);
        return entries;
    }

    private static List<DiffEntry> diffByNodeId(Map<NodeId, TerminalNode> oldTerminals,
            Map<NodeId, QueryRegions> oldRegions, Map<NodeId, TerminalNode> newTerminals,
            Map<NodeId, QueryRegions> newRegions) {
        Set<NodeId> ids = new LinkedHashSet<>(oldTerminals.keySet());
        ids.addAll(newTerminals.keySet());

        List<DiffEntry> entries = new ArrayList<>();
        for (NodeId id : ids) {
            TerminalNode oldNode = oldTerminals.get(id);
            TerminalNode newNode = newTerminals.get(id);
            QueryRegions before = oldNode == null ? QueryRegions.EMPTY : oldRegions.get(id);
            QueryRegions after = newNode == null ? QueryRegions.EMPTY : newRegions.get(id);

            if (oldNode != null && newNode != null && !oldNode.value().equals(newNode.value())) {
                addIfPresent(entries, before, oldNode.value(), null);
                addIfPresent(entries, after, null, newNode.value());
                continue;
            }
            if (oldNode != null)
                addIfPresent(entries, before.subtract(after), oldNode.value(), null);
            if (newNode != null)
                addIfPresent(entries, after.subtract(before), null, newNode.value());
        }
        return entries;
    }

    private static List<DiffEntry> diffByValue(Map<NodeId, TerminalNode> oldTerminals,
            Map<NodeId, QueryRegions> oldRegions, Map<NodeId, TerminalNode> newTerminals,
            Map<NodeId, QueryRegions> newRegions) {
        Map<Object, QueryRegions> before = groupByValue(oldTerminals, oldRegions);
        Map<Object, QueryRegions> after = groupByValue(newTerminals, newRegions);
        Set<Object> values = new LinkedHashSet<>(before.keySet());
        values.addAll(after.keySet());

        List<DiffEntry> entries = new ArrayList<>();
        for (Object value : values) {
            QueryRegions b = before.getOrDefault(value, QueryRegions.EMPTY);
            QueryRegions a = after.getOrDefault(value, QueryRegions.EMPTY);
            addIfPresent(entries, b.subtract(a), value, null);
            addIfPresent(entries, a.subtract(b), null, value);
        }
        return entries;
    }

    private static Map<Object, QueryRegions> groupByValue(Map<NodeId, TerminalNode> terminals,
            Map<NodeId, QueryRegions> regions) {
        Map<Object, QueryRegions> out = new LinkedHashMap<>();
        for (Map.Entry<NodeId, TerminalNode> e : terminals.entrySet())
            out.merge(e.getValue().value(), regions.get(e.getKey()), QueryRegions::union);
        return out;
    }

    private static void addIfPresent(List<DiffEntry> entries, QueryRegions regions, Object oldValue,
            Object newValue) {
        if (!regions.isEmpty())
            entries.add(new DiffEntry(regions, oldValue, newValue));
    }
}
