package com.updates.dtree;

import com.updates.dtree.api.NodeId;
import com.updates.dtree.api.Query;
import com.updates.dtree.api.RandomSource;
import com.updates.dtree.constraint.QueryRegions;
import com.updates.dtree.engine.DecisionGraph;
import com.updates.dtree.engine.DiffEntry;
import com.updates.dtree.engine.EvaluationResult;
import com.updates.dtree.engine.ReachabilityAnalyzer;
import com.updates.dtree.engine.TerminalMatching;
import com.updates.dtree.engine.TreeDiffer;
import com.updates.dtree.engine.TreeEvaluator;
import com.updates.dtree.io.GraphSerializer;
import com.updates.dtree.node.DecisionNode;
import com.updates.dtree.util.GraphExplain;
import com.updates.dtree.util.RandomSources;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import lombok.Getter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A high-level wrapper that loads a decision graph and exposes evaluation,
 * explanation and diffing in one place.
 * <p>
 * This class handles:
 * <ul>
 * <li>Reading JSON tree documents via {@link GraphSerializer}</li>
 * <li>Evaluating queries with a {@link TreeEvaluator}</li>
 * <li>Explaining outcomes with a {@link ReachabilityAnalyzer}</li>
 * <li>Diffing against an edited version with a {@link TreeDiffer}</li>
 * </ul>
 * Instances are immutable; {@link #replace} returns a new tree.
 */
@Getter
public final class DecisionTree {
    private static final Logger log = LogManager.getLogger(DecisionTree.class);

    private final DecisionGraph graph;
    private final TreeEvaluator evaluator;
    private final ReachabilityAnalyzer analyzer;
    private final RandomSource random;

    public DecisionTree(DecisionGraph graph) {
        this(graph, RandomSources.threadLocal());
    }

    public DecisionTree(DecisionGraph graph, RandomSource random) {
        this.graph = graph;
        this.random = random;
        this.evaluator = new TreeEvaluator(graph, random);
        this.analyzer = new ReachabilityAnalyzer(graph);
    }

    /**
     * Loads a tree from a JSON document.
     *
     * @param jsonPath path to the document
     */
    public static DecisionTree load(Path jsonPath) throws IOException {
        return load(jsonPath, RandomSources.threadLocal());
    }

    /**
     * Loads a tree whose probabilistic nodes draw from {@code random}.
     *
     * @param jsonPath path to the document
     * @param random   source for rollout draws
     */
    public static DecisionTree load(Path jsonPath, RandomSource random) throws IOException {
        DecisionTree tree = new DecisionTree(new GraphSerializer().read(jsonPath), random);
        log.info("Decision tree loaded from {}", jsonPath);
        return tree;
    }

    public Object evaluate(Query query) {
        return evaluator.evaluate(query);
    }

    public EvaluationResult trace(Query query) {
        return evaluator.trace(query);
    }

    public QueryRegions explain(NodeId target) {
        return analyzer.findQueriesFor(target);
    }

    /** Text report of every outcome and the queries that reach it. */
    public String report() {
        return new GraphExplain(graph, analyzer).explainOutcomes();
    }

    /** Returns a tree with one node replaced; this tree is unchanged. */
    public DecisionTree replace(NodeId id, DecisionNode node) {
        return new DecisionTree(graph.replace(id, node), random);
    }

    /** Changes from this tree to {@code edited}, pairing terminals by node id. */
    public List<DiffEntry> diff(DecisionTree edited) {
        return diff(edited, TerminalMatching.BY_NODE_ID);
    }

    public List<DiffEntry> diff(DecisionTree edited, TerminalMatching matching) {
        return new TreeDiffer(matching).diff(graph, edited.graph);
    }

    public void save(Path jsonPath, String name, String version) throws IOException {
        new GraphSerializer().write(graph, name, version, jsonPath);
    }
}
