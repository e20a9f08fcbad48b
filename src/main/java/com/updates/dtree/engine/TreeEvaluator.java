package com.updates.dtree.engine;

import com.updates.dtree.api.MissingFieldException;
import com.updates.dtree.api.NodeId;
import com.updates.dtree.api.Query;
import com.updates.dtree.api.RandomSource;
import com.updates.dtree.api.Step;
import com.updates.dtree.node.DecisionNode;
import com.updates.dtree.util.RandomSources;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Walks a {@link DecisionGraph} from its root until a terminal produces an
 * outcome.
 *
 * <p>
 * State is just the current node id. Each step asks the node to decide,
 * which yields either the next id or the outcome. The walk terminates
 * because {@link DecisionGraph} rejects cycles when built.
 *
 * <p>
 * Evaluation is a pure function of graph and query, apart from draws taken
 * by probabilistic nodes from the {@link RandomSource}. The evaluator holds
 * no mutable state and may be shared across threads provided the random
 * source may be too (the default, {@link RandomSources#threadLocal()}, can).
 */
public final class TreeEvaluator {
    private static final Logger log = LogManager.getLogger(TreeEvaluator.class);

    private final DecisionGraph graph;
    private final RandomSource random;

    public TreeEvaluator(DecisionGraph graph) {
        this(graph, RandomSources.threadLocal());
    }

    public TreeEvaluator(DecisionGraph graph, RandomSource random) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.random = Objects.requireNonNull(random, "random");
    }

    public DecisionGraph graph() {
        return graph;
    }

    /** Returns the outcome value for {@code query}. */
    public Object evaluate(Query query) {
        return trace(query, random).outcome();
    }

    /** Returns the outcome value, drawing from {@code random} instead of the default source. */
    public Object evaluate(Query query, RandomSource random) {
        return trace(query, random).outcome();
    }

    public EvaluationResult trace(Query query) {
        return trace(query, random);
    }

    /**
     * Evaluates and records the path taken.
     *
     * @throws MissingFieldException if a visited node reads a field the query
     *                               lacks
     */
    public EvaluationResult trace(Query query, RandomSource random) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(random, "random");
        NodeId current = graph.root();
        List<NodeId> path = new ArrayList<>();
        while (true) {
            DecisionNode node = graph.node(current);
            path.add(current);

            Step step;
            try {
                step = node.decide(query, random);
            } catch (MissingFieldException e) {
                throw e.node() == null ? e.atNode(current) : e;
            }

            if (step instanceof Step.Outcome outcome) {
                log.debug("Query {} -> {} via {}", query, outcome.value(), path);
                return new EvaluationResult(outcome.value(), current, path);
            }
            current = ((Step.Continue) step).next();
        }
    }
}
