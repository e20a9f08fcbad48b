package com.updates.dtree.node;

import com.updates.dtree.api.NodeId;
import com.updates.dtree.api.NodeType;
import com.updates.dtree.api.Query;
import com.updates.dtree.api.RandomSource;
import com.updates.dtree.api.Step;

import java.util.List;
import java.util.Objects;

/**
 * Gradual rollout: routes to {@code inside} when a draw from the injected
 * {@link RandomSource} is below {@code threshold}, otherwise to
 * {@code outside}.
 *
 * The branch does not depend on the query, so both edges are unconditioned:
 * reachability reports outcomes behind this node as reachable by chance.
 */
public record ProbabilisticNode(double threshold, NodeId inside, NodeId outside) implements DecisionNode {

    public ProbabilisticNode {
        if (!(threshold >= 0.0 && threshold <= 1.0))
            throw new IllegalArgumentException("threshold must be within [0, 1]: " + threshold);
        Objects.requireNonNull(inside, "inside");
        Objects.requireNonNull(outside, "outside");
    }

    @Override
    public NodeType type() {
        return NodeType.PROBABILISTIC;
    }

    @Override
    public Step decide(Query query, RandomSource random) {
        return Step.next(random.nextDouble() < threshold ? inside : outside);
    }

    @Override
    public List<Edge> edges() {
        return List.of(Edge.unconditioned(inside, "inside"), Edge.unconditioned(outside, "outside"));
    }

    @Override
    public String displayLabel() {
        return "rollout " + Math.round(threshold * 100) + "%";
    }
}
