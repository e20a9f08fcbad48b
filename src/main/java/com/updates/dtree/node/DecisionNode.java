package com.updates.dtree.node;

import com.updates.dtree.api.NodeType;
import com.updates.dtree.api.Query;
import com.updates.dtree.api.RandomSource;
import com.updates.dtree.api.Step;

import java.util.List;

/**
 * A node in a decision graph.
 *
 * <p>
 * The variant set is closed. Each variant carries immutable parameters and
 * exposes the same information two ways:
 * <ul>
 * <li>{@link #decide} - the decision rule, used by the evaluator.</li>
 * <li>{@link #edges} - the same rule as (constraint, target) pairs, used by
 * the reachability analysis.</li>
 * </ul>
 * The two must agree: a query takes an edge under {@code decide} exactly when
 * it satisfies that edge's constraint (probabilistic edges excepted, which
 * are unconditioned).
 *
 * <p>
 * Nodes refer to their successors by {@link com.updates.dtree.api.NodeId},
 * never by object reference.
 */
public sealed interface DecisionNode permits TerminalNode, EqualsBranchNode, OrderedCutoffNode,
        SetMembershipNode, EnumeratedNode, ProbabilisticNode {

    /** Variant tag, also used as the persisted type name. */
    NodeType type();

    /**
     * Applies the decision rule.
     *
     * @param query  the client query
     * @param random draws for probabilistic nodes; ignored by the others
     * @return the next node, or the outcome for terminals
     * @throws com.updates.dtree.api.MissingFieldException if the query lacks
     *                                                     the field read here
     */
    Step decide(Query query, RandomSource random);

    /** Out-edges in a stable order; empty for terminals. */
    List<Edge> edges();

    /** Short human-readable label for diagnostics and diagrams. */
    String displayLabel();

    default boolean isTerminal() {
        return type() == NodeType.TERMINAL;
    }
}
