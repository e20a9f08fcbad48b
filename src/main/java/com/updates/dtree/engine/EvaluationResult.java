package com.updates.dtree.engine;

import com.updates.dtree.api.NodeId;

import java.util.List;

/**
 * Outcome of one evaluation together with how it was reached.
 *
 * @param outcome  value of the terminal node
 * @param terminal id of the terminal node
 * @param path     visited node ids, root first, terminal last
 */
public record EvaluationResult(Object outcome, NodeId terminal, List<NodeId> path) {

    public EvaluationResult {
        path = List.copyOf(path);
    }
}
