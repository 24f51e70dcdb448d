package com.hcltech.graphs.engine;

import com.hcltech.graphs.engine.exceptions.NodeNotFoundException;
import com.hcltech.graphs.engine.exceptions.NotApplicableException;

final class GraphChecks {
    private GraphChecks() {}

    static void requireNode(Graph graph, int node, String role) {
        if (!graph.contains(node)) throw new NodeNotFoundException(role, node);
    }

    static void requireDirected(Graph graph, String operation) {
        if (!graph.directed()) throw new NotApplicableException(operation);
    }
}
