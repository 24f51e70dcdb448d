package com.hcltech.graphs.engine;

import java.util.List;

public enum TraversalKind {
    BREADTH_FIRST {
        @Override
        public List<TraversalStep> traverse(Graph graph, int start) {
            return Traversals.breadthFirst(graph, start);
        }
    },
    DEPTH_FIRST {
        @Override
        public List<TraversalStep> traverse(Graph graph, int start) {
            return Traversals.depthFirst(graph, start);
        }
    };

    public abstract List<TraversalStep> traverse(Graph graph, int start);
}
