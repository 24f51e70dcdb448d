package com.hcltech.graphs.engine.exceptions;

public final class NodeNotFoundException extends GraphAnalysisException {
    private final int node;

    public NodeNotFoundException(String role, int node) {
        super(GraphErrorKind.NODE_NOT_FOUND, "Invalid " + role + " node: " + node + " is not in the graph");
        this.node = node;
    }

    public int node() {
        return node;
    }
}
