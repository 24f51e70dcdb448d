package com.hcltech.graphs.engine.exceptions;

/**
 * Failure of an analysis call. Nothing is returned on failure and a retry will fail the same way.
 */
public abstract class GraphAnalysisException extends RuntimeException {
    private final GraphErrorKind kind;

    protected GraphAnalysisException(GraphErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GraphErrorKind kind() {
        return kind;
    }
}
