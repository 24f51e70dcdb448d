package com.hcltech.graphs.engine.exceptions;

public final class NotApplicableException extends GraphAnalysisException {
    public NotApplicableException(String operation) {
        super(GraphErrorKind.NOT_APPLICABLE, operation + " requires a directed graph");
    }
}
