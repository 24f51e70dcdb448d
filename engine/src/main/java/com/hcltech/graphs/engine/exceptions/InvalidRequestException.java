package com.hcltech.graphs.engine.exceptions;

public final class InvalidRequestException extends GraphAnalysisException {
    public InvalidRequestException(String message) {
        super(GraphErrorKind.INVALID_REQUEST, message);
    }
}
