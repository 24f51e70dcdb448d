package com.hcltech.graphs.engine.exceptions;

public enum GraphErrorKind {
    /** A start, source or sink node is not a key of the graph. */
    NODE_NOT_FOUND,
    /** The request itself makes no sense, e.g. source equals sink. */
    INVALID_REQUEST,
    /** The operation needs a directed graph and was given an undirected one. */
    NOT_APPLICABLE
}
