package com.hcltech.graphs.engine;

import java.util.Objects;

/**
 * One analysis to run against a graph. Only {@link AnalysisKind#MAX_FLOW} carries a source and sink.
 */
public record AnalysisRequest(AnalysisKind kind, Integer source, Integer sink) {

    public AnalysisRequest {
        Objects.requireNonNull(kind, "kind");
        boolean endpoints = source != null && sink != null;
        if (kind == AnalysisKind.MAX_FLOW && !endpoints) {
            throw new IllegalArgumentException("Max flow needs both a source and a sink");
        }
        if (kind != AnalysisKind.MAX_FLOW && (source != null || sink != null)) {
            throw new IllegalArgumentException(kind + " does not take a source or sink");
        }
    }

    public static AnalysisRequest connectedComponents() {
        return new AnalysisRequest(AnalysisKind.CONNECTED_COMPONENTS, null, null);
    }

    public static AnalysisRequest articulationPoints() {
        return new AnalysisRequest(AnalysisKind.ARTICULATION_POINTS, null, null);
    }

    public static AnalysisRequest biconnectedComponents() {
        return new AnalysisRequest(AnalysisKind.BICONNECTED_COMPONENTS, null, null);
    }

    public static AnalysisRequest stronglyConnectedComponents() {
        return new AnalysisRequest(AnalysisKind.STRONGLY_CONNECTED_COMPONENTS, null, null);
    }

    public static AnalysisRequest maxFlow(int source, int sink) {
        return new AnalysisRequest(AnalysisKind.MAX_FLOW, source, sink);
    }
}
