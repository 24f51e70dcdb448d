package com.hcltech.graphs.engine;

public enum AnalysisKind {
    CONNECTED_COMPONENTS,
    ARTICULATION_POINTS,
    BICONNECTED_COMPONENTS,
    STRONGLY_CONNECTED_COMPONENTS,
    MAX_FLOW
}
