package com.hcltech.graphs.engine;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("maxFlow")
public record MaxFlowResult(long value, int source, int sink) implements AnalysisResult {
    public MaxFlowResult {
        if (value < 0) throw new IllegalArgumentException("Flow value must not be negative but was " + value);
    }
}
