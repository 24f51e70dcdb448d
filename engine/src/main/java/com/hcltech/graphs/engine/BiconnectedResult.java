package com.hcltech.graphs.engine;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

@JsonTypeName("biconnected")
public record BiconnectedResult(List<List<Integer>> components) implements AnalysisResult {
    public BiconnectedResult {
        components = components.stream().map(List::copyOf).toList();
    }
}
