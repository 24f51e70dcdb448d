package com.hcltech.graphs.engine;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

@JsonTypeName("scc")
public record SccResult(List<List<Integer>> components) implements AnalysisResult {
    public SccResult {
        components = components.stream().map(List::copyOf).toList();
    }
}
