package com.hcltech.graphs.engine;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/** Connected components, each ascending, in ascending order of their smallest node. */
@JsonTypeName("components")
public record ComponentList(List<List<Integer>> components) implements AnalysisResult {
    public ComponentList {
        components = components.stream().map(List::copyOf).toList();
    }
}
