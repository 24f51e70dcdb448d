package com.hcltech.graphs.engine;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/** Articulation points ascending; bridges in the order the DFS found them. */
@JsonTypeName("articulation")
public record ArticulationResult(List<Integer> points, List<Bridge> bridges) implements AnalysisResult {
    public ArticulationResult {
        points = List.copyOf(points);
        bridges = List.copyOf(bridges);
    }
}
