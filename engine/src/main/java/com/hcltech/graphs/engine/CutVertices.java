package com.hcltech.graphs.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

public final class CutVertices {
    private CutVertices() {}

    /**
     * Articulation points and bridges by Tarjan's low-link DFS. The adjacency is read as an
     * undirected relation; on a directed graph the answer is only as meaningful as that reading.
     */
    public static ArticulationResult articulationPoints(Graph graph) {
        TreeSet<Integer> points = new TreeSet<>();
        List<Bridge> bridges = new ArrayList<>();
        new LowLinkSearch(graph).run((u, v, separates, bridge) -> {
            if (separates) points.add(u);
            if (bridge) bridges.add(new Bridge(u, v));
        });
        return new ArticulationResult(new ArrayList<>(points), bridges);
    }
}
