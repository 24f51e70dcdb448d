package com.hcltech.graphs.textinput;

import java.util.List;

/** One {@code node: n1 n2 ...} line. */
public record AdjacencyLine(int node, List<Integer> neighbors) {
    public AdjacencyLine {
        neighbors = List.copyOf(neighbors);
    }
}
