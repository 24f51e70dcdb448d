package com.hcltech.graphs.engine;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Remaining capacity per ordered node pair, held as {@code long} since a reverse residual can grow
 * past any single edge's capacity. Every forward pair has a reverse pair, at 0 unless a
 * real reverse edge supplied its own capacity.
 */
final class ResidualGraph {

    record NodePair(int from, int to) {}

    private final Map<NodePair, Long> residual = new HashMap<>();
    private final Map<Integer, Set<Integer>> successors = new LinkedHashMap<>();

    /** For a repeated {@code (from, to)} the last capacity wins. */
    static ResidualGraph from(List<GraphEdge> edges, int defaultCapacity) {
        Map<NodePair, Long> capacities = new LinkedHashMap<>();
        for (GraphEdge edge : edges) {
            capacities.put(new NodePair(edge.from(), edge.to()), (long) edge.capacityOr(defaultCapacity));
        }
        ResidualGraph graph = new ResidualGraph();
        capacities.forEach((pair, capacity) -> {
            graph.set(pair.from(), pair.to(), capacity);
            NodePair reverse = new NodePair(pair.to(), pair.from());
            if (!graph.residual.containsKey(reverse)) graph.set(reverse.from(), reverse.to(), 0L);
        });
        return graph;
    }

    private void set(int from, int to, long capacity) {
        residual.put(new NodePair(from, to), capacity);
        successors.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
    }

    long capacity(int from, int to) {
        return residual.getOrDefault(new NodePair(from, to), 0L);
    }

    Set<Integer> successors(int node) {
        return successors.getOrDefault(node, Set.of());
    }

    /** Moves {@code amount} from the forward residual to the reverse one. */
    void augment(int from, int to, long amount) {
        residual.merge(new NodePair(from, to), -amount, Long::sum);
        residual.merge(new NodePair(to, from), amount, Long::sum);
    }
}
