package com.hcltech.graphs.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable graph handed to every analysis.
 * <p>
 * {@code adjacency} is what the traversal-based operations read; {@code edges} is read only by
 * max flow. Node ids that appear only as neighbours are treated as having no outgoing edges.
 * Self-loops and parallel edges are allowed.
 */
public record Graph(boolean directed, Map<Integer, List<Integer>> adjacency, List<GraphEdge> edges) {

    public Graph {
        Objects.requireNonNull(adjacency, "adjacency");
        Map<Integer, List<Integer>> copy = new LinkedHashMap<>();
        adjacency.forEach((node, neighbors) -> copy.put(node, neighbors == null ? List.of() : List.copyOf(neighbors)));
        adjacency = Collections.unmodifiableMap(copy);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static Graph undirected(Map<Integer, List<Integer>> adjacency) {
        return new Graph(false, adjacency, List.of());
    }

    public static Graph directed(Map<Integer, List<Integer>> adjacency, List<GraphEdge> edges) {
        return new Graph(true, adjacency, edges);
    }

    /** Directed graph whose edge list is every adjacency pair, in order, with unspecified capacity. */
    public static Graph directed(Map<Integer, List<Integer>> adjacency) {
        List<GraphEdge> edges = new ArrayList<>();
        adjacency.forEach((from, neighbors) -> {
            for (int to : neighbors) edges.add(GraphEdge.of(from, to));
        });
        return new Graph(true, adjacency, edges);
    }

    /** Neighbours in adjacency order, empty if {@code node} is not a key. */
    public List<Integer> neighbors(int node) {
        return adjacency.getOrDefault(node, List.of());
    }

    /** All keys in insertion order. */
    public List<Integer> nodes() {
        return List.copyOf(adjacency.keySet());
    }

    public List<Integer> sortedNodes() {
        List<Integer> sorted = new ArrayList<>(adjacency.keySet());
        Collections.sort(sorted);
        return sorted;
    }

    public boolean contains(int node) {
        return adjacency.containsKey(node);
    }

    public int nodeCount() {
        return adjacency.size();
    }
}
