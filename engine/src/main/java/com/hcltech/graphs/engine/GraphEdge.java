package com.hcltech.graphs.engine;

/**
 * An explicit edge used by max flow. A {@code null} capacity means "not specified" and is
 * resolved to the configured default when the residual graph is built.
 */
public record GraphEdge(int from, int to, Integer capacity) {

    public GraphEdge {
        if (capacity != null && capacity <= 0) {
            throw new IllegalArgumentException("Capacity of edge " + from + "->" + to + " must be positive but was " + capacity);
        }
    }

    public static GraphEdge of(int from, int to) {
        return new GraphEdge(from, to, null);
    }

    public static GraphEdge of(int from, int to, int capacity) {
        return new GraphEdge(from, to, capacity);
    }

    public int capacityOr(int defaultCapacity) {
        return capacity == null ? defaultCapacity : capacity;
    }
}
