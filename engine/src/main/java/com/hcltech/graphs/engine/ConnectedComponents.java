package com.hcltech.graphs.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class ConnectedComponents {
    private ConnectedComponents() {}

    /**
     * Partitions the nodes by reachability, seeding from each unvisited node in ascending order.
     * On a directed graph edges are only followed the way they are stored.
     */
    public static ComponentList connectedComponents(Graph graph) {
        Set<Integer> visited = new HashSet<>();
        List<List<Integer>> components = new ArrayList<>();
        for (int seed : graph.sortedNodes()) {
            if (!visited.add(seed)) continue;
            List<Integer> component = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(seed);
            while (!queue.isEmpty()) {
                int node = queue.poll();
                component.add(node);
                for (int next : graph.neighbors(node)) {
                    if (visited.add(next)) queue.add(next);
                }
            }
            Collections.sort(component);
            components.add(component);
        }
        return new ComponentList(components);
    }
}
