package com.hcltech.graphs.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * Kosaraju's two-pass algorithm. Both passes use explicit stacks.
 * Undirected graphs are rejected with {@link com.hcltech.graphs.engine.exceptions.NotApplicableException}
 * rather than answered with an empty list.
 */
public final class StrongComponents {
    private StrongComponents() {}

    public static SccResult stronglyConnectedComponents(Graph graph) {
        GraphChecks.requireDirected(graph, "stronglyConnectedComponents");

        Deque<Integer> finished = new ArrayDeque<>();
        Set<Integer> visited = new HashSet<>();
        for (int seed : graph.sortedNodes()) {
            if (!visited.contains(seed)) finishOrder(graph::neighbors, seed, visited, finished);
        }

        Map<Integer, List<Integer>> transpose = transpose(graph);
        visited.clear();
        List<List<Integer>> components = new ArrayList<>();
        while (!finished.isEmpty()) {
            int node = finished.pop();
            if (visited.contains(node)) continue;
            List<Integer> component = collect(n -> transpose.getOrDefault(n, List.of()), node, visited);
            Collections.sort(component);
            components.add(component);
        }
        return new SccResult(components);
    }

    /** Pushes each node reached from {@code seed} onto {@code finished} once all its successors are done. */
    private static void finishOrder(IntFunction<List<Integer>> successors, int seed, Set<Integer> visited, Deque<Integer> finished) {
        Deque<int[]> stack = new ArrayDeque<>(); // {node, next neighbour index}
        visited.add(seed);
        stack.push(new int[]{seed, 0});
        while (!stack.isEmpty()) {
            int[] frame = stack.peek();
            List<Integer> next = successors.apply(frame[0]);
            if (frame[1] == next.size()) {
                stack.pop();
                finished.push(frame[0]);
                continue;
            }
            int v = next.get(frame[1]++);
            if (visited.add(v)) stack.push(new int[]{v, 0});
        }
    }

    private static List<Integer> collect(IntFunction<List<Integer>> successors, int seed, Set<Integer> visited) {
        List<Integer> reached = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        visited.add(seed);
        stack.push(seed);
        while (!stack.isEmpty()) {
            int node = stack.pop();
            reached.add(node);
            for (int v : successors.apply(node)) {
                if (visited.add(v)) stack.push(v);
            }
        }
        return reached;
    }

    static Map<Integer, List<Integer>> transpose(Graph graph) {
        Map<Integer, List<Integer>> reversed = new LinkedHashMap<>();
        for (int node : graph.nodes()) reversed.put(node, new ArrayList<>());
        for (Map.Entry<Integer, List<Integer>> entry : graph.adjacency().entrySet()) {
            for (int to : entry.getValue()) {
                reversed.computeIfAbsent(to, k -> new ArrayList<>()).add(entry.getKey());
            }
        }
        return reversed;
    }
}
