package com.hcltech.graphs.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Single-start traversals. Each call covers only what is reachable from {@code start}; sweeping a
 * disconnected graph is up to the caller.
 */
public final class Traversals {
    private Traversals() {}

    /**
     * FIFO order. A node is marked, and its step emitted, when it is first enqueued, so each step's
     * visited set is exactly one larger than the previous one.
     */
    public static List<TraversalStep> breadthFirst(Graph graph, int start) {
        GraphChecks.requireNode(graph, start, "start");
        List<TraversalStep> steps = new ArrayList<>();
        VisitLog visited = new VisitLog();
        Deque<Integer> queue = new ArrayDeque<>();

        visited.mark(start);
        steps.add(new TraversalStep(start, visited.snapshot()));
        queue.add(start);
        while (!queue.isEmpty()) {
            int node = queue.poll();
            for (int next : graph.neighbors(node)) {
                if (visited.mark(next)) {
                    steps.add(new TraversalStep(next, visited.snapshot()));
                    queue.add(next);
                }
            }
        }
        return Collections.unmodifiableList(steps);
    }

    /** Pre-order: mark, emit, then descend into neighbours in adjacency order. */
    public static List<TraversalStep> depthFirst(Graph graph, int start) {
        GraphChecks.requireNode(graph, start, "start");
        List<TraversalStep> steps = new ArrayList<>();
        VisitLog visited = new VisitLog();
        Deque<Frame> stack = new ArrayDeque<>();

        visited.mark(start);
        steps.add(new TraversalStep(start, visited.snapshot()));
        stack.push(new Frame(start));
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            List<Integer> neighbors = graph.neighbors(top.node);
            if (top.next == neighbors.size()) {
                stack.pop();
                continue;
            }
            int next = neighbors.get(top.next++);
            if (visited.mark(next)) {
                steps.add(new TraversalStep(next, visited.snapshot()));
                stack.push(new Frame(next));
            }
        }
        return Collections.unmodifiableList(steps);
    }

    private static final class Frame {
        final int node;
        int next;

        Frame(int node) {
            this.node = node;
        }
    }
}
