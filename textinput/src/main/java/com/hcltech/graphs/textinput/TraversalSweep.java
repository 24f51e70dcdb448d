package com.hcltech.graphs.textinput;

import java.util.List;

/**
 * Result of traversing a whole graph. {@code order} holds every node exactly once; {@code steps}
 * holds one step per node in the same order.
 */
public record TraversalSweep(List<Integer> order, List<SweepStep> steps) {
    public TraversalSweep {
        order = List.copyOf(order);
        steps = List.copyOf(steps);
    }

    public int sweepCount() {
        return steps.isEmpty() ? 0 : steps.get(steps.size() - 1).sweep() + 1;
    }
}
