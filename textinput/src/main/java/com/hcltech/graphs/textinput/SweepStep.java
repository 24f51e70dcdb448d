package com.hcltech.graphs.textinput;

import com.hcltech.graphs.engine.TraversalStep;

/** A traversal step tagged with the index of the sweep (one per unvisited start) that produced it. */
public record SweepStep(int sweep, TraversalStep step) {
    public int node() {
        return step.node();
    }
}
