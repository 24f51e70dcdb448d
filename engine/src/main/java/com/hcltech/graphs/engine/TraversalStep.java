package com.hcltech.graphs.engine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One visited node plus the nodes visited up to and including it, in marking order.
 * The set is read-only and fixed at construction, so later steps never change an earlier one.
 */
public record TraversalStep(int node, Set<Integer> visitedSoFar) {
    public TraversalStep {
        if (!(visitedSoFar instanceof VisitLog.Prefix)) {
            visitedSoFar = Collections.unmodifiableSet(new LinkedHashSet<>(visitedSoFar));
        }
    }
}
