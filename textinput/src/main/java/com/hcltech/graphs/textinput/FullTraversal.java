package com.hcltech.graphs.textinput;

import com.hcltech.graphs.engine.ComponentList;
import com.hcltech.graphs.engine.Graph;
import com.hcltech.graphs.engine.GraphAnalyzer;
import com.hcltech.graphs.engine.TraversalKind;
import com.hcltech.graphs.engine.TraversalStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Covers disconnected graphs by restarting the traversal from each unvisited node, smallest first,
 * and keeping one visited set across the restarts.
 */
public final class FullTraversal {
    private static final Logger log = LoggerFactory.getLogger(FullTraversal.class);

    private final GraphAnalyzer analyzer;

    public FullTraversal(GraphAnalyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    }

    public TraversalSweep sweep(Graph graph, TraversalKind kind) {
        Set<Integer> visited = new HashSet<>();
        List<Integer> order = new ArrayList<>();
        List<SweepStep> steps = new ArrayList<>();
        int sweep = 0;
        for (int start : graph.sortedNodes()) {
            if (visited.contains(start)) continue;
            for (TraversalStep step : traverse(graph, kind, start)) {
                // a directed traversal can reach nodes an earlier sweep already took
                if (visited.add(step.node())) {
                    order.add(step.node());
                    steps.add(new SweepStep(sweep, step));
                }
            }
            sweep++;
        }
        log.debug("{} over {} nodes took {} sweeps", kind, graph.nodeCount(), sweep);
        return new TraversalSweep(order, steps);
    }

    /** Node to the index of its connected component. */
    public Map<Integer, Integer> componentIndex(Graph graph) {
        ComponentList components = analyzer.connectedComponents(graph);
        Map<Integer, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < components.components().size(); i++) {
            for (int node : components.components().get(i)) index.put(node, i);
        }
        return index;
    }

    private List<TraversalStep> traverse(Graph graph, TraversalKind kind, int start) {
        return switch (kind) {
            case BREADTH_FIRST -> analyzer.breadthFirst(graph, start);
            case DEPTH_FIRST -> analyzer.depthFirst(graph, start);
        };
    }
}
