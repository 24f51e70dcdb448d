package com.hcltech.graphs.engine;

import com.hcltech.graphs.engine.exceptions.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Edmonds-Karp: shortest augmenting paths by BFS over edges with positive residual capacity.
 */
public final class MaxFlow {
    private static final Logger log = LoggerFactory.getLogger(MaxFlow.class);

    private MaxFlow() {}

    public static MaxFlowResult maxFlow(Graph graph, int source, int sink) {
        return maxFlow(graph, source, sink, EngineConfig.DEFAULT_CAPACITY);
    }

    /**
     * @param defaultCapacity capacity of edges that do not specify one
     */
    public static MaxFlowResult maxFlow(Graph graph, int source, int sink, int defaultCapacity) {
        GraphChecks.requireDirected(graph, "maxFlow");
        GraphChecks.requireNode(graph, source, "source");
        GraphChecks.requireNode(graph, sink, "sink");
        if (source == sink) throw new InvalidRequestException("Source and sink must be different nodes but both were " + source);

        ResidualGraph residual = ResidualGraph.from(graph.edges(), defaultCapacity);
        long total = 0;
        List<Integer> path;
        while ((path = augmentingPath(residual, source, sink)) != null) {
            long bottleneck = Long.MAX_VALUE;
            for (int i = 0; i + 1 < path.size(); i++) {
                bottleneck = Math.min(bottleneck, residual.capacity(path.get(i), path.get(i + 1)));
            }
            for (int i = 0; i + 1 < path.size(); i++) {
                residual.augment(path.get(i), path.get(i + 1), bottleneck);
            }
            total = Math.addExact(total, bottleneck);
            log.debug("Augmented {} along {} (flow so far {})", bottleneck, path, total);
        }
        return new MaxFlowResult(total, source, sink);
    }

    /** Shortest source-to-sink path in the residual graph, or {@code null} if the sink is unreachable. */
    private static List<Integer> augmentingPath(ResidualGraph residual, int source, int sink) {
        Map<Integer, Integer> parent = new HashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        parent.put(source, source);
        queue.add(source);
        while (!queue.isEmpty()) {
            int u = queue.poll();
            if (u == sink) {
                List<Integer> path = new ArrayList<>();
                for (int node = sink; node != source; node = parent.get(node)) path.add(node);
                path.add(source);
                Collections.reverse(path);
                return path;
            }
            for (int v : residual.successors(u)) {
                if (!parent.containsKey(v) && residual.capacity(u, v) > 0) {
                    parent.put(v, u);
                    queue.add(v);
                }
            }
        }
        return null;
    }
}
