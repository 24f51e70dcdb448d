package com.hcltech.graphs.engine;

import com.hcltech.graphs.common.errorsor.ErrorsOr;
import com.hcltech.graphs.engine.exceptions.GraphAnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

public final class DefaultGraphAnalyzer implements GraphAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(DefaultGraphAnalyzer.class);

    private final EngineConfig config;

    public DefaultGraphAnalyzer(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public EngineConfig config() {
        return config;
    }

    @Override
    public List<TraversalStep> breadthFirst(Graph graph, int start) {
        return run("breadthFirst", graph, () -> Traversals.breadthFirst(graph, start));
    }

    @Override
    public List<TraversalStep> depthFirst(Graph graph, int start) {
        return run("depthFirst", graph, () -> Traversals.depthFirst(graph, start));
    }

    @Override
    public ComponentList connectedComponents(Graph graph) {
        return run("connectedComponents", graph, () -> ConnectedComponents.connectedComponents(graph));
    }

    @Override
    public ArticulationResult articulationPoints(Graph graph) {
        return run("articulationPoints", graph, () -> CutVertices.articulationPoints(graph));
    }

    @Override
    public BiconnectedResult biconnectedComponents(Graph graph) {
        return run("biconnectedComponents", graph, () -> BiconnectedComponents.biconnectedComponents(graph));
    }

    @Override
    public SccResult stronglyConnectedComponents(Graph graph) {
        return run("stronglyConnectedComponents", graph, () -> StrongComponents.stronglyConnectedComponents(graph));
    }

    @Override
    public MaxFlowResult maxFlow(Graph graph, int source, int sink) {
        return run("maxFlow", graph, () -> MaxFlow.maxFlow(graph, source, sink, config.defaultCapacity()));
    }

    @Override
    public ErrorsOr<AnalysisResult> analyze(Graph graph, AnalysisRequest request) {
        try {
            AnalysisResult result = switch (request.kind()) {
                case CONNECTED_COMPONENTS -> connectedComponents(graph);
                case ARTICULATION_POINTS -> articulationPoints(graph);
                case BICONNECTED_COMPONENTS -> biconnectedComponents(graph);
                case STRONGLY_CONNECTED_COMPONENTS -> stronglyConnectedComponents(graph);
                case MAX_FLOW -> maxFlow(graph, request.source(), request.sink());
            };
            return ErrorsOr.lift(result);
        } catch (GraphAnalysisException e) {
            log.warn("{} failed: {}", request.kind(), e.getMessage());
            return ErrorsOr.error(e.kind() + ": " + e.getMessage());
        }
    }

    private <T> T run(String operation, Graph graph, Supplier<T> body) {
        log.debug("{} on {} nodes (directed={})", operation, graph.nodeCount(), graph.directed());
        T result = body.get();
        if (config.logSummaries()) log.info("{} -> {}", operation, result);
        return result;
    }
}
