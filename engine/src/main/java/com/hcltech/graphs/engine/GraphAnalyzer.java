package com.hcltech.graphs.engine;

import com.hcltech.graphs.common.IEnvGetter;
import com.hcltech.graphs.common.errorsor.ErrorsOr;

import java.util.List;

/**
 * The engine's call surface. Every method is synchronous, keeps no state between calls and
 * never mutates the graph, so calling twice gives the same answer.
 * <p>
 * The direct methods throw {@link com.hcltech.graphs.engine.exceptions.GraphAnalysisException};
 * {@link #analyze} and {@link #analyzeAll} report the same failures as {@link ErrorsOr} errors.
 */
public interface GraphAnalyzer {

    List<TraversalStep> breadthFirst(Graph graph, int start);

    List<TraversalStep> depthFirst(Graph graph, int start);

    ComponentList connectedComponents(Graph graph);

    ArticulationResult articulationPoints(Graph graph);

    BiconnectedResult biconnectedComponents(Graph graph);

    SccResult stronglyConnectedComponents(Graph graph);

    MaxFlowResult maxFlow(Graph graph, int source, int sink);

    ErrorsOr<AnalysisResult> analyze(Graph graph, AnalysisRequest request);

    /** Runs every request; the result is all values in request order, or every error from every failed request. */
    default ErrorsOr<List<AnalysisResult>> analyzeAll(Graph graph, List<AnalysisRequest> requests) {
        return ErrorsOr.sequence(requests.stream().map(request -> analyze(graph, request)).toList());
    }

    static GraphAnalyzer defaultAnalyzer() {
        return new DefaultGraphAnalyzer(EngineConfig.fromEnv(IEnvGetter.env));
    }
}
