package com.hcltech.graphs.engine;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Result of one analysis. Plain values with no reference back to the graph; serializable to JSON
 * as-is, tagged by {@code type}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ComponentList.class, name = "components"),
        @JsonSubTypes.Type(value = ArticulationResult.class, name = "articulation"),
        @JsonSubTypes.Type(value = BiconnectedResult.class, name = "biconnected"),
        @JsonSubTypes.Type(value = SccResult.class, name = "scc"),
        @JsonSubTypes.Type(value = MaxFlowResult.class, name = "maxFlow"),
})
public sealed interface AnalysisResult permits ComponentList, ArticulationResult, BiconnectedResult, SccResult, MaxFlowResult {
}
