package com.hcltech.graphs.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hcltech.graphs.common.codec.Codec;

import java.util.List;

/** JSON forms of graphs and results, for collaborators that ship them elsewhere. */
public final class AnalysisJson {
    private AnalysisJson() {}

    public static Codec<AnalysisResult, String> resultCodec() {
        return Codec.clazzCodec(AnalysisResult.class);
    }

    public static Codec<List<AnalysisResult>, String> resultsCodec() {
        return Codec.typeRefCodec(new TypeReference<>() {});
    }

    public static Codec<Graph, String> graphCodec() {
        return Codec.clazzCodec(Graph.class);
    }

    public static Codec<List<TraversalStep>, String> stepsCodec() {
        return Codec.typeRefCodec(new TypeReference<>() {});
    }
}
