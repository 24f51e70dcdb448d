package com.hcltech.graphs.textinput;

import com.hcltech.graphs.common.codec.Codec;
import com.hcltech.graphs.common.errorsor.ErrorsOr;
import com.hcltech.graphs.engine.Graph;
import com.hcltech.graphs.engine.GraphEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the two text areas (adjacency, and edge directions for directed graphs) into a {@link Graph}
 * that satisfies the engine's preconditions: every neighbour is a key, undirected adjacency is
 * symmetric, and directed edges carry their capacities.
 * <p>
 * Never throws on bad input; every problem found is returned as an error.
 */
public final class GraphTextParser {
    private static final Logger log = LoggerFactory.getLogger(GraphTextParser.class);

    static final String NO_NODES = "Please enter at least one node";
    static final String NO_DIRECTIONS = "Please specify edge directions for directed graph";

    private final Codec<List<AdjacencyLine>, String> adjacencyCodec;
    private final Codec<List<EdgeLine>, String> edgeCodec;

    public GraphTextParser() {
        this(new AdjacencyLineCodec(), new EdgeLineCodec());
    }

    public GraphTextParser(Codec<AdjacencyLine, String> adjacencyLineCodec, Codec<EdgeLine, String> edgeLineCodec) {
        this.adjacencyCodec = Codec.lines(adjacencyLineCodec);
        this.edgeCodec = Codec.lines(edgeLineCodec);
    }

    public ErrorsOr<Graph> parseUndirected(String adjacencyText) {
        return parse(false, adjacencyText, null);
    }

    public ErrorsOr<Graph> parseDirected(String adjacencyText, String edgeText) {
        return parse(true, adjacencyText, edgeText);
    }

    /** {@code edgeText} is ignored for undirected graphs. */
    public ErrorsOr<Graph> parse(boolean directed, String adjacencyText, String edgeText) {
        List<String> errors = new ArrayList<>();

        ErrorsOr<List<AdjacencyLine>> adjacencyLines = adjacencyCodec.decode(adjacencyText);
        adjacencyLines.ifError(errors::addAll);

        ErrorsOr<List<EdgeLine>> edgeLines = ErrorsOr.lift(List.of());
        if (directed) {
            if (edgeText == null || edgeText.isBlank()) errors.add(NO_DIRECTIONS);
            else {
                edgeLines = edgeCodec.decode(edgeText);
                edgeLines.ifError(errors::addAll);
            }
        }
        if (!errors.isEmpty()) return ErrorsOr.errors(errors);

        Map<Integer, List<Integer>> adjacency = new LinkedHashMap<>();
        for (AdjacencyLine line : adjacencyLines.valueOrThrow()) {
            adjacency.put(line.node(), new ArrayList<>(line.neighbors()));
        }
        if (adjacency.isEmpty()) return ErrorsOr.error(NO_NODES);

        ErrorsOr<Graph> graph = directed
                ? directedGraph(adjacency, edgeLines.valueOrThrow())
                : ErrorsOr.lift(undirectedGraph(adjacency));
        graph.ifValue(g -> log.debug("Parsed {} graph: {} nodes, {} edges",
                g.directed() ? "directed" : "undirected", g.nodeCount(), g.edges().size()));
        graph.ifError(es -> log.debug("Rejected graph text: {}", es));
        return graph;
    }

    private static Graph undirectedGraph(Map<Integer, List<Integer>> adjacency) {
        // mirroring appends to lists not yet visited, so walk the lines as written
        Map<Integer, List<Integer>> asWritten = new LinkedHashMap<>();
        adjacency.forEach((node, neighbors) -> asWritten.put(node, List.copyOf(neighbors)));

        // the k-th written node->neighbor slot needs at least k neighbor->node slots
        Map<Pair, Integer> written = new HashMap<>();
        List<GraphEdge> edges = new ArrayList<>();
        for (Map.Entry<Integer, List<Integer>> entry : asWritten.entrySet()) {
            int node = entry.getKey();
            for (int neighbor : entry.getValue()) {
                edges.add(GraphEdge.of(node, neighbor, 1));
                int k = written.merge(new Pair(node, neighbor), 1, Integer::sum);
                List<Integer> back = adjacency.computeIfAbsent(neighbor, n -> new ArrayList<>());
                if (Collections.frequency(back, node) < k) {
                    back.add(node);
                    edges.add(GraphEdge.of(neighbor, node, 1));
                }
            }
        }
        return new Graph(false, adjacency, edges);
    }

    private static ErrorsOr<Graph> directedGraph(Map<Integer, List<Integer>> adjacency, List<EdgeLine> edgeLines) {
        Map<Pair, EdgeLine> directions = new LinkedHashMap<>();
        for (EdgeLine line : edgeLines) directions.put(new Pair(line.from(), line.to()), line);

        Set<Pair> listed = new LinkedHashSet<>();
        List<GraphEdge> edges = new ArrayList<>();
        adjacency.forEach((from, neighbors) -> {
            for (int to : neighbors) {
                Pair pair = new Pair(from, to);
                listed.add(pair);
                EdgeLine line = directions.get(pair);
                if (line != null) edges.add(new GraphEdge(from, to, line.capacity()));
            }
        });

        List<String> errors = new ArrayList<>();
        for (Pair pair : directions.keySet()) {
            if (!listed.contains(pair)) errors.add("Edge " + pair.from() + " " + pair.to() + " is not in the adjacency list");
        }
        if (!errors.isEmpty()) return ErrorsOr.errors(errors);

        addDanglingNeighbors(adjacency);
        return ErrorsOr.lift(Graph.directed(adjacency, edges));
    }

    private static void addDanglingNeighbors(Map<Integer, List<Integer>> adjacency) {
        List<Integer> dangling = new ArrayList<>();
        adjacency.values().forEach(neighbors -> neighbors.forEach(n -> {
            if (!adjacency.containsKey(n) && !dangling.contains(n)) dangling.add(n);
        }));
        dangling.forEach(n -> adjacency.put(n, new ArrayList<>()));
    }

    private record Pair(int from, int to) {}
}
