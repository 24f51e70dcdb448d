package com.hcltech.graphs.engine;

import com.hcltech.graphs.engine.exceptions.GraphErrorKind;
import com.hcltech.graphs.engine.exceptions.InvalidRequestException;
import com.hcltech.graphs.engine.exceptions.NodeNotFoundException;
import com.hcltech.graphs.engine.exceptions.NotApplicableException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hcltech.graphs.engine.GraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class MaxFlowTest {

    @Nested
    class Values {
        @Test
        void chainIsLimitedByItsNarrowestEdge() {
            assertEquals(new MaxFlowResult(5, 0, 3), MaxFlow.maxFlow(flowChain(), 0, 3));
        }

        @Test
        void classicNetwork() {
            assertEquals(23, MaxFlow.maxFlow(clrsNetwork(), 0, 5).value());
        }

        @Test
        void crossEdgeDoesNotInflateTheFlow() {
            List<GraphEdge> edges = List.of(
                    GraphEdge.of(0, 1), GraphEdge.of(0, 2),
                    GraphEdge.of(1, 2), GraphEdge.of(1, 3), GraphEdge.of(2, 3));
            Graph g = Graph.directed(adjacencyOf(edges, 4), edges);
            assertEquals(2, MaxFlow.maxFlow(g, 0, 3).value());
        }

        @Test
        void disconnectedSourceAndSinkGiveZero() {
            Graph g = Graph.directed(adj(0, list(1), 1, list(), 2, list()), List.of(GraphEdge.of(0, 1, 3)));
            assertEquals(0, MaxFlow.maxFlow(g, 0, 2).value());
        }

        @Test
        void edgesPointingTheWrongWayCarryNothing() {
            Graph g = Graph.directed(adj(0, list(), 1, list(0)), List.of(GraphEdge.of(1, 0, 9)));
            assertEquals(0, MaxFlow.maxFlow(g, 0, 1).value());
            assertEquals(9, MaxFlow.maxFlow(g, 1, 0).value());
        }

        @Test
        void flowIsPushedBackAlongAReverseResidual() {
            // the only shortest path 0-1-2-5 blocks both 1 and 2; the second unit must cancel 1->2
            List<GraphEdge> edges = List.of(
                    GraphEdge.of(0, 1), GraphEdge.of(0, 3),
                    GraphEdge.of(1, 2), GraphEdge.of(1, 4),
                    GraphEdge.of(3, 2), GraphEdge.of(2, 5),
                    GraphEdge.of(4, 6), GraphEdge.of(6, 5));
            Graph g = Graph.directed(adjacencyOf(edges, 7), edges);
            assertEquals(2, MaxFlow.maxFlow(g, 0, 5).value());
        }

        @Test
        void unspecifiedCapacityUsesTheDefault() {
            Graph g = Graph.directed(adj(0, list(1), 1, list()));
            assertEquals(1, MaxFlow.maxFlow(g, 0, 1).value());
            assertEquals(4, MaxFlow.maxFlow(g, 0, 1, 4).value());
        }

        @Test
        void lastDuplicateEdgeCapacityWins() {
            Graph g = Graph.directed(adj(0, list(1), 1, list()),
                    List.of(GraphEdge.of(0, 1, 8), GraphEdge.of(0, 1, 3)));
            assertEquals(3, MaxFlow.maxFlow(g, 0, 1).value());
        }

        @Test
        void realReverseEdgeKeepsItsCapacity() {
            // 1->0 is listed after 0->1, so the zero placeholder for (1,0) must be replaced, not kept
            Graph g = Graph.directed(adj(0, list(1), 1, list(0)),
                    List.of(GraphEdge.of(0, 1, 2), GraphEdge.of(1, 0, 6)));
            assertEquals(2, MaxFlow.maxFlow(g, 0, 1).value());
            assertEquals(6, MaxFlow.maxFlow(g, 1, 0).value());
        }

        @Test
        void parallelPathsAddUp() {
            List<GraphEdge> edges = List.of(
                    GraphEdge.of(0, 1, 3), GraphEdge.of(1, 4, 3),
                    GraphEdge.of(0, 2, 2), GraphEdge.of(2, 4, 5),
                    GraphEdge.of(0, 3, 4), GraphEdge.of(3, 4, 1));
            Graph g = Graph.directed(adjacencyOf(edges, 5), edges);
            assertEquals(6, MaxFlow.maxFlow(g, 0, 4).value());
        }

        @Test
        void flowCanExceedTheIntRange() {
            int big = 2_000_000_000;
            List<GraphEdge> edges = List.of(
                    GraphEdge.of(0, 1, big), GraphEdge.of(1, 3, big),
                    GraphEdge.of(0, 2, big), GraphEdge.of(2, 3, big));
            Graph g = Graph.directed(adjacencyOf(edges, 4), edges);
            assertEquals(4_000_000_000L, MaxFlow.maxFlow(g, 0, 3).value());
        }

        @Test
        void largeRealReverseEdgeDoesNotWrap() {
            // after 0->1 is saturated the residual on (1,0) holds both capacities
            int big = Integer.MAX_VALUE;
            Graph g = Graph.directed(adj(0, list(1), 1, list(0, 2), 2, list()),
                    List.of(GraphEdge.of(0, 1, big), GraphEdge.of(1, 0, big), GraphEdge.of(1, 2, big)));
            assertEquals(big, MaxFlow.maxFlow(g, 0, 2).value());
            assertEquals(0, MaxFlow.maxFlow(g, 2, 0).value());
        }

        @Test
        void repeatedCallsGiveEqualResults() {
            Graph g = clrsNetwork();
            assertEquals(MaxFlow.maxFlow(g, 0, 5), MaxFlow.maxFlow(g, 0, 5));
        }
    }

    @Nested
    class Failures {
        @Test
        void sourceEqualToSinkIsInvalid() {
            var ex = assertThrows(InvalidRequestException.class, () -> MaxFlow.maxFlow(flowChain(), 2, 2));
            assertEquals(GraphErrorKind.INVALID_REQUEST, ex.kind());
        }

        @Test
        void missingSourceOrSinkIsNodeNotFound() {
            var missingSource = assertThrows(NodeNotFoundException.class, () -> MaxFlow.maxFlow(flowChain(), 7, 3));
            assertEquals(7, missingSource.node());
            assertTrue(missingSource.getMessage().contains("source"));

            var missingSink = assertThrows(NodeNotFoundException.class, () -> MaxFlow.maxFlow(flowChain(), 0, 8));
            assertTrue(missingSink.getMessage().contains("sink"));
        }

        @Test
        void undirectedGraphIsNotApplicable() {
            assertThrows(NotApplicableException.class, () -> MaxFlow.maxFlow(cycleWithPendant(), 0, 2));
        }

        @Test
        void directednessIsCheckedBeforeNodes() {
            assertThrows(NotApplicableException.class, () -> MaxFlow.maxFlow(cycleWithPendant(), 99, 99));
        }
    }
}
