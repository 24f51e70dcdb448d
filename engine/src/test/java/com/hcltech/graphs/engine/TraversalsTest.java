package com.hcltech.graphs.engine;

import com.hcltech.graphs.engine.exceptions.GraphErrorKind;
import com.hcltech.graphs.engine.exceptions.NodeNotFoundException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.hcltech.graphs.engine.GraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class TraversalsTest {

    private static List<Integer> order(List<TraversalStep> steps) {
        return steps.stream().map(TraversalStep::node).toList();
    }

    @Nested
    class BreadthFirst {
        @Test
        void visitsLevelByLevelInAdjacencyOrder() {
            Graph g = Graph.undirected(adj(
                    0, list(1, 2),
                    1, list(0, 3),
                    2, list(0, 4),
                    3, list(1),
                    4, list(2)));
            assertEquals(List.of(0, 1, 2, 3, 4), order(Traversals.breadthFirst(g, 0)));
        }

        @Test
        void visitedSetGrowsByExactlyOnePerStep() {
            Graph star = Graph.undirected(adj(0, list(1, 2, 3), 1, list(0), 2, list(0), 3, list(0)));
            List<TraversalStep> steps = Traversals.breadthFirst(star, 0);
            for (int i = 0; i < steps.size(); i++) {
                assertEquals(i + 1, steps.get(i).visitedSoFar().size());
                assertTrue(steps.get(i).visitedSoFar().contains(steps.get(i).node()));
            }
            assertEquals(List.of(0, 1), List.copyOf(steps.get(1).visitedSoFar()));
        }
    }

    @Nested
    class DepthFirst {
        @Test
        void isPreOrderInAdjacencyOrder() {
            Graph g = Graph.undirected(adj(
                    0, list(1, 2),
                    1, list(0, 3),
                    2, list(0, 4),
                    3, list(1),
                    4, list(2)));
            assertEquals(List.of(0, 1, 3, 2, 4), order(Traversals.depthFirst(g, 0)));
        }

        @Test
        void backtracksToEarlierSiblings() {
            Graph g = Graph.directed(adj(0, list(1, 2), 1, list(3), 2, list(), 3, list(2)));
            assertEquals(List.of(0, 1, 3, 2), order(Traversals.depthFirst(g, 0)));
        }

        @Test
        void handlesPathsDeeperThanTheCallStack() {
            int n = 200_000;
            List<TraversalStep> steps = Traversals.depthFirst(longDirectedChain(n), 0);
            assertEquals(n, steps.size());
            assertEquals(n - 1, steps.get(n - 1).node());
        }
    }

    @ParameterizedTest
    @EnumSource(TraversalKind.class)
    void visitsEveryReachableNodeExactlyOnce(TraversalKind kind) {
        Graph g = Graph.undirected(adj(
                0, list(1, 1, 0, 2),
                1, list(0, 0, 2),
                2, list(0, 1, 3),
                3, list(2),
                8, list(9),
                9, list(8)));
        List<Integer> visited = order(kind.traverse(g, 0));
        assertEquals(4, visited.size());
        assertEquals(Set.of(0, 1, 2, 3), new HashSet<>(visited));
    }

    @ParameterizedTest
    @EnumSource(TraversalKind.class)
    void danglingNeighborIsVisitedButHasNoEdges(TraversalKind kind) {
        Graph g = Graph.directed(adj(0, list(1), 1, list(42)));
        assertEquals(List.of(0, 1, 42), order(kind.traverse(g, 0)));
    }

    @ParameterizedTest
    @EnumSource(TraversalKind.class)
    void missingStartIsNodeNotFound(TraversalKind kind) {
        var ex = assertThrows(NodeNotFoundException.class, () -> kind.traverse(cycleWithPendant(), 99));
        assertEquals(GraphErrorKind.NODE_NOT_FOUND, ex.kind());
        assertEquals(99, ex.node());
    }

    @ParameterizedTest
    @EnumSource(TraversalKind.class)
    void earlierStepsAreNotChangedByLaterOnes(TraversalKind kind) {
        List<TraversalStep> steps = kind.traverse(cycleWithPendant(), 0);
        assertEquals(Set.of(0), steps.get(0).visitedSoFar());
        assertThrows(UnsupportedOperationException.class, () -> steps.get(0).visitedSoFar().add(5));
        assertThrows(UnsupportedOperationException.class, () -> steps.add(steps.get(0)));
    }

    @ParameterizedTest
    @EnumSource(TraversalKind.class)
    void repeatedCallsGiveEqualResults(TraversalKind kind) {
        Graph g = cycleWithPendant();
        assertEquals(kind.traverse(g, 1), kind.traverse(g, 1));
    }
}
