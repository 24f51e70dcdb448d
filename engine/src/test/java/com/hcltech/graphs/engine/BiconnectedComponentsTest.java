package com.hcltech.graphs.engine;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.hcltech.graphs.engine.GraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class BiconnectedComponentsTest {

    @Test
    void cycleWithPendantSplitsIntoPendantAndCycle() {
        assertEquals(List.of(List.of(1, 4), List.of(0, 1, 2, 3)),
                BiconnectedComponents.biconnectedComponents(cycleWithPendant()).components());
    }

    @Test
    void bowtieSplitsAtItsCentre() {
        assertEquals(List.of(List.of(2, 3, 4), List.of(0, 1, 2)),
                BiconnectedComponents.biconnectedComponents(bowtie()).components());
    }

    @Test
    void rootWithTwoChildrenKeepsBothBlocks() {
        Graph g = Graph.undirected(adj(0, list(1, 2), 1, list(0), 2, list(0)));
        assertEquals(List.of(List.of(0, 2), List.of(0, 1)),
                BiconnectedComponents.biconnectedComponents(g).components());
    }

    @Test
    void pathGivesOneBlockPerEdge() {
        assertEquals(List.of(List.of(2, 3), List.of(1, 2), List.of(0, 1)),
                BiconnectedComponents.biconnectedComponents(path4()).components());
    }

    @Test
    void isolatedNodesBelongToNoBlock() {
        List<List<Integer>> blocks = BiconnectedComponents.biconnectedComponents(disconnected()).components();
        assertTrue(blocks.stream().noneMatch(b -> b.contains(9)));
        assertEquals(List.of(List.of(1, 2), List.of(0, 1), List.of(5, 6)), blocks);
    }

    @Test
    void everyEdgeIsInExactlyOneBlock() {
        Graph g = Graph.undirected(adj(
                0, list(1, 2),
                1, list(0, 2, 3),
                2, list(0, 1),
                3, list(1, 4, 5),
                4, list(3, 5),
                5, list(3, 4, 6),
                6, list(5),
                7, list(8),
                8, list(7)));
        List<List<Integer>> blocks = BiconnectedComponents.biconnectedComponents(g).components();
        for (List<Integer> edge : undirectedEdges(g)) {
            long owners = blocks.stream().filter(b -> b.containsAll(edge)).count();
            assertEquals(1, owners, "edge " + edge + " is in " + owners + " blocks");
        }
        Set<Integer> covered = new HashSet<>();
        blocks.forEach(covered::addAll);
        assertEquals(new HashSet<>(g.nodes()), covered);
    }

    @Test
    void parallelEdgesFormOneBlock() {
        Graph doubled = Graph.undirected(adj(0, list(1, 1), 1, list(0, 0)));
        assertEquals(List.of(List.of(0, 1)), BiconnectedComponents.biconnectedComponents(doubled).components());
    }

    @Test
    void selfLoopJoinsTheBlockOfItsNode() {
        Graph g = Graph.undirected(adj(0, list(0, 1), 1, list(0), 2, list(2)));
        assertEquals(List.of(List.of(0, 1), List.of(2)), BiconnectedComponents.biconnectedComponents(g).components());
    }

    @Test
    void selfLoopBelowACutVertexStaysWithItsParentEdge() {
        // 1 carries a loop and is the cut vertex between {0,1} and {1,2}
        Graph g = Graph.undirected(adj(0, list(1), 1, list(1, 0, 2), 2, list(1)));
        assertEquals(List.of(List.of(1, 2), List.of(0, 1)), BiconnectedComponents.biconnectedComponents(g).components());
    }

    @Test
    void deepPathDoesNotOverflowTheStack() {
        int n = 200_000;
        List<List<Integer>> blocks = BiconnectedComponents.biconnectedComponents(longPath(n)).components();
        assertEquals(n - 1, blocks.size());
        assertEquals(List.of(n - 2, n - 1), blocks.get(0));
    }

    @Test
    void blocksAreIndependentCopies() {
        List<List<Integer>> blocks = new ArrayList<>(BiconnectedComponents.biconnectedComponents(bowtie()).components());
        assertThrows(UnsupportedOperationException.class, () -> blocks.get(0).add(7));
    }
}
