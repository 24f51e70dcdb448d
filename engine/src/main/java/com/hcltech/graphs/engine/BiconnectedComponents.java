package com.hcltech.graphs.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.TreeSet;

/**
 * Splits the edges into biconnected blocks with the low-link DFS plus an edge stack.
 * Every edge lands in exactly one block; isolated nodes are in none.
 * <p>
 * A self-loop goes to the block holding its node's edge to its DFS parent, or to the root's last
 * block. A node whose only edges are self-loops is a block of its own.
 */
public final class BiconnectedComponents {
    private BiconnectedComponents() {}

    public static BiconnectedResult biconnectedComponents(Graph graph) {
        BlockCollector collector = new BlockCollector();
        new LowLinkSearch(graph).run(collector);
        return new BiconnectedResult(collector.blocks);
    }

    private static final class BlockCollector implements LowLinkSearch.Visitor {
        final Deque<int[]> edges = new ArrayDeque<>();
        final List<List<Integer>> blocks = new ArrayList<>();

        @Override
        public void onTreeEdge(int u, int v) {
            edges.push(new int[]{u, v});
        }

        @Override
        public void onBackEdge(int u, int v) {
            edges.push(new int[]{u, v});
        }

        @Override
        public void onSelfLoop(int u) {
            edges.push(new int[]{u, u});
        }

        @Override
        public void onChildFinished(int u, int v, boolean separates, boolean bridge) {
            if (!separates) return;
            TreeSet<Integer> block = new TreeSet<>();
            int[] edge;
            do {
                edge = edges.pop();
                block.add(edge[0]);
                block.add(edge[1]);
            } while (edge[0] != u || edge[1] != v);
            blocks.add(new ArrayList<>(block));
        }

        @Override
        public void onRootFinished(int root) {
            if (edges.isEmpty()) return;
            TreeSet<Integer> block = new TreeSet<>();
            while (!edges.isEmpty()) {
                int[] edge = edges.pop();
                block.add(edge[0]);
                block.add(edge[1]);
            }
            blocks.add(new ArrayList<>(block));
        }
    }
}
