package com.hcltech.graphs.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Discovery-time / low-link DFS over the adjacency taken as an undirected relation, with an
 * explicit frame stack instead of recursion. Roots are tried in ascending order so disconnected
 * graphs are fully covered.
 * <p>
 * Only the one adjacency slot that is the tree edge back to the parent is skipped. A second,
 * parallel edge to the parent counts as a back edge.
 * <p>
 * Every instance is single use: create one per analysis call.
 */
final class LowLinkSearch {

    interface Visitor {
        /** {@code u} discovered {@code v} for the first time. */
        default void onTreeEdge(int u, int v) {}

        /** {@code u} reached an ancestor {@code v} (disc[v] < disc[u]) by a non-tree edge. */
        default void onBackEdge(int u, int v) {}

        /** One adjacency slot of {@code u} names {@code u} itself. */
        default void onSelfLoop(int u) {}

        /**
         * Child {@code v} of {@code u} is finished and {@code low[u]} has been updated.
         *
         * @param separates {@code u} is a root with more than one child so far, or a non-root with low[v] >= disc[u]
         * @param bridge    low[v] > disc[u]
         */
        void onChildFinished(int u, int v, boolean separates, boolean bridge);

        /** The DFS tree rooted at {@code root} is complete. */
        default void onRootFinished(int root) {}
    }

    private final Graph graph;
    private final Map<Integer, Integer> disc = new HashMap<>();
    private final Map<Integer, Integer> low = new HashMap<>();
    private int time;

    LowLinkSearch(Graph graph) {
        this.graph = graph;
    }

    void run(Visitor visitor) {
        Deque<Frame> stack = new ArrayDeque<>();
        for (int root : graph.sortedNodes()) {
            if (disc.containsKey(root)) continue;
            discover(root);
            stack.push(Frame.root(root));
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                int u = frame.node;
                List<Integer> neighbors = graph.neighbors(u);
                if (frame.next == neighbors.size()) {
                    stack.pop();
                    if (!stack.isEmpty()) finishChild(stack.peek(), u, visitor);
                    continue;
                }
                int v = neighbors.get(frame.next++);
                if (frame.hasParent && !frame.parentEdgeSkipped && v == frame.parent) {
                    frame.parentEdgeSkipped = true;
                    continue;
                }
                Integer discV = disc.get(v);
                if (discV == null) {
                    frame.children++;
                    visitor.onTreeEdge(u, v);
                    discover(v);
                    stack.push(Frame.child(v, u));
                } else {
                    if (v == u) visitor.onSelfLoop(u);
                    else if (discV < disc.get(u)) visitor.onBackEdge(u, v);
                    low.put(u, Math.min(low.get(u), discV));
                }
            }
            visitor.onRootFinished(root);
        }
    }

    private void finishChild(Frame parentFrame, int v, Visitor visitor) {
        int u = parentFrame.node;
        int lowV = low.get(v);
        int discU = disc.get(u);
        low.put(u, Math.min(low.get(u), lowV));
        boolean separates = parentFrame.hasParent ? lowV >= discU : parentFrame.children > 1;
        visitor.onChildFinished(u, v, separates, lowV > discU);
    }

    private void discover(int node) {
        disc.put(node, time);
        low.put(node, time);
        time++;
    }

    private static final class Frame {
        final int node;
        final boolean hasParent;
        final int parent;
        int next;
        int children;
        boolean parentEdgeSkipped;

        private Frame(int node, boolean hasParent, int parent) {
            this.node = node;
            this.hasParent = hasParent;
            this.parent = parent;
        }

        static Frame root(int node) {
            return new Frame(node, false, 0);
        }

        static Frame child(int node, int parent) {
            return new Frame(node, true, parent);
        }
    }
}
