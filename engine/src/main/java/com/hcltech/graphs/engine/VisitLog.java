package com.hcltech.graphs.engine;

import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Append-only record of marked nodes. {@link #snapshot()} returns a read-only view of the
 * nodes marked so far; later marks land beyond its end, so a snapshot never changes and costs
 * O(1) to take.
 */
final class VisitLog {
    private final List<Integer> order = new ArrayList<>();
    private final Map<Integer, Integer> rank = new HashMap<>();

    /** @return false if the node was already marked */
    boolean mark(int node) {
        if (rank.putIfAbsent(node, order.size()) != null) return false;
        order.add(node);
        return true;
    }

    Set<Integer> snapshot() {
        return new Prefix(order, rank, order.size());
    }

    static final class Prefix extends AbstractSet<Integer> {
        private final List<Integer> order;
        private final Map<Integer, Integer> rank;
        private final int size;

        private Prefix(List<Integer> order, Map<Integer, Integer> rank, int size) {
            this.order = order;
            this.rank = rank;
            this.size = size;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public boolean contains(Object o) {
            Integer r = rank.get(o);
            return r != null && r < size;
        }

        @Override
        public Iterator<Integer> iterator() {
            return new Iterator<>() {
                private int next;

                @Override
                public boolean hasNext() {
                    return next < size;
                }

                @Override
                public Integer next() {
                    if (next >= size) throw new NoSuchElementException();
                    return order.get(next++);
                }
            };
        }
    }
}
