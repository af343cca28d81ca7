package org.Aayush.graphlab.core;

import java.util.BitSet;

/**
 * Tracks vertices whose shortest distance is final during one Dijkstra run.
 * <p>
 * Wraps a {@link java.util.BitSet}: O(1) access, about one bit per vertex.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> NOT thread-safe; owned by a single solve call.
 * </p>
 */
final class SettledSet {

    private final BitSet settled;
    private int count = 0;

    SettledSet(int vertexCount) {
        this.settled = new BitSet(vertexCount);
    }

    /**
     * Settles a vertex if it is not settled yet.
     *
     * @return {@code true} if the vertex was newly settled, {@code false} if it already was.
     */
    boolean settle(int vertex) {
        if (settled.get(vertex)) {
            return false;
        }
        settled.set(vertex);
        count++;
        return true;
    }

    int count() {
        return count;
    }
}
