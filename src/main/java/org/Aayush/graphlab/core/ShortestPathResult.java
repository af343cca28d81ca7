package org.Aayush.graphlab.core;

import java.util.Arrays;

/**
 * Distance and parent tables produced by one single-source shortest-path run.
 * <p>
 * {@code distance(v) == +Infinity} together with {@code parent(v) == NO_PARENT} marks an
 * unreached vertex. When {@link #hasNegativeCycle()} is true the tables are not trustworthy
 * for vertices affected by the cycle.
 * </p>
 * Instances are immutable; array accessors return copies.
 */
public final class ShortestPathResult {
    public static final int NO_PARENT = -1;

    private final double[] dist;
    private final int[] parent;
    private final boolean negativeCycle;

    ShortestPathResult(double[] dist, int[] parent, boolean negativeCycle) {
        if (dist.length != parent.length) {
            throw new IllegalArgumentException(
                    "dist/parent length mismatch: " + dist.length + " != " + parent.length);
        }
        this.dist = dist;
        this.parent = parent;
        this.negativeCycle = negativeCycle;
    }

    /**
     * Fresh tables for {@code vertexCount} vertices, all unreached.
     */
    static ShortestPathResult.Builder unreached(int vertexCount) {
        double[] dist = new double[vertexCount];
        int[] parent = new int[vertexCount];
        Arrays.fill(dist, Double.POSITIVE_INFINITY);
        Arrays.fill(parent, NO_PARENT);
        return new Builder(dist, parent);
    }

    public int vertexCount() {
        return dist.length;
    }

    /**
     * @throws IndexOutOfBoundsException if {@code vertex} is outside the table.
     */
    public double distance(int vertex) {
        checkVertex(vertex);
        return dist[vertex];
    }

    /**
     * @return predecessor on the shortest path tree, or {@link #NO_PARENT}.
     * @throws IndexOutOfBoundsException if {@code vertex} is outside the table.
     */
    public int parent(int vertex) {
        checkVertex(vertex);
        return parent[vertex];
    }

    public boolean isReachable(int vertex) {
        return distance(vertex) != Double.POSITIVE_INFINITY;
    }

    public boolean hasNegativeCycle() {
        return negativeCycle;
    }

    public double[] distancesCopy() {
        return dist.clone();
    }

    public int[] parentsCopy() {
        return parent.clone();
    }

    private void checkVertex(int vertex) {
        if (vertex < 0 || vertex >= dist.length) {
            throw new IndexOutOfBoundsException("Vertex " + vertex + " out of bounds [0, " + dist.length + ")");
        }
    }

    @Override
    public String toString() {
        return "ShortestPathResult{" +
                "dist=" + Arrays.toString(dist) +
                ", parent=" + Arrays.toString(parent) +
                ", negativeCycle=" + negativeCycle +
                '}';
    }

    /**
     * Mutable tables owned by a solver until {@link #build()} hands them to the result.
     */
    static final class Builder {
        final double[] dist;
        final int[] parent;
        private boolean negativeCycle = false;

        private Builder(double[] dist, int[] parent) {
            this.dist = dist;
            this.parent = parent;
        }

        Builder negativeCycle(boolean negativeCycle) {
            this.negativeCycle = negativeCycle;
            return this;
        }

        ShortestPathResult build() {
            return new ShortestPathResult(dist, parent, negativeCycle);
        }
    }
}
