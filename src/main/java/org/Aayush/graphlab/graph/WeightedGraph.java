package org.Aayush.graphlab.graph;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.Collections;
import java.util.List;

/**
 * Adjacency-list weighted graph, directed or undirected.
 * <p>
 * Storage is one growable list of arcs per vertex, indexed by vertex id. Undirected graphs
 * store every inserted edge as two arcs, except self-loops which are stored once.
 * </p>
 * <p>
 * Ownership: {@link #copyOf(WeightedGraph)} deep-copies all adjacency lists,
 * {@link #transfer()} hands the storage over to a new instance and leaves this one empty.
 * </p>
 *
 * <p><strong>Thread Safety:</strong> NOT thread-safe. The graph must not be mutated while a
 * shortest-path computation reads it.</p>
 */
public class WeightedGraph {

    private ObjectArrayList<ObjectArrayList<Edge>> adjacency;
    private final boolean directed;

    public WeightedGraph(int vertexCount, boolean directed) {
        requireNonNegative(vertexCount);
        this.directed = directed;
        this.adjacency = new ObjectArrayList<>(vertexCount);
        for (int i = 0; i < vertexCount; i++) {
            adjacency.add(new ObjectArrayList<>());
        }
    }

    private WeightedGraph(ObjectArrayList<ObjectArrayList<Edge>> adjacency, boolean directed) {
        this.adjacency = adjacency;
        this.directed = directed;
    }

    /**
     * Deep copy: the returned graph shares no adjacency list with {@code source}.
     */
    public static WeightedGraph copyOf(WeightedGraph source) {
        ObjectArrayList<ObjectArrayList<Edge>> copied = new ObjectArrayList<>(source.adjacency.size());
        for (ObjectArrayList<Edge> arcs : source.adjacency) {
            copied.add(new ObjectArrayList<>(arcs));
        }
        return new WeightedGraph(copied, source.directed);
    }

    /**
     * Moves the adjacency storage into a new graph. This graph is left with zero vertices.
     */
    public WeightedGraph transfer() {
        WeightedGraph moved = new WeightedGraph(adjacency, directed);
        this.adjacency = new ObjectArrayList<>();
        return moved;
    }

    public int vertexCount() {
        return adjacency.size();
    }

    public boolean isDirected() {
        return directed;
    }

    /**
     * Grows or shrinks vertex storage. Existing lists keep their order.
     * <p>
     * Shrinking drops the lists of removed vertices only: arcs of surviving vertices that
     * point into the removed range are kept as they are and the caller must not traverse them.
     * </p>
     *
     * @throws IllegalArgumentException if {@code vertexCount} is negative.
     */
    public void resize(int vertexCount) {
        requireNonNegative(vertexCount);
        int current = adjacency.size();
        if (vertexCount < current) {
            adjacency.removeElements(vertexCount, current);
        } else {
            for (int i = current; i < vertexCount; i++) {
                adjacency.add(new ObjectArrayList<>());
            }
        }
    }

    /**
     * Adds edge {@code u -> v}; undirected graphs also get {@code v -> u} unless {@code u == v}.
     *
     * @throws IndexOutOfBoundsException if either endpoint is outside {@code [0, vertexCount())}.
     */
    public void addEdge(int u, int v, double weight) {
        int n = vertexCount();
        if (u < 0 || v < 0 || u >= n || v >= n) {
            throw new IndexOutOfBoundsException(
                    "Edge " + u + "->" + v + " out of bounds [0, " + n + ")");
        }
        adjacency.get(u).add(new Edge(v, weight));
        if (!directed && u != v) {
            adjacency.get(v).add(new Edge(u, weight));
        }
    }

    /**
     * Read-only view of the arcs leaving {@code u}, in insertion order.
     *
     * @throws IndexOutOfBoundsException if {@code u} is not a vertex.
     */
    public List<Edge> neighbors(int u) {
        if (u < 0 || u >= vertexCount()) {
            throw new IndexOutOfBoundsException("Vertex " + u + " out of bounds [0, " + vertexCount() + ")");
        }
        return Collections.unmodifiableList(adjacency.get(u));
    }

    /**
     * Number of edges: stored arcs, halved for undirected graphs.
     */
    public long edgeCount() {
        long arcs = arcCount();
        return directed ? arcs : arcs / 2;
    }

    /**
     * Number of stored arcs, both directions included.
     */
    public long arcCount() {
        long arcs = 0;
        for (ObjectArrayList<Edge> list : adjacency) {
            arcs += list.size();
        }
        return arcs;
    }

    /**
     * Flattens every stored arc into parallel arrays, ordered by source vertex then insertion.
     */
    public ArcList arcs() {
        int capacity = (int) Math.min(Integer.MAX_VALUE - 8, arcCount());
        IntArrayList from = new IntArrayList(capacity);
        IntArrayList to = new IntArrayList(capacity);
        DoubleArrayList weights = new DoubleArrayList(capacity);
        for (int u = 0; u < adjacency.size(); u++) {
            for (Edge edge : adjacency.get(u)) {
                from.add(u);
                to.add(edge.to());
                weights.add(edge.weight());
            }
        }
        return new ArcList(from, to, weights);
    }

    @Override
    public String toString() {
        return String.format("WeightedGraph[vertices=%d, edges=%d, directed=%b]",
                vertexCount(), edgeCount(), directed);
    }

    /**
     * Multi-line dump: one line per vertex listing {@code (target, w=weight)} arcs.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder()
                .append(directed ? "Directed" : "Undirected")
                .append(" graph, vertices: ").append(vertexCount())
                .append(", edges: ").append(edgeCount()).append('\n');
        for (int u = 0; u < adjacency.size(); u++) {
            sb.append(u).append(':');
            for (Edge edge : adjacency.get(u)) {
                sb.append(" (").append(edge.to()).append(", w=").append(edge.weight()).append(')');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void requireNonNegative(int vertexCount) {
        if (vertexCount < 0) {
            throw new IllegalArgumentException("vertexCount must be non-negative, got " + vertexCount);
        }
    }

    /**
     * Flat arc table in structure-of-arrays layout.
     */
    public static final class ArcList {
        private final IntArrayList from;
        private final IntArrayList to;
        private final DoubleArrayList weights;

        ArcList(IntArrayList from, IntArrayList to, DoubleArrayList weights) {
            this.from = from;
            this.to = to;
            this.weights = weights;
        }

        public int size() {
            return from.size();
        }

        public int from(int arc) {
            return from.getInt(arc);
        }

        public int to(int arc) {
            return to.getInt(arc);
        }

        public double weight(int arc) {
            return weights.getDouble(arc);
        }
    }
}
