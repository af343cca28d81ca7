package org.Aayush.graphlab.core;

import org.Aayush.graphlab.graph.WeightedGraph;

/**
 * Single-source shortest-path strategy.
 * <p>
 * Implementations are stateless between calls and run synchronously on the caller's thread.
 * A source outside {@code [0, vertexCount)} is not an error: the result marks every vertex as
 * unreached.
 * </p>
 */
public interface ShortestPathSolver {

    /**
     * @param graph graph to search; must not be mutated during the call.
     * @param source source vertex.
     * @return fresh result sized to {@code graph.vertexCount()}.
     */
    ShortestPathResult solve(WeightedGraph graph, int source);
}
