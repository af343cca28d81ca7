package org.Aayush.graphlab.graph;

/**
 * Directed arc stored in the adjacency list of its source vertex.
 *
 * @param to target vertex.
 * @param weight arc weight; may be negative.
 */
public record Edge(int to, double weight) {
}
