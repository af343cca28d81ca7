package org.Aayush.graphlab.graph;

import java.util.Objects;
import java.util.Random;

/**
 * Erdős–Rényi style random graph builder with uniform edge weights.
 */
public class RandomGraphGenerator {

    private final Random random;

    public RandomGraphGenerator() {
        this(new Random());
    }

    /**
     * @param random source of randomness; pass a seeded instance for reproducible graphs.
     */
    public RandomGraphGenerator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Builds a graph where every candidate pair {@code u != v} (only {@code u < v} when
     * undirected) receives an edge with probability {@code edgeProbability}. Weights are drawn
     * uniformly from {@code [minWeight, maxWeight)}; reversed bounds are swapped.
     *
     * @throws IllegalArgumentException if {@code vertexCount < 0} or the probability is outside [0, 1].
     */
    public WeightedGraph generate(int vertexCount, double edgeProbability,
                                  double minWeight, double maxWeight, boolean directed) {
        if (vertexCount < 0) {
            throw new IllegalArgumentException("vertexCount must be non-negative, got " + vertexCount);
        }
        if (!(edgeProbability >= 0.0 && edgeProbability <= 1.0)) {
            throw new IllegalArgumentException("edgeProbability must be in [0, 1], got " + edgeProbability);
        }
        if (minWeight > maxWeight) {
            double tmp = minWeight;
            minWeight = maxWeight;
            maxWeight = tmp;
        }

        WeightedGraph graph = new WeightedGraph(vertexCount, directed);
        if (edgeProbability == 0.0) {
            return graph;
        }
        for (int u = 0; u < vertexCount; u++) {
            for (int v = directed ? 0 : u + 1; v < vertexCount; v++) {
                if (u == v) continue;
                if (edgeProbability == 1.0 || random.nextDouble() < edgeProbability) {
                    graph.addEdge(u, v, nextWeight(minWeight, maxWeight));
                }
            }
        }
        return graph;
    }

    private double nextWeight(double minWeight, double maxWeight) {
        if (minWeight == maxWeight) {
            return minWeight;
        }
        return minWeight + random.nextDouble() * (maxWeight - minWeight);
    }
}
