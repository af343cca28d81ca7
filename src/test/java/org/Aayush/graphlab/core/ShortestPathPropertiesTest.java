package org.Aayush.graphlab.core;

import org.Aayush.graphlab.graph.Edge;
import org.Aayush.graphlab.graph.RandomGraphGenerator;
import org.Aayush.graphlab.graph.WeightedGraph;
import org.Aayush.graphlab.search.BinaryHeapPriorityQueue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cross-checks both solvers against a Floyd-Warshall reference on random graphs.
 */
@DisplayName("Shortest-path properties on random graphs")
class ShortestPathPropertiesTest {

    private static final double EPS = 1e-6;

    private static double[][] floydWarshall(WeightedGraph g) {
        int n = g.vertexCount();
        double[][] d = new double[n][n];
        for (int i = 0; i < n; i++) {
            Arrays.fill(d[i], Double.POSITIVE_INFINITY);
            d[i][i] = 0.0;
            for (Edge e : g.neighbors(i)) {
                d[i][e.to()] = Math.min(d[i][e.to()], e.weight());
            }
        }
        for (int k = 0; k < n; k++) {
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    if (d[i][k] + d[k][j] < d[i][j]) {
                        d[i][j] = d[i][k] + d[k][j];
                    }
                }
            }
        }
        return d;
    }

    private static void assertPathConsistent(WeightedGraph g, ShortestPathResult result, int source) {
        for (int t = 0; t < g.vertexCount(); t++) {
            int[] path = PathRestorer.restorePath(result, source, t);
            if (!result.isReachable(t)) {
                assertEquals(0, path.length, "Unreached target must have no path");
                continue;
            }
            assertEquals(source, path[0]);
            assertEquals(t, path[path.length - 1]);
            double length = 0.0;
            for (int i = 1; i < path.length; i++) {
                int u = path[i - 1];
                int v = path[i];
                assertEquals(u, result.parent(v));
                double best = Double.POSITIVE_INFINITY;
                for (Edge e : g.neighbors(u)) {
                    if (e.to() == v) best = Math.min(best, e.weight());
                }
                length += best;
            }
            assertEquals(result.distance(t), length, EPS, "Path length must equal the reported distance");
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 2L, 3L, 4L, 5L, 6L})
    @DisplayName("Non-negative weights: Dijkstra == Bellman-Ford == reference")
    void testNonNegativeAgreement(long seed) {
        Random random = new Random(seed);
        boolean directed = seed % 2 == 0;
        WeightedGraph g = new RandomGraphGenerator(random).generate(25, 0.15, 0.0, 20.0, directed);
        double[][] reference = floydWarshall(g);
        int source = random.nextInt(25);

        ShortestPathResult dijkstra = new DijkstraSolver().solve(g, source);
        ShortestPathResult heapDijkstra = new DijkstraSolver(BinaryHeapPriorityQueue::new).solve(g, source);
        ShortestPathResult bellmanFord = new BellmanFordSolver().solve(g, source);

        assertFalse(bellmanFord.hasNegativeCycle());
        for (int v = 0; v < 25; v++) {
            double expected = reference[source][v];
            if (expected == Double.POSITIVE_INFINITY) {
                assertFalse(dijkstra.isReachable(v));
                assertFalse(bellmanFord.isReachable(v));
            } else {
                assertEquals(expected, dijkstra.distance(v), EPS);
                assertEquals(expected, heapDijkstra.distance(v), EPS);
                assertEquals(expected, bellmanFord.distance(v), EPS);
            }
        }
        assertPathConsistent(g, dijkstra, source);
        assertPathConsistent(g, bellmanFord, source);
    }

    @ParameterizedTest
    @ValueSource(longs = {11L, 12L, 13L})
    @DisplayName("Negative arcs on a DAG: Bellman-Ford matches the reference")
    void testNegativeDag(long seed) {
        Random random = new Random(seed);
        int n = 20;
        WeightedGraph g = new WeightedGraph(n, true);
        for (int u = 0; u < n; u++) {
            for (int v = u + 1; v < n; v++) {
                if (random.nextDouble() < 0.2) {
                    g.addEdge(u, v, random.nextDouble() * 10.0 - 4.0);
                }
            }
        }
        double[][] reference = floydWarshall(g);

        ShortestPathResult bellmanFord = new BellmanFordSolver().solve(g, 0);
        ShortestPathResult dijkstra = new DijkstraSolver().solve(g, 0);

        assertFalse(bellmanFord.hasNegativeCycle(), "A DAG has no cycle");
        for (int v = 0; v < n; v++) {
            double expected = reference[0][v];
            if (expected == Double.POSITIVE_INFINITY) {
                assertFalse(bellmanFord.isReachable(v));
            } else {
                assertEquals(expected, bellmanFord.distance(v), EPS);
            }
            if (dijkstra.isReachable(v)) {
                assertTrue(dijkstra.distance(v) >= expected - EPS,
                        "Dijkstra ignoring negative arcs can only over-estimate");
            }
        }
        assertPathConsistent(g, bellmanFord, 0);
    }
}
