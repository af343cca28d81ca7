package org.Aayush.graphlab.core;

import org.Aayush.graphlab.graph.WeightedGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BellmanFordSolver Tests")
class BellmanFordSolverTest {

    private static final double EPS = 1e-9;

    @Test
    @DisplayName("Sample graph distances and path")
    void testSampleGraph() {
        ShortestPathResult result = new BellmanFordSolver().solve(DijkstraSolverTest.sampleGraph(), 0);
        assertArrayEquals(new double[]{0, 2, 3, 4, 7}, result.distancesCopy(), EPS);
        assertFalse(result.hasNegativeCycle());
        assertArrayEquals(new int[]{0, 1, 2, 3, 4}, PathRestorer.restorePath(result, 0, 4));
    }

    @Test
    @DisplayName("Negative arc without cycle")
    void testNegativeArc() {
        WeightedGraph g = new WeightedGraph(3, true);
        g.addEdge(0, 1, 1.0);
        g.addEdge(1, 2, -2.0);
        g.addEdge(0, 2, 4.0);

        ShortestPathResult result = new BellmanFordSolver().solve(g, 0);
        assertFalse(result.hasNegativeCycle());
        assertEquals(-1.0, result.distance(2), EPS);
        assertArrayEquals(new int[]{0, 1, 2}, PathRestorer.restorePath(result, 0, 2));
    }

    @Test
    @DisplayName("Reachable negative cycle is flagged and the result still returned")
    void testNegativeCycle() {
        WeightedGraph g = new WeightedGraph(4, true);
        g.addEdge(0, 1, 1.0);
        g.addEdge(1, 2, -1.0);
        g.addEdge(2, 1, -1.0);
        g.addEdge(2, 3, 1.0);

        ShortestPathResult bellmanFord = new BellmanFordSolver().solve(g, 0);
        assertTrue(bellmanFord.hasNegativeCycle());
        assertEquals(4, bellmanFord.vertexCount());

        ShortestPathResult dijkstra = new DijkstraSolver().solve(g, 0);
        assertFalse(dijkstra.hasNegativeCycle());
        assertEquals(1.0, dijkstra.distance(1), EPS);
        assertFalse(dijkstra.isReachable(3), "Only negative arcs lead to 3");
    }

    @Test
    @DisplayName("Unreachable negative cycle is not flagged")
    void testUnreachableNegativeCycle() {
        WeightedGraph g = new WeightedGraph(4, true);
        g.addEdge(0, 1, 2.0);
        g.addEdge(2, 3, -5.0);
        g.addEdge(3, 2, 1.0);

        ShortestPathResult result = new BellmanFordSolver().solve(g, 0);
        assertFalse(result.hasNegativeCycle());
        assertEquals(2.0, result.distance(1), EPS);
        assertFalse(result.isReachable(2));
    }

    @Test
    @DisplayName("Undirected negative edge forms a negative cycle")
    void testUndirectedNegativeEdge() {
        WeightedGraph g = new WeightedGraph(2, false);
        g.addEdge(0, 1, -1.0);
        assertTrue(new BellmanFordSolver().solve(g, 0).hasNegativeCycle());
    }

    @Test
    @DisplayName("Undirected graph uses both arc directions")
    void testUndirectedBothDirections() {
        WeightedGraph g = new WeightedGraph(3, false);
        g.addEdge(2, 1, 1.0);
        g.addEdge(1, 0, 1.0);
        ShortestPathResult result = new BellmanFordSolver().solve(g, 0);
        assertEquals(2.0, result.distance(2), EPS);
        assertFalse(result.hasNegativeCycle());
    }

    @Test
    @DisplayName("Source out of range yields an all-unreached result")
    void testSourceOutOfRange() {
        ShortestPathResult result = new BellmanFordSolver().solve(DijkstraSolverTest.sampleGraph(), 9);
        for (int v = 0; v < result.vertexCount(); v++) {
            assertFalse(result.isReachable(v));
        }
        assertFalse(result.hasNegativeCycle());
    }

    @Test
    @DisplayName("Single vertex with a negative self-loop")
    void testNegativeSelfLoop() {
        WeightedGraph g = new WeightedGraph(1, true);
        g.addEdge(0, 0, -1.0);
        assertTrue(new BellmanFordSolver().solve(g, 0).hasNegativeCycle());
    }
}
