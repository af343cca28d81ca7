package org.Aayush.graphlab.benchmark;

import org.Aayush.graphlab.config.GraphLabSettings;
import org.Aayush.graphlab.graph.WeightedGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AlgorithmComparison Tests")
class AlgorithmComparisonTest {

    private final AlgorithmComparison comparison =
            new AlgorithmComparison(GraphLabSettings.of(1e-6, List.of("true")));

    @Test
    @DisplayName("Agreeing algorithms are both ok")
    void testAgreement() {
        WeightedGraph g = new WeightedGraph(3, true);
        g.addEdge(0, 1, 1.0);
        g.addEdge(1, 2, 2.0);

        List<BenchmarkRecord> records = comparison.compare(g, 0);

        assertEquals(2, records.size());
        BenchmarkRecord dijkstra = records.get(0);
        BenchmarkRecord bellmanFord = records.get(1);
        assertEquals("Dijkstra", dijkstra.getAlgorithm());
        assertEquals("Bellman-Ford", bellmanFord.getAlgorithm());
        assertEquals(3, dijkstra.getVertices());
        assertEquals(2, dijkstra.getEdges());
        assertTrue(dijkstra.isOk());
        assertTrue(bellmanFord.isOk());
        assertTrue(dijkstra.getElapsedMillis() >= 0.0);
    }

    @Test
    @DisplayName("Negative arc makes the tables disagree")
    void testDisagreement() {
        WeightedGraph g = new WeightedGraph(3, true);
        g.addEdge(0, 1, 1.0);
        g.addEdge(1, 2, -2.0);
        g.addEdge(0, 2, 4.0);

        List<BenchmarkRecord> records = comparison.compare(g, 0);
        assertTrue(records.get(0).isOk());
        assertFalse(records.get(1).isOk());
    }

    @Test
    @DisplayName("Negative cycle fails the Bellman-Ford record")
    void testNegativeCycle() {
        WeightedGraph g = new WeightedGraph(2, false);
        g.addEdge(0, 1, -3.0);
        assertFalse(comparison.compare(g, 0).get(1).isOk());
    }

    @Test
    @DisplayName("Empty graph fails the Dijkstra record")
    void testEmptyGraph() {
        List<BenchmarkRecord> records = comparison.compare(new WeightedGraph(0, true), 0);
        assertFalse(records.get(0).isOk());
        assertTrue(records.get(1).isOk());
    }
}
