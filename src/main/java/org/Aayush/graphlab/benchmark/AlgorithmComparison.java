package org.Aayush.graphlab.benchmark;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.graphlab.config.GraphLabSettings;
import org.Aayush.graphlab.core.BellmanFordSolver;
import org.Aayush.graphlab.core.DijkstraSolver;
import org.Aayush.graphlab.core.ShortestPathAlgorithm;
import org.Aayush.graphlab.core.ShortestPathResult;
import org.Aayush.graphlab.core.ShortestPathSolver;
import org.Aayush.graphlab.graph.WeightedGraph;

import java.util.List;
import java.util.Objects;

/**
 * Times Dijkstra and Bellman-Ford on the same graph and cross-checks their distances.
 * <p>
 * The Dijkstra record is ok when it produced a table. The Bellman-Ford record is ok when no
 * negative cycle was found and both tables agree: same unreached vertices and finite
 * distances within {@link GraphLabSettings#benchmarkTolerance()}.
 * </p>
 */
@Slf4j
public class AlgorithmComparison {

    private final ShortestPathSolver dijkstra;
    private final ShortestPathSolver bellmanFord;
    private final double tolerance;

    public AlgorithmComparison() {
        this(GraphLabSettings.fromSystemProperties());
    }

    public AlgorithmComparison(GraphLabSettings settings) {
        this(new DijkstraSolver(), new BellmanFordSolver(), settings);
    }

    AlgorithmComparison(ShortestPathSolver dijkstra, ShortestPathSolver bellmanFord, GraphLabSettings settings) {
        this.dijkstra = Objects.requireNonNull(dijkstra, "dijkstra");
        this.bellmanFord = Objects.requireNonNull(bellmanFord, "bellmanFord");
        this.tolerance = Objects.requireNonNull(settings, "settings").benchmarkTolerance();
    }

    /**
     * Runs both algorithms from {@code source}.
     *
     * @return the Dijkstra record followed by the Bellman-Ford record.
     */
    public List<BenchmarkRecord> compare(WeightedGraph graph, int source) {
        Objects.requireNonNull(graph, "graph");

        long t1 = System.nanoTime();
        ShortestPathResult dijkstraResult = dijkstra.solve(graph, source);
        long t2 = System.nanoTime();
        ShortestPathResult bellmanFordResult = bellmanFord.solve(graph, source);
        long t3 = System.nanoTime();

        boolean same = sameDistances(dijkstraResult, bellmanFordResult, tolerance);

        BenchmarkRecord dijkstraRecord = BenchmarkRecord.builder()
                .vertices(graph.vertexCount())
                .edges(graph.edgeCount())
                .algorithm(ShortestPathAlgorithm.DIJKSTRA.displayName())
                .elapsedMillis(toMillis(t2 - t1))
                .ok(dijkstraResult.vertexCount() > 0)
                .build();
        BenchmarkRecord bellmanFordRecord = BenchmarkRecord.builder()
                .vertices(graph.vertexCount())
                .edges(graph.edgeCount())
                .algorithm(ShortestPathAlgorithm.BELLMAN_FORD.displayName())
                .elapsedMillis(toMillis(t3 - t2))
                .ok(!bellmanFordResult.hasNegativeCycle() && same)
                .build();

        log.info("Compared on {} from {}: dijkstra={}ms, bellmanFord={}ms, agree={}, negativeCycle={}",
                graph, source, dijkstraRecord.getElapsedMillis(), bellmanFordRecord.getElapsedMillis(),
                same, bellmanFordResult.hasNegativeCycle());
        return List.of(dijkstraRecord, bellmanFordRecord);
    }

    /**
     * Checks that two tables have the same unreached vertices and close finite distances.
     */
    static boolean sameDistances(ShortestPathResult a, ShortestPathResult b, double tolerance) {
        if (a.vertexCount() != b.vertexCount()) {
            return false;
        }
        for (int v = 0; v < a.vertexCount(); v++) {
            boolean reachedA = a.isReachable(v);
            if (reachedA != b.isReachable(v)) {
                return false;
            }
            if (reachedA && Math.abs(a.distance(v) - b.distance(v)) > tolerance) {
                return false;
            }
        }
        return true;
    }

    private static double toMillis(long nanos) {
        return (nanos / 1_000L) / 1000.0;
    }
}
