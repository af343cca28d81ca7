package org.Aayush.graphlab.core;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.graphlab.graph.WeightedGraph;

import java.util.Objects;

/**
 * Bellman-Ford over the flattened arc list of a graph.
 * <p>
 * Runs at most {@code n - 1} relaxation passes and stops early after a pass without change.
 * A final pass looks for any arc that still relaxes from a reached vertex; finding one sets
 * {@link ShortestPathResult#hasNegativeCycle()} and the tables are returned as they are.
 * </p>
 */
@Slf4j
public final class BellmanFordSolver implements ShortestPathSolver {

    @Override
    public ShortestPathResult solve(WeightedGraph graph, int source) {
        Objects.requireNonNull(graph, "graph");
        int n = graph.vertexCount();
        ShortestPathResult.Builder tables = ShortestPathResult.unreached(n);
        if (source < 0 || source >= n) {
            log.debug("Bellman-Ford source {} outside [0, {}), nothing reached", source, n);
            return tables.build();
        }

        double[] dist = tables.dist;
        int[] parent = tables.parent;
        dist[source] = 0.0;

        WeightedGraph.ArcList arcs = graph.arcs();
        int arcCount = arcs.size();

        int passes = 0;
        for (int pass = 0; pass < n - 1; pass++) {
            passes++;
            boolean changed = false;
            for (int a = 0; a < arcCount; a++) {
                int u = arcs.from(a);
                double du = dist[u];
                if (du == Double.POSITIVE_INFINITY) continue;
                int v = arcs.to(a);
                double candidate = du + arcs.weight(a);
                if (candidate < dist[v]) {
                    dist[v] = candidate;
                    parent[v] = u;
                    changed = true;
                }
            }
            if (!changed) break;
        }

        boolean negativeCycle = false;
        for (int a = 0; a < arcCount; a++) {
            double du = dist[arcs.from(a)];
            if (du != Double.POSITIVE_INFINITY && du + arcs.weight(a) < dist[arcs.to(a)]) {
                negativeCycle = true;
                break;
            }
        }

        log.debug("Bellman-Ford from {}: arcs={}, passes={}, negativeCycle={}",
                source, arcCount, passes, negativeCycle);
        return tables.negativeCycle(negativeCycle).build();
    }
}
