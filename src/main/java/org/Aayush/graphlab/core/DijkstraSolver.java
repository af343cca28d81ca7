package org.Aayush.graphlab.core;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.graphlab.graph.Edge;
import org.Aayush.graphlab.graph.WeightedGraph;
import org.Aayush.graphlab.search.HashTablePriorityQueue;
import org.Aayush.graphlab.search.MinPriorityQueue;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Dijkstra's algorithm over a {@link MinPriorityQueue} keyed by tentative distance.
 * <p>
 * <strong>Lazy deletion:</strong> the queue has no decrease-key. Every successful relaxation
 * enqueues the vertex again and dequeued entries of already settled vertices are skipped.
 * </p>
 * <p>
 * <strong>Negative weights:</strong> arcs with a negative weight are excluded from relaxation.
 * Vertices reachable only through such arcs may be reported with an over-estimated distance or
 * as unreached. Negative cycles are never reported.
 * </p>
 */
@Slf4j
public final class DijkstraSolver implements ShortestPathSolver {

    private final Supplier<? extends MinPriorityQueue<Integer, Double>> queueFactory;

    public DijkstraSolver() {
        this(HashTablePriorityQueue::new);
    }

    /**
     * @param queueFactory creates one queue per solve call.
     */
    public DijkstraSolver(Supplier<? extends MinPriorityQueue<Integer, Double>> queueFactory) {
        this.queueFactory = Objects.requireNonNull(queueFactory, "queueFactory");
    }

    @Override
    public ShortestPathResult solve(WeightedGraph graph, int source) {
        Objects.requireNonNull(graph, "graph");
        int n = graph.vertexCount();
        ShortestPathResult.Builder tables = ShortestPathResult.unreached(n);
        if (source < 0 || source >= n) {
            log.debug("Dijkstra source {} outside [0, {}), nothing reached", source, n);
            return tables.build();
        }

        double[] dist = tables.dist;
        int[] parent = tables.parent;
        SettledSet settled = new SettledSet(n);
        MinPriorityQueue<Integer, Double> queue = queueFactory.get();
        int staleEntries = 0;
        int skippedNegativeArcs = 0;

        dist[source] = 0.0;
        queue.enqueue(source, 0.0);

        while (!queue.isEmpty()) {
            int u = queue.dequeue();
            if (!settled.settle(u)) {
                staleEntries++;
                continue;
            }
            double du = dist[u];
            for (Edge edge : graph.neighbors(u)) {
                if (edge.weight() < 0) {
                    skippedNegativeArcs++;
                    continue;
                }
                int v = edge.to();
                double candidate = du + edge.weight();
                if (candidate < dist[v]) {
                    dist[v] = candidate;
                    parent[v] = u;
                    queue.enqueue(v, candidate);
                }
            }
        }

        log.debug("Dijkstra from {}: settled={}, stale={}, skippedNegativeArcs={}",
                source, settled.count(), staleEntries, skippedNegativeArcs);
        return tables.build();
    }
}
