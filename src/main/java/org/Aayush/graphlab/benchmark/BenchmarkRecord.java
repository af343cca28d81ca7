package org.Aayush.graphlab.benchmark;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable timing record of one shortest-path run.
 */
@Value
@Builder
public class BenchmarkRecord {

    /**
     * Vertex count of the benchmarked graph.
     */
    int vertices;

    /**
     * Edge count of the benchmarked graph.
     */
    long edges;

    /**
     * Algorithm display name.
     */
    String algorithm;

    /**
     * Wall-clock run time in milliseconds, microsecond resolution.
     */
    double elapsedMillis;

    /**
     * Whether the run produced a trustworthy result.
     */
    boolean ok;
}
