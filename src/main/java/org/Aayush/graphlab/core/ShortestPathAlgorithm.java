package org.Aayush.graphlab.core;

/**
 * Shortest-path strategy selector.
 */
public enum ShortestPathAlgorithm {
    DIJKSTRA("Dijkstra"),
    BELLMAN_FORD("Bellman-Ford");

    private final String displayName;

    ShortestPathAlgorithm(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Human-readable name, also used as the benchmark CSV algorithm column.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Creates the default solver for this algorithm.
     */
    public ShortestPathSolver newSolver() {
        switch (this) {
            case DIJKSTRA:
                return new DijkstraSolver();
            case BELLMAN_FORD:
                return new BellmanFordSolver();
            default:
                throw new IllegalStateException("Unsupported algorithm: " + this);
        }
    }
}
