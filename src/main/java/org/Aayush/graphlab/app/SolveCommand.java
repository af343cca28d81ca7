package org.Aayush.graphlab.app;

import org.Aayush.graphlab.core.PathRestorer;
import org.Aayush.graphlab.core.ShortestPathAlgorithm;
import org.Aayush.graphlab.core.ShortestPathResult;
import org.Aayush.graphlab.graph.WeightedGraph;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.Locale;

/**
 * Runs one algorithm and prints the distance table and, optionally, one path.
 */
@Command(name = "solve", description = "Run one shortest-path algorithm from a source vertex.")
class SolveCommand extends GraphFileCommand {

    @Option(names = {"-a", "--algorithm"}, defaultValue = "DIJKSTRA",
            description = "Algorithm: ${COMPLETION-CANDIDATES}.")
    ShortestPathAlgorithm algorithm;

    @Option(names = {"-s", "--source"}, required = true, description = "Source vertex.")
    int source;

    @Option(names = {"-t", "--target"}, defaultValue = "-1",
            description = "Target vertex whose path is printed; negative to skip.")
    int target;

    @Override
    protected int execute(WeightedGraph graph) {
        long start = System.nanoTime();
        ShortestPathResult result = algorithm.newSolver().solve(graph, source);
        double elapsedMillis = ((System.nanoTime() - start) / 1_000L) / 1000.0;

        PrintWriter out = out();
        if (result.hasNegativeCycle()) {
            out.println("Negative cycle detected. Distances may be incorrect.");
        }
        out.println(String.format(Locale.ROOT, "%s finished in %.3f ms.", algorithm.displayName(), elapsedMillis));
        printDistances(out, result);
        if (target >= 0) {
            int[] path = PathRestorer.restorePath(result, source, target);
            out.println("Path from " + source + " to " + target + ": " + PathRestorer.format(path));
        }
        return GraphLabCommand.EXIT_OK;
    }

    static void printDistances(PrintWriter out, ShortestPathResult result) {
        out.println("vertex : distance");
        for (int v = 0; v < result.vertexCount(); v++) {
            out.println(v + " : " + (result.isReachable(v) ? String.valueOf(result.distance(v)) : "INF"));
        }
    }
}
