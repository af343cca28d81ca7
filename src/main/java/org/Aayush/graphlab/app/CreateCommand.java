package org.Aayush.graphlab.app;

import org.Aayush.graphlab.graph.GraphTextFormat;
import org.Aayush.graphlab.graph.WeightedGraph;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Builds a graph from edges given on the command line and saves it in the plain-text format.
 */
@Command(name = "create", description = "Create a graph file from explicit edges.")
class CreateCommand implements Callable<Integer> {

    @Option(names = {"-n", "--vertices"}, required = true, description = "Vertex count.")
    int vertices;

    @Option(names = "--undirected", description = "Create an undirected graph.")
    boolean undirected;

    @Option(names = {"-e", "--edge"}, paramLabel = "\"U V WEIGHT\"",
            description = "Edge as 'u v weight'; repeat for more edges.")
    List<String> edges = new ArrayList<>();

    @Option(names = {"-o", "--output"}, required = true, description = "Output graph file.")
    Path output;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        if (vertices < 0) {
            err.println("Invalid vertex count: " + vertices);
            return GraphLabCommand.EXIT_USAGE;
        }
        WeightedGraph graph = new WeightedGraph(vertices, !undirected);
        for (String edge : edges) {
            String[] parts = edge.trim().split("\\s+");
            try {
                if (parts.length != 3) {
                    throw new IllegalArgumentException("expected 'u v weight'");
                }
                double weight = Double.parseDouble(parts[2]);
                if (!Double.isFinite(weight)) {
                    throw new IllegalArgumentException("weight must be finite");
                }
                graph.addEdge(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), weight);
            } catch (IllegalArgumentException | IndexOutOfBoundsException ex) {
                err.println("Invalid edge '" + edge + "': " + ex.getMessage());
                return GraphLabCommand.EXIT_USAGE;
            }
        }
        try {
            GraphTextFormat.save(graph, output);
        } catch (IOException ex) {
            err.println("Cannot write " + output + ": " + ex.getMessage());
            return GraphLabCommand.EXIT_FAILURE;
        }
        spec.commandLine().getOut().println("Created " + graph + " into " + output);
        return GraphLabCommand.EXIT_OK;
    }
}
