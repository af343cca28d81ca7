package org.Aayush.graphlab.app;

import org.Aayush.graphlab.graph.GraphTextFormat;
import org.Aayush.graphlab.graph.RandomGraphGenerator;
import org.Aayush.graphlab.graph.WeightedGraph;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Generates a random graph and saves it in the plain-text graph format.
 */
@Command(name = "generate", description = "Generate a random graph file.")
class GenerateCommand implements Callable<Integer> {

    @Option(names = {"-n", "--vertices"}, required = true, description = "Vertex count.")
    int vertices;

    @Option(names = {"-p", "--probability"}, required = true, description = "Edge probability in [0, 1].")
    double probability;

    @Option(names = "--min-weight", defaultValue = "1.0", description = "Minimum edge weight.")
    double minWeight;

    @Option(names = "--max-weight", defaultValue = "10.0", description = "Maximum edge weight.")
    double maxWeight;

    @Option(names = "--undirected", description = "Generate an undirected graph.")
    boolean undirected;

    @Option(names = "--seed", description = "Random seed for reproducible graphs.")
    Long seed;

    @Option(names = {"-o", "--output"}, required = true, description = "Output graph file.")
    Path output;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        RandomGraphGenerator generator = new RandomGraphGenerator(seed == null ? new Random() : new Random(seed));
        WeightedGraph graph;
        try {
            graph = generator.generate(vertices, probability, minWeight, maxWeight, !undirected);
        } catch (IllegalArgumentException ex) {
            spec.commandLine().getErr().println("Invalid generator settings: " + ex.getMessage());
            return GraphLabCommand.EXIT_USAGE;
        }
        try {
            GraphTextFormat.save(graph, output);
        } catch (IOException ex) {
            spec.commandLine().getErr().println("Cannot write " + output + ": " + ex.getMessage());
            return GraphLabCommand.EXIT_FAILURE;
        }
        spec.commandLine().getOut().println("Generated " + graph + " into " + output);
        return GraphLabCommand.EXIT_OK;
    }
}
