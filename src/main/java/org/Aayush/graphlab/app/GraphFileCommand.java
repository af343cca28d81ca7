package org.Aayush.graphlab.app;

import org.Aayush.graphlab.graph.GraphTextFormat;
import org.Aayush.graphlab.graph.WeightedGraph;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Base for sub-commands that operate on a graph file.
 */
abstract class GraphFileCommand implements Callable<Integer> {

    @Option(names = {"-g", "--graph"}, required = true, description = "Graph file in plain-text graph format.")
    Path graphFile;

    @Spec
    CommandSpec spec;

    /**
     * Runs the command against a loaded graph.
     */
    protected abstract int execute(WeightedGraph graph) throws Exception;

    @Override
    public Integer call() throws Exception {
        Optional<WeightedGraph> graph = GraphTextFormat.load(graphFile);
        if (graph.isEmpty()) {
            err().println("Cannot load graph from " + graphFile);
            return GraphLabCommand.EXIT_FAILURE;
        }
        return execute(graph.get());
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
