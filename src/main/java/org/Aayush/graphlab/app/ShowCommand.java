package org.Aayush.graphlab.app;

import org.Aayush.graphlab.graph.WeightedGraph;
import picocli.CommandLine.Command;

@Command(name = "show", description = "Print the adjacency lists of a graph.")
class ShowCommand extends GraphFileCommand {

    @Override
    protected int execute(WeightedGraph graph) {
        out().print(graph.describe());
        out().flush();
        return GraphLabCommand.EXIT_OK;
    }
}
