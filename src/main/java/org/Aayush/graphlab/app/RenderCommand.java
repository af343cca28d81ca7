package org.Aayush.graphlab.app;

import org.Aayush.graphlab.graph.WeightedGraph;
import org.Aayush.graphlab.render.GraphRenderer;
import org.Aayush.graphlab.render.RenderException;
import picocli.CommandLine.Command;

import java.util.Objects;

/**
 * Hands a validated graph file to the external renderer.
 */
@Command(name = "render", description = "Visualise a graph file with the external renderer.")
class RenderCommand extends GraphFileCommand {

    private final GraphRenderer renderer;

    RenderCommand(GraphRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    @Override
    protected int execute(WeightedGraph graph) {
        try {
            renderer.render(graphFile);
        } catch (RenderException ex) {
            err().println("Rendering failed: " + ex.getMessage());
            return GraphLabCommand.EXIT_FAILURE;
        }
        out().println("Rendered " + graph);
        return GraphLabCommand.EXIT_OK;
    }
}
