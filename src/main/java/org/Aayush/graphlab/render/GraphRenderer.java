package org.Aayush.graphlab.render;

import java.nio.file.Path;

/**
 * External visualisation capability.
 * <p>
 * Injected into the command-line front end; the graph and shortest-path modules never
 * depend on it.
 * </p>
 */
public interface GraphRenderer {

    /**
     * Displays a graph stored in the plain-text graph format.
     *
     * @param graphFile readable graph file.
     * @throws RenderException if the renderer cannot be started or reports a failure.
     */
    void render(Path graphFile);
}
