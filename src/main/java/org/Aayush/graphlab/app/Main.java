package org.Aayush.graphlab.app;

import org.Aayush.graphlab.config.GraphLabSettings;
import org.Aayush.graphlab.render.ProcessGraphRenderer;
import picocli.CommandLine;

import java.io.PrintWriter;

/**
 * Command-line entry point.
 */
public class Main {
    /**
     * Runs the {@code graphlab} command tree and exits with its code.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        GraphLabSettings settings = GraphLabSettings.fromSystemProperties();
        CommandLine cmd = GraphLabCommand.commandLine(
                settings,
                new ProcessGraphRenderer(settings),
                new PrintWriter(System.out, true),
                new PrintWriter(System.err, true)
        );
        System.exit(GraphLabCommand.execute(cmd, args));
    }
}
