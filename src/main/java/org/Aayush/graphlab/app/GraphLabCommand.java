package org.Aayush.graphlab.app;

import org.Aayush.graphlab.config.GraphLabSettings;
import org.Aayush.graphlab.render.GraphRenderer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;

import java.io.PrintWriter;
import java.util.Objects;

/**
 * Root {@code graphlab} command. Sub-commands are registered as instances so collaborators
 * such as the renderer can be injected.
 */
@Command(
        name = "graphlab",
        description = "Single-source shortest paths with Dijkstra and Bellman-Ford.",
        mixinStandardHelpOptions = true,
        version = "graphlab 1.0",
        subcommands = {HelpCommand.class})
public class GraphLabCommand {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    /**
     * Builds the command tree.
     *
     * @param settings runtime settings.
     * @param renderer external renderer used by {@code render}.
     * @param out standard output of the commands.
     * @param err error output of the commands.
     */
    public static CommandLine commandLine(GraphLabSettings settings, GraphRenderer renderer,
                                          PrintWriter out, PrintWriter err) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(renderer, "renderer");
        CommandLine cmd = new CommandLine(new GraphLabCommand())
                .addSubcommand(new CreateCommand())
                .addSubcommand(new SolveCommand())
                .addSubcommand(new CompareCommand(settings))
                .addSubcommand(new GenerateCommand())
                .addSubcommand(new ShowCommand())
                .addSubcommand(new RenderCommand(renderer));
        cmd.setOut(out)
                .setErr(err)
                .setUsageHelpWidth(120)
                .setCaseInsensitiveEnumValuesAllowed(true);
        return cmd;
    }

    /**
     * Runs the command tree; prints usage and returns {@link #EXIT_USAGE} when no argument is given.
     */
    public static int execute(CommandLine cmd, String... args) {
        if (args.length == 0) {
            cmd.usage(cmd.getOut());
            return EXIT_USAGE;
        }
        return cmd.execute(args);
    }
}
