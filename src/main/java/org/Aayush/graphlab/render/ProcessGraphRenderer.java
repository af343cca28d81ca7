package org.Aayush.graphlab.render;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.graphlab.config.GraphLabSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a graph by spawning an external process and waiting for it to exit.
 * <p>
 * The command line is the configured prefix followed by the absolute graph file path. The child
 * inherits this process's standard streams.
 * </p>
 */
@Slf4j
public class ProcessGraphRenderer implements GraphRenderer {

    private final List<String> commandPrefix;

    public ProcessGraphRenderer(GraphLabSettings settings) {
        this(Objects.requireNonNull(settings, "settings").renderCommand());
    }

    public ProcessGraphRenderer(List<String> commandPrefix) {
        if (commandPrefix == null || commandPrefix.isEmpty()) {
            throw new IllegalArgumentException("commandPrefix must not be empty");
        }
        this.commandPrefix = List.copyOf(commandPrefix);
    }

    @Override
    public void render(Path graphFile) {
        Objects.requireNonNull(graphFile, "graphFile");
        List<String> command = new ArrayList<>(commandPrefix);
        command.add(graphFile.toAbsolutePath().toString());
        log.info("Launching renderer: {}", command);

        Process process;
        try {
            process = new ProcessBuilder(command).inheritIO().start();
        } catch (IOException ex) {
            throw new RenderException(RenderException.REASON_START_FAILED,
                    "cannot start " + command.get(0) + ": " + ex.getMessage(), ex);
        }
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new RenderException(RenderException.REASON_INTERRUPTED, "interrupted while rendering", ex);
        }
        if (exitCode != 0) {
            throw new RenderException(RenderException.REASON_EXIT_NONZERO,
                    "renderer exited with code " + exitCode);
        }
    }

    List<String> commandPrefix() {
        return commandPrefix;
    }
}
