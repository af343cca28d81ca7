package org.Aayush.graphlab.config;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runtime settings resolved from JVM system properties.
 * <p>
 * Missing, blank or malformed values fall back to the defaults.
 * </p>
 */
@Getter
@Accessors(fluent = true)
public final class GraphLabSettings {
    public static final String PROP_BENCHMARK_TOLERANCE = "graphlab.benchmark.tolerance";
    public static final String PROP_RENDER_COMMAND = "graphlab.render.command";
    public static final String PROP_MAX_VERTICES = "graphlab.graph.maxVertices";

    public static final double DEFAULT_BENCHMARK_TOLERANCE = 1e-6;
    public static final String DEFAULT_RENDER_COMMAND = "python3 visualize_vectors.py";
    public static final int DEFAULT_MAX_VERTICES = 1_000_000;

    /**
     * Maximum absolute difference for two finite distances to count as equal.
     */
    private final double benchmarkTolerance;

    /**
     * Command prefix of the external renderer; the graph file is appended as the last argument.
     */
    private final List<String> renderCommand;

    /**
     * Largest vertex count a graph file header may declare.
     */
    private final int maxVertices;

    private GraphLabSettings(double benchmarkTolerance, List<String> renderCommand, int maxVertices) {
        this.benchmarkTolerance = benchmarkTolerance;
        this.renderCommand = List.copyOf(renderCommand);
        this.maxVertices = maxVertices;
    }

    /**
     * Creates settings with explicit values.
     *
     * @throws IllegalArgumentException if the tolerance is negative or not finite, or the command is empty.
     */
    public static GraphLabSettings of(double benchmarkTolerance, List<String> renderCommand) {
        return of(benchmarkTolerance, renderCommand, DEFAULT_MAX_VERTICES);
    }

    /**
     * Creates settings with explicit values, including the graph file vertex limit.
     *
     * @throws IllegalArgumentException if a value is out of range.
     */
    public static GraphLabSettings of(double benchmarkTolerance, List<String> renderCommand, int maxVertices) {
        if (!(benchmarkTolerance >= 0.0) || Double.isInfinite(benchmarkTolerance)) {
            throw new IllegalArgumentException("benchmarkTolerance must be finite and non-negative");
        }
        if (renderCommand == null || renderCommand.isEmpty()) {
            throw new IllegalArgumentException("renderCommand must not be empty");
        }
        if (maxVertices < 0) {
            throw new IllegalArgumentException("maxVertices must be >= 0");
        }
        return new GraphLabSettings(benchmarkTolerance, renderCommand, maxVertices);
    }

    /**
     * Loads settings from system properties.
     */
    public static GraphLabSettings fromSystemProperties() {
        return new GraphLabSettings(
                readTolerance(PROP_BENCHMARK_TOLERANCE),
                readCommand(PROP_RENDER_COMMAND),
                readMaxVertices(PROP_MAX_VERTICES)
        );
    }

    private static double readTolerance(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_BENCHMARK_TOLERANCE;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (value >= 0.0 && !Double.isInfinite(value)) {
                return value;
            }
            return DEFAULT_BENCHMARK_TOLERANCE;
        } catch (NumberFormatException ex) {
            return DEFAULT_BENCHMARK_TOLERANCE;
        }
    }

    private static int readMaxVertices(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_MAX_VERTICES;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value >= 0 ? value : DEFAULT_MAX_VERTICES;
        } catch (NumberFormatException ex) {
            return DEFAULT_MAX_VERTICES;
        }
    }

    private static List<String> readCommand(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            raw = DEFAULT_RENDER_COMMAND;
        }
        return new ArrayList<>(Arrays.asList(raw.trim().split("\\s+")));
    }
}
