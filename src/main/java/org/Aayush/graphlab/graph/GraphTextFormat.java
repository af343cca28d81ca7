package org.Aayush.graphlab.graph;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.graphlab.config.GraphLabSettings;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Plain-text graph persistence.
 * <p>
 * Format: a header {@code <vertex_count> <edge_count> <directed:0|1>} followed by
 * {@code edge_count} records {@code <u> <v> <weight>}. Tokens are whitespace separated;
 * content after the last expected record is ignored. Undirected graphs are written with
 * one record per stored pair ({@code u <= v}). Weights are finite decimals, optionally with an
 * exponent ({@code 2}, {@code -0.5}, {@code 1.0E-3}).
 * </p>
 * <p>
 * The header vertex count must not exceed a limit, {@link GraphLabSettings#maxVertices()}
 * unless given explicitly. Vertex storage is allocated from the header.
 * </p>
 */
@Slf4j
@UtilityClass
public final class GraphTextFormat {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Parses a graph, capping the header vertex count at the configured
     * {@link GraphLabSettings#PROP_MAX_VERTICES} limit.
     *
     * @throws GraphFormatException if the header or an edge record is malformed, records are
     * missing, or an endpoint is out of range.
     * @throws UncheckedIOException if the reader fails.
     */
    public static WeightedGraph read(Reader reader) {
        return read(reader, GraphLabSettings.fromSystemProperties().maxVertices());
    }

    /**
     * Parses a graph whose header declares at most {@code maxVertices} vertices.
     *
     * @throws GraphFormatException if the input is malformed or the vertex count exceeds the limit.
     * @throws UncheckedIOException if the reader fails.
     */
    public static WeightedGraph read(Reader reader, int maxVertices) {
        Objects.requireNonNull(reader, "reader");
        Tokenizer tokens = new Tokenizer(reader);

        int vertexCount;
        long edgeCount;
        boolean directed;
        try {
            vertexCount = Integer.parseInt(tokens.next());
            edgeCount = Long.parseLong(tokens.next());
            String directedFlag = tokens.next();
            if (!directedFlag.equals("0") && !directedFlag.equals("1")) {
                throw new GraphFormatException(GraphFormatException.REASON_HEADER_INVALID,
                        "directed flag must be 0 or 1, got '" + directedFlag + "'");
            }
            directed = directedFlag.equals("1");
        } catch (NumberFormatException | NoSuchElementException ex) {
            throw new GraphFormatException(GraphFormatException.REASON_HEADER_INVALID,
                    "header must be '<vertex_count> <edge_count> <directed:0|1>'", ex);
        }
        if (vertexCount < 0 || edgeCount < 0) {
            throw new GraphFormatException(GraphFormatException.REASON_HEADER_INVALID,
                    "negative counts in header: " + vertexCount + " " + edgeCount);
        }
        if (vertexCount > maxVertices) {
            throw new GraphFormatException(GraphFormatException.REASON_HEADER_INVALID,
                    "vertex count " + vertexCount + " exceeds limit " + maxVertices);
        }

        WeightedGraph graph = new WeightedGraph(vertexCount, directed);
        for (long i = 0; i < edgeCount; i++) {
            int u;
            int v;
            double weight;
            try {
                u = Integer.parseInt(tokens.next());
                v = Integer.parseInt(tokens.next());
                weight = parseWeight(tokens.next());
            } catch (NoSuchElementException ex) {
                throw new GraphFormatException(GraphFormatException.REASON_EDGE_MISSING,
                        "expected " + edgeCount + " edge records, found " + i, ex);
            } catch (NumberFormatException ex) {
                throw new GraphFormatException(GraphFormatException.REASON_EDGE_INVALID,
                        "edge record " + i + " is not '<u> <v> <weight>'", ex);
            }
            try {
                graph.addEdge(u, v, weight);
            } catch (IndexOutOfBoundsException ex) {
                throw new GraphFormatException(GraphFormatException.REASON_VERTEX_OUT_OF_RANGE,
                        "edge record " + i + ": " + ex.getMessage(), ex);
            }
        }
        return graph;
    }

    private static double parseWeight(String token) {
        if (!DECIMAL.matcher(token).matches()) {
            throw new NumberFormatException("not a decimal weight: " + token);
        }
        double weight = Double.parseDouble(token);
        if (Double.isInfinite(weight)) {
            throw new NumberFormatException("weight out of range: " + token);
        }
        return weight;
    }

    /**
     * Loads a graph file with the configured vertex limit. Any failure is logged and reported
     * as an empty result.
     *
     * @return the graph, or empty when the file is unreadable, malformed or too large.
     */
    public static Optional<WeightedGraph> load(Path file) {
        return load(file, GraphLabSettings.fromSystemProperties().maxVertices());
    }

    /**
     * Loads a graph file declaring at most {@code maxVertices} vertices.
     *
     * @return the graph, or empty when the file is unreadable, malformed or too large.
     */
    public static Optional<WeightedGraph> load(Path file, int maxVertices) {
        Objects.requireNonNull(file, "file");
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return Optional.of(read(reader, maxVertices));
        } catch (GraphFormatException ex) {
            log.warn("Rejected graph file {}: {}", file, ex.getMessage());
            return Optional.empty();
        } catch (IOException | UncheckedIOException ex) {
            log.warn("Cannot read graph file {}: {}", file, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes a graph. The header edge count is the number of records written.
     */
    public static void write(WeightedGraph graph, Writer writer) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(writer, "writer");

        List<String> records = new ArrayList<>();
        for (int u = 0; u < graph.vertexCount(); u++) {
            for (Edge edge : graph.neighbors(u)) {
                if (!graph.isDirected() && u > edge.to()) {
                    continue;
                }
                records.add(u + " " + edge.to() + " " + edge.weight());
            }
        }

        writer.write(graph.vertexCount() + " " + records.size() + " " + (graph.isDirected() ? 1 : 0));
        writer.write('\n');
        for (String record : records) {
            writer.write(record);
            writer.write('\n');
        }
        writer.flush();
    }

    /**
     * Saves a graph to {@code file}, replacing it.
     */
    public static void save(WeightedGraph graph, Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(graph, writer);
        }
        log.debug("Saved {} to {}", graph, file);
    }

    /**
     * Whitespace tokenizer over a reader, one line buffered at a time.
     */
    private static final class Tokenizer {
        private final BufferedReader reader;
        private String[] pending = new String[0];
        private int cursor = 0;

        Tokenizer(Reader reader) {
            this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        }

        String next() {
            while (cursor >= pending.length) {
                String line;
                try {
                    line = reader.readLine();
                } catch (IOException ex) {
                    throw new UncheckedIOException(ex);
                }
                if (line == null) {
                    throw new NoSuchElementException("end of input");
                }
                String trimmed = line.trim();
                pending = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
                cursor = 0;
            }
            return pending[cursor++];
        }
    }
}
