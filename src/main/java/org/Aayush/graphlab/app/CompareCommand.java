package org.Aayush.graphlab.app;

import org.Aayush.graphlab.benchmark.AlgorithmComparison;
import org.Aayush.graphlab.benchmark.BenchmarkCsvWriter;
import org.Aayush.graphlab.benchmark.BenchmarkRecord;
import org.Aayush.graphlab.config.GraphLabSettings;
import org.Aayush.graphlab.graph.WeightedGraph;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Times both algorithms on one graph and optionally exports the records as CSV.
 */
@Command(name = "compare", description = "Compare Dijkstra and Bellman-Ford on one graph.")
class CompareCommand extends GraphFileCommand {

    private final GraphLabSettings settings;

    @Option(names = {"-s", "--source"}, required = true, description = "Source vertex.")
    int source;

    @Option(names = "--csv", description = "Write the benchmark records to this CSV file.")
    Path csvFile;

    CompareCommand(GraphLabSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    protected int execute(WeightedGraph graph) {
        List<BenchmarkRecord> records = new AlgorithmComparison(settings).compare(graph, source);
        for (BenchmarkRecord record : records) {
            out().println(String.format(Locale.ROOT, "Algorithm: %s, time: %.3f ms, result: %s",
                    record.getAlgorithm(), record.getElapsedMillis(), record.isOk() ? "OK" : "FAIL"));
        }
        if (csvFile != null) {
            try {
                BenchmarkCsvWriter.save(records, csvFile);
            } catch (IOException ex) {
                err().println("Cannot write " + csvFile + ": " + ex.getMessage());
                return GraphLabCommand.EXIT_FAILURE;
            }
            out().println("Saved benchmark records to " + csvFile);
        }
        return GraphLabCommand.EXIT_OK;
    }
}
