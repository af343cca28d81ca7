package org.Aayush.graphlab.benchmark;

import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Comma-separated export of {@link BenchmarkRecord}s for external reporting.
 */
@UtilityClass
public final class BenchmarkCsvWriter {
    public static final String HEADER = "vertices,edges,algorithm,time_ms,ok";

    public static void write(List<BenchmarkRecord> records, Writer writer) throws IOException {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(writer, "writer");
        writer.write(HEADER);
        writer.write('\n');
        for (BenchmarkRecord record : records) {
            writer.write(toLine(record));
            writer.write('\n');
        }
        writer.flush();
    }

    public static void save(List<BenchmarkRecord> records, Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(records, writer);
        }
    }

    static String toLine(BenchmarkRecord record) {
        return String.format(Locale.ROOT, "%d,%d,%s,%.3f,%d",
                record.getVertices(),
                record.getEdges(),
                record.getAlgorithm(),
                record.getElapsedMillis(),
                record.isOk() ? 1 : 0);
    }
}
