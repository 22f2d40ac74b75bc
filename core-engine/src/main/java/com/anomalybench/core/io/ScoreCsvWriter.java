package com.anomalybench.core.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes anomaly scores as a comma-delimited file without header, one line
 * per timestamp and one column per score channel.
 *
 * @since 1.0.0
 */
public final class ScoreCsvWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ScoreCsvWriter.class);

    private final CsvMapper mapper = new CsvMapper();

    /**
     * Write the score matrix, replacing any existing file atomically.
     *
     * @param path   destination; must not be {@code null}
     * @param scores {@code T×K} scores, {@code K ≥ 1}
     * @throws IllegalArgumentException if rows have different widths
     * @throws IllegalStateException    if the file cannot be written
     */
    public void write(Path path, double[][] scores) {
        Objects.requireNonNull(path, "Output path must not be null");
        Objects.requireNonNull(scores, "Scores must not be null");
        int width = scores.length == 0 ? 0 : scores[0].length;

        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(false);
        for (int c = 0; c < width; c++) {
            schema.addColumn("s" + c, CsvSchema.ColumnType.NUMBER);
        }

        try {
            ArtifactFiles.writeAtomically(path, out -> {
                Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
                try (SequenceWriter rows = mapper.writer(schema.build()).writeValues(writer)) {
                    for (double[] row : scores) {
                        if (row.length != width) {
                            throw new IllegalArgumentException("Score rows must all have " + width + " columns");
                        }
                        Map<String, Object> line = new LinkedHashMap<>();
                        for (int c = 0; c < width; c++) {
                            line.put("s" + c, row[c]);
                        }
                        rows.write(line);
                    }
                }
            });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write scores to " + path, e);
        }
        LOG.info("Wrote {} score row(s) x {} column(s) to {}", scores.length, width, path);
    }
}
