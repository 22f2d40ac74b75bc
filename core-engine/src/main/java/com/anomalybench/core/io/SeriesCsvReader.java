package com.anomalybench.core.io;

import com.anomalybench.core.error.DataShapeException;
import com.anomalybench.core.model.LabeledSeries;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads a labelled time series from a CSV file.
 *
 * <h3>Expected layout</h3>
 *
 * <pre>
 * timestamp,temp,pressure,is_anomaly_temp,is_anomaly_pressure
 * 2024-01-01T00:00:00,21.5,1013.2,0,0
 * </pre>
 *
 * <p>
 * The {@value #TIMESTAMP_COLUMN} column is the index; every other column is
 * a channel unless its name starts with {@value #LABEL_PREFIX}. Label columns
 * must come after all channels.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesCsvReader.class);

    /** Name of the index column. */
    public static final String TIMESTAMP_COLUMN = "timestamp";

    /** Reserved name prefix that marks a label column. */
    public static final String LABEL_PREFIX = "is_anomaly";

    private final CsvMapper mapper;

    public SeriesCsvReader() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /**
     * Read the whole file.
     *
     * @param path CSV file; must not be {@code null}
     * @return the parsed series
     * @throws DataShapeException    if the header or a row is malformed
     * @throws IllegalStateException if the file cannot be read
     */
    public LabeledSeries read(Path path) {
        Objects.requireNonNull(path, "Input path must not be null");
        LOG.info("Loading: {}", path);

        List<String[]> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(reader)) {
            while (it.hasNext()) {
                rows.add(it.next());
            }
        } catch (NoSuchFileException e) {
            throw new IllegalStateException("Input file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read input file: " + path, e);
        }

        if (rows.isEmpty()) {
            throw new DataShapeException("Input file has no header: " + path);
        }
        return parse(rows.get(0), rows.subList(1, rows.size()), path);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private LabeledSeries parse(String[] header, List<String[]> body, Path path) {
        int timestampIndex = -1;
        List<Integer> columnIndices = new ArrayList<>();
        List<String> columnNames = new ArrayList<>();
        for (int i = 0; i < header.length; i++) {
            if (TIMESTAMP_COLUMN.equals(header[i])) {
                timestampIndex = i;
            } else {
                columnIndices.add(i);
                columnNames.add(header[i]);
            }
        }
        if (timestampIndex < 0) {
            throw new DataShapeException("Input file " + path + " has no '" + TIMESTAMP_COLUMN + "' column");
        }

        int labelCount = 0;
        for (String name : columnNames) {
            if (name.startsWith(LABEL_PREFIX)) {
                labelCount++;
            }
        }
        if (labelCount == 0) {
            throw new DataShapeException("Input file " + path + " has no '" + LABEL_PREFIX + "*' label column");
        }
        int channelCount = columnNames.size() - labelCount;
        for (int i = 0; i < columnNames.size(); i++) {
            boolean isLabel = columnNames.get(i).startsWith(LABEL_PREFIX);
            if (isLabel != (i >= channelCount)) {
                throw new DataShapeException("Label columns must follow all channel columns, but '"
                        + columnNames.get(i) + "' is out of place in " + path);
            }
        }

        List<String> timestamps = new ArrayList<>(body.size());
        double[][] values = new double[body.size()][channelCount];
        int[][] labels = new int[body.size()][labelCount];
        for (int r = 0; r < body.size(); r++) {
            String[] row = body.get(r);
            if (row.length != header.length) {
                throw new DataShapeException("Row " + (r + 1) + " of " + path + " has " + row.length
                        + " fields, expected " + header.length);
            }
            timestamps.add(row[timestampIndex]);
            for (int c = 0; c < columnIndices.size(); c++) {
                String cell = row[columnIndices.get(c)];
                if (c < channelCount) {
                    values[r][c] = parseValue(cell, r, columnNames.get(c));
                } else {
                    labels[r][c - channelCount] = parseLabel(cell, r, columnNames.get(c));
                }
            }
        }

        LabeledSeries series = new LabeledSeries(timestamps, columnNames.subList(0, channelCount),
                columnNames.subList(channelCount, columnNames.size()), values, labels);
        LOG.debug("Read {}", series);
        return series;
    }

    private static double parseValue(String cell, int row, String column) {
        if (cell == null || cell.isEmpty() || "nan".equalsIgnoreCase(cell)) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            throw new DataShapeException("Non-numeric value '" + cell + "' in column '" + column
                    + "' at row " + (row + 1));
        }
    }

    private static int parseLabel(String cell, int row, String column) {
        double value;
        try {
            value = Double.parseDouble(cell);
        } catch (NumberFormatException | NullPointerException e) {
            throw new DataShapeException("Non-numeric label '" + cell + "' in column '" + column
                    + "' at row " + (row + 1));
        }
        if (value < 0 || value != Math.rint(value)) {
            throw new DataShapeException("Label '" + cell + "' in column '" + column + "' at row "
                    + (row + 1) + " is not a non-negative integer");
        }
        return (int) value;
    }
}
