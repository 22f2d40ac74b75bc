package com.anomalybench.core.model;

import com.anomalybench.core.error.DataShapeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A multivariate time series exactly as read from the input file.
 *
 * <p>
 * Columns are split into channel columns (numeric values) and the trailing
 * label columns (integer 0/1 flags). No channel selection has been applied
 * yet; see {@link com.anomalybench.core.channel.ChannelResolver}.
 * </p>
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>at least one row</li>
 * <li>every row has {@code channelNames.size()} values and
 * {@code labelNames.size()} labels</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class LabeledSeries {

    private final List<String> timestamps;
    private final List<String> channelNames;
    private final List<String> labelNames;
    private final double[][] values;
    private final int[][] labels;

    /**
     * @param timestamps   one timestamp per row, in file order
     * @param channelNames channel column names in source order
     * @param labelNames   label column names in source order
     * @param values       {@code T×C} channel values
     * @param labels       {@code T×L} label values
     * @throws DataShapeException if the dimensions disagree or there are no rows
     */
    public LabeledSeries(List<String> timestamps,
                         List<String> channelNames,
                         List<String> labelNames,
                         double[][] values,
                         int[][] labels) {
        this.timestamps = List.copyOf(Objects.requireNonNull(timestamps, "timestamps must not be null"));
        this.channelNames = List.copyOf(Objects.requireNonNull(channelNames, "channelNames must not be null"));
        this.labelNames = List.copyOf(Objects.requireNonNull(labelNames, "labelNames must not be null"));
        this.values = ResolvedSeries.copy(Objects.requireNonNull(values, "values must not be null"));
        this.labels = ResolvedSeries.copy(Objects.requireNonNull(labels, "labels must not be null"));

        if (values.length == 0) {
            throw new DataShapeException("Time series must contain at least one row");
        }
        if (values.length != labels.length || values.length != timestamps.size()) {
            throw new DataShapeException("Row count mismatch: " + timestamps.size() + " timestamps, "
                    + values.length + " value rows, " + labels.length + " label rows");
        }
        for (int row = 0; row < values.length; row++) {
            if (values[row].length != channelNames.size() || labels[row].length != labelNames.size()) {
                throw new DataShapeException("Row " + row + " has " + values[row].length + " values and "
                        + labels[row].length + " labels, expected " + channelNames.size() + " and "
                        + labelNames.size());
            }
        }
    }

    public int getRowCount() {
        return values.length;
    }

    public List<String> getTimestamps() {
        return timestamps;
    }

    public List<String> getChannelNames() {
        return channelNames;
    }

    public List<String> getLabelNames() {
        return labelNames;
    }

    /**
     * Return all column names as they appeared in the file, channels first.
     *
     * @return unmodifiable list of column names
     */
    public List<String> getColumnNames() {
        List<String> columns = new ArrayList<>(channelNames);
        columns.addAll(labelNames);
        return Collections.unmodifiableList(columns);
    }

    public double getValue(int row, int channel) {
        return values[row][channel];
    }

    public int getLabel(int row, int labelColumn) {
        return labels[row][labelColumn];
    }

    @Override
    public String toString() {
        return "LabeledSeries{rows=" + values.length
                + ", channels=" + channelNames
                + ", labels=" + labelNames + '}';
    }
}
