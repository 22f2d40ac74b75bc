package com.anomalybench.core.model;

import com.anomalybench.core.error.DataShapeException;

import java.util.Objects;

/**
 * Output of channel and label resolution: the selected channel matrix, one
 * label column per selected channel, and the selection that produced them.
 *
 * <p>
 * Detectors only ever see this type. Column {@code i} of both matrices belongs
 * to the {@code i}-th channel of {@link #getSelection()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ResolvedSeries {

    private final double[][] data;
    private final int[][] labels;
    private final ChannelSelection selection;
    private final LabelSchema labelSchema;

    public ResolvedSeries(double[][] data, int[][] labels, ChannelSelection selection, LabelSchema labelSchema) {
        this.data = copy(Objects.requireNonNull(data, "data must not be null"));
        this.labels = copy(Objects.requireNonNull(labels, "labels must not be null"));
        this.selection = Objects.requireNonNull(selection, "selection must not be null");
        this.labelSchema = Objects.requireNonNull(labelSchema, "labelSchema must not be null");

        if (data.length != labels.length) {
            throw new DataShapeException("Data has " + data.length + " rows but labels have " + labels.length);
        }
        for (int row = 0; row < data.length; row++) {
            if (data[row].length != selection.size() || labels[row].length != selection.size()) {
                throw new DataShapeException("Row " + row + " does not match the " + selection.size()
                        + " selected channel(s)");
            }
        }
    }

    public int getRowCount() {
        return data.length;
    }

    public int getChannelCount() {
        return selection.size();
    }

    /**
     * @return a copy of the {@code T×S} data matrix
     */
    public double[][] getData() {
        return copy(data);
    }

    /**
     * @return a copy of the {@code T×S} label matrix
     */
    public int[][] getLabels() {
        return copy(labels);
    }

    public ChannelSelection getSelection() {
        return selection;
    }

    public LabelSchema getLabelSchema() {
        return labelSchema;
    }

    /**
     * Collapse per-channel labels into one flag per row: 1 if any selected
     * channel is labelled anomalous, else 0.
     *
     * @return per-row label vector
     */
    public int[] rowLabels() {
        int[] result = new int[labels.length];
        for (int row = 0; row < labels.length; row++) {
            int max = 0;
            for (int label : labels[row]) {
                max = Math.max(max, label);
            }
            result[row] = max > 0 ? 1 : 0;
        }
        return result;
    }

    static double[][] copy(double[][] matrix) {
        double[][] result = new double[matrix.length][];
        for (int row = 0; row < matrix.length; row++) {
            result[row] = matrix[row].clone();
        }
        return result;
    }

    static int[][] copy(int[][] matrix) {
        int[][] result = new int[matrix.length][];
        for (int row = 0; row < matrix.length; row++) {
            result[row] = matrix[row].clone();
        }
        return result;
    }

    @Override
    public String toString() {
        return "ResolvedSeries{rows=" + data.length + ", selection=" + selection
                + ", labelSchema=" + labelSchema + '}';
    }
}
