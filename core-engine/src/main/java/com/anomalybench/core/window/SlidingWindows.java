package com.anomalybench.core.window;

import com.anomalybench.core.error.ConfigurationException;
import com.anomalybench.core.error.DataShapeException;

import java.util.Objects;

/**
 * Fixed-width context windows over a {@code T×C} matrix.
 *
 * <p>
 * {@link #window(double[][], int)} turns each run of {@code W} consecutive
 * rows into one flattened sample of {@code W·C} values (row-major), giving
 * {@code T − W + 1} samples. Sample {@code i} is centred on row
 * {@code i + (W − 1) / 2}, so {@link #unwindow(double[], int, double)} pads
 * {@code ⌊W/2⌋} values on each side to line per-sample results back up with
 * the original rows.
 * </p>
 *
 * <p>
 * Both operations are pure and deterministic.
 * </p>
 *
 * @since 1.0.0
 */
public final class SlidingWindows {

    private SlidingWindows() {
        // utility class, not instantiable
    }

    /**
     * @param data       {@code T×C} matrix; must not be {@code null}
     * @param windowSize odd window width {@code W ≤ T}
     * @return {@code (T − W + 1) × (W·C)} samples
     * @throws ConfigurationException if {@code W} is not positive and odd
     * @throws DataShapeException     if {@code W > T}
     */
    public static double[][] window(double[][] data, int windowSize) {
        Objects.requireNonNull(data, "data must not be null");
        checkWindow(windowSize, data.length);

        int channels = data.length == 0 ? 0 : data[0].length;
        int samples = data.length - windowSize + 1;
        double[][] result = new double[samples][windowSize * channels];
        for (int s = 0; s < samples; s++) {
            for (int w = 0; w < windowSize; w++) {
                System.arraycopy(data[s + w], 0, result[s], w * channels, channels);
            }
        }
        return result;
    }

    /**
     * Pad per-sample values back to one value per original row.
     *
     * @param predictions {@code T − W + 1} values
     * @param windowSize  the window width used to produce them
     * @param padding     value for the {@code ⌊W/2⌋} leading and trailing rows
     * @return {@code T} values
     * @throws ConfigurationException if {@code W} is not positive and odd
     */
    public static double[] unwindow(double[] predictions, int windowSize, double padding) {
        Objects.requireNonNull(predictions, "predictions must not be null");
        checkOdd(windowSize);

        int pad = windowSize / 2;
        double[] result = new double[predictions.length + 2 * pad];
        for (int i = 0; i < pad; i++) {
            result[i] = padding;
            result[result.length - 1 - i] = padding;
        }
        System.arraycopy(predictions, 0, result, pad, predictions.length);
        return result;
    }

    /**
     * @param windowSize window width
     * @param rows       series length
     * @throws ConfigurationException if {@code W} is not positive and odd
     * @throws DataShapeException     if {@code W > rows}
     */
    public static void checkWindow(int windowSize, int rows) {
        checkOdd(windowSize);
        if (windowSize > rows) {
            throw new DataShapeException("Window size " + windowSize + " is larger than the series length "
                    + rows);
        }
    }

    private static void checkOdd(int windowSize) {
        if (windowSize < 1 || windowSize % 2 == 0) {
            throw new ConfigurationException("Window size must be a positive odd number, got: " + windowSize);
        }
    }
}
