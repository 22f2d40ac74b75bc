package com.anomalybench.core.detection;

import com.anomalybench.core.config.Algorithm;
import com.anomalybench.core.config.BaselineParameters;
import com.anomalybench.core.error.DataShapeException;
import com.anomalybench.core.error.MissingArtifactException;
import com.anomalybench.core.io.ArtifactFiles;
import com.anomalybench.core.model.Baseline;
import com.anomalybench.core.model.ResolvedSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Statistical baseline-deviation detector.
 *
 * <p>
 * Learns a per-channel mean and standard deviation from the rows labelled
 * non-anomalous for that channel. A value is anomalous when it lies strictly
 * outside {@code mean ± tol × σ}.
 * </p>
 *
 * <h3>Artifacts</h3>
 * <p>
 * Two plain text sidecars next to the model path, one value per line in
 * channel selection order: {@code <model>}{@value #MEANS_SUFFIX} and
 * {@code <model>}{@value #STDS_SUFFIX}.
 * </p>
 *
 * <h3>Output</h3>
 * <p>
 * One binary flag per row and selected channel.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalBaselineDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalBaselineDetector.class);

    static final String MEANS_SUFFIX = ".means.txt";
    static final String STDS_SUFFIX = ".stds.txt";

    private final double tol;

    /**
     * @param parameters validated detector parameters
     * @throws NullPointerException if {@code parameters} is {@code null}
     */
    public StatisticalBaselineDetector(BaselineParameters parameters) {
        Objects.requireNonNull(parameters, "BaselineParameters must not be null");
        this.tol = parameters.getTol();
    }

    @Override
    public void train(ResolvedSeries series, Path modelOutput) {
        Baseline baseline = fit(series);
        LOG.debug("Trained {}", baseline);
        writeVector(sidecar(modelOutput, MEANS_SUFFIX), baseline.getMeans());
        writeVector(sidecar(modelOutput, STDS_SUFFIX), baseline.getStds());
        LOG.info("Baseline for {} channel(s) saved next to {}", baseline.getChannelCount(), modelOutput);
    }

    @Override
    public double[][] execute(ResolvedSeries series, Path modelInput) {
        Baseline baseline = load(modelInput);
        if (baseline.getChannelCount() != series.getChannelCount()) {
            throw new DataShapeException("Baseline was trained on " + baseline.getChannelCount()
                    + " channel(s) but the series has " + series.getChannelCount());
        }
        return score(series, baseline, tol);
    }

    @Override
    public String getAlgorithmId() {
        return Algorithm.STATISTICAL.getId();
    }

    // ---------------------------------------------------------------
    // Statistics
    // ---------------------------------------------------------------

    /**
     * Compute the baseline over non-anomalous rows.
     *
     * @param series resolved training series
     * @return per-channel mean and population standard deviation
     */
    static Baseline fit(ResolvedSeries series) {
        int channels = series.getChannelCount();
        double[][] data = series.getData();
        int[][] labels = series.getLabels();
        double[] means = new double[channels];
        double[] stds = new double[channels];

        for (int c = 0; c < channels; c++) {
            boolean anyNormal = false;
            for (int[] row : labels) {
                if (row[c] == 0) {
                    anyNormal = true;
                    break;
                }
            }
            if (!anyNormal) {
                LOG.warn("Channel '{}' has no non-anomalous rows; using all rows for its baseline",
                        series.getSelection().getChannelNames().get(c));
            }

            // Shift by the first value so constant channels yield their value exactly.
            double shift = Double.NaN;
            double sum = 0;
            int n = 0;
            for (int r = 0; r < data.length; r++) {
                if (!anyNormal || labels[r][c] == 0) {
                    if (n == 0) {
                        shift = data[r][c];
                    }
                    sum += data[r][c] - shift;
                    n++;
                }
            }
            double mean = shift + sum / n;

            double sumSquaredDiff = 0;
            for (int r = 0; r < data.length; r++) {
                if (!anyNormal || labels[r][c] == 0) {
                    double diff = data[r][c] - mean;
                    sumSquaredDiff += diff * diff;
                }
            }
            means[c] = mean;
            stds[c] = Math.sqrt(sumSquaredDiff / n);
        }
        return new Baseline(means, stds);
    }

    static double[][] score(ResolvedSeries series, Baseline baseline, double tol) {
        double[][] data = series.getData();
        double[][] scores = new double[data.length][series.getChannelCount()];
        int flagged = 0;
        for (int r = 0; r < data.length; r++) {
            for (int c = 0; c < scores[r].length; c++) {
                if (baseline.isOutside(c, data[r][c], tol)) {
                    scores[r][c] = 1.0;
                    flagged++;
                }
            }
        }
        LOG.debug("Flagged {} of {} value(s) outside mean ± {}σ", flagged,
                (long) data.length * series.getChannelCount(), tol);
        return scores;
    }

    // ---------------------------------------------------------------
    // Sidecar files
    // ---------------------------------------------------------------

    static Path sidecar(Path model, String suffix) {
        return model.resolveSibling(model.getFileName() + suffix);
    }

    static Baseline load(Path modelInput) {
        double[] means = readVector(sidecar(modelInput, MEANS_SUFFIX));
        double[] stds = readVector(sidecar(modelInput, STDS_SUFFIX));
        return new Baseline(means, stds);
    }

    private static void writeVector(Path path, double[] values) {
        StringBuilder text = new StringBuilder();
        for (double value : values) {
            text.append(String.format(Locale.ROOT, "%.18e", value)).append('\n');
        }
        try {
            ArtifactFiles.writeAtomically(path, out -> out.write(text.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write " + path, e);
        }
    }

    private static double[] readVector(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new MissingArtifactException(path, "Baseline sidecar");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + path, e);
        }

        List<Double> values = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            try {
                values.add(Double.parseDouble(trimmed));
            } catch (NumberFormatException e) {
                throw new DataShapeException("Malformed value '" + trimmed + "' in " + path);
            }
        }
        if (values.isEmpty()) {
            throw new DataShapeException("Baseline sidecar " + path + " holds no values");
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
