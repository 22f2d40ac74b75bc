package com.anomalybench.core.detection;

import com.anomalybench.core.config.Algorithm;
import com.anomalybench.core.config.EnsembleParameters;
import com.anomalybench.core.error.ConfigurationException;
import com.anomalybench.core.error.DataShapeException;
import com.anomalybench.core.ensemble.EnsembleModel;
import com.anomalybench.core.ensemble.IsolationForest;
import com.anomalybench.core.model.ResolvedSeries;
import com.anomalybench.core.window.SlidingWindows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Windowed isolation-forest detector.
 *
 * <p>
 * Every run of {@code window_size} consecutive rows becomes one sample; the
 * forest is fitted on those samples with a contamination equal to the share
 * of rows labelled anomalous in any selected channel.
 * </p>
 *
 * <h3>Output</h3>
 * <p>
 * One binary score per timestamp. Forest labels are translated at the
 * boundary ({@code -1 → 1}, {@code +1 → 0}) and the {@code ⌊W/2⌋} rows at
 * each end that no window is centred on are padded with {@value #NORMAL}.
 * </p>
 *
 * @since 1.0.0
 */
public class WindowedEnsembleDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(WindowedEnsembleDetector.class);

    /** Score of a timestamp judged normal, also used as padding. */
    static final double NORMAL = 0.0;
    static final double ANOMALOUS = 1.0;

    private final EnsembleParameters parameters;

    /**
     * @param parameters validated detector parameters
     * @throws NullPointerException   if {@code parameters} is {@code null}
     * @throws ConfigurationException if the window size is even
     */
    public WindowedEnsembleDetector(EnsembleParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "EnsembleParameters must not be null");
        if (parameters.getWindowSize() % 2 == 0) {
            throw new ConfigurationException("window_size must be odd, got: " + parameters.getWindowSize());
        }
    }

    @Override
    public void train(ResolvedSeries series, Path modelOutput) {
        int windowSize = parameters.getWindowSize();
        double contamination = contamination(series.rowLabels());
        LOG.info("Training with contamination {}", contamination);

        double[][] samples = toSamples(series, windowSize);
        IsolationForest forest = IsolationForest.builder()
                .numTrees(parameters.getNTrees())
                .maxSamples(parameters.getMaxSamples())
                .maxFeatures(parameters.getMaxFeatures())
                .bootstrap(parameters.isBootstrap())
                .seed(parameters.getRandomState())
                .jobs(parameters.effectiveJobs())
                .verbose(parameters.getVerbose() > 0)
                .fit(samples, contamination);

        new EnsembleModel(windowSize, series.getChannelCount(), forest).write(modelOutput);
    }

    @Override
    public double[][] execute(ResolvedSeries series, Path modelInput) {
        EnsembleModel model = EnsembleModel.read(modelInput);
        int windowSize = parameters.getWindowSize();
        if (model.getWindowSize() != windowSize || model.getChannelCount() != series.getChannelCount()) {
            throw new DataShapeException("Model was trained with window_size=" + model.getWindowSize()
                    + " on " + model.getChannelCount() + " channel(s), but this run uses window_size="
                    + windowSize + " on " + series.getChannelCount());
        }

        double[][] samples = toSamples(series, windowSize);
        int[] predictions = model.getForest().predict(samples);

        double[] perSample = new double[predictions.length];
        for (int i = 0; i < predictions.length; i++) {
            perSample[i] = predictions[i] == IsolationForest.OUTLIER ? ANOMALOUS : NORMAL;
        }
        double[] perRow = SlidingWindows.unwindow(perSample, windowSize, NORMAL);

        double[][] scores = new double[perRow.length][1];
        for (int r = 0; r < perRow.length; r++) {
            scores[r][0] = perRow[r];
        }
        return scores;
    }

    @Override
    public String getAlgorithmId() {
        return Algorithm.WINDOWED_ENSEMBLE.getId();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Share of anomalous rows, never exactly zero: an all-normal series gets
     * the smallest positive double so the forest still accepts it.
     *
     * @param rowLabels per-row labels in {0, 1}
     * @return contamination in {@code (0, 1]}
     */
    static double contamination(int[] rowLabels) {
        long anomalous = 0;
        for (int label : rowLabels) {
            anomalous += label > 0 ? 1 : 0;
        }
        double contamination = (double) anomalous / rowLabels.length;
        return contamination == 0.0 ? Double.MIN_VALUE : contamination;
    }

    private static double[][] toSamples(ResolvedSeries series, int windowSize) {
        LOG.info("Shape before ({}, {})", series.getRowCount(), series.getChannelCount());
        double[][] samples = SlidingWindows.window(series.getData(), windowSize);
        LOG.info("Shape after ({}, {})", samples.length, windowSize * series.getChannelCount());
        return samples;
    }
}
