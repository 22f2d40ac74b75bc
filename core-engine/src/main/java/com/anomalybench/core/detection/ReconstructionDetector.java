package com.anomalybench.core.detection;

import com.anomalybench.core.config.Algorithm;
import com.anomalybench.core.config.ReconstructionParameters;
import com.anomalybench.core.error.DataShapeException;
import com.anomalybench.core.model.ResolvedSeries;
import com.anomalybench.core.reconstruction.EpochObserver;
import com.anomalybench.core.reconstruction.ReconstructionArchive;
import com.anomalybench.core.reconstruction.ReconstructionTrainer;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Denoising-autoencoder detector.
 *
 * <p>
 * Training is delegated to {@link ReconstructionTrainer}, which keeps the
 * model archive at the model path in step with the best checkpoint. Scoring
 * reconstructs every row with the archived network and reports the mean
 * squared reconstruction error of that row: the higher, the more anomalous.
 * </p>
 *
 * @since 1.0.0
 */
public class ReconstructionDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ReconstructionDetector.class);

    private final ReconstructionParameters parameters;
    private final EpochObserver observer;

    public ReconstructionDetector(ReconstructionParameters parameters) {
        this(parameters, EpochObserver.NONE);
    }

    /**
     * @param parameters validated detector parameters
     * @param observer   notified after every training epoch
     */
    public ReconstructionDetector(ReconstructionParameters parameters, EpochObserver observer) {
        this.parameters = Objects.requireNonNull(parameters, "ReconstructionParameters must not be null");
        this.observer = Objects.requireNonNull(observer, "observer must not be null");
    }

    @Override
    public void train(ResolvedSeries series, Path modelOutput) {
        new ReconstructionTrainer(parameters, observer).train(series.getData(), modelOutput);
    }

    @Override
    public double[][] execute(ResolvedSeries series, Path modelInput) {
        ReconstructionArchive archive = ReconstructionArchive.load(modelInput);
        int trainedChannels = archive.getMetadata().getChannelCount();
        if (trainedChannels != series.getChannelCount()) {
            throw new DataShapeException("Model was trained on " + trainedChannels
                    + " channel(s) but the series has " + series.getChannelCount());
        }

        double[][] data = series.getData();
        INDArray reconstruction = archive.getNetwork().output(Nd4j.create(data));
        double[][] scores = reconstructionErrors(data, reconstruction.toDoubleMatrix());
        LOG.info("Scored {} row(s)", scores.length);
        return scores;
    }

    @Override
    public String getAlgorithmId() {
        return Algorithm.RECONSTRUCTION.getId();
    }

    /**
     * Mean squared difference per row.
     *
     * @return {@code T×1} errors
     */
    static double[][] reconstructionErrors(double[][] data, double[][] reconstruction) {
        double[][] errors = new double[data.length][1];
        for (int r = 0; r < data.length; r++) {
            double sum = 0.0;
            for (int c = 0; c < data[r].length; c++) {
                double diff = data[r][c] - reconstruction[r][c];
                sum += diff * diff;
            }
            errors[r][0] = sum / data[r].length;
        }
        return errors;
    }
}
