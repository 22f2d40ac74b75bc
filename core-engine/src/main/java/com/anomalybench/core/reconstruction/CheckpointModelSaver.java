package com.anomalybench.core.reconstruction;

import org.deeplearning4j.earlystopping.EarlyStoppingModelSaver;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.util.ModelSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Keeps the weights of the best epoch in a checkpoint directory.
 *
 * <p>
 * The early-stopping trainer calls {@link #saveBestModel} whenever the
 * validation loss improves. Non-finite losses are never written, so a run
 * that diverges from its first epoch leaves the directory empty. In that case
 * {@link #getBestModel} hands back the network being trained, since the
 * trainer expects a model at the end of every run.
 * </p>
 *
 * @since 1.0.0
 */
public class CheckpointModelSaver implements EarlyStoppingModelSaver<MultiLayerNetwork> {

    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(CheckpointModelSaver.class);

    private final File directory;
    private final transient MultiLayerNetwork network;
    private double bestScore = Double.NaN;
    private boolean unrecorded;

    public CheckpointModelSaver(File directory, MultiLayerNetwork network) {
        this.directory = directory;
        this.network = network;
    }

    @Override
    public void saveBestModel(MultiLayerNetwork net, double score) throws IOException {
        if (!Double.isFinite(score)) {
            LOG.warn("Validation loss is {}; keeping the previous checkpoint", score);
            return;
        }
        ModelSerializer.writeModel(net, bestModelFile(), false);
        bestScore = score;
        unrecorded = true;
    }

    @Override
    public void saveLatestModel(MultiLayerNetwork net, double score) {
        // only the best epoch is kept
    }

    @Override
    public MultiLayerNetwork getBestModel() throws IOException {
        File file = bestModelFile();
        return file.isFile() ? ModelSerializer.restoreMultiLayerNetwork(file, false) : network;
    }

    @Override
    public MultiLayerNetwork getLatestModel() {
        return null;
    }

    /**
     * @return {@code true} once after every new best checkpoint
     */
    boolean takeUnrecorded() {
        boolean result = unrecorded;
        unrecorded = false;
        return result;
    }

    double getBestScore() {
        return bestScore;
    }

    File bestModelFile() {
        return new File(directory, ReconstructionArchive.BEST_MODEL_ENTRY);
    }
}
