package com.anomalybench.core.reconstruction;

import com.anomalybench.core.config.ReconstructionParameters;
import com.anomalybench.core.error.DataShapeException;
import org.deeplearning4j.datasets.iterator.utilty.ListDataSetIterator;
import org.deeplearning4j.earlystopping.EarlyStoppingConfiguration;
import org.deeplearning4j.earlystopping.EarlyStoppingResult;
import org.deeplearning4j.earlystopping.listener.EarlyStoppingListener;
import org.deeplearning4j.earlystopping.scorecalc.DataSetLossCalculator;
import org.deeplearning4j.earlystopping.termination.MaxEpochsTerminationCondition;
import org.deeplearning4j.earlystopping.termination.ScoreImprovementEpochTerminationCondition;
import org.deeplearning4j.earlystopping.trainer.EarlyStoppingTrainer;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.nd4j.linalg.dataset.DataSet;
import org.nd4j.linalg.dataset.api.iterator.DataSetIterator;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.Random;
import java.util.stream.Stream;

/**
 * Trains a denoising autoencoder with early stopping and keeps the model
 * archive in step with the best checkpoint.
 *
 * <h3>Procedure</h3>
 * <ol>
 *   <li>Zero {@code ⌊T·noise_ratio⌋} random rows of a copy of the input.</li>
 *   <li>Fit on the first {@code ⌊T·split⌋} rows (corrupted input, clean
 *       target) and validate on the rest.</li>
 *   <li>After every epoch, save the weights if the validation loss improved
 *       and replace the archive with the saved checkpoint.</li>
 *   <li>Stop after {@code epochs} epochs or once the loss has not improved by
 *       more than {@code early_stopping_delta} for
 *       {@code early_stopping_patience} epochs.</li>
 * </ol>
 *
 * <p>
 * The checkpoint directory is a temporary sibling of the archive and is
 * removed when training ends, whether it completes or not.
 * </p>
 *
 * @since 1.0.0
 */
public class ReconstructionTrainer {

    private static final Logger LOG = LoggerFactory.getLogger(ReconstructionTrainer.class);

    private final ReconstructionParameters parameters;
    private final EpochObserver observer;

    public ReconstructionTrainer(ReconstructionParameters parameters) {
        this(parameters, EpochObserver.NONE);
    }

    public ReconstructionTrainer(ReconstructionParameters parameters, EpochObserver observer) {
        this.parameters = Objects.requireNonNull(parameters, "ReconstructionParameters must not be null");
        this.observer = Objects.requireNonNull(observer, "observer must not be null");
    }

    /**
     * Train on {@code data} and write the archive to {@code archive}.
     *
     * @param data    {@code T×C} clean input
     * @param archive destination of the model archive
     * @return what the run achieved
     * @throws DataShapeException if the split leaves either part empty
     */
    public TrainingSummary train(double[][] data, Path archive) {
        int rows = data.length;
        int channels = data[0].length;
        int trainRows = (int) (rows * parameters.getSplit());
        if (trainRows < 1 || trainRows >= rows) {
            throw new DataShapeException("split=" + parameters.getSplit() + " of " + rows
                    + " row(s) leaves no rows for " + (trainRows < 1 ? "training" : "validation"));
        }

        Random random = new Random(parameters.getRandomState());
        double[][] noisy = DenoisingAutoencoder.corrupt(data, parameters.getNoiseRatio(), random);
        DataSetIterator trainIterator = iterator(noisy, data, 0, trainRows);
        DataSetIterator validationIterator = iterator(noisy, data, trainRows, rows);
        LOG.info("Training on {} row(s), validating on {} row(s), {} channel(s)",
                trainRows, rows - trainRows, channels);

        MultiLayerNetwork network = DenoisingAutoencoder.build(channels, parameters.getLatentSize(),
                parameters.getLearningRate(), parameters.getRandomState());

        Path checkpointDirectory = createCheckpointDirectory(archive);
        try {
            CheckpointModelSaver saver = new CheckpointModelSaver(checkpointDirectory.toFile(), network);
            CheckpointArchiver archiver = new CheckpointArchiver(checkpointDirectory, archive);
            ArchivingListener listener = new ArchivingListener(saver, archiver, channels);

            EarlyStoppingConfiguration<MultiLayerNetwork> configuration =
                    new EarlyStoppingConfiguration.Builder<MultiLayerNetwork>()
                            .epochTerminationConditions(
                                    new MaxEpochsTerminationCondition(parameters.getEpochs()),
                                    new ScoreImprovementEpochTerminationCondition(
                                            parameters.getEarlyStoppingPatience(),
                                            parameters.getEarlyStoppingDelta()))
                            .scoreCalculator(new DataSetLossCalculator(validationIterator, true))
                            .evaluateEveryNEpochs(1)
                            .modelSaver(saver)
                            .build();

            EarlyStoppingTrainer trainer = new EarlyStoppingTrainer(configuration, network, trainIterator);
            trainer.setListener(listener);
            EarlyStoppingResult<MultiLayerNetwork> result = trainer.fit();

            if (!listener.archived) {
                LOG.warn("No epoch reached a finite validation loss; no model archive written to {}", archive);
                Files.deleteIfExists(archive);
            }
            if (result.getTerminationReason() == EarlyStoppingResult.TerminationReason.Error) {
                throw new IllegalStateException("Training failed: " + result.getTerminationDetails());
            }

            TrainingSummary summary = new TrainingSummary(result.getTotalEpochs(), listener.bestEpoch,
                    saver.getBestScore(), result.getTerminationDetails(), listener.archived);
            LOG.info("Training finished: {}", summary);
            return summary;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write model archive " + archive, e);
        } finally {
            deleteRecursively(checkpointDirectory);
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private DataSetIterator iterator(double[][] features, double[][] targets, int from, int to) {
        DataSet dataSet = new DataSet(
                Nd4j.create(Arrays.copyOfRange(features, from, to)),
                Nd4j.create(Arrays.copyOfRange(targets, from, to)));
        return new ListDataSetIterator<>(dataSet.asList(), parameters.getBatchSize());
    }

    private static Path createCheckpointDirectory(Path archive) {
        Path absolute = archive.toAbsolutePath();
        try {
            Files.createDirectories(absolute.getParent());
            return Files.createTempDirectory(absolute.getParent(), "." + absolute.getFileName() + ".checkpoint-");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create checkpoint directory next to " + archive, e);
        }
    }

    private static void deleteRecursively(Path directory) {
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    LOG.warn("Could not delete checkpoint file {}", path, e);
                }
            });
        } catch (IOException e) {
            LOG.warn("Could not clean up checkpoint directory {}", directory, e);
        }
    }

    /**
     * Records metadata for each new best checkpoint and refreshes the archive
     * before handing the epoch to the observer.
     */
    private final class ArchivingListener implements EarlyStoppingListener<MultiLayerNetwork> {

        private final CheckpointModelSaver saver;
        private final CheckpointArchiver archiver;
        private final int channels;
        private boolean archived;
        private int bestEpoch = -1;

        ArchivingListener(CheckpointModelSaver saver, CheckpointArchiver archiver, int channels) {
            this.saver = saver;
            this.archiver = archiver;
            this.channels = channels;
        }

        @Override
        public void onStart(EarlyStoppingConfiguration<MultiLayerNetwork> configuration, MultiLayerNetwork net) {
            LOG.debug("Early stopping started with {}", parameters);
        }

        @Override
        public void onEpoch(int epoch, double score,
                            EarlyStoppingConfiguration<MultiLayerNetwork> configuration, MultiLayerNetwork net) {
            LOG.info("Epoch {}: validation loss {}", epoch, score);
            try {
                if (saver.takeUnrecorded()) {
                    archiver.recordMetadata(new CheckpointMetadata(epoch, saver.getBestScore(), channels));
                    archived |= archiver.archiveIfPresent();
                    bestEpoch = epoch;
                }
            } catch (IOException e) {
                throw new IllegalStateException("Failed to archive checkpoint of epoch " + epoch, e);
            }
            observer.onEpoch(epoch, score);
        }

        @Override
        public void onCompletion(EarlyStoppingResult<MultiLayerNetwork> result) {
            LOG.debug("Early stopping ended: {}", result.getTerminationReason());
        }
    }
}
