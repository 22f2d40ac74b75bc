package com.anomalybench.core.reconstruction;

import com.anomalybench.core.config.ReconstructionParameters;
import com.anomalybench.core.detection.ReconstructionDetector;
import com.anomalybench.core.error.DataShapeException;
import com.anomalybench.core.error.MissingArtifactException;
import com.anomalybench.core.model.ChannelSelection;
import com.anomalybench.core.model.LabelSchema;
import com.anomalybench.core.model.ResolvedSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nd4j.linalg.factory.Nd4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Unit tests for {@link ReconstructionTrainer}.
 */
class ReconstructionTrainerTest {

    @TempDir
    Path tempDir;

    private ReconstructionParameters parameters;
    private Path archive;

    @BeforeEach
    void setUp() {
        parameters = new ReconstructionParameters();
        parameters.setLatentSize(3);
        parameters.setBatchSize(10);
        parameters.setEarlyStoppingDelta(0.0);
        archive = tempDir.resolve("model").resolve("dae.zip");
    }

    private static double[][] data(int rows) {
        double[][] data = new double[rows][3];
        for (int r = 0; r < rows; r++) {
            data[r][0] = Math.sin(r / 4.0);
            data[r][1] = Math.cos(r / 4.0);
            data[r][2] = 0.5 * Math.sin(r / 4.0) + 0.1;
        }
        return data;
    }

    private static double minimum(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
    }

    private List<Path> leftovers() throws IOException {
        try (Stream<Path> files = Files.list(archive.getParent())) {
            return files.filter(p -> !p.equals(archive)).toList();
        }
    }

    @Test
    @DisplayName("A completed run archives the checkpoint with the lowest validation loss")
    void shouldArchiveBestCheckpoint() throws IOException {
        parameters.setEpochs(4);
        List<Double> losses = new ArrayList<>();

        TrainingSummary summary = new ReconstructionTrainer(parameters, (epoch, loss) -> losses.add(loss))
                .train(data(50), archive);

        assertThat(summary.isArchived()).isTrue();
        assertThat(summary.getBestValidationLoss()).isEqualTo(minimum(losses));
        assertThat(losses).hasSize(4);
        ReconstructionArchive restored = ReconstructionArchive.load(archive);
        assertThat(summary.getBestEpoch()).isEqualTo(restored.getMetadata().getEpoch());
        assertThat(restored.getMetadata().getValidationLoss()).isEqualTo(minimum(losses));
        assertThat(restored.getMetadata().getChannelCount()).isEqualTo(3);
        assertThat(losses.get(restored.getMetadata().getEpoch())).isEqualTo(minimum(losses));
        assertThat(leftovers()).isEmpty();
    }

    @Test
    @DisplayName("An interrupted run leaves a loadable archive of the best epoch seen so far")
    void shouldKeepArchiveWhenInterrupted() throws IOException {
        parameters.setEpochs(10);
        List<Double> losses = new ArrayList<>();
        EpochObserver interruptAfterThird = (epoch, loss) -> {
            losses.add(loss);
            if (epoch == 2) {
                throw new SimulatedCrash();
            }
        };

        Throwable thrown = catchThrowable(() ->
                new ReconstructionTrainer(parameters, interruptAfterThird).train(data(50), archive));

        assertThat(thrown).isNotNull();
        assertThat(losses).hasSize(3);
        ReconstructionArchive restored = ReconstructionArchive.load(archive);
        assertThat(restored.getMetadata().getValidationLoss()).isEqualTo(minimum(losses));
        assertThat(restored.getMetadata().getEpoch()).isLessThanOrEqualTo(2);
        assertThat(restored.getNetwork().output(
                Nd4j.create(data(5))).shape()).containsExactly(5L, 3L);
        assertThat(leftovers()).isEmpty();
    }

    @Test
    @DisplayName("Training stops early once the loss stops improving by more than the delta")
    void shouldStopEarly() {
        parameters.setEpochs(50);
        parameters.setEarlyStoppingPatience(1);
        parameters.setEarlyStoppingDelta(1e6);
        List<Double> losses = new ArrayList<>();

        TrainingSummary summary = new ReconstructionTrainer(parameters, (epoch, loss) -> losses.add(loss))
                .train(data(50), archive);

        assertThat(losses).hasSizeLessThanOrEqualTo(3);
        assertThat(summary.isArchived()).isTrue();
        assertThat(archive).isRegularFile();
    }

    @Test
    @DisplayName("A run without a finite validation loss removes the stale archive and leaves nothing to execute")
    void shouldRemoveStaleArchiveWhenNoCheckpointIsWritten() throws IOException {
        parameters.setEpochs(3);
        double[][] data = new double[20][2];
        for (int r = 0; r < data.length; r++) {
            data[r][0] = Double.NaN;
            data[r][1] = r / 20.0;
        }
        Files.createDirectories(archive.getParent());
        Files.writeString(archive, "stale");

        TrainingSummary summary = new ReconstructionTrainer(parameters).train(data, archive);

        assertThat(summary.isArchived()).isFalse();
        assertThat(summary.getBestEpoch()).isEqualTo(-1);
        assertThat(summary.getBestValidationLoss()).isNaN();
        assertThat(archive).doesNotExist();
        assertThat(leftovers()).isEmpty();

        ResolvedSeries series = new ResolvedSeries(data, new int[20][2],
                ChannelSelection.all(List.of("a", "b")), LabelSchema.PER_CHANNEL);
        assertThatThrownBy(() -> new ReconstructionDetector(parameters).execute(series, archive))
                .isInstanceOf(MissingArtifactException.class);
    }

    @Test
    @DisplayName("A split that leaves no validation rows is a shape error")
    void shouldRejectEmptyValidationSplit() {
        parameters.setSplit(0.8);

        assertThatThrownBy(() -> new ReconstructionTrainer(parameters).train(data(1), archive))
                .isInstanceOf(DataShapeException.class);
        assertThat(archive).doesNotExist();
    }

    @Test
    @DisplayName("Corruption zeroes whole rows and leaves the input untouched")
    void shouldCorruptWholeRows() {
        double[][] clean = data(20);
        double[][] noisy = DenoisingAutoencoder.corrupt(clean, 0.25, new Random(1));

        int zeroed = 0;
        for (int r = 0; r < clean.length; r++) {
            if (noisy[r][0] == 0.0 && noisy[r][1] == 0.0 && noisy[r][2] == 0.0) {
                zeroed++;
            } else {
                assertThat(noisy[r]).containsExactly(clean[r]);
            }
        }
        assertThat(zeroed).isEqualTo(5);
        assertThat(clean[0][1]).isEqualTo(1.0);
    }

    /** Stand-in for a process being killed between epochs. */
    private static final class SimulatedCrash extends RuntimeException {
        private static final long serialVersionUID = 1L;
    }
}
