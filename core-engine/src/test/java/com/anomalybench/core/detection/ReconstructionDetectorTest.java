package com.anomalybench.core.detection;

import com.anomalybench.core.config.ReconstructionParameters;
import com.anomalybench.core.error.DataShapeException;
import com.anomalybench.core.error.MissingArtifactException;
import com.anomalybench.core.model.ChannelSelection;
import com.anomalybench.core.model.LabelSchema;
import com.anomalybench.core.model.ResolvedSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ReconstructionDetector}.
 */
class ReconstructionDetectorTest {

    @TempDir
    Path tempDir;

    private ReconstructionParameters parameters;

    @BeforeEach
    void setUp() {
        parameters = new ReconstructionParameters();
        parameters.setLatentSize(4);
        parameters.setEpochs(3);
        parameters.setBatchSize(8);
    }

    private static ResolvedSeries series(int rows, int channels) {
        double[][] data = new double[rows][channels];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < channels; c++) {
                data[r][c] = Math.sin(r / 3.0 + c);
            }
        }
        List<String> names = channels == 2 ? List.of("a", "b") : List.of("a", "b", "c");
        return new ResolvedSeries(data, new int[rows][channels], ChannelSelection.all(names),
                LabelSchema.PER_CHANNEL);
    }

    @Test
    @DisplayName("Execute returns one non-negative reconstruction error per row")
    void shouldScoreEveryRow() {
        Path model = tempDir.resolve("dae.zip");
        ReconstructionDetector detector = new ReconstructionDetector(parameters);
        ResolvedSeries series = series(40, 3);

        detector.train(series, model);
        double[][] scores = detector.execute(series, model);

        assertThat(model).isRegularFile();
        assertThat(scores).hasNumberOfRows(40);
        for (double[] row : scores) {
            assertThat(row).hasSize(1);
            assertThat(row[0]).isGreaterThanOrEqualTo(0.0).isFinite();
        }
    }

    @Test
    @DisplayName("Executing twice on the same input gives identical scores")
    void shouldBeRepeatable() {
        Path model = tempDir.resolve("dae.zip");
        ReconstructionDetector detector = new ReconstructionDetector(parameters);
        ResolvedSeries series = series(30, 2);
        detector.train(series, model);

        assertThat(detector.execute(series, model)).isDeepEqualTo(detector.execute(series, model));
    }

    @Test
    @DisplayName("Execute without a trained archive fails with a missing artifact")
    void shouldRequireArchive() {
        ReconstructionDetector detector = new ReconstructionDetector(parameters);

        assertThatThrownBy(() -> detector.execute(series(10, 2), tempDir.resolve("absent.zip")))
                .isInstanceOf(MissingArtifactException.class)
                .hasMessageContaining("absent.zip");
    }

    @Test
    @DisplayName("Execute on a different channel count than trained is a shape error")
    void shouldRejectChannelMismatch() {
        Path model = tempDir.resolve("dae.zip");
        ReconstructionDetector detector = new ReconstructionDetector(parameters);
        detector.train(series(30, 2), model);

        assertThatThrownBy(() -> detector.execute(series(30, 3), model))
                .isInstanceOf(DataShapeException.class);
    }

    @Test
    @DisplayName("Row error is the mean of squared differences")
    void shouldAverageSquaredDifferences() {
        double[][] errors = ReconstructionDetector.reconstructionErrors(
                new double[][]{{1, 2}, {0, 0}}, new double[][]{{0, 0}, {0, 0}});

        assertThat(errors[0]).containsExactly(2.5);
        assertThat(errors[1]).containsExactly(0.0);
    }
}
