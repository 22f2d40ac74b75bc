package com.anomalybench.core.detection;

import com.anomalybench.core.config.EnsembleParameters;
import com.anomalybench.core.error.ConfigurationException;
import com.anomalybench.core.error.DataShapeException;
import com.anomalybench.core.error.MissingArtifactException;
import com.anomalybench.core.model.ChannelSelection;
import com.anomalybench.core.model.LabelSchema;
import com.anomalybench.core.model.ResolvedSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link WindowedEnsembleDetector}.
 */
class WindowedEnsembleDetectorTest {

    @TempDir
    Path tempDir;

    private static ResolvedSeries singleChannel(int rows) {
        double[][] data = new double[rows][1];
        for (int r = 0; r < rows; r++) {
            data[r][0] = Math.sin(r / 2.0);
        }
        return new ResolvedSeries(data, new int[rows][1], ChannelSelection.all(List.of("value")), LabelSchema.GLOBAL);
    }

    private static EnsembleParameters parameters(int windowSize) {
        EnsembleParameters parameters = new EnsembleParameters();
        parameters.setWindowSize(windowSize);
        parameters.setNTrees(25);
        return parameters;
    }

    @Test
    @DisplayName("All-normal labels give the smallest positive contamination")
    void shouldNeverUseZeroContamination() {
        assertThat(WindowedEnsembleDetector.contamination(new int[21])).isEqualTo(Double.MIN_VALUE);
        assertThat(WindowedEnsembleDetector.contamination(new int[]{0, 1, 0, 1, 0, 0, 0, 0, 0, 0}))
                .isEqualTo(0.2);
    }

    @Test
    @DisplayName("21 normal rows with window 5 score every timestamp and pad two rows at each end")
    void shouldScoreEveryTimestamp() {
        Path model = tempDir.resolve("forest.json");
        ResolvedSeries series = singleChannel(21);
        WindowedEnsembleDetector detector = new WindowedEnsembleDetector(parameters(5));

        detector.train(series, model);
        double[][] scores = detector.execute(series, model);

        assertThat(scores).hasNumberOfRows(21);
        assertThat(scores[0]).containsExactly(0.0);
        assertThat(scores[1]).containsExactly(0.0);
        assertThat(scores[19]).containsExactly(0.0);
        assertThat(scores[20]).containsExactly(0.0);
        for (double[] row : scores) {
            assertThat(row).hasSize(1);
            assertThat(row[0]).isIn(0.0, 1.0);
        }
    }

    @Test
    @DisplayName("Even window sizes are rejected at construction")
    void shouldRejectEvenWindow() {
        assertThatThrownBy(() -> new WindowedEnsembleDetector(parameters(4)))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Execute without a trained model fails with a missing artifact")
    void shouldRequireTrainedModel() {
        WindowedEnsembleDetector detector = new WindowedEnsembleDetector(parameters(5));

        assertThatThrownBy(() -> detector.execute(singleChannel(21), tempDir.resolve("absent.json")))
                .isInstanceOf(MissingArtifactException.class);
    }

    @Test
    @DisplayName("Execute with another window size than trained is a shape error")
    void shouldRejectWindowMismatch() {
        Path model = tempDir.resolve("forest.json");
        new WindowedEnsembleDetector(parameters(5)).train(singleChannel(21), model);

        assertThatThrownBy(() -> new WindowedEnsembleDetector(parameters(7)).execute(singleChannel(21), model))
                .isInstanceOf(DataShapeException.class)
                .hasMessageContaining("window_size=5");
    }

    @Test
    @DisplayName("A series shorter than the window is a shape error")
    void shouldRejectShortSeries() {
        assertThatThrownBy(() -> new WindowedEnsembleDetector(parameters(5))
                .train(singleChannel(3), tempDir.resolve("forest.json")))
                .isInstanceOf(DataShapeException.class);
    }
}
