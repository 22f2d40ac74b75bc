package com.anomalybench.core.detection;

import com.anomalybench.core.config.BaselineParameters;
import com.anomalybench.core.error.DataShapeException;
import com.anomalybench.core.error.MissingArtifactException;
import com.anomalybench.core.model.Baseline;
import com.anomalybench.core.model.ChannelSelection;
import com.anomalybench.core.model.LabelSchema;
import com.anomalybench.core.model.ResolvedSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StatisticalBaselineDetector}.
 */
class StatisticalBaselineDetectorTest {

    @TempDir
    Path tempDir;

    private Path model;

    @BeforeEach
    void setUp() {
        model = tempDir.resolve("model.bin");
    }

    private static ResolvedSeries series(double[][] data, int[][] labels) {
        List<String> names = data[0].length == 1 ? List.of("a") : List.of("a", "b");
        return new ResolvedSeries(data, labels, ChannelSelection.all(names), LabelSchema.PER_CHANNEL);
    }

    private static StatisticalBaselineDetector detector(double tol) {
        BaselineParameters parameters = new BaselineParameters();
        parameters.setTol(tol);
        return new StatisticalBaselineDetector(parameters);
    }

    @Test
    @DisplayName("Two normal channels of ten rows produce an all-zero score matrix at tol 3")
    void shouldFlagNothingOnNormalData() {
        double[][] data = new double[10][2];
        for (int r = 0; r < 10; r++) {
            data[r][0] = Math.sin(r) * 5;
            data[r][1] = 100 + (r % 3) - r * 0.5;
        }
        ResolvedSeries series = series(data, new int[10][2]);
        StatisticalBaselineDetector detector = detector(3.0);

        detector.train(series, model);
        double[][] scores = detector.execute(series, model);

        assertThat(scores).hasNumberOfRows(10);
        for (double[] row : scores) {
            assertThat(row).containsExactly(0.0, 0.0);
        }
    }

    @ParameterizedTest(name = "tol={0}")
    @ValueSource(doubles = {0.0, 0.5, 3.0})
    @DisplayName("A constant channel gets its value as mean, std 1, and is never flagged")
    void shouldHandleConstantChannel(double tol) {
        double[][] data = new double[8][1];
        for (double[] row : data) {
            row[0] = 0.1;
        }
        ResolvedSeries series = series(data, new int[8][1]);

        Baseline baseline = StatisticalBaselineDetector.fit(series);
        assertThat(baseline.getMean(0)).isEqualTo(0.1);
        assertThat(baseline.getStd(0)).isEqualTo(1.0);

        StatisticalBaselineDetector detector = detector(tol);
        detector.train(series, model);
        for (double[] row : detector.execute(series, model)) {
            assertThat(row).containsExactly(0.0);
        }
    }

    @Test
    @DisplayName("Rows labelled anomalous are left out of the baseline")
    void shouldExcludeAnomalousRows() {
        double[][] data = {{1}, {2}, {3}, {100}, {2}};
        int[][] labels = {{0}, {0}, {0}, {1}, {0}};

        Baseline baseline = StatisticalBaselineDetector.fit(series(data, labels));

        assertThat(baseline.getMean(0)).isCloseTo(2.0, within(1e-12));
        assertThat(baseline.getStd(0)).isCloseTo(Math.sqrt(0.5), within(1e-12));
    }

    @Test
    @DisplayName("A channel labelled anomalous everywhere falls back to all rows")
    void shouldFallBackToAllRows() {
        double[][] data = {{2}, {4}};
        int[][] labels = {{1}, {1}};

        Baseline baseline = StatisticalBaselineDetector.fit(series(data, labels));

        assertThat(baseline.getMean(0)).isEqualTo(3.0);
        assertThat(baseline.getStd(0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Values strictly outside mean ± tol·σ are flagged per channel")
    void shouldFlagOutliersPerChannel() {
        double[][] train = {{1, 10}, {3, 10}, {1, 10}, {3, 10}};
        StatisticalBaselineDetector detector = detector(1.0);
        detector.train(series(train, new int[4][2]), model);

        double[][] test = {{2, 10}, {3, 10}, {3.5, 10}, {0.4, 11.5}};
        double[][] scores = detector.execute(series(test, new int[4][2]), model);

        assertThat(scores[0]).containsExactly(0.0, 0.0);
        assertThat(scores[1]).containsExactly(0.0, 0.0);
        assertThat(scores[2]).containsExactly(1.0, 0.0);
        assertThat(scores[3]).containsExactly(1.0, 1.0);
    }

    @Test
    @DisplayName("Train writes the means and stds sidecars next to the model path")
    void shouldWriteSidecars() throws Exception {
        detector(3.0).train(series(new double[][]{{1, 5}, {3, 5}}, new int[2][2]), model);

        Path means = tempDir.resolve("model.bin.means.txt");
        Path stds = tempDir.resolve("model.bin.stds.txt");
        assertThat(Files.readAllLines(means)).hasSize(2);
        assertThat(Double.parseDouble(Files.readAllLines(means).get(0))).isEqualTo(2.0);
        assertThat(Double.parseDouble(Files.readAllLines(stds).get(1))).isEqualTo(1.0);
        assertThat(model).doesNotExist();
    }

    @Test
    @DisplayName("Execute without trained sidecars fails with a missing artifact")
    void shouldRequireTrainedModel() {
        ResolvedSeries series = series(new double[][]{{1}}, new int[1][1]);

        assertThatThrownBy(() -> detector(3.0).execute(series, model))
                .isInstanceOfSatisfying(MissingArtifactException.class, e ->
                        assertThat(e.getArtifact()).isEqualTo(tempDir.resolve("model.bin.means.txt")))
                .hasMessageContaining("run with executionType=train first");
    }

    @Test
    @DisplayName("Execute on a different channel count than trained is a shape error")
    void shouldRejectChannelMismatch() {
        StatisticalBaselineDetector detector = detector(3.0);
        detector.train(series(new double[][]{{1}, {2}}, new int[2][1]), model);

        ResolvedSeries wider = series(new double[][]{{1, 2}}, new int[1][2]);
        assertThatThrownBy(() -> detector.execute(wider, model))
                .isInstanceOf(DataShapeException.class);
    }
}
