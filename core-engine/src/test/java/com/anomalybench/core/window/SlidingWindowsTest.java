package com.anomalybench.core.window;

import com.anomalybench.core.error.ConfigurationException;
import com.anomalybench.core.error.DataShapeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SlidingWindows}.
 */
class SlidingWindowsTest {

    private static double[][] series(int rows, int channels) {
        double[][] data = new double[rows][channels];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < channels; c++) {
                data[r][c] = r * 10 + c;
            }
        }
        return data;
    }

    @Test
    @DisplayName("Each sample is W consecutive rows flattened row by row")
    void shouldFlattenConsecutiveRows() {
        double[][] samples = SlidingWindows.window(series(5, 2), 3);

        assertThat(samples).hasNumberOfRows(3);
        assertThat(samples[0]).containsExactly(0, 1, 10, 11, 20, 21);
        assertThat(samples[2]).containsExactly(20, 21, 30, 31, 40, 41);
    }

    @Test
    @DisplayName("A window as long as the series yields one sample")
    void shouldAllowWindowEqualToLength() {
        assertThat(SlidingWindows.window(series(7, 1), 7)).hasNumberOfRows(1);
    }

    @ParameterizedTest(name = "T={0}, W={1}")
    @CsvSource({"1, 1", "5, 1", "5, 3", "21, 5", "21, 21", "100, 9"})
    @DisplayName("Windowing then unwindowing restores one value per row with padded ends")
    void shouldRestoreLength(int rows, int windowSize) {
        double[][] samples = SlidingWindows.window(series(rows, 2), windowSize);
        double[] perSample = new double[samples.length];
        Arrays.fill(perSample, 7.0);

        double[] restored = SlidingWindows.unwindow(perSample, windowSize, -1.0);

        int pad = windowSize / 2;
        assertThat(restored).hasSize(rows);
        for (int i = 0; i < pad; i++) {
            assertThat(restored[i]).isEqualTo(-1.0);
            assertThat(restored[rows - 1 - i]).isEqualTo(-1.0);
        }
        for (int i = pad; i < rows - pad; i++) {
            assertThat(restored[i]).isEqualTo(7.0);
        }
    }

    @Test
    @DisplayName("Even window sizes are rejected")
    void shouldRejectEvenWindow() {
        assertThatThrownBy(() -> SlidingWindows.window(series(10, 1), 4))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> SlidingWindows.unwindow(new double[3], 2, 0.0))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("A window longer than the series is a shape error")
    void shouldRejectWindowLongerThanSeries() {
        assertThatThrownBy(() -> SlidingWindows.window(series(3, 1), 5))
                .isInstanceOf(DataShapeException.class)
                .hasMessageContaining("larger than the series length 3");
    }
}
