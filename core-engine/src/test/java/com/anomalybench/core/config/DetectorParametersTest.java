package com.anomalybench.core.config;

import com.anomalybench.core.error.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Validation tests for the detector parameter types.
 */
class DetectorParametersTest {

    @Test
    @DisplayName("Defaults of every algorithm are valid")
    void shouldAcceptDefaults() {
        for (Algorithm algorithm : Algorithm.values()) {
            assertThatCode(() -> algorithm.defaultParameters().validate()).doesNotThrowAnyException();
        }
    }

    @Test
    @DisplayName("Default ensemble window is odd")
    void shouldDefaultToOddWindow() {
        EnsembleParameters parameters = (EnsembleParameters) Algorithm.WINDOWED_ENSEMBLE.defaultParameters();

        assertThat(parameters.getWindowSize()).isEqualTo(101);
        assertThat(parameters.getWindowSize() % 2).isEqualTo(1);
    }

    @Test
    @DisplayName("Negative tol is rejected, zero is accepted")
    void shouldValidateTol() {
        BaselineParameters parameters = new BaselineParameters();
        parameters.setTol(0.0);
        assertThatCode(parameters::validate).doesNotThrowAnyException();

        parameters.setTol(-1.0);
        assertThatThrownBy(parameters::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("tol");
    }

    @Test
    @DisplayName("Ensemble validation reports every invalid field")
    void shouldCollectEnsembleErrors() {
        EnsembleParameters parameters = new EnsembleParameters();
        parameters.setWindowSize(4);
        parameters.setNTrees(0);
        parameters.setMaxSamples(2.5);
        parameters.setNJobs(0);

        assertThatThrownBy(parameters::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("window_size")
                .hasMessageContaining("n_trees")
                .hasMessageContaining("max_samples")
                .hasMessageContaining("n_jobs");
    }

    @Test
    @DisplayName("Reconstruction ranges are enforced")
    void shouldValidateReconstructionRanges() {
        ReconstructionParameters parameters = new ReconstructionParameters();
        parameters.setSplit(1.0);
        parameters.setNoiseRatio(1.0);
        parameters.setEarlyStoppingPatience(0);

        assertThatThrownBy(parameters::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("split")
                .hasMessageContaining("noise_ratio")
                .hasMessageContaining("early_stopping_patience");
    }

    @Test
    @DisplayName("Blank target channel names are rejected")
    void shouldRejectBlankChannels() {
        BaselineParameters parameters = new BaselineParameters();
        parameters.setTargetChannels(Arrays.asList("a", " "));

        assertThatThrownBy(parameters::validate).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Algorithm ids are looked up case-insensitively")
    void shouldResolveAlgorithmIds() {
        assertThat(Algorithm.fromId("Windowed-Ensemble")).isEqualTo(Algorithm.WINDOWED_ENSEMBLE);
        assertThatThrownBy(() -> Algorithm.fromId("lstm"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("statistical, windowed-ensemble, reconstruction");
    }

    @Test
    @DisplayName("n_jobs of -1 expands to the processor count")
    void shouldExpandAllJobs() {
        EnsembleParameters parameters = new EnsembleParameters();
        parameters.setNJobs(-1);

        assertThat(parameters.effectiveJobs()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(parameters.getNJobs()).isEqualTo(-1);
    }
}
