package com.anomalybench.core.detection;

import com.anomalybench.core.config.Algorithm;
import com.anomalybench.core.config.AlgorithmArgs;
import com.anomalybench.core.config.BaselineParameters;
import com.anomalybench.core.config.EnsembleParameters;
import com.anomalybench.core.config.ReconstructionParameters;
import com.anomalybench.core.model.ExecutionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create a StatisticalBaselineDetector for 'statistical'")
    void shouldCreateStatisticalDetector() {
        AnomalyDetector detector = DetectorFactory.create(Algorithm.STATISTICAL, new BaselineParameters());

        assertThat(detector).isInstanceOf(StatisticalBaselineDetector.class);
        assertThat(detector.getAlgorithmId()).isEqualTo("statistical");
    }

    @Test
    @DisplayName("Should create a WindowedEnsembleDetector for 'windowed-ensemble'")
    void shouldCreateEnsembleDetector() {
        AnomalyDetector detector = DetectorFactory.create(Algorithm.WINDOWED_ENSEMBLE, new EnsembleParameters());

        assertThat(detector).isInstanceOf(WindowedEnsembleDetector.class);
        assertThat(detector.getAlgorithmId()).isEqualTo("windowed-ensemble");
    }

    @Test
    @DisplayName("Should create a ReconstructionDetector for 'reconstruction'")
    void shouldCreateReconstructionDetector() {
        AnomalyDetector detector = DetectorFactory.create(Algorithm.RECONSTRUCTION, new ReconstructionParameters());

        assertThat(detector).isInstanceOf(ReconstructionDetector.class);
        assertThat(detector.getAlgorithmId()).isEqualTo("reconstruction");
    }

    @Test
    @DisplayName("Should create the detector a run configuration names")
    void shouldCreateFromArgs() {
        AlgorithmArgs args = AlgorithmArgs.builder(Algorithm.WINDOWED_ENSEMBLE)
                .executionType(ExecutionType.TRAIN)
                .dataInput(Path.of("data.csv"))
                .modelOutput(Path.of("model.json"))
                .build();

        assertThat(DetectorFactory.create(args)).isInstanceOf(WindowedEnsembleDetector.class);
    }

    @Test
    @DisplayName("Should reject parameters that belong to another algorithm")
    void shouldRejectMismatchedParameters() {
        assertThatThrownBy(() -> DetectorFactory.create(Algorithm.STATISTICAL, new EnsembleParameters()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("BaselineParameters");
    }

    @Test
    @DisplayName("Should reject null arguments")
    void shouldRejectNull() {
        assertThatThrownBy(() -> DetectorFactory.create(null))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> DetectorFactory.create(Algorithm.STATISTICAL, null))
                .isInstanceOf(NullPointerException.class);
    }
}
