package com.anomalybench.core.detection;

import com.anomalybench.core.model.ResolvedSeries;

import java.nio.file.Path;

/**
 * Contract for all anomaly detectors.
 *
 * <p>
 * A detector is driven in two separate runs: {@link #train} fits state from a
 * labelled series and persists it under a model path; {@link #execute} loads
 * that state and scores a series. The two runs share nothing but the
 * persisted artifact.
 * </p>
 *
 * @since 1.0.0
 */
public interface AnomalyDetector {

    /**
     * Fit the detector and persist it.
     *
     * @param series      resolved training series
     * @param modelOutput where the artifact is written
     * @throws com.anomalybench.core.error.AnomalyBenchException on a
     *         configuration or shape problem
     */
    void train(ResolvedSeries series, Path modelOutput);

    /**
     * Load the persisted detector and score every timestamp.
     *
     * @param series     resolved series to score
     * @param modelInput where the artifact was written
     * @return {@code T×K} scores in timestamp order, {@code K ≥ 1}
     * @throws com.anomalybench.core.error.MissingArtifactException if no
     *         trained artifact exists
     */
    double[][] execute(ResolvedSeries series, Path modelInput);

    /**
     * @return the algorithm id this detector implements
     */
    String getAlgorithmId();
}
