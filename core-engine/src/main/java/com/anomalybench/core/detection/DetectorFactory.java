package com.anomalybench.core.detection;

import com.anomalybench.core.config.Algorithm;
import com.anomalybench.core.config.AlgorithmArgs;
import com.anomalybench.core.config.BaselineParameters;
import com.anomalybench.core.config.DetectorParameters;
import com.anomalybench.core.config.EnsembleParameters;
import com.anomalybench.core.config.ReconstructionParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Creates the {@link AnomalyDetector} for an {@link Algorithm}.
 *
 * <p>
 * This is the single point of extension when adding a new algorithm:
 * register it in {@link Algorithm} and map it to its detector here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create the detector a run is configured for.
     *
     * @param args validated run configuration; must not be {@code null}
     * @return the detector
     */
    public static AnomalyDetector create(AlgorithmArgs args) {
        Objects.requireNonNull(args, "AlgorithmArgs must not be null");
        return create(args.getAlgorithm(), args.getCustomParameters());
    }

    /**
     * Create a detector from an algorithm and its parameters.
     *
     * @param algorithm  the algorithm; must not be {@code null}
     * @param parameters parameters of the matching type; must not be {@code null}
     * @return the detector
     * @throws IllegalArgumentException if the parameters belong to another algorithm
     */
    public static AnomalyDetector create(Algorithm algorithm, DetectorParameters parameters) {
        Objects.requireNonNull(algorithm, "Algorithm must not be null");
        Objects.requireNonNull(parameters, "DetectorParameters must not be null");
        if (!algorithm.getParametersType().isInstance(parameters)) {
            throw new IllegalArgumentException("Algorithm '" + algorithm.getId() + "' expects "
                    + algorithm.getParametersType().getSimpleName() + " but got "
                    + parameters.getClass().getSimpleName());
        }

        LOG.debug("Creating detector for '{}' with {}", algorithm.getId(), parameters);
        return switch (algorithm) {
            case STATISTICAL -> new StatisticalBaselineDetector((BaselineParameters) parameters);
            case WINDOWED_ENSEMBLE -> new WindowedEnsembleDetector((EnsembleParameters) parameters);
            case RECONSTRUCTION -> new ReconstructionDetector((ReconstructionParameters) parameters);
        };
    }
}
