package com.anomalybench.core.config;

import com.anomalybench.core.error.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * The detectors this project can run, each with its parameter schema.
 *
 * @since 1.0.0
 */
public enum Algorithm {

    STATISTICAL("statistical", BaselineParameters.class, BaselineParameters::new),
    WINDOWED_ENSEMBLE("windowed-ensemble", EnsembleParameters.class, EnsembleParameters::new),
    RECONSTRUCTION("reconstruction", ReconstructionParameters.class, ReconstructionParameters::new);

    private final String id;
    private final Class<? extends DetectorParameters> parametersType;
    private final Supplier<? extends DetectorParameters> defaults;

    Algorithm(String id,
              Class<? extends DetectorParameters> parametersType,
              Supplier<? extends DetectorParameters> defaults) {
        this.id = id;
        this.parametersType = parametersType;
        this.defaults = defaults;
    }

    /**
     * Look an algorithm up by its command-line id.
     *
     * @param id algorithm id, case-insensitive
     * @return the algorithm
     * @throws ConfigurationException if the id is unknown
     */
    public static Algorithm fromId(String id) {
        if (id != null) {
            String normalised = id.trim().toLowerCase(Locale.ROOT);
            for (Algorithm algorithm : values()) {
                if (algorithm.id.equals(normalised)) {
                    return algorithm;
                }
            }
        }
        throw new ConfigurationException("Unknown algorithm: '" + id + "'. Supported: "
                + Arrays.stream(values()).map(Algorithm::getId).collect(Collectors.joining(", ")));
    }

    public String getId() {
        return id;
    }

    public Class<? extends DetectorParameters> getParametersType() {
        return parametersType;
    }

    /**
     * @return a fresh parameter object holding every default
     */
    public DetectorParameters defaultParameters() {
        return defaults.get();
    }
}
