package com.anomalybench.core.config;

import com.anomalybench.core.error.ConfigurationException;
import com.anomalybench.core.model.ExecutionType;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration of one detector run.
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link ArgsLoader} to bind the harness JSON, or the {@link Builder} for
 * programmatic / test scenarios. {@link Builder#build()} validates the
 * paths required by the execution type and the detector parameters.
 * </p>
 *
 * <h3>Model paths</h3>
 * <p>
 * {@code modelInput} defaults to {@code modelOutput} when absent, so a train
 * run followed by an execute run with the same configuration finds its
 * artifact.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlgorithmArgs {

    private final Algorithm algorithm;
    private final ExecutionType executionType;
    private final Path dataInput;
    private final Path dataOutput;
    private final Path modelInput;
    private final Path modelOutput;
    private final DetectorParameters customParameters;

    private AlgorithmArgs(Builder b) {
        this.algorithm = b.algorithm;
        this.executionType = b.executionType;
        this.dataInput = b.dataInput;
        this.dataOutput = b.dataOutput;
        this.modelOutput = b.modelOutput;
        this.modelInput = b.modelInput != null ? b.modelInput : b.modelOutput;
        this.customParameters = b.customParameters;
    }

    /**
     * Create a new {@link Builder}.
     *
     * @param algorithm the detector the arguments are for
     * @return builder instance
     */
    public static Builder builder(Algorithm algorithm) {
        return new Builder(algorithm);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public ExecutionType getExecutionType() {
        return executionType;
    }

    public Path getDataInput() {
        return dataInput;
    }

    public Path getDataOutput() {
        return dataOutput;
    }

    public Path getModelInput() {
        return modelInput;
    }

    public Path getModelOutput() {
        return modelOutput;
    }

    public DetectorParameters getCustomParameters() {
        return customParameters;
    }

    /**
     * Return the custom parameters as the type the detector expects.
     *
     * @param type expected parameter class
     * @param <P>  parameter type
     * @return the parameters
     * @throws ConfigurationException if the parameters belong to another
     *                                algorithm
     */
    public <P extends DetectorParameters> P getCustomParameters(Class<P> type) {
        if (!type.isInstance(customParameters)) {
            throw new ConfigurationException("Expected " + type.getSimpleName() + " but configuration holds "
                    + customParameters.getClass().getSimpleName());
        }
        return type.cast(customParameters);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AlgorithmArgs}.
     */
    public static class Builder {
        private final Algorithm algorithm;
        private ExecutionType executionType;
        private Path dataInput;
        private Path dataOutput;
        private Path modelInput;
        private Path modelOutput;
        private DetectorParameters customParameters;

        private Builder(Algorithm algorithm) {
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm must not be null");
        }

        public Builder executionType(ExecutionType v) {
            this.executionType = v;
            return this;
        }

        public Builder dataInput(Path v) {
            this.dataInput = v;
            return this;
        }

        public Builder dataOutput(Path v) {
            this.dataOutput = v;
            return this;
        }

        public Builder modelInput(Path v) {
            this.modelInput = v;
            return this;
        }

        public Builder modelOutput(Path v) {
            this.modelOutput = v;
            return this;
        }

        public Builder customParameters(DetectorParameters v) {
            this.customParameters = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link AlgorithmArgs}
         * @throws ConfigurationException if any value is missing or invalid
         */
        public AlgorithmArgs build() {
            List<String> errors = new ArrayList<>();
            if (executionType == null) {
                errors.add("'executionType' is required");
            }
            if (dataInput == null) {
                errors.add("'dataInput' is required");
            }
            if (executionType == ExecutionType.TRAIN && modelOutput == null) {
                errors.add("'modelOutput' is required for train");
            }
            if (executionType == ExecutionType.EXECUTE) {
                if (dataOutput == null) {
                    errors.add("'dataOutput' is required for execute");
                }
                if (modelInput == null && modelOutput == null) {
                    errors.add("'modelInput' (or 'modelOutput') is required for execute");
                }
            }
            if (!errors.isEmpty()) {
                throw new ConfigurationException("Invalid configuration: " + String.join("; ", errors));
            }

            if (customParameters == null) {
                customParameters = algorithm.defaultParameters();
            } else if (!algorithm.getParametersType().isInstance(customParameters)) {
                throw new ConfigurationException("Algorithm '" + algorithm.getId() + "' expects "
                        + algorithm.getParametersType().getSimpleName() + ", got "
                        + customParameters.getClass().getSimpleName());
            }
            customParameters.validate();

            return new AlgorithmArgs(this);
        }
    }

    @Override
    public String toString() {
        return "AlgorithmArgs{" +
                "algorithm=" + algorithm.getId() +
                ", executionType=" + (executionType == null ? null : executionType.wireName()) +
                ", dataInput=" + dataInput +
                ", dataOutput=" + dataOutput +
                ", modelInput=" + modelInput +
                ", modelOutput=" + modelOutput +
                ", customParameters=" + customParameters +
                '}';
    }
}
