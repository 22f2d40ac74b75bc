package com.anomalybench.core.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parameters of the windowed isolation-forest detector.
 *
 * <h3>Sample and feature counts</h3>
 * <p>
 * {@code max_samples} and {@code max_features} accept either a fraction in
 * {@code (0, 1]} of the available rows/features or an absolute integral count
 * greater than one. A {@code null} {@code max_samples} means "auto", i.e.
 * {@code min(256, rows)}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class EnsembleParameters extends DetectorParameters {

    @JsonProperty("window_size")
    private int windowSize = 101;

    @JsonProperty("n_trees")
    private int nTrees = 100;

    @JsonProperty("max_samples")
    private Double maxSamples;

    @JsonProperty("max_features")
    private double maxFeatures = 1.0;

    @JsonProperty("bootstrap")
    private boolean bootstrap = false;

    /** Worker threads used to grow trees; {@code -1} uses every core. */
    @JsonProperty("n_jobs")
    private int nJobs = 1;

    @JsonProperty("verbose")
    private int verbose = 0;

    @Override
    protected void collectErrors(List<String> errors) {
        super.collectErrors(errors);
        if (windowSize < 1 || windowSize % 2 == 0) {
            errors.add("'window_size' must be a positive odd number, got: " + windowSize);
        }
        if (nTrees < 1) {
            errors.add("'n_trees' must be >= 1, got: " + nTrees);
        }
        if (maxSamples != null) {
            checkFractionOrCount("max_samples", maxSamples, errors);
        }
        checkFractionOrCount("max_features", maxFeatures, errors);
        if (nJobs == 0 || nJobs < -1) {
            errors.add("'n_jobs' must be >= 1 or -1, got: " + nJobs);
        }
        if (verbose < 0) {
            errors.add("'verbose' must be >= 0, got: " + verbose);
        }
    }

    private static void checkFractionOrCount(String name, double value, List<String> errors) {
        if (!Double.isFinite(value) || value <= 0) {
            errors.add("'" + name + "' must be > 0, got: " + value);
        } else if (value > 1 && value != Math.rint(value)) {
            errors.add("'" + name + "' above 1 must be a whole count, got: " + value);
        }
    }

    /**
     * Resolve the worker count, expanding {@code -1} to the processor count.
     *
     * @return number of threads to grow trees with
     */
    public int effectiveJobs() {
        return nJobs == -1 ? Runtime.getRuntime().availableProcessors() : nJobs;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public int getNTrees() {
        return nTrees;
    }

    public void setNTrees(int nTrees) {
        this.nTrees = nTrees;
    }

    /**
     * A value of exactly {@code 1} means every row, not one sample.
     *
     * @return the configured max samples, or {@code null} for "auto"
     */
    public Double getMaxSamples() {
        return maxSamples;
    }

    public void setMaxSamples(Double maxSamples) {
        this.maxSamples = maxSamples;
    }

    public double getMaxFeatures() {
        return maxFeatures;
    }

    public void setMaxFeatures(double maxFeatures) {
        this.maxFeatures = maxFeatures;
    }

    public boolean isBootstrap() {
        return bootstrap;
    }

    public void setBootstrap(boolean bootstrap) {
        this.bootstrap = bootstrap;
    }

    public int getNJobs() {
        return nJobs;
    }

    public void setNJobs(int nJobs) {
        this.nJobs = nJobs;
    }

    public int getVerbose() {
        return verbose;
    }

    public void setVerbose(int verbose) {
        this.verbose = verbose;
    }

    @Override
    public String toString() {
        return "EnsembleParameters{" +
                "windowSize=" + windowSize +
                ", nTrees=" + nTrees +
                ", maxSamples=" + (maxSamples == null ? "auto" : maxSamples) +
                ", maxFeatures=" + maxFeatures +
                ", bootstrap=" + bootstrap +
                ", nJobs=" + nJobs +
                ", randomState=" + getRandomState() +
                ", targetChannels=" + getTargetChannels() +
                '}';
    }
}
