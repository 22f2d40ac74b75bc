package com.anomalybench.core.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parameters of the denoising-autoencoder detector.
 *
 * @since 1.0.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class ReconstructionParameters extends DetectorParameters {

    @JsonProperty("latent_size")
    private int latentSize = 32;

    @JsonProperty("epochs")
    private int epochs = 10;

    @JsonProperty("learning_rate")
    private double learningRate = 0.005;

    /** Fraction of rows zeroed out in the corrupted training input. */
    @JsonProperty("noise_ratio")
    private double noiseRatio = 0.1;

    @JsonProperty("early_stopping_patience")
    private int earlyStoppingPatience = 10;

    @JsonProperty("early_stopping_delta")
    private double earlyStoppingDelta = 1e-2;

    /** Fraction of rows used for fitting; the remainder is the validation set. */
    @JsonProperty("split")
    private double split = 0.8;

    @JsonProperty("batch_size")
    private int batchSize = 32;

    @Override
    protected void collectErrors(List<String> errors) {
        super.collectErrors(errors);
        if (latentSize < 1) {
            errors.add("'latent_size' must be >= 1, got: " + latentSize);
        }
        if (epochs < 1) {
            errors.add("'epochs' must be >= 1, got: " + epochs);
        }
        if (!(learningRate > 0) || !Double.isFinite(learningRate)) {
            errors.add("'learning_rate' must be > 0, got: " + learningRate);
        }
        if (!(noiseRatio >= 0 && noiseRatio < 1)) {
            errors.add("'noise_ratio' must be in [0, 1), got: " + noiseRatio);
        }
        if (earlyStoppingPatience < 1) {
            errors.add("'early_stopping_patience' must be >= 1, got: " + earlyStoppingPatience);
        }
        if (!(earlyStoppingDelta >= 0) || !Double.isFinite(earlyStoppingDelta)) {
            errors.add("'early_stopping_delta' must be >= 0, got: " + earlyStoppingDelta);
        }
        if (!(split > 0 && split < 1)) {
            errors.add("'split' must be in (0, 1), got: " + split);
        }
        if (batchSize < 1) {
            errors.add("'batch_size' must be >= 1, got: " + batchSize);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getLatentSize() {
        return latentSize;
    }

    public void setLatentSize(int latentSize) {
        this.latentSize = latentSize;
    }

    public int getEpochs() {
        return epochs;
    }

    public void setEpochs(int epochs) {
        this.epochs = epochs;
    }

    public double getLearningRate() {
        return learningRate;
    }

    public void setLearningRate(double learningRate) {
        this.learningRate = learningRate;
    }

    public double getNoiseRatio() {
        return noiseRatio;
    }

    public void setNoiseRatio(double noiseRatio) {
        this.noiseRatio = noiseRatio;
    }

    public int getEarlyStoppingPatience() {
        return earlyStoppingPatience;
    }

    public void setEarlyStoppingPatience(int earlyStoppingPatience) {
        this.earlyStoppingPatience = earlyStoppingPatience;
    }

    public double getEarlyStoppingDelta() {
        return earlyStoppingDelta;
    }

    public void setEarlyStoppingDelta(double earlyStoppingDelta) {
        this.earlyStoppingDelta = earlyStoppingDelta;
    }

    public double getSplit() {
        return split;
    }

    public void setSplit(double split) {
        this.split = split;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    @Override
    public String toString() {
        return "ReconstructionParameters{" +
                "latentSize=" + latentSize +
                ", epochs=" + epochs +
                ", learningRate=" + learningRate +
                ", noiseRatio=" + noiseRatio +
                ", earlyStoppingPatience=" + earlyStoppingPatience +
                ", earlyStoppingDelta=" + earlyStoppingDelta +
                ", split=" + split +
                ", batchSize=" + batchSize +
                ", randomState=" + getRandomState() +
                ", targetChannels=" + getTargetChannels() +
                '}';
    }
}
