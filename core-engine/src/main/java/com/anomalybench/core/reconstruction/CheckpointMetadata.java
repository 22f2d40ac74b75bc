package com.anomalybench.core.reconstruction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Describes the weights held in a checkpoint: which epoch produced them and
 * the validation loss they reached.
 *
 * @since 1.0.0
 */
public final class CheckpointMetadata {

    private final int epoch;
    private final double validationLoss;
    private final int channelCount;

    @JsonCreator
    public CheckpointMetadata(@JsonProperty("epoch") int epoch,
                              @JsonProperty("validationLoss") double validationLoss,
                              @JsonProperty("channelCount") int channelCount) {
        this.epoch = epoch;
        this.validationLoss = validationLoss;
        this.channelCount = channelCount;
    }

    @JsonProperty("epoch")
    public int getEpoch() {
        return epoch;
    }

    @JsonProperty("validationLoss")
    public double getValidationLoss() {
        return validationLoss;
    }

    @JsonProperty("channelCount")
    public int getChannelCount() {
        return channelCount;
    }

    @Override
    public String toString() {
        return "CheckpointMetadata{epoch=" + epoch
                + ", validationLoss=" + validationLoss
                + ", channelCount=" + channelCount + '}';
    }
}
