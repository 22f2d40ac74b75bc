package com.anomalybench.core.reconstruction;

/**
 * Outcome of one training run.
 *
 * @since 1.0.0
 */
public final class TrainingSummary {

    private final int epochs;
    private final int bestEpoch;
    private final double bestValidationLoss;
    private final String terminationReason;
    private final boolean archived;

    TrainingSummary(int epochs, int bestEpoch, double bestValidationLoss,
                    String terminationReason, boolean archived) {
        this.epochs = epochs;
        this.bestEpoch = bestEpoch;
        this.bestValidationLoss = bestValidationLoss;
        this.terminationReason = terminationReason;
        this.archived = archived;
    }

    /** @return number of epochs that ran */
    public int getEpochs() {
        return epochs;
    }

    /** @return epoch of the archived checkpoint, or {@code -1} when none was written */
    public int getBestEpoch() {
        return bestEpoch;
    }

    /** @return validation loss of the archived checkpoint, or {@code NaN} when none was written */
    public double getBestValidationLoss() {
        return bestValidationLoss;
    }

    public String getTerminationReason() {
        return terminationReason;
    }

    /** @return {@code false} when no epoch reached a finite validation loss */
    public boolean isArchived() {
        return archived;
    }

    @Override
    public String toString() {
        return "TrainingSummary{epochs=" + epochs
                + ", bestEpoch=" + bestEpoch
                + ", bestValidationLoss=" + bestValidationLoss
                + ", terminationReason=" + terminationReason
                + ", archived=" + archived + '}';
    }
}
