package com.anomalybench.core.reconstruction;

/**
 * Callback run after each training epoch, once the epoch's checkpoint (if
 * any) has been archived.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface EpochObserver {

    EpochObserver NONE = (epoch, validationLoss) -> { };

    /**
     * @param epoch          zero-based epoch number
     * @param validationLoss mean reconstruction loss on the validation rows
     */
    void onEpoch(int epoch, double validationLoss);
}
