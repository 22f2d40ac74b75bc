package com.anomalybench.core.model;

/**
 * How anomaly labels are laid out in the input file.
 *
 * @since 1.0.0
 */
public enum LabelSchema {

    /** One {@code is_anomaly} column shared by every channel. */
    GLOBAL,

    /** One {@code is_anomaly_<channel>} column per channel. */
    PER_CHANNEL
}
