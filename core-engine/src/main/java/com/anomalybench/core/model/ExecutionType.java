package com.anomalybench.core.model;

import com.anomalybench.core.error.ConfigurationException;

import java.util.Locale;

/**
 * The two phases of the harness contract.
 *
 * @since 1.0.0
 */
public enum ExecutionType {

    /** Fit a detector and persist it. */
    TRAIN,

    /** Load a persisted detector and write scores. */
    EXECUTE;

    /**
     * Parse the harness spelling ({@code train} / {@code execute}).
     *
     * @param value raw value
     * @return the execution type
     * @throws ConfigurationException if the value is neither
     */
    public static ExecutionType parse(String value) {
        if (value != null) {
            switch (value.trim().toLowerCase(Locale.ROOT)) {
                case "train":
                    return TRAIN;
                case "execute":
                    return EXECUTE;
                default:
                    break;
            }
        }
        throw new ConfigurationException("Unknown execution type '" + value
                + "'; expected either 'train' or 'execute'!");
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
