package com.anomalybench.core.error;

/**
 * Bad or missing parameters, an unresolvable channel selection, an even
 * window size, or an unknown execution type.
 *
 * @since 1.0.0
 */
public class ConfigurationException extends AnomalyBenchException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
