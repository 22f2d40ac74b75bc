package com.anomalybench.core.error;

/**
 * Root of the failures a detector run can end with.
 *
 * <p>
 * All subclasses are fail-fast conditions: they are raised before or at the
 * start of the stage that detects them and are never retried.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AnomalyBenchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected AnomalyBenchException(String message) {
        super(message);
    }

    protected AnomalyBenchException(String message, Throwable cause) {
        super(message, cause);
    }
}
