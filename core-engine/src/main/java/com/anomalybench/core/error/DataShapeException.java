package com.anomalybench.core.error;

/**
 * Channel/label column mismatch, a window larger than the series, or data
 * whose dimensions disagree with a persisted model.
 *
 * @since 1.0.0
 */
public class DataShapeException extends AnomalyBenchException {

    private static final long serialVersionUID = 1L;

    public DataShapeException(String message) {
        super(message);
    }
}
