package com.anomalybench.core.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parameters of the statistical baseline detector.
 *
 * @since 1.0.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class BaselineParameters extends DetectorParameters {

    /** Number of standard deviations a value may stray from the mean. */
    @JsonProperty("tol")
    private double tol = 3.0;

    @Override
    protected void collectErrors(List<String> errors) {
        super.collectErrors(errors);
        if (!Double.isFinite(tol) || tol < 0) {
            errors.add("'tol' must be a finite value >= 0, got: " + tol);
        }
    }

    public double getTol() {
        return tol;
    }

    public void setTol(double tol) {
        this.tol = tol;
    }

    @Override
    public String toString() {
        return "BaselineParameters{tol=" + tol
                + ", randomState=" + getRandomState()
                + ", targetChannels=" + getTargetChannels() + '}';
    }
}
