package com.anomalybench.core.model;

import com.anomalybench.core.error.DataShapeException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-channel mean and standard deviation learned from non-anomalous rows.
 *
 * <p>
 * Immutable. Standard deviations of zero are stored as {@code 1.0} so that
 * constant channels never produce a degenerate threshold.
 * </p>
 *
 * @since 1.0.0
 */
public final class Baseline {

    private final double[] means;
    private final double[] stds;

    public Baseline(double[] means, double[] stds) {
        Objects.requireNonNull(means, "means must not be null");
        Objects.requireNonNull(stds, "stds must not be null");
        if (means.length != stds.length) {
            throw new DataShapeException("Baseline has " + means.length + " means but "
                    + stds.length + " standard deviations");
        }
        this.means = means.clone();
        this.stds = new double[stds.length];
        for (int i = 0; i < stds.length; i++) {
            this.stds[i] = stds[i] == 0.0 ? 1.0 : stds[i];
        }
    }

    public int getChannelCount() {
        return means.length;
    }

    public double getMean(int channel) {
        return means[channel];
    }

    public double getStd(int channel) {
        return stds[channel];
    }

    public double[] getMeans() {
        return means.clone();
    }

    public double[] getStds() {
        return stds.clone();
    }

    /**
     * @param channel channel index
     * @param value   observed value
     * @param tol     tolerance multiple of the standard deviation
     * @return {@code true} if the value lies strictly outside
     *         {@code mean ± tol·std}
     */
    public boolean isOutside(int channel, double value, double tol) {
        double mean = means[channel];
        double band = tol * stds[channel];
        return value > mean + band || value < mean - band;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Baseline that))
            return false;
        return Arrays.equals(means, that.means) && Arrays.equals(stds, that.stds);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(means) + Arrays.hashCode(stds);
    }

    @Override
    public String toString() {
        return "Baseline{means=" + Arrays.toString(means) + ", stds=" + Arrays.toString(stds) + '}';
    }
}
