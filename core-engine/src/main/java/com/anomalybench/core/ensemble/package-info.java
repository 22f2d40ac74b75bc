/**
 * Isolation-forest ensemble used by the windowed ensemble detector.
 *
 * <p>
 * {@link com.anomalybench.core.ensemble.IsolationForest} is fitted through
 * its builder and labels samples with the ±1 convention;
 * {@link com.anomalybench.core.ensemble.EnsembleModel} is its persisted form.
 * </p>
 *
 * @since 1.0.0
 */
package com.anomalybench.core.ensemble;
