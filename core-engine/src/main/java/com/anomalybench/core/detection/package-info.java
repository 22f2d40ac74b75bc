/**
 * The detectors and the factory that picks one for a run.
 *
 * <p>
 * Every detector implements
 * {@link com.anomalybench.core.detection.AnomalyDetector}: a train run that
 * persists an artifact and an execute run that reads it back and returns one
 * row of scores per timestamp.
 * </p>
 */
package com.anomalybench.core.detection;
