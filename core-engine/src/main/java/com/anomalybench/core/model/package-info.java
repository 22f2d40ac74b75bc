/**
 * Domain model shared by the resolver, the detectors and the job layer.
 *
 * <ul>
 * <li>{@link com.anomalybench.core.model.LabeledSeries}: the input file as
 * read</li>
 * <li>{@link com.anomalybench.core.model.ResolvedSeries}: selected channels
 * with one label column each</li>
 * <li>{@link com.anomalybench.core.model.ChannelSelection}: channel name to
 * column index mapping</li>
 * <li>{@link com.anomalybench.core.model.Baseline}: statistical detector
 * state</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.anomalybench.core.model;
