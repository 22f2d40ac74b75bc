/**
 * Configuration schema and loading.
 *
 * <p>
 * The harness hands every run a JSON object that
 * {@link com.anomalybench.core.config.ArgsLoader} binds to an immutable
 * {@link com.anomalybench.core.config.AlgorithmArgs}. Algorithm-specific
 * {@code customParameters} bind to a subclass of
 * {@link com.anomalybench.core.config.DetectorParameters} chosen by
 * {@link com.anomalybench.core.config.Algorithm}.
 * </p>
 *
 * @since 1.0.0
 */
package com.anomalybench.core.config;
