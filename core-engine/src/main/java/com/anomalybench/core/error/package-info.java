/**
 * Error taxonomy shared by every stage of a detector run.
 *
 * <ul>
 * <li>{@link com.anomalybench.core.error.ConfigurationException}</li>
 * <li>{@link com.anomalybench.core.error.MissingArtifactException}</li>
 * <li>{@link com.anomalybench.core.error.DataShapeException}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.anomalybench.core.error;
