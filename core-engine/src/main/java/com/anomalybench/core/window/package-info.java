/**
 * Windowing transform used by window-based detectors.
 *
 * @since 1.0.0
 */
package com.anomalybench.core.window;
