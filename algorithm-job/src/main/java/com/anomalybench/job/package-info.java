/**
 * Command-line job that reads a CSV series, resolves channels and runs one
 * detector pass.
 *
 * @since 1.0.0
 */
package com.anomalybench.job;
