/**
 * File adapters: CSV series input, CSV score output and atomic artifact writes.
 *
 * @since 1.0.0
 */
package com.anomalybench.core.io;
