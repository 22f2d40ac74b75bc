/**
 * Channel and label resolution: picks the channels a detector works on and
 * gives each one exactly one label column.
 *
 * @since 1.0.0
 */
package com.anomalybench.core.channel;
