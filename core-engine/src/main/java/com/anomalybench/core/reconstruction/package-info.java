/**
 * Denoising autoencoder built on Deeplearning4j, its early-stopping training
 * loop, and the zip archive the best checkpoint is kept in.
 */
package com.anomalybench.core.reconstruction;
