package com.anomalybench.core.reconstruction;

import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.conf.layers.OutputLayer;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.learning.config.Adam;
import org.nd4j.linalg.lossfunctions.LossFunctions;

import java.util.Arrays;
import java.util.Random;

/**
 * Network shape and input corruption of the denoising autoencoder.
 *
 * <p>
 * The network is a single linear encoder layer ({@code C → latent}) followed
 * by a linear decoder output layer ({@code latent → C}) trained with mean
 * squared error, so it learns to map a corrupted row back to the clean one.
 * </p>
 *
 * @since 1.0.0
 */
public final class DenoisingAutoencoder {

    private DenoisingAutoencoder() {
        // utility class, not instantiable
    }

    /**
     * Build and initialise a fresh network.
     *
     * @param features     channel count {@code C}
     * @param latentSize   width of the hidden layer
     * @param learningRate Adam learning rate
     * @param seed         weight-initialisation seed
     * @return an initialised network
     */
    public static MultiLayerNetwork build(int features, int latentSize, double learningRate, long seed) {
        MultiLayerConfiguration conf = new NeuralNetConfiguration.Builder()
                .seed(seed)
                .dataType(DataType.DOUBLE)
                .weightInit(WeightInit.XAVIER_UNIFORM)
                .updater(new Adam(learningRate))
                .list()
                .layer(new DenseLayer.Builder()
                        .nIn(features)
                        .nOut(latentSize)
                        .activation(Activation.IDENTITY)
                        .build())
                .layer(new OutputLayer.Builder(LossFunctions.LossFunction.MSE)
                        .nIn(latentSize)
                        .nOut(features)
                        .activation(Activation.IDENTITY)
                        .build())
                .build();

        MultiLayerNetwork network = new MultiLayerNetwork(conf);
        network.init();
        return network;
    }

    /**
     * Copy {@code data} and zero every value of {@code ⌊T·noiseRatio⌋} rows
     * chosen uniformly without replacement.
     *
     * @param data       clean {@code T×C} input, not modified
     * @param noiseRatio share of rows to blank out
     * @param random     source of the row choice
     * @return the corrupted copy
     */
    public static double[][] corrupt(double[][] data, double noiseRatio, Random random) {
        double[][] noisy = new double[data.length][];
        for (int r = 0; r < data.length; r++) {
            noisy[r] = data[r].clone();
        }

        int count = (int) (data.length * noiseRatio);
        int[] order = new int[data.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        for (int i = 0; i < count; i++) {
            int j = i + random.nextInt(order.length - i);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
            Arrays.fill(noisy[order[i]], 0.0);
        }
        return noisy;
    }
}
