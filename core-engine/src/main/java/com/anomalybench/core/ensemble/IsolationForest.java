package com.anomalybench.core.ensemble;

import com.anomalybench.core.error.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Isolation forest with a contamination-derived decision threshold.
 *
 * <h3>Fitting</h3>
 * <p>
 * Each tree is grown on {@code sampleSize} rows (drawn with or without
 * replacement) restricted to {@code featureCount} randomly chosen features,
 * up to depth {@code ceil(log2(sampleSize))}. The decision threshold is the
 * {@code 100·(1 − contamination)} percentile of the training scores, so
 * roughly a {@code contamination} share of the training samples scores above
 * it.
 * </p>
 *
 * <h3>Prediction</h3>
 * <p>
 * {@link #predict(double[][])} follows the ±1 convention: {@value #OUTLIER}
 * for samples scoring strictly above the threshold, {@value #INLIER}
 * otherwise.
 * </p>
 *
 * <h3>Determinism</h3>
 * <p>
 * Per-tree seeds are drawn from the master seed before any tree is grown, so
 * the fitted forest is the same whichever number of worker threads grows it.
 * </p>
 *
 * @since 1.0.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class IsolationForest {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForest.class);

    public static final int OUTLIER = -1;
    public static final int INLIER = 1;

    /** Sample size used when none is configured, capped by the row count. */
    static final int AUTO_MAX_SAMPLES = 256;

    private List<IsolationTree> trees;
    private int sampleSize;
    private int dimensions;
    private double contamination;
    private double threshold;

    private IsolationForest() {
        // for Jackson
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder with library defaults
     */
    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------

    /**
     * Compute the anomaly score of a single point.
     *
     * @param point feature vector of {@link #getDimensions()} values
     * @return score in {@code (0, 1]}; higher is more anomalous
     */
    public double anomalyScore(double[] point) {
        if (point.length != dimensions) {
            throw new IllegalArgumentException("Expected " + dimensions + " features, got " + point.length);
        }
        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) {
            return 0.0;
        }
        // s(x, n) = 2^(-E(h(x)) / c(n))
        return Math.pow(2.0, -avgPathLength / c);
    }

    /**
     * @param data samples to score
     * @return one score per sample
     */
    public double[] anomalyScores(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = anomalyScore(data[i]);
        }
        return scores;
    }

    /**
     * Label samples as {@value #OUTLIER} (anomalous) or {@value #INLIER}.
     *
     * @param data samples to label
     * @return one ±1 label per sample
     */
    public int[] predict(double[][] data) {
        int[] labels = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            labels[i] = anomalyScore(data[i]) > threshold ? OUTLIER : INLIER;
        }
        return labels;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getTreeCount() {
        return trees.size();
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public int getDimensions() {
        return dimensions;
    }

    public double getContamination() {
        return contamination;
    }

    public double getThreshold() {
        return threshold;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Linear-interpolated percentile, matching the conventional definition
     * used by numeric libraries.
     *
     * @param values     values, not modified
     * @param percentile in {@code [0, 100]}
     * @return the percentile
     */
    static double percentile(double[] values, double percentile) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }

    static int resolveCount(double value, int available) {
        if (value <= 1.0) {
            return Math.max(1, (int) (value * available));
        }
        return (int) value;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent configuration for {@link #fit(double[][], double)}.
     */
    public static final class Builder {
        private int numTrees = 100;
        private Double maxSamples;
        private double maxFeatures = 1.0;
        private boolean bootstrap;
        private long seed = 42L;
        private int jobs = 1;
        private boolean verbose;

        private Builder() {
        }

        public Builder numTrees(int v) {
            this.numTrees = v;
            return this;
        }

        /**
         * A value of exactly {@code 1} is the fraction 1.0 (every row), not a
         * count of one sample.
         *
         * @param v fraction in {@code (0, 1]}, absolute count above one, or
         *          {@code null} for {@code min(256, rows)}
         * @return this builder
         */
        public Builder maxSamples(Double v) {
            this.maxSamples = v;
            return this;
        }

        /**
         * @param v fraction in {@code (0, 1]} or absolute count above one
         * @return this builder
         */
        public Builder maxFeatures(double v) {
            this.maxFeatures = v;
            return this;
        }

        public Builder bootstrap(boolean v) {
            this.bootstrap = v;
            return this;
        }

        public Builder seed(long v) {
            this.seed = v;
            return this;
        }

        public Builder jobs(int v) {
            this.jobs = v;
            return this;
        }

        public Builder verbose(boolean v) {
            this.verbose = v;
            return this;
        }

        /**
         * Fit a forest.
         *
         * @param data          training samples, each row a feature vector
         * @param contamination expected share of anomalies, in {@code (0, 0.5]}
         * @return the fitted forest
         * @throws ConfigurationException if a setting does not fit the data
         */
        public IsolationForest fit(double[][] data, double contamination) {
            Objects.requireNonNull(data, "data must not be null");
            if (data.length == 0) {
                throw new IllegalArgumentException("Cannot fit an isolation forest on zero samples");
            }
            if (!(contamination > 0 && contamination <= 0.5)) {
                throw new ConfigurationException("contamination must be in (0, 0.5], got: " + contamination);
            }
            if (numTrees < 1 || jobs < 1) {
                throw new ConfigurationException("numTrees and jobs must be >= 1");
            }

            int rows = data.length;
            int dims = data[0].length;
            int sampleSize = maxSamples == null
                    ? Math.min(AUTO_MAX_SAMPLES, rows)
                    : resolveCount(maxSamples, rows);
            if (sampleSize > rows) {
                LOG.warn("max_samples ({}) is greater than the number of samples ({}); using {}",
                        sampleSize, rows, rows);
                sampleSize = rows;
            }
            int featureCount = resolveCount(maxFeatures, dims);
            if (featureCount > dims) {
                throw new ConfigurationException("max_features (" + featureCount
                        + ") exceeds the number of features (" + dims + ")");
            }
            int maxDepth = (int) Math.ceil(Math.log(Math.max(sampleSize, 2)) / Math.log(2));

            Random master = new Random(seed);
            long[] treeSeeds = new long[numTrees];
            for (int i = 0; i < numTrees; i++) {
                treeSeeds[i] = master.nextLong();
            }

            IsolationForest forest = new IsolationForest();
            forest.sampleSize = sampleSize;
            forest.dimensions = dims;
            forest.contamination = contamination;
            forest.trees = growAll(data, treeSeeds, sampleSize, featureCount, maxDepth);

            forest.threshold = percentile(forest.anomalyScores(data), 100.0 * (1.0 - contamination));
            LOG.debug("Fitted {} trees (sampleSize={}, features={}/{}, maxDepth={}, threshold={})",
                    numTrees, sampleSize, featureCount, dims, maxDepth, forest.threshold);
            return forest;
        }

        private List<IsolationTree> growAll(double[][] data, long[] treeSeeds, int sampleSize,
                                            int featureCount, int maxDepth) {
            if (jobs == 1) {
                List<IsolationTree> trees = new ArrayList<>(treeSeeds.length);
                for (int i = 0; i < treeSeeds.length; i++) {
                    trees.add(growOne(data, treeSeeds[i], i, sampleSize, featureCount, maxDepth));
                }
                return trees;
            }

            List<Callable<IsolationTree>> tasks = new ArrayList<>(treeSeeds.length);
            for (int i = 0; i < treeSeeds.length; i++) {
                int index = i;
                tasks.add(() -> growOne(data, treeSeeds[index], index, sampleSize, featureCount, maxDepth));
            }

            ExecutorService pool = Executors.newFixedThreadPool(Math.min(jobs, treeSeeds.length), r -> {
                Thread t = new Thread(r, "isolation-forest");
                t.setDaemon(true);
                return t;
            });
            try {
                List<IsolationTree> trees = new ArrayList<>(tasks.size());
                for (Future<IsolationTree> future : pool.invokeAll(tasks)) {
                    trees.add(future.get());
                }
                return trees;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while growing isolation trees", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) {
                    throw re;
                }
                throw new IllegalStateException("Failed to grow isolation tree", cause);
            } finally {
                pool.shutdownNow();
            }
        }

        private IsolationTree growOne(double[][] data, long treeSeed, int index, int sampleSize,
                                      int featureCount, int maxDepth) {
            Random random = new Random(treeSeed);
            double[][] sample = bootstrap
                    ? sampleWithReplacement(data, sampleSize, random)
                    : sampleWithoutReplacement(data, sampleSize, random);
            int[] features = chooseFeatures(data[0].length, featureCount, random);
            IsolationTree tree = IsolationTree.build(sample, features, maxDepth, random);
            if (verbose) {
                LOG.debug("Grew tree {} on {} samples", index + 1, sampleSize);
            }
            return tree;
        }
    }

    // ---------------------------------------------------------------
    // Sampling
    // ---------------------------------------------------------------

    private static double[][] sampleWithoutReplacement(double[][] data, int size, Random random) {
        int[] indices = partialShuffle(data.length, size, random);
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    private static double[][] sampleWithReplacement(double[][] data, int size, Random random) {
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            sample[i] = data[random.nextInt(data.length)];
        }
        return sample;
    }

    private static int[] chooseFeatures(int dims, int count, Random random) {
        int[] chosen = Arrays.copyOf(partialShuffle(dims, count, random), count);
        Arrays.sort(chosen);
        return chosen;
    }

    // Fisher-Yates over the first `size` positions.
    private static int[] partialShuffle(int n, int size, Random random) {
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        return indices;
    }
}
