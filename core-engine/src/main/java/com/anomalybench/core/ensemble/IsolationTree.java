package com.anomalybench.core.ensemble;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.util.Random;

/**
 * One randomly grown isolation tree over a subset of the features.
 *
 * @since 1.0.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
final class IsolationTree {

    private int[] features;
    private IsolationNode root;

    private IsolationTree() {
        // for Jackson
    }

    /**
     * Grow a tree on {@code sample}.
     *
     * @param sample   training rows drawn for this tree
     * @param features feature indices the tree may split on
     * @param maxDepth height limit
     * @param random   source of split choices
     * @return the tree
     */
    static IsolationTree build(double[][] sample, int[] features, int maxDepth, Random random) {
        IsolationTree tree = new IsolationTree();
        tree.features = features.clone();
        int[] rows = new int[sample.length];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = i;
        }
        tree.root = grow(sample, rows, rows.length, features, 0, maxDepth, random);
        return tree;
    }

    double pathLength(double[] point) {
        return root.pathLength(point);
    }

    int[] getFeatures() {
        return features.clone();
    }

    // ---------------------------------------------------------------
    // Growth
    // ---------------------------------------------------------------

    private static IsolationNode grow(double[][] sample, int[] rows, int count, int[] features,
                                      int depth, int maxDepth, Random random) {
        if (count <= 1 || depth >= maxDepth) {
            return IsolationNode.leaf(count);
        }

        // Only features that still vary inside this node can isolate anything.
        int[] candidates = new int[features.length];
        double[] mins = new double[features.length];
        double[] maxs = new double[features.length];
        int candidateCount = 0;
        for (int feature : features) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < count; i++) {
                double v = sample[rows[i]][feature];
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            if (max > min) {
                candidates[candidateCount] = feature;
                mins[candidateCount] = min;
                maxs[candidateCount] = max;
                candidateCount++;
            }
        }
        if (candidateCount == 0) {
            return IsolationNode.leaf(count);
        }

        int pick = random.nextInt(candidateCount);
        int feature = candidates[pick];
        double threshold = mins[pick] + random.nextDouble() * (maxs[pick] - mins[pick]);

        // Left holds values <= threshold.
        int[] partitioned = new int[count];
        int leftCount = 0;
        int rightIndex = count;
        for (int i = 0; i < count; i++) {
            int row = rows[i];
            if (sample[row][feature] <= threshold) {
                partitioned[leftCount++] = row;
            } else {
                partitioned[--rightIndex] = row;
            }
        }
        int[] leftRows = new int[leftCount];
        int[] rightRows = new int[count - leftCount];
        System.arraycopy(partitioned, 0, leftRows, 0, leftCount);
        System.arraycopy(partitioned, leftCount, rightRows, 0, count - leftCount);

        return IsolationNode.split(feature, threshold, count,
                grow(sample, leftRows, leftRows.length, features, depth + 1, maxDepth, random),
                grow(sample, rightRows, rightRows.length, features, depth + 1, maxDepth, random));
    }
}
