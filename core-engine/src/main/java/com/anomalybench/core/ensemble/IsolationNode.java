package com.anomalybench.core.ensemble;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Node of an isolation tree: either an internal split or a leaf that
 * remembers how many training samples reached it.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
final class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649015329;

    /** Split feature, or {@code -1} for a leaf. */
    private int feature = -1;
    private double threshold;
    private int size;
    private IsolationNode left;
    private IsolationNode right;

    private IsolationNode() {
        // for Jackson
    }

    static IsolationNode leaf(int size) {
        IsolationNode node = new IsolationNode();
        node.size = size;
        return node;
    }

    static IsolationNode split(int feature, double threshold, int size, IsolationNode left, IsolationNode right) {
        IsolationNode node = new IsolationNode();
        node.feature = feature;
        node.threshold = threshold;
        node.size = size;
        node.left = left;
        node.right = right;
        return node;
    }

    boolean isLeaf() {
        return feature < 0;
    }

    /**
     * Depth at which {@code point} is isolated, plus the expected remaining
     * depth for the samples sharing its leaf.
     */
    double pathLength(double[] point) {
        IsolationNode node = this;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.feature] <= node.threshold ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree
     * of {@code n} nodes.
     *
     * @param n sample count
     * @return {@code c(n)}
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }
}
