package com.costsentinel.core.detection.isolation;

/**
 * One node of an isolation tree: either a split on a feature or a leaf that
 * remembers how many sample rows reached it.
 */
final class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size;

    private IsolationNode(int splitFeature, double splitValue, IsolationNode left, IsolationNode right, int size) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    static IsolationNode split(int feature, double value, IsolationNode left, IsolationNode right) {
        return new IsolationNode(feature, value, left, right, 0);
    }

    static IsolationNode leaf(int size) {
        return new IsolationNode(-1, Double.NaN, null, null, size);
    }

    boolean isLeaf() {
        return left == null;
    }

    /**
     * Depth at which {@code point} is isolated, with the expected remaining
     * depth added for leaves that still hold several rows.
     */
    double pathLength(double[] point, int depth) {
        IsolationNode node = this;
        int current = depth;
        while (!node.isLeaf()) {
            node = point[node.splitFeature] < node.splitValue ? node.left : node.right;
            current++;
        }
        return current + averagePathLength(node.size);
    }

    /**
     * Average path length of an unsuccessful binary-search-tree lookup over
     * {@code n} rows: {@code c(n) = 2H(n-1) - 2(n-1)/n}.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - (2.0 * (n - 1.0) / n);
    }
}
