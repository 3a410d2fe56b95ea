package com.costsentinel.core.detection.isolation;

import java.util.Random;

/**
 * A single random isolation tree grown on a sub-sample.
 */
final class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] rows, int maxDepth, Random random) {
        return new IsolationTree(grow(rows, 0, maxDepth, random));
    }

    double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    private static IsolationNode grow(double[][] rows, int depth, int maxDepth, Random random) {
        int n = rows.length;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.leaf(n);
        }

        int feature = random.nextInt(rows[0].length);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : rows) {
            min = Math.min(min, row[feature]);
            max = Math.max(max, row[feature]);
        }
        // constant on this feature
        if (min >= max) {
            return IsolationNode.leaf(n);
        }

        double split = min + random.nextDouble() * (max - min);
        int leftCount = 0;
        for (double[] row : rows) {
            if (row[feature] < split) {
                leftCount++;
            }
        }
        double[][] left = new double[leftCount][];
        double[][] right = new double[n - leftCount][];
        int l = 0;
        int r = 0;
        for (double[] row : rows) {
            if (row[feature] < split) {
                left[l++] = row;
            } else {
                right[r++] = row;
            }
        }
        return IsolationNode.split(feature, split,
                grow(left, depth + 1, maxDepth, random),
                grow(right, depth + 1, maxDepth, random));
    }
}
