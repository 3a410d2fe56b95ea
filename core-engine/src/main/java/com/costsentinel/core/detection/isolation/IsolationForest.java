package com.costsentinel.core.detection.isolation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Isolation forest over small numeric feature matrices.
 *
 * <p>
 * Points that are isolated after few random splits receive high scores.
 * Scores follow {@code s(x) = 2^(-E[h(x)] / c(psi))} and lie in (0, 1];
 * values near 1 are anomalous, values well below 0.5 are normal.
 * </p>
 *
 * <p>
 * Training is fully determined by the seed, so the same data and parameters
 * always produce the same scores. A trained forest is immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = Collections.unmodifiableList(trees);
        this.sampleSize = sampleSize;
    }

    /**
     * Grow a forest.
     *
     * @param rows       training rows, each a feature vector of equal length
     * @param treeCount  number of trees
     * @param sampleSize rows drawn per tree (capped at the row count)
     * @param seed       random seed
     * @return the trained forest
     * @throws IllegalArgumentException if there are no rows or the sizes are
     *                                  not positive
     */
    public static IsolationForest train(double[][] rows, int treeCount, int sampleSize, long seed) {
        Objects.requireNonNull(rows, "rows must not be null");
        if (rows.length == 0) {
            throw new IllegalArgumentException("rows must not be empty");
        }
        if (treeCount < 1 || sampleSize < 1) {
            throw new IllegalArgumentException("treeCount and sampleSize must be >= 1, got: "
                    + treeCount + ", " + sampleSize);
        }

        int psi = Math.min(sampleSize, rows.length);
        int maxDepth = (int) Math.ceil(Math.log(psi) / Math.log(2));
        Random random = new Random(seed);
        List<IsolationTree> trees = new ArrayList<>(treeCount);
        for (int i = 0; i < treeCount; i++) {
            trees.add(IsolationTree.grow(subsample(rows, psi, random), maxDepth, random));
        }
        return new IsolationForest(trees, psi);
    }

    /**
     * @param point feature vector of the training width
     * @return anomaly score in (0, 1], higher is more anomalous
     */
    public double score(double[] point) {
        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0.0) {
            return 0.0;
        }
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return Math.pow(2.0, -(total / trees.size()) / c);
    }

    /**
     * @return the score of every row, in row order
     */
    public double[] scoreAll(double[][] rows) {
        double[] scores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            scores[i] = score(rows[i]);
        }
        return scores;
    }

    public int getTreeCount() {
        return trees.size();
    }

    private static double[][] subsample(double[][] rows, int size, Random random) {
        if (rows.length <= size) {
            return Arrays.copyOf(rows, rows.length);
        }
        // partial Fisher-Yates over row indices
        int[] indices = new int[rows.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(rows.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = rows[indices[i]];
        }
        return sample;
    }
}
