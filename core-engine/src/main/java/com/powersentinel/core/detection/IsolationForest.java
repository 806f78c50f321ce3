package com.powersentinel.core.detection;

import java.util.Random;

/**
 * One-dimensional isolation forest.
 *
 * <p>
 * Each tree is grown on a sub-sample drawn without replacement, splitting
 * at a uniformly random point between the current minimum and maximum until
 * a point is isolated or the height limit {@code ceil(log2(sampleSize))} is
 * reached. The anomaly score of {@code x} is
 * {@code 2^(-E[h(x)] / c(sampleSize))}, where {@code h} is the path length
 * and {@code c(n)} the average path length of an unsuccessful search in a
 * binary search tree of {@code n} nodes. Scores near 1 are outliers.
 * </p>
 *
 * <p>
 * Growth depends only on the data and the seed, so equal inputs give equal
 * scores.
 * </p>
 */
final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final Node[] roots;
    private final int sampleSize;

    private IsolationForest(Node[] roots, int sampleSize) {
        this.roots = roots;
        this.sampleSize = sampleSize;
    }

    /**
     * @param data       training values, at least two
     * @param trees      number of trees, &gt;= 1
     * @param sampleSize requested sub-sample size; capped at
     *                   {@code data.length}
     * @param seed       random seed
     */
    static IsolationForest fit(double[] data, int trees, int sampleSize, long seed) {
        if (data.length < 2) {
            throw new IllegalArgumentException("Isolation forest needs at least 2 points, got: " + data.length);
        }
        if (trees < 1) {
            throw new IllegalArgumentException("trees must be >= 1, got: " + trees);
        }
        Random random = new Random(seed);
        int psi = Math.min(sampleSize, data.length);
        int heightLimit = (int) Math.ceil(Math.log(psi) / Math.log(2));

        Node[] roots = new Node[trees];
        int[] indices = new int[data.length];
        for (int t = 0; t < trees; t++) {
            for (int i = 0; i < indices.length; i++) {
                indices[i] = i;
            }
            double[] sample = new double[psi];
            for (int i = 0; i < psi; i++) {
                int j = i + random.nextInt(indices.length - i);
                int swap = indices[i];
                indices[i] = indices[j];
                indices[j] = swap;
                sample[i] = data[indices[i]];
            }
            roots[t] = grow(sample, 0, heightLimit, random);
        }
        return new IsolationForest(roots, psi);
    }

    /** Anomaly score in (0, 1]. */
    double score(double x) {
        double total = 0;
        for (Node root : roots) {
            total += pathLength(root, x);
        }
        double mean = total / roots.length;
        return Math.pow(2, -mean / averagePathLength(sampleSize));
    }

    private static Node grow(double[] values, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || values.length <= 1) {
            return Node.leaf(values.length);
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (min == max) {
            return Node.leaf(values.length);
        }

        double split = min + random.nextDouble() * (max - min);
        int leftCount = 0;
        for (double v : values) {
            if (v < split) {
                leftCount++;
            }
        }
        double[] left = new double[leftCount];
        double[] right = new double[values.length - leftCount];
        int l = 0;
        int r = 0;
        for (double v : values) {
            if (v < split) {
                left[l++] = v;
            } else {
                right[r++] = v;
            }
        }
        return Node.split(split, grow(left, depth + 1, heightLimit, random),
                grow(right, depth + 1, heightLimit, random));
    }

    private static double pathLength(Node node, double x) {
        int depth = 0;
        Node current = node;
        while (!current.isLeaf()) {
            current = x < current.split ? current.left : current.right;
            depth++;
        }
        return depth + averagePathLength(current.size);
    }

    /**
     * {@code c(n) = 2 H(n - 1) - 2 (n - 1) / n}, with {@code c(2) = 1} and
     * {@code c(n <= 1) = 0}.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0;
        }
        if (n == 2) {
            return 1;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2 * harmonic - 2.0 * (n - 1) / n;
    }

    // ---------------------------------------------------------------
    // Tree node
    // ---------------------------------------------------------------

    private static final class Node {

        final double split;
        final Node left;
        final Node right;
        final int size;

        private Node(double split, Node left, Node right, int size) {
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(Double.NaN, null, null, size);
        }

        static Node split(double split, Node left, Node right) {
            return new Node(split, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
