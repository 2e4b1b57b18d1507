package com.fleet.anomaly.engine.isolationforest;

import java.util.Random;

public class IsolationTree {

    private final IsolationNode root;

    public IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        IsolationNode root = buildNode(data, 0, maxDepth, random);
        return new IsolationTree(root);
    }

    private static IsolationNode buildNode(double[][] data, int depth, int maxDepth, Random random) {
        int n = data.length;

        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.externalNode(n);
        }

        int numFeatures = data[0].length;
        double[] mins = new double[numFeatures];
        double[] maxs = new double[numFeatures];
        int[] candidates = new int[numFeatures];
        int candidateCount = 0;

        // Only features that still vary inside this node can split it
        for (int f = 0; f < numFeatures; f++) {
            double min = Double.MAX_VALUE;
            double max = -Double.MAX_VALUE;
            for (double[] row : data) {
                if (row[f] < min) min = row[f];
                if (row[f] > max) max = row[f];
            }
            mins[f] = min;
            maxs[f] = max;
            if (min < max) {
                candidates[candidateCount++] = f;
            }
        }

        // Identical points cannot be separated any further
        if (candidateCount == 0) {
            return IsolationNode.externalNode(n);
        }

        int featureIdx = candidates[random.nextInt(candidateCount)];
        double min = mins[featureIdx];
        double max = maxs[featureIdx];
        double splitValue = min + random.nextDouble() * (max - min);

        int leftCount = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) leftCount++;
        }

        double[][] leftData = new double[leftCount][];
        double[][] rightData = new double[n - leftCount][];
        int li = 0, ri = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) {
                leftData[li++] = row;
            } else {
                rightData[ri++] = row;
            }
        }

        IsolationNode left = buildNode(leftData, depth + 1, maxDepth, random);
        IsolationNode right = buildNode(rightData, depth + 1, maxDepth, random);

        return IsolationNode.internalNode(featureIdx, splitValue, left, right);
    }

    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    public IsolationNode getRoot() { return root; }
}
