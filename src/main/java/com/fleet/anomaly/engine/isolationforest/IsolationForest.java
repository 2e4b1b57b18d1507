package com.fleet.anomaly.engine.isolationforest;

import com.fleet.anomaly.exception.InsufficientDataException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Ensemble of isolation trees over a fixed batch of points.
 *
 * Per-tree seeds are drawn up front, in tree order, from a single {@code Random(seed)}; tree
 * {@code i} then draws from its own {@code Random(treeSeeds[i])}, so the forest is the same
 * whether the trees are built one after another or in parallel. Scores follow the usual convention:
 * close to 1.0 means easy to isolate (anomalous), 0.5 or below means normal.
 */
public class IsolationForest {

    private List<IsolationTree> trees;
    private int sampleSize;

    public IsolationForest() {
        this.trees = new ArrayList<>();
    }

    /**
     * Train the isolation forest on the given data.
     *
     * @param data       training samples, each row is a feature vector
     * @param numTrees   number of trees in the forest (typically 100)
     * @param sampleSize sub-sampling size per tree (typically 256), capped at the number of rows
     * @param seed       seed of the generator the per-tree seeds are drawn from
     * @param parallel   build the trees on the common fork-join pool
     * @throws InsufficientDataException with fewer than two rows
     */
    public void train(double[][] data, int numTrees, int sampleSize, long seed, boolean parallel) {
        if (data.length < 2) {
            throw new InsufficientDataException(
                    "Isolation forest needs at least 2 devices with complete features, got " + data.length);
        }
        this.sampleSize = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(this.sampleSize) / Math.log(2));

        // Tree seeds come from one generator; consecutive seeds would correlate the trees' first draws
        Random seeds = new Random(seed);
        long[] treeSeeds = new long[numTrees];
        for (int i = 0; i < numTrees; i++) {
            treeSeeds[i] = seeds.nextLong();
        }

        IntStream treeIndexes = IntStream.range(0, numTrees);
        if (parallel) {
            treeIndexes = treeIndexes.parallel();
        }
        // Ordered collect keeps tree i at position i regardless of scheduling
        this.trees = treeIndexes
                .mapToObj(i -> {
                    Random random = new Random(treeSeeds[i]);
                    double[][] sample = subsample(data, this.sampleSize, random);
                    return IsolationTree.build(sample, maxDepth, random);
                })
                .collect(Collectors.toList());
    }

    /**
     * Mean path length of a point over all trees, including the c(size) adjustment at leaves.
     */
    public double averagePathLength(double[] point) {
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return total / trees.size();
    }

    /**
     * Compute anomaly score for a single point.
     *
     * @return score in (0.0, 1.0]; higher is more anomalous
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double avgPathLength = averagePathLength(point);

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        // s(x, n) = 2^(-E(h(x)) / c(n))
        return Math.pow(2.0, -avgPathLength / c);
    }

    public double[] anomalyScores(double[][] points) {
        double[] scores = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            scores[i] = anomalyScore(points[i]);
        }
        return scores;
    }

    private double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // Partial Fisher-Yates shuffle on indices, without replacement
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public int getSampleSize() { return sampleSize; }
}
