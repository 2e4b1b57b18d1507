package com.fleet.anomaly.engine.changepoint;

import com.fleet.anomaly.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Penalised change-point search (PELT) with an L2 segment cost.
 *
 * The cost of a segment is the sum of squared deviations from its own mean. Each segment adds
 * {@code penalty} to the total, so a larger penalty yields fewer change points. Candidate
 * boundaries are restricted to multiples of {@code jump}, and no segment is shorter than
 * {@code minSize}.
 */
public class PeltChangePointDetector {

    private final double penalty;
    private final int minSize;
    private final int jump;

    public PeltChangePointDetector(double penalty, int minSize, int jump) {
        if (Double.isNaN(penalty) || penalty < 0) {
            throw new ConfigurationException("Change-point penalty must be >= 0, got " + penalty);
        }
        if (minSize < 1) {
            throw new ConfigurationException("Change-point min size must be >= 1, got " + minSize);
        }
        if (jump < 1) {
            throw new ConfigurationException("Change-point jump must be >= 1, got " + jump);
        }
        this.penalty = penalty;
        this.minSize = minSize;
        this.jump = jump;
    }

    /**
     * @return indexes at which a new segment starts, ascending; the end of the signal is not included
     */
    public List<Integer> detect(double[] signal) {
        int n = signal.length;
        if (n < 2 * minSize) {
            return Collections.emptyList();
        }

        double[] prefixSum = new double[n + 1];
        double[] prefixSumSq = new double[n + 1];
        for (int i = 0; i < n; i++) {
            prefixSum[i + 1] = prefixSum[i] + signal[i];
            prefixSumSq[i + 1] = prefixSumSq[i] + signal[i] * signal[i];
        }

        // best[t]: optimal penalised cost of signal[0, t); previous[t]: start of its last segment
        double[] best = new double[n + 1];
        int[] previous = new int[n + 1];
        boolean[] solved = new boolean[n + 1];
        best[0] = 0.0;
        solved[0] = true;

        List<Integer> ends = new ArrayList<>();
        for (int k = 0; k < n; k += jump) {
            if (k >= minSize) ends.add(k);
        }
        ends.add(n);

        List<Integer> admissible = new ArrayList<>();
        for (int end : ends) {
            int newCandidate = ((end - minSize) / jump) * jump;
            admissible.add(newCandidate);

            double[] candidateCost = new double[admissible.size()];
            double min = Double.POSITIVE_INFINITY;
            int argMin = -1;
            for (int a = 0; a < admissible.size(); a++) {
                int start = admissible.get(a);
                if (start < 0 || !solved[start] || end - start < 1) {
                    candidateCost[a] = Double.NaN;
                    continue;
                }
                double cost = best[start] + segmentCost(prefixSum, prefixSumSq, start, end) + penalty;
                candidateCost[a] = cost;
                if (cost < min) {
                    min = cost;
                    argMin = start;
                }
            }
            if (argMin < 0) {
                continue;
            }
            best[end] = min;
            previous[end] = argMin;
            solved[end] = true;

            // Prune starts that can no longer beat the optimum
            List<Integer> kept = new ArrayList<>(admissible.size());
            for (int a = 0; a < admissible.size(); a++) {
                if (!Double.isNaN(candidateCost[a]) && candidateCost[a] <= min + penalty) {
                    kept.add(admissible.get(a));
                }
            }
            admissible = kept;
        }

        if (!solved[n]) {
            return Collections.emptyList();
        }

        List<Integer> changePoints = new ArrayList<>();
        int cursor = previous[n];
        while (cursor > 0) {
            changePoints.add(cursor);
            cursor = previous[cursor];
        }
        Collections.reverse(changePoints);
        return changePoints;
    }

    static double segmentCost(double[] prefixSum, double[] prefixSumSq, int start, int end) {
        int length = end - start;
        double sum = prefixSum[end] - prefixSum[start];
        double sumSq = prefixSumSq[end] - prefixSumSq[start];
        double cost = sumSq - sum * sum / length;
        return Math.max(0.0, cost);
    }

    public double getPenalty() { return penalty; }
}
