package com.fleet.anomaly.engine.isolationforest;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Flags the top contamination fraction of a batch by anomaly score.
 */
public final class ContaminationThreshold {

    private ContaminationThreshold() {}

    /**
     * Number of points flagged for a batch of the given size: round(c * n), halves rounded up.
     */
    public static int anomalyCount(int n, double contamination) {
        return (int) Math.round(contamination * n);
    }

    /**
     * @param anomalyScores isolation scores, higher is more anomalous
     * @return per-point flag; the highest-scoring points win, earlier points win ties
     */
    public static boolean[] label(double[] anomalyScores, double contamination) {
        int n = anomalyScores.length;
        boolean[] labels = new boolean[n];
        int k = anomalyCount(n, contamination);
        if (k == 0) return labels;

        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) order[i] = i;
        // Arrays.sort on objects is stable, so equal scores keep input order
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> anomalyScores[i]).reversed());

        for (int rank = 0; rank < k; rank++) {
            labels[order[rank]] = true;
        }
        return labels;
    }
}
