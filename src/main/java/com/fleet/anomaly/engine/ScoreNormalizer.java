package com.fleet.anomaly.engine;

/**
 * Min-max scaling of negated raw scores, so that 1.0 is the most anomalous device of the batch
 * and 0.0 the least. A batch whose raw scores are all equal maps to all zeros.
 */
public final class ScoreNormalizer {

    private ScoreNormalizer() {}

    public static double[] normalize(double[] rawScores) {
        double[] normalized = new double[rawScores.length];
        if (rawScores.length == 0) return normalized;

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double raw : rawScores) {
            double flipped = -raw;
            if (flipped < min) min = flipped;
            if (flipped > max) max = flipped;
        }

        double range = max - min;
        if (range <= 0) return normalized;

        for (int i = 0; i < rawScores.length; i++) {
            normalized[i] = (-rawScores[i] - min) / range;
        }
        return normalized;
    }
}
