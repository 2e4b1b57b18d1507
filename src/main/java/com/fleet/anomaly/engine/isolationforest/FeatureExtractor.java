package com.fleet.anomaly.engine.isolationforest;

import com.fleet.anomaly.model.DeviceFeatures;
import com.fleet.anomaly.model.MissingFeaturePolicy;

/**
 * Maps device statistics onto the 2-dimensional vector the forest works on.
 *
 * Features:
 *   [0] Mean discrepancy (observed - reported process count)
 *   [1] Sample standard deviation of the discrepancy
 */
public final class FeatureExtractor {

    public static final int FEATURE_COUNT = 2;

    private FeatureExtractor() {}

    public static boolean isScorable(DeviceFeatures features, MissingFeaturePolicy policy) {
        return features.hasStdDiscrepancy() || policy == MissingFeaturePolicy.ZERO_VARIANCE;
    }

    /**
     * Callers check {@link #isScorable} first; an excluded device has no vector.
     */
    public static double[] extract(DeviceFeatures features, MissingFeaturePolicy policy) {
        if (!isScorable(features, policy)) {
            throw new IllegalArgumentException("Device " + features.deviceId()
                    + " has no standard deviation and policy is " + policy);
        }
        double[] vector = new double[FEATURE_COUNT];
        vector[0] = features.meanDiscrepancy();
        vector[1] = features.hasStdDiscrepancy() ? features.stdDiscrepancy() : 0.0;
        return vector;
    }
}
