package com.fleet.anomaly.model;

/**
 * What to do with a device whose standard deviation is undefined (a single scan).
 */
public enum MissingFeaturePolicy {
    /** Leave the device out of scoring and report it as insufficient data. */
    EXCLUDE,
    /** Score the device with a standard deviation of zero. */
    ZERO_VARIANCE
}
