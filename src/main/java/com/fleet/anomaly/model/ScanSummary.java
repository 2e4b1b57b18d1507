package com.fleet.anomaly.model;

/**
 * One row per device and scan: how many process rows were observed versus what the device reported.
 */
public record ScanSummary(String deviceId,
                          String scanId,
                          int observedProcCount,
                          int reportedProcCount) {

    public int discrepancy() {
        return observedProcCount - reportedProcCount;
    }
}
