package com.fleet.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Per-device discrepancy statistics fed to the detector.
 * {@code stdDiscrepancy} is NaN when the device has fewer than two scans.
 */
@Schema(description = "Discrepancy statistics of one device across all of its scans")
public record DeviceFeatures(
        @Schema(description = "Device identifier", example = "iphone-017")
        String deviceId,
        @Schema(description = "Number of distinct scans seen for the device", example = "12")
        int scanCount,
        @Schema(description = "Mean of (observed - reported) process count", example = "-0.25")
        double meanDiscrepancy,
        @Schema(description = "Sample standard deviation of the discrepancy; NaN with fewer than two scans", example = "1.12")
        double stdDiscrepancy) {

    public boolean hasStdDiscrepancy() {
        return !Double.isNaN(stdDiscrepancy);
    }
}
