package com.fleet.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A device that went through the isolation forest, with its classification")
public class ScoredDevice {

    @Schema(description = "Device identifier", example = "iphone-017")
    private String deviceId;

    @Schema(description = "Number of distinct scans seen for the device", example = "12")
    private int scanCount;

    @Schema(description = "Mean of (observed - reported) process count", example = "-0.25")
    private double meanDiscrepancy;

    @Schema(description = "Sample standard deviation of the discrepancy; NaN for a single-scan device " +
            "scored under ZERO_VARIANCE", example = "1.12")
    private double stdDiscrepancy;

    @Schema(description = "True when the device falls in the contamination fraction", example = "false")
    private boolean anomaly;

    @Schema(description = "Negated isolation score in [-1, 0). Lower = more anomalous", example = "-0.47")
    private double rawScore;

    @Schema(description = "Min-max scaled score in [0, 1]. Higher = more anomalous", example = "0.08")
    private double normalizedScore;
}
