package com.fleet.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of one anomaly analysis over a batch of scans")
public class AnalysisResult {

    @Schema(description = "Devices classified as anomalous, in input order")
    private Set<String> anomalousDevices;

    @Schema(description = "Every device that was scored, in input order")
    private List<ScoredDevice> scoredDevices;

    @Schema(description = "Devices left out of scoring because a feature was undefined")
    private List<DeviceFeatures> insufficientDataDevices;

    @Schema(description = "Number of distinct devices in the input", example = "40")
    private int deviceCount;

    @Schema(description = "Number of distinct (device, scan) pairs in the input", example = "480")
    private int scanCount;

    @Schema(description = "Contamination fraction used for the threshold", example = "0.15")
    private double contamination;

    @Schema(description = "Number of isolation trees", example = "100")
    private int numTrees;

    @Schema(description = "Effective sub-sample size per tree, min(configured, scored devices)", example = "40")
    private int sampleSize;

    @Schema(description = "Random seed", example = "42")
    private long seed;

    @Schema(description = "Policy applied to devices with an undefined standard deviation", example = "EXCLUDE")
    private MissingFeaturePolicy missingFeaturePolicy;
}
