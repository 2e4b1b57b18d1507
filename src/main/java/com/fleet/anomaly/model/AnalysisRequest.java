package com.fleet.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Scan records to analyse plus optional parameters")
public class AnalysisRequest {

    @Schema(description = "Raw process rows, one per observed process per scan")
    private List<ScanRecord> records;

    @Schema(description = "Expected fraction of anomalous devices, 0 < c < 1", example = "0.15")
    private Double contamination;

    @Schema(description = "Number of isolation trees", example = "100")
    private Integer numTrees;

    @Schema(description = "Sub-sample size per tree", example = "256")
    private Integer sampleSize;

    @Schema(description = "Random seed", example = "42")
    private Long seed;

    @Schema(description = "Handling of devices with a single scan", example = "EXCLUDE")
    private MissingFeaturePolicy missingFeaturePolicy;

    @Schema(description = "Log a per-device anomaly report", example = "false")
    private Boolean verbose;

    public AnalysisOptions toOptions() {
        return AnalysisOptions.builder()
                .contamination(contamination)
                .numTrees(numTrees)
                .sampleSize(sampleSize)
                .seed(seed)
                .missingFeaturePolicy(missingFeaturePolicy)
                .verbose(verbose)
                .build();
    }
}
