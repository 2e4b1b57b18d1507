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
@Schema(description = "One process row observed on a device during a scan")
public class ScanRecord {

    @Schema(description = "Device identifier", example = "iphone-017")
    private String deviceId;

    @Schema(description = "Scan identifier. Numeric tokens are ordered numerically, others lexicographically", example = "42")
    private String scanId;

    @Schema(description = "Name of the observed process", example = "launchd")
    private String processName;

    @Schema(description = "Process count the device itself reported for this scan", example = "311")
    private Integer reportedProcCount;

    @Schema(description = "Scan timestamp as exported. Not used for scoring", example = "2024-05-03 10:15:00")
    private String timestamp;
}
