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
@Schema(description = "Scan records for which to build per-device discrepancy series")
public class SeriesRequest {

    @Schema(description = "Raw process rows, one per observed process per scan")
    private List<ScanRecord> records;

    @Schema(description = "Change-point penalty; larger values give fewer change points", example = "1000")
    private Double penalty;
}
