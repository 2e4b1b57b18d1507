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
@Schema(description = "Discrepancy over time for one device, with detected change points")
public class DiscrepancySeries {

    @Schema(description = "Device identifier", example = "iphone-017")
    private String deviceId;

    @Schema(description = "Discrepancy per scan, ordered by scan id")
    private List<SeriesPoint> points;

    @Schema(description = "Mean discrepancy over the series", example = "0.4")
    private double mean;

    @Schema(description = "Indexes into points where a new segment begins")
    private List<Integer> changePoints;

    @Schema(description = "Why change points are missing, when detection failed for this device")
    private String changePointError;

    @Schema(description = "A single scan's discrepancy")
    public record SeriesPoint(String scanId, int discrepancy) {}
}
