package com.fleet.anomaly.controller;

import com.fleet.anomaly.model.AnalysisOptions;
import com.fleet.anomaly.model.AnalysisRequest;
import com.fleet.anomaly.model.AnalysisResult;
import com.fleet.anomaly.model.DiscrepancySeries;
import com.fleet.anomaly.model.MissingFeaturePolicy;
import com.fleet.anomaly.model.ScanRecord;
import com.fleet.anomaly.model.SeriesRequest;
import com.fleet.anomaly.service.DeviceAnomalyAnalysisService;
import com.fleet.anomaly.service.DiscrepancySeriesService;
import com.fleet.anomaly.service.ScanCsvReader;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analysis")
@Tag(name = "Analysis", description = "Fleet-wide process-count anomaly detection")
public class AnalysisController {

    private final DeviceAnomalyAnalysisService analysisService;
    private final DiscrepancySeriesService seriesService;
    private final ScanCsvReader csvReader;

    public AnalysisController(DeviceAnomalyAnalysisService analysisService,
                              DiscrepancySeriesService seriesService,
                              ScanCsvReader csvReader) {
        this.analysisService = analysisService;
        this.seriesService = seriesService;
        this.csvReader = csvReader;
    }

    @Operation(summary = "Analyse a batch of scan records",
            description = "Aggregates the records into per-device discrepancy statistics, scores every device " +
                    "with an Isolation Forest and flags the top contamination fraction. Unset parameters use the " +
                    "configured defaults.")
    @PostMapping
    public ResponseEntity<AnalysisResult> analyze(@RequestBody AnalysisRequest request) {
        return ResponseEntity.ok(analysisService.analyze(request.getRecords(), request.toOptions()));
    }

    @Operation(summary = "Analyse a CSV scan export",
            description = "Accepts the tabular export with columns device, scan, procName, scan_proc_count " +
                    "and optionally timestamp. A leading unnamed index column is ignored.")
    @PostMapping(value = "/csv", consumes = {"text/csv", "text/plain"})
    public ResponseEntity<AnalysisResult> analyzeCsv(
            @RequestBody String csv,
            @Parameter(description = "Expected fraction of anomalous devices, 0 < c < 1", example = "0.15")
            @RequestParam(required = false) Double contamination,
            @Parameter(description = "Number of isolation trees", example = "100")
            @RequestParam(required = false) Integer numTrees,
            @Parameter(description = "Sub-sampling size per tree", example = "256")
            @RequestParam(required = false) Integer sampleSize,
            @Parameter(description = "Random seed", example = "42")
            @RequestParam(required = false) Long seed,
            @Parameter(description = "Handling of single-scan devices", example = "EXCLUDE")
            @RequestParam(required = false) MissingFeaturePolicy missingFeaturePolicy,
            @Parameter(description = "Log a per-device anomaly report", example = "false")
            @RequestParam(required = false) Boolean verbose) {

        List<ScanRecord> records = csvReader.read(csv);
        AnalysisOptions options = AnalysisOptions.builder()
                .contamination(contamination)
                .numTrees(numTrees)
                .sampleSize(sampleSize)
                .seed(seed)
                .missingFeaturePolicy(missingFeaturePolicy)
                .verbose(verbose)
                .build();
        return ResponseEntity.ok(analysisService.analyze(records, options));
    }

    @Operation(summary = "Per-device discrepancy series with change points",
            description = "Returns each device's discrepancy per scan, ordered by scan id, with the indexes at " +
                    "which a change-point search (PELT, L2 cost) detected a shift. Intended for plotting.")
    @PostMapping("/series")
    public ResponseEntity<List<DiscrepancySeries>> series(@RequestBody SeriesRequest request) {
        return ResponseEntity.ok(seriesService.seriesFor(request.getRecords(), request.getPenalty()));
    }
}
