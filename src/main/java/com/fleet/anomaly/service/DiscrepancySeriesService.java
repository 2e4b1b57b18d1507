package com.fleet.anomaly.service;

import com.fleet.anomaly.config.AnalysisConfig;
import com.fleet.anomaly.engine.ScanAggregator;
import com.fleet.anomaly.engine.changepoint.PeltChangePointDetector;
import com.fleet.anomaly.model.DiscrepancySeries;
import com.fleet.anomaly.model.DiscrepancySeries.SeriesPoint;
import com.fleet.anomaly.model.ScanRecord;
import com.fleet.anomaly.model.ScanSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the per-device discrepancy time series that plotting tools render, with change points
 * marking where a device's reporting behaviour shifted.
 *
 * Independent of classification: a device whose change-point search fails still gets its series.
 */
@Service
public class DiscrepancySeriesService {

    private static final Logger log = LoggerFactory.getLogger(DiscrepancySeriesService.class);

    static final Comparator<String> SCAN_ORDER = (a, b) -> {
        Long na = asNumber(a);
        Long nb = asNumber(b);
        if (na != null && nb != null) return Long.compare(na, nb);
        if (na != null) return -1;
        if (nb != null) return 1;
        return a.compareTo(b);
    };

    private final ScanAggregator aggregator;
    private final AnalysisConfig config;

    public DiscrepancySeriesService(ScanAggregator aggregator, AnalysisConfig config) {
        this.aggregator = aggregator;
        this.config = config;
    }

    /**
     * Series for every device, in first-seen order.
     *
     * @param penalty change-point penalty, or null for the configured one
     */
    public List<DiscrepancySeries> seriesFor(List<ScanRecord> records, Double penalty) {
        AnalysisConfig.ChangePoint cp = config.getChangePoint();
        PeltChangePointDetector detector = new PeltChangePointDetector(
                penalty != null ? penalty : cp.getPenalty(), cp.getMinSize(), cp.getJump());

        Map<String, List<ScanSummary>> byDevice = new LinkedHashMap<>();
        for (ScanSummary summary : aggregator.summarize(records)) {
            byDevice.computeIfAbsent(summary.deviceId(), d -> new ArrayList<>()).add(summary);
        }

        List<DiscrepancySeries> series = new ArrayList<>(byDevice.size());
        byDevice.forEach((deviceId, scans) -> series.add(buildSeries(deviceId, scans, detector)));
        log.debug("Built discrepancy series for {} devices (penalty={})", series.size(), detector.getPenalty());
        return series;
    }

    private DiscrepancySeries buildSeries(String deviceId, List<ScanSummary> scans,
                                          PeltChangePointDetector detector) {
        List<ScanSummary> ordered = new ArrayList<>(scans);
        ordered.sort(Comparator.comparing(ScanSummary::scanId, SCAN_ORDER));

        List<SeriesPoint> points = new ArrayList<>(ordered.size());
        double[] signal = new double[ordered.size()];
        double sum = 0.0;
        for (int i = 0; i < ordered.size(); i++) {
            ScanSummary s = ordered.get(i);
            points.add(new SeriesPoint(s.scanId(), s.discrepancy()));
            signal[i] = s.discrepancy();
            sum += s.discrepancy();
        }

        DiscrepancySeries.DiscrepancySeriesBuilder builder = DiscrepancySeries.builder()
                .deviceId(deviceId)
                .points(points)
                .mean(sum / signal.length)
                .changePoints(List.of());
        try {
            builder.changePoints(detector.detect(signal));
        } catch (RuntimeException e) {
            log.warn("Skipping change points for device {}: {} - {}",
                    deviceId, e.getClass().getSimpleName(), e.getMessage());
            builder.changePointError(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        return builder.build();
    }

    private static Long asNumber(String token) {
        try {
            return Long.parseLong(token.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
