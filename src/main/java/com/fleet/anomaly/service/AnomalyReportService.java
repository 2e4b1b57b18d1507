package com.fleet.anomaly.service;

import com.fleet.anomaly.model.AnalysisResult;
import com.fleet.anomaly.model.DeviceFeatures;
import com.fleet.anomaly.model.ScoredDevice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable per-device report of an analysis run, written to the log.
 */
@Service
public class AnomalyReportService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyReportService.class);

    public void report(AnalysisResult result) {
        log.info(summaryLine(result));
        for (ScoredDevice device : result.getScoredDevices()) {
            if (device.isAnomaly()) {
                log.warn(anomalyLine(device));
            }
        }
        for (DeviceFeatures device : result.getInsufficientDataDevices()) {
            log.info(insufficientLine(device));
        }
    }

    /**
     * The lines {@link #report} logs, in the same order.
     */
    public List<String> render(AnalysisResult result) {
        List<String> lines = new ArrayList<>();
        lines.add(summaryLine(result));
        for (ScoredDevice device : result.getScoredDevices()) {
            if (device.isAnomaly()) {
                lines.add(anomalyLine(device));
            }
        }
        for (DeviceFeatures device : result.getInsufficientDataDevices()) {
            lines.add(insufficientLine(device));
        }
        return lines;
    }

    private String summaryLine(AnalysisResult result) {
        return String.format(Locale.ROOT,
                "Anomaly report: %d devices scored, %d anomalous, %d with insufficient data",
                result.getScoredDevices().size(),
                result.getAnomalousDevices().size(),
                result.getInsufficientDataDevices().size());
    }

    private String anomalyLine(ScoredDevice device) {
        return String.format(Locale.ROOT,
                "Attention: device %s is an anomaly (score = %.4f, normalized = %.4f, mean discrepancy = %.2f, std = %.2f) - needs investigation.",
                device.getDeviceId(), device.getRawScore(), device.getNormalizedScore(),
                device.getMeanDiscrepancy(), device.getStdDiscrepancy());
    }

    private String insufficientLine(DeviceFeatures device) {
        return String.format(Locale.ROOT,
                "Device %s has insufficient data (%d scan) and was not scored.",
                device.deviceId(), device.scanCount());
    }
}
