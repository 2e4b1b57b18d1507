package com.fleet.anomaly.engine;

import com.fleet.anomaly.exception.MalformedInputException;
import com.fleet.anomaly.model.DeviceFeatures;
import com.fleet.anomaly.model.ScanRecord;
import com.fleet.anomaly.model.ScanSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw process rows into per-scan summaries and per-device discrepancy statistics.
 *
 * Every process row of a scan counts towards the observed total, so a process name that
 * appears twice in one scan is counted twice. The reported count of a scan is taken from
 * the first row of that scan. Output order follows the first appearance of each device
 * (and of each scan within a device) in the input.
 */
@Component
public class ScanAggregator {

    private static final Logger log = LoggerFactory.getLogger(ScanAggregator.class);

    /**
     * Collapse process rows into one summary per (device, scan).
     *
     * @throws MalformedInputException if the input is empty or a record is incomplete
     */
    public List<ScanSummary> summarize(List<ScanRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new MalformedInputException("No scan records supplied");
        }

        Map<ScanKey, int[]> counts = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            ScanRecord record = records.get(i);
            validate(record, i);
            ScanKey key = new ScanKey(record.getDeviceId(), record.getScanId());
            // [0] observed rows, [1] reported count of the first row
            int[] slot = counts.computeIfAbsent(key, k -> new int[]{0, record.getReportedProcCount()});
            slot[0]++;
        }

        List<ScanSummary> summaries = new ArrayList<>(counts.size());
        counts.forEach((key, slot) ->
                summaries.add(new ScanSummary(key.deviceId(), key.scanId(), slot[0], slot[1])));

        log.debug("Collapsed {} process rows into {} scans", records.size(), summaries.size());
        return summaries;
    }

    /**
     * One feature vector per distinct device in the input.
     */
    public List<DeviceFeatures> aggregate(List<ScanRecord> records) {
        return featuresOf(summarize(records));
    }

    public List<DeviceFeatures> featuresOf(List<ScanSummary> summaries) {
        Map<String, List<Integer>> byDevice = new LinkedHashMap<>();
        for (ScanSummary summary : summaries) {
            byDevice.computeIfAbsent(summary.deviceId(), d -> new ArrayList<>()).add(summary.discrepancy());
        }

        List<DeviceFeatures> features = new ArrayList<>(byDevice.size());
        byDevice.forEach((deviceId, discrepancies) -> features.add(new DeviceFeatures(
                deviceId,
                discrepancies.size(),
                mean(discrepancies),
                sampleStdDev(discrepancies))));
        return features;
    }

    static double mean(List<Integer> values) {
        double sum = 0.0;
        for (int v : values) sum += v;
        return sum / values.size();
    }

    /**
     * Sample standard deviation (divisor n - 1). NaN for fewer than two values.
     */
    static double sampleStdDev(List<Integer> values) {
        int n = values.size();
        if (n < 2) return Double.NaN;
        double mean = mean(values);
        double sumSq = 0.0;
        for (int v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (n - 1));
    }

    private void validate(ScanRecord record, int index) {
        if (record == null) {
            throw new MalformedInputException("Scan record " + index + " is null");
        }
        if (isBlank(record.getDeviceId())) {
            throw new MalformedInputException("Scan record " + index + " has no device id");
        }
        if (isBlank(record.getScanId())) {
            throw new MalformedInputException("Scan record " + index + " has no scan id");
        }
        if (isBlank(record.getProcessName())) {
            throw new MalformedInputException("Scan record " + index + " has no process name");
        }
        if (record.getReportedProcCount() == null) {
            throw new MalformedInputException("Scan record " + index + " has no reported process count");
        }
        if (record.getReportedProcCount() < 0) {
            throw new MalformedInputException("Scan record " + index + " has a negative reported process count: "
                    + record.getReportedProcCount());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private record ScanKey(String deviceId, String scanId) {}
}
