package com.fleet.anomaly.testutil;

import com.fleet.anomaly.model.ScanRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Shared scan-record builders to avoid repeating fixture boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final int BASE_REPORTED_COUNT = 120;

    private TestDataFactory() {}

    public static ScanRecord createRecord(String deviceId, String scanId, String processName, int reportedCount) {
        return ScanRecord.builder()
                .deviceId(deviceId)
                .scanId(scanId)
                .processName(processName)
                .reportedProcCount(reportedCount)
                .timestamp("2024-05-03 10:15:00")
                .build();
    }

    /**
     * Process rows for one scan whose observed-minus-reported discrepancy equals {@code discrepancy}.
     */
    public static List<ScanRecord> createScan(String deviceId, String scanId, int discrepancy) {
        int reported = BASE_REPORTED_COUNT;
        int observed = reported + discrepancy;
        List<ScanRecord> rows = new ArrayList<>(observed);
        for (int p = 0; p < observed; p++) {
            rows.add(createRecord(deviceId, scanId, "proc-" + p, reported));
        }
        return rows;
    }

    /**
     * All process rows for a device with one scan per given discrepancy, scans numbered from 1.
     */
    public static List<ScanRecord> createDevice(String deviceId, int... discrepancies) {
        List<ScanRecord> rows = new ArrayList<>();
        for (int s = 0; s < discrepancies.length; s++) {
            rows.addAll(createScan(deviceId, String.valueOf(s + 1), discrepancies[s]));
        }
        return rows;
    }

    /**
     * Integer discrepancies drawn from N(mean, stdDev), rounded.
     */
    public static int[] gaussianDiscrepancies(Random random, int scans, double mean, double stdDev) {
        int[] values = new int[scans];
        for (int i = 0; i < scans; i++) {
            values[i] = (int) Math.round(mean + random.nextGaussian() * stdDev);
        }
        return values;
    }

    /**
     * A fleet of {@code normalDevices} devices drawn from N(0,1) followed by one device, "outlier",
     * drawn from N(outlierMean, 1). Every device gets {@code scans} scans.
     */
    public static List<ScanRecord> createFleetWithOutlier(Random random, int normalDevices, int scans,
                                                          double outlierMean) {
        List<ScanRecord> rows = new ArrayList<>();
        for (int d = 1; d <= normalDevices; d++) {
            rows.addAll(createDevice(String.format("device-%03d", d), gaussianDiscrepancies(random, scans, 0.0, 1.0)));
        }
        rows.addAll(createDevice("outlier", gaussianDiscrepancies(random, scans, outlierMean, 1.0)));
        return rows;
    }

    /**
     * Header and rows in the layout of the original export, including pandas' unnamed index column.
     */
    public static String createCsv(List<ScanRecord> records) {
        StringBuilder sb = new StringBuilder(",device,scan,procName,scan_proc_count,timestamp\n");
        for (int i = 0; i < records.size(); i++) {
            ScanRecord r = records.get(i);
            sb.append(i).append(',')
                    .append(r.getDeviceId()).append(',')
                    .append(r.getScanId()).append(',')
                    .append(r.getProcessName()).append(',')
                    .append(r.getReportedProcCount()).append(',')
                    .append(r.getTimestamp() == null ? "" : r.getTimestamp())
                    .append('\n');
        }
        return sb.toString();
    }
}
