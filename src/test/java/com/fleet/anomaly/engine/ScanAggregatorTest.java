package com.fleet.anomaly.engine;

import com.fleet.anomaly.exception.MalformedInputException;
import com.fleet.anomaly.model.DeviceFeatures;
import com.fleet.anomaly.model.ScanRecord;
import com.fleet.anomaly.model.ScanSummary;
import com.fleet.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScanAggregatorTest {

    private final ScanAggregator aggregator = new ScanAggregator();

    @Test
    void summarize_countsEveryRowIncludingRepeatedProcessNames() {
        List<ScanRecord> rows = List.of(
                TestDataFactory.createRecord("D1", "1", "launchd", 2),
                TestDataFactory.createRecord("D1", "1", "launchd", 2),
                TestDataFactory.createRecord("D1", "1", "syslogd", 2),
                TestDataFactory.createRecord("D1", "2", "launchd", 5));

        List<ScanSummary> summaries = aggregator.summarize(rows);

        assertThat(summaries).containsExactly(
                new ScanSummary("D1", "1", 3, 2),
                new ScanSummary("D1", "2", 1, 5));
        assertThat(summaries.get(0).discrepancy()).isEqualTo(1);
        assertThat(summaries.get(1).discrepancy()).isEqualTo(-4);
    }

    @Test
    void summarize_usesFirstReportedCountOfScan() {
        List<ScanRecord> rows = List.of(
                TestDataFactory.createRecord("D1", "1", "a", 10),
                TestDataFactory.createRecord("D1", "1", "b", 99));

        assertThat(aggregator.summarize(rows).get(0).reportedProcCount()).isEqualTo(10);
    }

    @Test
    void summarize_sameScanIdOnDifferentDevicesIsSeparate() {
        List<ScanRecord> rows = List.of(
                TestDataFactory.createRecord("D1", "1", "a", 1),
                TestDataFactory.createRecord("D2", "1", "a", 1),
                TestDataFactory.createRecord("D2", "1", "b", 1));

        assertThat(aggregator.summarize(rows))
                .extracting(ScanSummary::observedProcCount)
                .containsExactly(1, 2);
    }

    @Test
    void aggregate_oneVectorPerDeviceInFirstSeenOrder() {
        List<ScanRecord> rows = new ArrayList<>();
        rows.addAll(TestDataFactory.createDevice("zeta", 1, 2, 3));
        rows.addAll(TestDataFactory.createDevice("alpha", 0, 0));
        rows.addAll(TestDataFactory.createScan("zeta", "4", 6));

        List<DeviceFeatures> features = aggregator.aggregate(rows);

        assertThat(features).extracting(DeviceFeatures::deviceId).containsExactly("zeta", "alpha");
        assertThat(features.get(0).scanCount()).isEqualTo(4);
        assertThat(features.get(0).meanDiscrepancy()).isCloseTo(3.0, within(1e-12));
    }

    @Test
    void aggregate_meanAndSampleStdMatchDirectRecomputation() {
        Random random = new Random(7);
        List<ScanRecord> rows = new ArrayList<>();
        List<int[]> perDevice = new ArrayList<>();
        for (int d = 0; d < 6; d++) {
            int[] discrepancies = TestDataFactory.gaussianDiscrepancies(random, 3 + d, d * 2.0, 3.0);
            perDevice.add(discrepancies);
            rows.addAll(TestDataFactory.createDevice("D" + d, discrepancies));
        }
        Collections.shuffle(rows, random);

        List<DeviceFeatures> features = aggregator.aggregate(rows);
        assertThat(features).hasSize(6);

        for (DeviceFeatures f : features) {
            int[] expected = perDevice.get(Integer.parseInt(f.deviceId().substring(1)));
            double mean = 0;
            for (int v : expected) mean += v;
            mean /= expected.length;
            double ss = 0;
            for (int v : expected) ss += (v - mean) * (v - mean);
            double std = Math.sqrt(ss / (expected.length - 1));

            assertThat(f.scanCount()).isEqualTo(expected.length);
            assertThat(f.meanDiscrepancy()).isCloseTo(mean, within(1e-9));
            assertThat(f.stdDiscrepancy()).isCloseTo(std, within(1e-9));
        }
    }

    @Test
    void aggregate_singleScanDeviceHasMissingStd() {
        DeviceFeatures f = aggregator.aggregate(TestDataFactory.createDevice("solo", 4)).get(0);

        assertThat(f.scanCount()).isEqualTo(1);
        assertThat(f.meanDiscrepancy()).isEqualTo(4.0);
        assertThat(f.hasStdDiscrepancy()).isFalse();
        assertThat(f.stdDiscrepancy()).isNaN();
    }

    @Test
    void aggregate_constantDiscrepancyHasZeroStd() {
        DeviceFeatures f = aggregator.aggregate(TestDataFactory.createDevice("flat", -2, -2, -2)).get(0);

        assertThat(f.hasStdDiscrepancy()).isTrue();
        assertThat(f.stdDiscrepancy()).isEqualTo(0.0);
        assertThat(f.meanDiscrepancy()).isEqualTo(-2.0);
    }

    @Test
    void summarize_emptyInput_throws() {
        assertThatThrownBy(() -> aggregator.summarize(List.of()))
                .isInstanceOf(MalformedInputException.class);
        assertThatThrownBy(() -> aggregator.summarize(null))
                .isInstanceOf(MalformedInputException.class);
    }

    @Test
    void summarize_missingFields_throwWithRecordIndex() {
        ScanRecord good = TestDataFactory.createRecord("D1", "1", "a", 1);

        assertThatThrownBy(() -> aggregator.summarize(List.of(good,
                TestDataFactory.createRecord(" ", "1", "a", 1))))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("record 1")
                .hasMessageContaining("device id");
        assertThatThrownBy(() -> aggregator.summarize(List.of(
                TestDataFactory.createRecord("D1", null, "a", 1))))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("scan id");
        assertThatThrownBy(() -> aggregator.summarize(List.of(
                TestDataFactory.createRecord("D1", "1", null, 1))))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("process name");
    }

    @Test
    void summarize_invalidReportedCount_throws() {
        ScanRecord missing = ScanRecord.builder().deviceId("D1").scanId("1").processName("a").build();
        ScanRecord negative = TestDataFactory.createRecord("D1", "1", "a", -3);

        assertThatThrownBy(() -> aggregator.summarize(List.of(missing)))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("reported process count");
        assertThatThrownBy(() -> aggregator.summarize(List.of(negative)))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("negative");
    }

    @Test
    void featuresOf_exactlyOnePerDistinctDevice() {
        Random random = new Random(11);
        List<ScanRecord> rows = TestDataFactory.createFleetWithOutlier(random, 9, 4, 20.0);

        List<DeviceFeatures> features = aggregator.aggregate(rows);
        List<String> distinct = rows.stream().map(ScanRecord::getDeviceId).distinct().collect(Collectors.toList());

        assertThat(features).extracting(DeviceFeatures::deviceId).containsExactlyElementsOf(distinct);
    }
}
