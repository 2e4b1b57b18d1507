package com.fleet.anomaly.service;

import com.fleet.anomaly.config.AnalysisConfig;
import com.fleet.anomaly.engine.ScanAggregator;
import com.fleet.anomaly.exception.ConfigurationException;
import com.fleet.anomaly.exception.MalformedInputException;
import com.fleet.anomaly.model.DiscrepancySeries;
import com.fleet.anomaly.model.DiscrepancySeries.SeriesPoint;
import com.fleet.anomaly.model.ScanRecord;
import com.fleet.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DiscrepancySeriesServiceTest {

    private AnalysisConfig config;
    private DiscrepancySeriesService seriesService;

    @BeforeEach
    void setUp() {
        config = new AnalysisConfig();
        seriesService = new DiscrepancySeriesService(new ScanAggregator(), config);
    }

    @Test
    void seriesFor_ordersScansNumerically() {
        List<ScanRecord> records = new ArrayList<>();
        records.addAll(TestDataFactory.createScan("D1", "10", 3));
        records.addAll(TestDataFactory.createScan("D1", "2", 1));
        records.addAll(TestDataFactory.createScan("D1", "1", -1));

        DiscrepancySeries series = seriesService.seriesFor(records, null).get(0);

        assertThat(series.getPoints()).containsExactly(
                new SeriesPoint("1", -1), new SeriesPoint("2", 1), new SeriesPoint("10", 3));
        assertThat(series.getMean()).isCloseTo(1.0, within(1e-12));
        assertThat(series.getChangePoints()).isEmpty();
    }

    @Test
    void seriesFor_nonNumericScanIdsSortLexicographically() {
        List<ScanRecord> records = new ArrayList<>();
        records.addAll(TestDataFactory.createScan("D1", "scan-b", 0));
        records.addAll(TestDataFactory.createScan("D1", "scan-a", 2));

        assertThat(seriesService.seriesFor(records, null).get(0).getPoints())
                .extracting(SeriesPoint::scanId)
                .containsExactly("scan-a", "scan-b");
    }

    @Test
    void seriesFor_detectsShiftInReportingBehaviour() {
        int[] discrepancies = new int[20];
        for (int i = 10; i < 20; i++) discrepancies[i] = 40;
        List<ScanRecord> records = new ArrayList<>(TestDataFactory.createDevice("drifter", discrepancies));
        records.addAll(TestDataFactory.createDevice("steady", new int[20]));

        List<DiscrepancySeries> series = seriesService.seriesFor(records, null);

        assertThat(series).extracting(DiscrepancySeries::getDeviceId).containsExactly("drifter", "steady");
        assertThat(series.get(0).getChangePoints()).containsExactly(10);
        assertThat(series.get(1).getChangePoints()).isEmpty();
    }

    @Test
    void seriesFor_penaltyOverridesConfiguration() {
        int[] discrepancies = new int[20];
        for (int i = 10; i < 20; i++) discrepancies[i] = 5;
        List<ScanRecord> records = TestDataFactory.createDevice("D1", discrepancies);

        assertThat(seriesService.seriesFor(records, null).get(0).getChangePoints()).isEmpty();
        assertThat(seriesService.seriesFor(records, 10.0).get(0).getChangePoints()).containsExactly(10);
    }

    @Test
    void seriesFor_invalidPenalty_throws() {
        assertThatThrownBy(() -> seriesService.seriesFor(TestDataFactory.createDevice("D1", 1, 2), -1.0))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void seriesFor_emptyInput_throws() {
        assertThatThrownBy(() -> seriesService.seriesFor(List.of(), null))
                .isInstanceOf(MalformedInputException.class);
    }
}
