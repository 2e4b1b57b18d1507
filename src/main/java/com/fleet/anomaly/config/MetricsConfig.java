package com.fleet.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger lastAnomalousCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.lastAnomalousCount = registry.gauge("analysis.last.anomalous.devices", new AtomicInteger(0));
    }

    public void recordAnalysis(int scoredDevices, int anomalousDevices, int insufficientDevices) {
        Counter.builder("analysis.run.count")
                .tag("outcome", "success")
                .register(registry)
                .increment();

        DistributionSummary.builder("analysis.devices.scored")
                .register(registry)
                .record(scoredDevices);

        Counter.builder("analysis.devices.anomalous")
                .register(registry)
                .increment(anomalousDevices);

        Counter.builder("analysis.devices.insufficient_data")
                .register(registry)
                .increment(insufficientDevices);

        lastAnomalousCount.set(anomalousDevices);
    }

    public void recordNormalizedScore(double normalizedScore) {
        DistributionSummary.builder("analysis.normalized_score")
                .register(registry)
                .record(normalizedScore);
    }

    public void recordFailure(String errorType) {
        Counter.builder("analysis.run.count")
                .tag("outcome", "failure")
                .tag("error", errorType)
                .register(registry)
                .increment();
    }
}
