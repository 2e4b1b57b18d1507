package com.fleet.anomaly.service;

import com.fleet.anomaly.config.AnalysisConfig;
import com.fleet.anomaly.config.MetricsConfig;
import com.fleet.anomaly.engine.ScanAggregator;
import com.fleet.anomaly.engine.ScoreNormalizer;
import com.fleet.anomaly.engine.isolationforest.ContaminationThreshold;
import com.fleet.anomaly.engine.isolationforest.FeatureExtractor;
import com.fleet.anomaly.engine.isolationforest.IsolationForest;
import com.fleet.anomaly.exception.AnalysisException;
import com.fleet.anomaly.exception.ConfigurationException;
import com.fleet.anomaly.model.AnalysisOptions;
import com.fleet.anomaly.model.AnalysisResult;
import com.fleet.anomaly.model.DeviceFeatures;
import com.fleet.anomaly.model.MissingFeaturePolicy;
import com.fleet.anomaly.model.ScanRecord;
import com.fleet.anomaly.model.ScanSummary;
import com.fleet.anomaly.model.ScoredDevice;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Runs the full batch pipeline: scan rows -> device features -> isolation forest -> thresholding
 * -> normalized scores.
 *
 * Raw scores use the decision-function convention: {@code rawScore = -s(x)} where s(x) is the
 * isolation score, so the most anomalous device has the lowest raw score.
 */
@Service
public class DeviceAnomalyAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(DeviceAnomalyAnalysisService.class);

    private final ScanAggregator aggregator;
    private final AnalysisConfig config;
    private final AnomalyReportService reportService;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    public DeviceAnomalyAnalysisService(ScanAggregator aggregator,
                                        AnalysisConfig config,
                                        AnomalyReportService reportService,
                                        MetricsConfig metricsConfig,
                                        Tracer tracer) {
        this.aggregator = aggregator;
        this.config = config;
        this.reportService = reportService;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
    }

    public AnalysisResult analyze(List<ScanRecord> records) {
        return analyze(records, new AnalysisOptions());
    }

    /**
     * Analyse a complete batch of scans.
     *
     * @throws ConfigurationException if an option is out of range, before anything is computed
     * @throws com.fleet.anomaly.exception.MalformedInputException if the batch is empty or a record is incomplete
     * @throws com.fleet.anomaly.exception.InsufficientDataException if fewer than two devices can be scored
     */
    @Observed(name = "analysis.run", contextualName = "analyze-scan-batch")
    public AnalysisResult analyze(List<ScanRecord> records, AnalysisOptions options) {
        try {
            AnalysisOptions effective = resolve(options);
            AnalysisResult result = run(records, effective);
            metricsConfig.recordAnalysis(result.getScoredDevices().size(),
                    result.getAnomalousDevices().size(),
                    result.getInsufficientDataDevices().size());
            if (Boolean.TRUE.equals(effective.getVerbose())) {
                reportService.report(result);
            }
            return result;
        } catch (AnalysisException e) {
            metricsConfig.recordFailure(e.getClass().getSimpleName());
            throw e;
        }
    }

    private AnalysisResult run(List<ScanRecord> records, AnalysisOptions options) {
        MissingFeaturePolicy policy = options.getMissingFeaturePolicy();

        List<ScanSummary> summaries = inSpan("analysis.aggregate", () -> aggregator.summarize(records));
        List<DeviceFeatures> features = aggregator.featuresOf(summaries);

        List<DeviceFeatures> scorable = new ArrayList<>();
        List<DeviceFeatures> insufficient = new ArrayList<>();
        for (DeviceFeatures f : features) {
            if (FeatureExtractor.isScorable(f, policy)) {
                scorable.add(f);
            } else {
                insufficient.add(f);
            }
        }
        log.debug("Aggregated {} rows into {} scans across {} devices ({} scorable, {} insufficient data)",
                records.size(), summaries.size(), features.size(), scorable.size(), insufficient.size());

        double[][] data = new double[scorable.size()][];
        for (int i = 0; i < scorable.size(); i++) {
            data[i] = FeatureExtractor.extract(scorable.get(i), policy);
        }

        IsolationForest forest = new IsolationForest();
        double[] anomalyScores = inSpan("analysis.isolation_forest", () -> {
            forest.train(data, options.getNumTrees(), options.getSampleSize(), options.getSeed(),
                    config.isParallelTrees());
            return forest.anomalyScores(data);
        });

        boolean[] labels = ContaminationThreshold.label(anomalyScores, options.getContamination());

        double[] rawScores = new double[anomalyScores.length];
        for (int i = 0; i < anomalyScores.length; i++) {
            rawScores[i] = -anomalyScores[i];
        }
        double[] normalized = ScoreNormalizer.normalize(rawScores);

        List<ScoredDevice> scored = new ArrayList<>(scorable.size());
        Set<String> anomalous = new LinkedHashSet<>();
        for (int i = 0; i < scorable.size(); i++) {
            DeviceFeatures f = scorable.get(i);
            scored.add(ScoredDevice.builder()
                    .deviceId(f.deviceId())
                    .scanCount(f.scanCount())
                    .meanDiscrepancy(f.meanDiscrepancy())
                    .stdDiscrepancy(f.stdDiscrepancy())
                    .anomaly(labels[i])
                    .rawScore(rawScores[i])
                    .normalizedScore(normalized[i])
                    .build());
            if (labels[i]) {
                anomalous.add(f.deviceId());
            }
            metricsConfig.recordNormalizedScore(normalized[i]);
        }

        log.info("Analysed {} devices: {} scored, {} anomalous, {} insufficient data (trees={}, psi={}, c={}, seed={})",
                features.size(), scored.size(), anomalous.size(), insufficient.size(),
                options.getNumTrees(), forest.getSampleSize(), options.getContamination(), options.getSeed());

        return AnalysisResult.builder()
                .anomalousDevices(anomalous)
                .scoredDevices(scored)
                .insufficientDataDevices(insufficient)
                .deviceCount(features.size())
                .scanCount(summaries.size())
                .contamination(options.getContamination())
                .numTrees(options.getNumTrees())
                .sampleSize(forest.getSampleSize())
                .seed(options.getSeed())
                .missingFeaturePolicy(policy)
                .build();
    }

    /**
     * Fill unset options from configuration and reject out-of-range values.
     */
    AnalysisOptions resolve(AnalysisOptions options) {
        AnalysisOptions o = options != null ? options : new AnalysisOptions();
        AnalysisOptions effective = AnalysisOptions.builder()
                .contamination(o.getContamination() != null ? o.getContamination() : config.getContamination())
                .numTrees(o.getNumTrees() != null ? o.getNumTrees() : config.getNumTrees())
                .sampleSize(o.getSampleSize() != null ? o.getSampleSize() : config.getSampleSize())
                .seed(o.getSeed() != null ? o.getSeed() : config.getSeed())
                .missingFeaturePolicy(o.getMissingFeaturePolicy() != null
                        ? o.getMissingFeaturePolicy() : config.getMissingFeaturePolicy())
                .verbose(o.getVerbose() != null ? o.getVerbose() : config.isVerbose())
                .build();

        double c = effective.getContamination();
        if (Double.isNaN(c) || c <= 0.0 || c >= 1.0) {
            throw new ConfigurationException("Contamination must be in (0, 1), got " + c);
        }
        if (effective.getNumTrees() <= 0) {
            throw new ConfigurationException("Number of trees must be positive, got " + effective.getNumTrees());
        }
        if (effective.getSampleSize() <= 0) {
            throw new ConfigurationException("Sample size must be positive, got " + effective.getSampleSize());
        }
        if (effective.getMissingFeaturePolicy() == null) {
            throw new ConfigurationException("Missing-feature policy must be set");
        }
        return effective;
    }

    private <T> T inSpan(String name, Supplier<T> stage) {
        Span span = tracer.nextSpan().name(name).start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            return stage.get();
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
