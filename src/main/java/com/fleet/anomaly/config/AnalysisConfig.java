package com.fleet.anomaly.config;

import com.fleet.anomaly.model.MissingFeaturePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "analysis")
public class AnalysisConfig {

    // Expected fraction of anomalous devices (0 < c < 1). Sets the classification cut-off.
    private double contamination = 0.15;

    // Number of isolation trees in the ensemble.
    private int numTrees = 100;

    // Sub-sample drawn per tree; capped at the number of scored devices.
    private int sampleSize = 256;

    private long seed = 42L;

    // Single-scan devices have no standard deviation.
    private MissingFeaturePolicy missingFeaturePolicy = MissingFeaturePolicy.EXCLUDE;

    // Log a per-device report after each run.
    private boolean verbose = false;

    // Build trees on the common fork-join pool. Results do not depend on this flag.
    private boolean parallelTrees = true;

    private ChangePoint changePoint = new ChangePoint();

    private Batch batch = new Batch();

    @Data
    public static class ChangePoint {
        // Cost added per change point; raise for fewer, larger segments.
        private double penalty = 1000.0;
        private int minSize = 2;
        // Only every jump-th index is considered as a change point.
        private int jump = 5;
    }

    @Data
    public static class Batch {
        // CSV export analysed at startup under the "batch" profile.
        private String inputFile;
    }
}
