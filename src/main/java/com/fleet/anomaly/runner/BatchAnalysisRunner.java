package com.fleet.anomaly.runner;

import com.fleet.anomaly.config.AnalysisConfig;
import com.fleet.anomaly.model.AnalysisOptions;
import com.fleet.anomaly.model.AnalysisResult;
import com.fleet.anomaly.model.ScanRecord;
import com.fleet.anomaly.service.DeviceAnomalyAnalysisService;
import com.fleet.anomaly.service.ScanCsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Analyses a CSV scan export once at startup and logs the anomaly report.
 * Only runs when the "batch" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=batch -Dspring-boot.run.arguments=--analysis.batch.input-file=scans.csv
 */
@Component
@Profile("batch")
public class BatchAnalysisRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchAnalysisRunner.class);

    private final AnalysisConfig config;
    private final ScanCsvReader csvReader;
    private final DeviceAnomalyAnalysisService analysisService;

    public BatchAnalysisRunner(AnalysisConfig config,
                               ScanCsvReader csvReader,
                               DeviceAnomalyAnalysisService analysisService) {
        this.config = config;
        this.csvReader = csvReader;
        this.analysisService = analysisService;
    }

    @Override
    public void run(String... args) throws Exception {
        String inputFile = config.getBatch().getInputFile();
        if (inputFile == null || inputFile.isBlank()) {
            throw new IllegalStateException("analysis.batch.input-file must be set for the batch profile");
        }

        Path path = Path.of(inputFile);
        log.info("=== Analysing scan export {} ===", path.toAbsolutePath());

        List<ScanRecord> records;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            records = csvReader.read(reader);
        }

        AnalysisResult result = analysisService.analyze(records, AnalysisOptions.builder().verbose(true).build());

        log.info("=== Anomalous devices detected: {} ===", result.getAnomalousDevices());
    }
}
