package com.fleet.anomaly.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fleet.anomaly.exception.MalformedInputException;
import com.fleet.anomaly.model.ScanRecord;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the tabular scan export into scan records.
 *
 * Expected header columns: {@code device, scan, procName, scan_proc_count} and optionally
 * {@code timestamp}. Other columns, including the unnamed index column pandas writes first,
 * are ignored.
 */
@Service
public class ScanCsvReader {

    public static final String DEVICE = "device";
    public static final String SCAN = "scan";
    public static final String PROC_NAME = "procName";
    public static final String REPORTED_COUNT = "scan_proc_count";
    public static final String TIMESTAMP = "timestamp";

    private static final List<String> REQUIRED = List.of(DEVICE, SCAN, PROC_NAME, REPORTED_COUNT);

    private final CsvMapper csvMapper;

    public ScanCsvReader() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    public List<ScanRecord> read(String csv) {
        return read(new StringReader(csv));
    }

    public List<ScanRecord> read(Reader reader) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<ScanRecord> records = new ArrayList<>();

        try (MappingIterator<Map<String, String>> rows = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(reader)) {
            int line = 1;
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                line++;
                records.add(toRecord(row, line));
            }
        } catch (MalformedInputException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new MalformedInputException("Unreadable scan CSV: " + e.getMessage(), e);
        }
        return records;
    }

    private ScanRecord toRecord(Map<String, String> row, int line) {
        for (String column : REQUIRED) {
            String value = row.get(column);
            if (value == null || value.isBlank()) {
                throw new MalformedInputException("Line " + line + ": missing value for column '" + column + "'");
            }
        }

        String rawCount = row.get(REPORTED_COUNT).trim();
        int reportedCount;
        try {
            reportedCount = Integer.parseInt(rawCount);
        } catch (NumberFormatException e) {
            throw new MalformedInputException(
                    "Line " + line + ": " + REPORTED_COUNT + " is not an integer: '" + rawCount + "'", e);
        }

        String timestamp = row.get(TIMESTAMP);
        return ScanRecord.builder()
                .deviceId(row.get(DEVICE).trim())
                .scanId(row.get(SCAN).trim())
                .processName(row.get(PROC_NAME))
                .reportedProcCount(reportedCount)
                .timestamp(timestamp == null || timestamp.isBlank() ? null : timestamp)
                .build();
    }
}
