package com.jobmarket.etl.ingest.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmarket.etl.ingest.model.QualityReport;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Persists a finished report: JSON for the whole report, CSV for the rejected-record audit. */
@Component
public class QualityReportWriter {
    static final String[] REJECTED_HEADER = {"record_index", "job_id", "reasons"};

    private final ObjectMapper objectMapper;

    public QualityReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void writeJson(QualityReport report, Path target) throws IOException {
        createParent(target);
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), report);
    }

    public void writeRejectedCsv(QualityReport report, Path target) throws IOException {
        createParent(target);
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(REJECTED_HEADER).build();
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (QualityReport.RejectedRecordEntry entry : report.rejectedRecords()) {
                printer.printRecord(entry.recordIndex(), entry.externalId(), String.join("; ", entry.reasons()));
            }
        }
    }

    private void createParent(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
