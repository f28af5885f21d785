package com.jobmarket.etl.ingest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmarket.etl.config.PipelineProperties;
import com.jobmarket.etl.ingest.model.QualityReport;
import com.jobmarket.etl.ingest.model.RawJobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a single batch from a file when {@code pipeline.cli.run} is set. The input is either a
 * JSON array of records or a search API response whose {@code data} field holds that array.
 */
@Component
public class IngestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(IngestCliRunner.class);

    private final PipelineProperties properties;
    private final IngestionPipelineService pipelineService;
    private final QualityReportWriter reportWriter;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public IngestCliRunner(
        PipelineProperties properties,
        IngestionPipelineService pipelineService,
        QualityReportWriter reportWriter,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.pipelineService = pipelineService;
        this.reportWriter = reportWriter;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        PipelineProperties.Cli cli = properties.getCli();
        Path input = Path.of(cli.getInputFile());
        List<RawJobRecord> records = readRecords(input);
        boolean replace = cli.isReplaceExisting() || properties.isReplaceExisting();

        QualityReport report = pipelineService.run(records, replace);
        try {
            reportWriter.writeJson(report, Path.of(cli.getReportFile()));
            reportWriter.writeRejectedCsv(report, Path.of(cli.getRejectedCsvFile()));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write quality report for batch " + report.batchId(), e);
        }

        log.info("Batch {} from {} completed with status {}", report.batchId(), input, report.status());
        log.info(
            "Summary: total={}, accepted={}, flagged={}, rejected={}, loaded={}, duplicates={}, loadFailed={}, notAttempted={}",
            report.totalRecords(),
            report.accepted(),
            report.flagged(),
            report.rejected(),
            report.loaded(),
            report.duplicates(),
            report.loadFailed(),
            report.notAttempted()
        );
        for (Map.Entry<String, Long> reason : report.reasonCounts().entrySet()) {
            log.info("Reason '{}': {}", reason.getKey(), reason.getValue());
        }
        log.info("Report written to {}; rejected records written to {}", cli.getReportFile(), cli.getRejectedCsvFile());

        if (cli.isExitAfterRun()) {
            int status = QualityReporter.STATUS_ABORTED.equals(report.status()) ? 1 : 0;
            int exitCode = SpringApplication.exit(applicationContext, () -> status);
            System.exit(exitCode);
        }
    }

    List<RawJobRecord> readRecords(Path input) {
        JsonNode root;
        try {
            root = objectMapper.readTree(input.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read input file " + input, e);
        }
        JsonNode array = root;
        if (root != null && root.isObject() && root.has("data")) {
            array = root.get("data");
        }
        if (array == null || !array.isArray()) {
            throw new IllegalStateException("Input file " + input + " must hold a JSON array of job records");
        }
        List<RawJobRecord> records = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            records.add(toRecord(node));
        }
        log.info("Read {} records from {}", records.size(), input);
        return records;
    }

    // non-object entries become null and are rejected by the processor
    private RawJobRecord toRecord(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, RawJobRecord.class);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable job record in input: {}", e.getOriginalMessage());
            return null;
        }
    }
}
