package com.jobmarket.etl.ingest.service;

import com.jobmarket.etl.ingest.model.CompanyRef;
import com.jobmarket.etl.ingest.model.ProcessedRecord;
import com.jobmarket.etl.ingest.model.QualityReport;
import com.jobmarket.etl.ingest.model.RawJobRecord;
import com.jobmarket.etl.ingest.model.RecordDecision;
import com.jobmarket.etl.ingest.normalize.CompanyIndex;
import com.jobmarket.etl.ingest.normalize.CompanyNameNormalizer;
import com.jobmarket.etl.ingest.persistence.JobMarketJdbcRepository;
import com.jobmarket.etl.ingest.util.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one batch end to end. The per-record stages fan out over the pipeline executor; loading
 * starts only once every record has been processed, so company display names are settled before
 * the first write. Only one batch may run at a time.
 */
@Service
public class IngestionPipelineService {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipelineService.class);

    private final JobRecordProcessor processor;
    private final BatchLoader batchLoader;
    private final QualityReporter reporter;
    private final CompanyNameNormalizer companyNameNormalizer;
    private final JobMarketJdbcRepository repository;
    private final Executor pipelineExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public IngestionPipelineService(
        JobRecordProcessor processor,
        BatchLoader batchLoader,
        QualityReporter reporter,
        CompanyNameNormalizer companyNameNormalizer,
        JobMarketJdbcRepository repository,
        @Qualifier("pipelineExecutor") Executor pipelineExecutor
    ) {
        this.processor = processor;
        this.batchLoader = batchLoader;
        this.reporter = reporter;
        this.companyNameNormalizer = companyNameNormalizer;
        this.repository = repository;
        this.pipelineExecutor = pipelineExecutor;
    }

    public QualityReport run(List<RawJobRecord> records, boolean replaceExisting) {
        if (records == null) {
            throw new InvalidIngestRequestException("records must be provided");
        }
        if (!running.compareAndSet(false, true)) {
            throw new ActiveIngestRunException("An ingest batch is already running");
        }
        try {
            return runBatch(records, replaceExisting);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private QualityReport runBatch(List<RawJobRecord> records, boolean replaceExisting) {
        String batchId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        log.info("Batch {} started with {} records (replaceExisting={})", batchId, records.size(), replaceExisting);

        CompanyIndex companyIndex = new CompanyIndex(companyNameNormalizer);
        List<CompletableFuture<ProcessedRecord>> futures = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            int recordIndex = i;
            RawJobRecord raw = records.get(i);
            futures.add(CompletableFuture.supplyAsync(
                () -> processor.process(recordIndex, raw, companyIndex, startedAt),
                pipelineExecutor
            ));
        }

        List<ProcessedRecord> processed = new ArrayList<>(records.size());
        for (int i = 0; i < futures.size(); i++) {
            ProcessedRecord record;
            try {
                record = futures.get(i).join();
            } catch (CompletionException e) {
                log.warn("Record {} could not be processed", i, e.getCause());
                record = new ProcessedRecord(
                    i, null, RecordDecision.rejected(i, null, List.of(ReasonCodes.PROCESSING_ERROR)), null
                );
            }
            processed.add(record);
        }
        // The index is final only once every record has resolved its company.
        processed.replaceAll(record -> settleCompany(record, companyIndex));
        log.info("Batch {} processed: {} companies resolved", batchId, companyIndex.size());

        Set<String> storedBefore = storedExternalIds(processed);
        BatchLoadOutcome outcome = batchLoader.load(processed, batchId, replaceExisting);
        QualityReport report = reporter.report(batchId, startedAt, Instant.now(), processed, outcome, storedBefore);
        log.info(
            "Batch {} finished with status {}: total={}, accepted={}, flagged={}, rejected={}, loaded={}, duplicates={}, loadFailed={}, notAttempted={}",
            batchId,
            report.status(),
            report.totalRecords(),
            report.accepted(),
            report.flagged(),
            report.rejected(),
            report.loaded(),
            report.duplicates(),
            report.loadFailed(),
            report.notAttempted()
        );
        return report;
    }

    private ProcessedRecord settleCompany(ProcessedRecord record, CompanyIndex companyIndex) {
        if (record.job() == null) {
            return record;
        }
        CompanyRef canonical = companyIndex.canonical(record.job().company().nameKey());
        if (canonical == null || canonical.equals(record.job().company())) {
            return record;
        }
        return new ProcessedRecord(record.recordIndex(), record.decoded(), record.decision(), record.job().withCompany(canonical));
    }

    private Set<String> storedExternalIds(List<ProcessedRecord> records) {
        Set<String> ids = new LinkedHashSet<>();
        for (ProcessedRecord record : records) {
            if (record.externalId() != null) {
                ids.add(record.externalId());
            }
        }
        try {
            return repository.findExistingExternalIds(ids);
        } catch (DataAccessException e) {
            log.warn("Could not look up previously stored job ids; duplicate id count covers this batch only", e);
            return Set.of();
        }
    }
}
