package com.jobmarket.etl.ingest.service;

import com.jobmarket.etl.config.PipelineProperties;
import com.jobmarket.etl.ingest.model.ExtractedSkill;
import com.jobmarket.etl.ingest.model.LoadResult;
import com.jobmarket.etl.ingest.model.LoadStatus;
import com.jobmarket.etl.ingest.model.NormalizedJob;
import com.jobmarket.etl.ingest.model.ProcessedRecord;
import com.jobmarket.etl.ingest.persistence.JobMarketJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes processed records to the store, one transaction per record. Records are loaded
 * sequentially in input order; a record's rows are either all committed or all rolled back.
 */
@Component
public class BatchLoader {
    private static final Logger log = LoggerFactory.getLogger(BatchLoader.class);

    private final JobMarketJdbcRepository repository;
    private final TransactionOperations transactions;
    private final PipelineProperties properties;

    public BatchLoader(
        JobMarketJdbcRepository repository,
        TransactionOperations recordTransactionTemplate,
        PipelineProperties properties
    ) {
        this.repository = repository;
        this.transactions = recordTransactionTemplate;
        this.properties = properties;
    }

    public BatchLoadOutcome load(List<ProcessedRecord> records, String batchId, boolean replaceExisting) {
        List<LoadResult> results = new ArrayList<>(records.size());
        Set<String> loadedInBatch = new HashSet<>();
        boolean aborted = false;
        for (ProcessedRecord record : records) {
            if (record.job() == null) {
                results.add(LoadResult.skipped(record.recordIndex(), record.externalId()));
                continue;
            }
            if (aborted) {
                results.add(LoadResult.notAttempted(record.recordIndex(), record.externalId(), "batch aborted"));
                continue;
            }
            if (!loadedInBatch.add(record.externalId())) {
                results.add(new LoadResult(
                    record.recordIndex(), record.externalId(), LoadStatus.DUPLICATE, null, 0, "repeated within batch"
                ));
                continue;
            }
            try {
                results.add(loadRecord(record, batchId, replaceExisting));
            } catch (TransactionFailureException e) {
                log.warn("Giving up on job {} after {} attempts", record.externalId(), e.getAttempts(), e.getCause());
                results.add(new LoadResult(
                    record.recordIndex(), record.externalId(), LoadStatus.LOAD_FAILED, null, e.getAttempts(), rootMessage(e)
                ));
            } catch (FatalStoreFailureException e) {
                log.warn("Store unreachable while loading job {}; aborting batch {}", record.externalId(), batchId, e);
                aborted = true;
                results.add(new LoadResult(
                    record.recordIndex(), record.externalId(), LoadStatus.LOAD_FAILED, null, 1, rootMessage(e)
                ));
            } catch (RuntimeException e) {
                log.warn("Unexpected failure loading job {}; continuing with the batch", record.externalId(), e);
                results.add(new LoadResult(
                    record.recordIndex(), record.externalId(), LoadStatus.LOAD_FAILED, null, 1, rootMessage(e)
                ));
            }
        }
        return new BatchLoadOutcome(List.copyOf(results), aborted);
    }

    LoadResult loadRecord(ProcessedRecord record, String batchId, boolean replaceExisting) {
        NormalizedJob job = record.job();
        int maxAttempts = properties.getLoader().getMaxRetries() + 1;
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                Long jobId = transactions.execute(status -> writeJob(job, batchId, replaceExisting));
                if (jobId == null) {
                    throw new IllegalStateException("Load transaction returned no job id for " + job.externalId());
                }
                log.debug("Loaded job {} as id {} (attempt {})", job.externalId(), jobId, attempts);
                return LoadResult.loaded(record.recordIndex(), job.externalId(), jobId, attempts);
            } catch (DuplicateJobException e) {
                return new LoadResult(
                    record.recordIndex(), job.externalId(), LoadStatus.DUPLICATE, null, attempts, e.getMessage()
                );
            } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
                throw new FatalStoreFailureException("Store unreachable while loading " + job.externalId(), e);
            } catch (DataAccessException | TransactionException e) {
                if (attempts >= maxAttempts) {
                    throw new TransactionFailureException("Load of " + job.externalId() + " failed", attempts, e);
                }
                log.warn("Load of job {} failed on attempt {}; retrying", job.externalId(), attempts, e);
            }
        }
    }

    private Long writeJob(NormalizedJob job, String batchId, boolean replaceExisting) {
        long companyId = repository.upsertCompany(job.company());
        Long existingId = repository.findJobIdByExternalId(job.externalId());
        if (existingId != null) {
            if (!replaceExisting) {
                throw new DuplicateJobException(job.externalId());
            }
            repository.deleteJob(existingId);
        }
        long jobId = repository.insertJob(job, companyId, batchId);

        Map<Long, Boolean> requiredBySkillId = new LinkedHashMap<>();
        for (ExtractedSkill skill : job.skills()) {
            requiredBySkillId.merge(repository.upsertSkill(skill), skill.required(), Boolean::logicalOr);
        }
        repository.insertJobSkills(jobId, requiredBySkillId);
        repository.insertBenefits(jobId, job.benefits());
        repository.insertHighlights(jobId, job.highlights());
        return jobId;
    }

    private String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return message == null ? current.getClass().getSimpleName() : message;
    }
}
