package com.jobmarket.etl.ingest.service;

import com.jobmarket.etl.ingest.model.DecisionOutcome;
import com.jobmarket.etl.ingest.model.DecodedJobRecord;
import com.jobmarket.etl.ingest.model.ExtractedSkill;
import com.jobmarket.etl.ingest.model.LoadResult;
import com.jobmarket.etl.ingest.model.LoadStatus;
import com.jobmarket.etl.ingest.model.ProcessedRecord;
import com.jobmarket.etl.ingest.model.QualityReport;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_CITY;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_COUNTRY;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_DESCRIPTION;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_EMPLOYER_NAME;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_JOB_ID;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_LOCATION;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_MAX_SALARY;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_MIN_SALARY;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_POSTED_AT_DATETIME;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_STATE;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_TITLE;

/** Aggregates per-record decisions and load results into a {@link QualityReport}. */
@Component
public class QualityReporter {
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_COMPLETED_WITH_ERRORS = "COMPLETED_WITH_ERRORS";
    public static final String STATUS_ABORTED = "ABORTED";

    private static final Map<String, Predicate<DecodedJobRecord>> COMPLETENESS_FIELDS = new LinkedHashMap<>();

    static {
        COMPLETENESS_FIELDS.put(FIELD_JOB_ID, r -> r.externalId() != null);
        COMPLETENESS_FIELDS.put(FIELD_TITLE, r -> r.title() != null);
        COMPLETENESS_FIELDS.put(FIELD_EMPLOYER_NAME, r -> r.employerName() != null);
        COMPLETENESS_FIELDS.put(FIELD_DESCRIPTION, r -> r.description() != null);
        COMPLETENESS_FIELDS.put(FIELD_LOCATION, r -> r.location() != null);
        COMPLETENESS_FIELDS.put(FIELD_CITY, r -> r.city() != null);
        COMPLETENESS_FIELDS.put(FIELD_STATE, r -> r.state() != null);
        COMPLETENESS_FIELDS.put(FIELD_COUNTRY, r -> r.country() != null);
        COMPLETENESS_FIELDS.put("job_employment_type", r -> r.employmentType() != null);
        COMPLETENESS_FIELDS.put(FIELD_MIN_SALARY, r -> r.minSalary() != null);
        COMPLETENESS_FIELDS.put(FIELD_MAX_SALARY, r -> r.maxSalary() != null);
        COMPLETENESS_FIELDS.put("job_salary_period", r -> r.salaryPeriod() != null);
        COMPLETENESS_FIELDS.put(FIELD_POSTED_AT_DATETIME, r -> r.postedAtUtc() != null);
        COMPLETENESS_FIELDS.put("job_apply_link", r -> r.applyLink() != null);
        COMPLETENESS_FIELDS.put("job_highlights", r -> r.highlights() != null && !r.highlights().isEmpty());
    }

    /**
     * @param storedExternalIds external ids that were already stored before the batch started
     */
    public QualityReport report(
        String batchId,
        Instant startedAt,
        Instant finishedAt,
        List<ProcessedRecord> records,
        BatchLoadOutcome loadOutcome,
        Set<String> storedExternalIds
    ) {
        int accepted = 0;
        int flagged = 0;
        int rejected = 0;
        Map<String, Long> reasonCounts = new TreeMap<>();
        List<QualityReport.RejectedRecordEntry> rejectedRecords = new ArrayList<>();
        for (ProcessedRecord record : records) {
            DecisionOutcome outcome = record.decision().outcome();
            if (outcome == DecisionOutcome.ACCEPTED) {
                accepted++;
            } else if (outcome == DecisionOutcome.FLAGGED) {
                flagged++;
            } else {
                rejected++;
                rejectedRecords.add(new QualityReport.RejectedRecordEntry(
                    record.recordIndex(), record.externalId(), record.decision().reasons()
                ));
            }
            for (String reason : record.decision().reasons()) {
                reasonCounts.merge(reason, 1L, Long::sum);
            }
        }

        int loaded = 0;
        int duplicates = 0;
        int loadFailed = 0;
        int notAttempted = 0;
        List<QualityReport.LoadFailureEntry> loadFailures = new ArrayList<>();
        Map<Integer, ProcessedRecord> byIndex = new HashMap<>();
        for (ProcessedRecord record : records) {
            byIndex.put(record.recordIndex(), record);
        }
        Map<String, Long> skillCounts = new TreeMap<>();
        Map<String, Long> seniority = new TreeMap<>();
        for (LoadResult result : loadOutcome.results()) {
            switch (result.status()) {
                case LOADED -> {
                    loaded++;
                    ProcessedRecord record = byIndex.get(result.recordIndex());
                    if (record != null && record.job() != null) {
                        for (ExtractedSkill skill : record.job().skills()) {
                            skillCounts.merge(skill.name(), 1L, Long::sum);
                        }
                        seniority.merge(record.job().seniorityLevel(), 1L, Long::sum);
                    }
                }
                case DUPLICATE -> duplicates++;
                case LOAD_FAILED -> loadFailed++;
                case NOT_ATTEMPTED -> notAttempted++;
                default -> {
                }
            }
            if (result.status() == LoadStatus.LOAD_FAILED || result.status() == LoadStatus.NOT_ATTEMPTED) {
                loadFailures.add(new QualityReport.LoadFailureEntry(
                    result.recordIndex(), result.externalId(), result.status(), result.attempts(), result.detail()
                ));
            }
        }

        String status = STATUS_COMPLETED;
        if (loadOutcome.aborted()) {
            status = STATUS_ABORTED;
        } else if (loadFailed > 0 || notAttempted > 0) {
            status = STATUS_COMPLETED_WITH_ERRORS;
        }

        return new QualityReport(
            batchId,
            startedAt,
            finishedAt,
            status,
            records.size(),
            accepted,
            flagged,
            rejected,
            loaded,
            duplicates,
            loadFailed,
            notAttempted,
            countDuplicateIds(records, storedExternalIds),
            reasonCounts,
            fieldCompleteness(records),
            rejectedRecords,
            loadFailures,
            skillCounts,
            seniority
        );
    }

    private int countDuplicateIds(List<ProcessedRecord> records, Set<String> storedExternalIds) {
        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        for (ProcessedRecord record : records) {
            String externalId = record.externalId();
            if (externalId == null) {
                continue;
            }
            boolean repeated = !seen.add(externalId);
            if (repeated || (storedExternalIds != null && storedExternalIds.contains(externalId))) {
                duplicates++;
            }
        }
        return duplicates;
    }

    private Map<String, Double> fieldCompleteness(List<ProcessedRecord> records) {
        Map<String, Double> completeness = new LinkedHashMap<>();
        for (Map.Entry<String, Predicate<DecodedJobRecord>> field : COMPLETENESS_FIELDS.entrySet()) {
            if (records.isEmpty()) {
                completeness.put(field.getKey(), 0.0);
                continue;
            }
            long present = records.stream()
                .filter(record -> record.decoded() != null && field.getValue().test(record.decoded()))
                .count();
            double percent = present * 100.0 / records.size();
            completeness.put(field.getKey(), Math.round(percent * 100.0) / 100.0);
        }
        return completeness;
    }
}
