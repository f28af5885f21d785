package com.jobmarket.etl.ingest.service;

import com.jobmarket.etl.ingest.JobFixtures;
import com.jobmarket.etl.ingest.decode.RawRecordDecoder;
import com.jobmarket.etl.ingest.model.LoadResult;
import com.jobmarket.etl.ingest.model.LoadStatus;
import com.jobmarket.etl.ingest.model.ProcessedRecord;
import com.jobmarket.etl.ingest.model.QualityReport;
import com.jobmarket.etl.ingest.model.RecordDecision;
import com.jobmarket.etl.ingest.util.ReasonCodes;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class QualityReporterTest {

    private final QualityReporter reporter = new QualityReporter();
    private final RawRecordDecoder decoder = new RawRecordDecoder();

    @Test
    void aggregatesDecisionsAndLoadResults() {
        ProcessedRecord accepted = JobFixtures.loadable(0, "job-1");
        ProcessedRecord flagged = new ProcessedRecord(
            1,
            null,
            RecordDecision.loadable(1, "job-2", List.of(ReasonCodes.SALARY_OUTLIER)),
            JobFixtures.normalizedJob("job-2")
        );
        ProcessedRecord rejected = JobFixtures.rejected(2, "job-3", "missing job_title");
        BatchLoadOutcome outcome = new BatchLoadOutcome(
            List.of(
                LoadResult.loaded(0, "job-1", 10L, 1),
                new LoadResult(1, "job-2", LoadStatus.LOAD_FAILED, null, 2, "lock timeout"),
                LoadResult.skipped(2, "job-3")
            ),
            false
        );

        QualityReport report = reporter.report(
            "batch-1", Instant.EPOCH, Instant.EPOCH, List.of(accepted, flagged, rejected), outcome, Set.of()
        );

        assertThat(report.totalRecords()).isEqualTo(3);
        assertThat(report.accepted()).isEqualTo(1);
        assertThat(report.flagged()).isEqualTo(1);
        assertThat(report.rejected()).isEqualTo(1);
        assertThat(report.loaded()).isEqualTo(1);
        assertThat(report.loadFailed()).isEqualTo(1);
        assertThat(report.status()).isEqualTo(QualityReporter.STATUS_COMPLETED_WITH_ERRORS);
        assertThat(report.reasonCounts()).containsOnly(
            entry(ReasonCodes.SALARY_OUTLIER, 1L),
            entry("missing job_title", 1L)
        );
        assertThat(report.rejectedRecords()).containsExactly(
            new QualityReport.RejectedRecordEntry(2, "job-3", List.of("missing job_title"))
        );
        assertThat(report.loadFailures()).extracting(QualityReport.LoadFailureEntry::externalId).containsExactly("job-2");
        assertThat(report.skillCounts()).containsOnly(entry("SQL", 1L), entry("Tableau", 1L));
        assertThat(report.seniorityDistribution()).containsOnly(entry("Mid", 1L));
    }

    @Test
    void countsRepeatedAndPreviouslyStoredIds() {
        List<ProcessedRecord> records = List.of(
            JobFixtures.loadable(0, "job-1"),
            JobFixtures.loadable(1, "job-1"),
            JobFixtures.loadable(2, "job-2"),
            JobFixtures.rejected(3, null, ReasonCodes.JOB_ID_NOT_STRING)
        );
        BatchLoadOutcome outcome = new BatchLoadOutcome(List.of(), false);

        QualityReport report = reporter.report("batch-2", Instant.EPOCH, Instant.EPOCH, records, outcome, Set.of("job-2"));

        assertThat(report.duplicateIdCount()).isEqualTo(2);
    }

    @Test
    void abortedLoadMarksReportAborted() {
        BatchLoadOutcome outcome = new BatchLoadOutcome(
            List.of(new LoadResult(0, "job-1", LoadStatus.LOAD_FAILED, null, 1, "database down")),
            true
        );

        QualityReport report = reporter.report(
            "batch-3", Instant.EPOCH, Instant.EPOCH, List.of(JobFixtures.loadable(0, "job-1")), outcome, Set.of()
        );

        assertThat(report.status()).isEqualTo(QualityReporter.STATUS_ABORTED);
    }

    @Test
    void fieldCompletenessIsAPercentageOfAllRecords() {
        Map<String, Object> withoutSalary = JobFixtures.validRecord("job-2");
        withoutSalary.remove("job_min_salary");
        List<ProcessedRecord> records = List.of(
            new ProcessedRecord(0, decoder.decode(JobFixtures.validRaw("job-1")), RecordDecision.loadable(0, "job-1", List.of()), null),
            new ProcessedRecord(1, decoder.decode(JobFixtures.raw(withoutSalary)), RecordDecision.loadable(1, "job-2", List.of()), null),
            new ProcessedRecord(2, null, RecordDecision.rejected(2, null, List.of(ReasonCodes.PROCESSING_ERROR)), null)
        );

        QualityReport report = reporter.report(
            "batch-4", Instant.EPOCH, Instant.EPOCH, records, new BatchLoadOutcome(List.of(), false), Set.of()
        );

        assertThat(report.fieldCompleteness().get("job_title")).isEqualTo(66.67);
        assertThat(report.fieldCompleteness().get("job_min_salary")).isEqualTo(33.33);
        assertThat(report.status()).isEqualTo(QualityReporter.STATUS_COMPLETED);
    }
}
