package com.jobmarket.etl.ingest.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobmarket.etl.config.PipelineProperties;
import com.jobmarket.etl.ingest.JobFixtures;
import com.jobmarket.etl.ingest.decode.RawRecordDecoder;
import com.jobmarket.etl.ingest.model.DecisionOutcome;
import com.jobmarket.etl.ingest.model.EmploymentType;
import com.jobmarket.etl.ingest.model.NormalizedJob;
import com.jobmarket.etl.ingest.model.ProcessedRecord;
import com.jobmarket.etl.ingest.model.SalaryPeriod;
import com.jobmarket.etl.ingest.normalize.CompanyIndex;
import com.jobmarket.etl.ingest.normalize.CompanyNameNormalizer;
import com.jobmarket.etl.ingest.normalize.LocationStandardizer;
import com.jobmarket.etl.ingest.normalize.SeniorityClassifier;
import com.jobmarket.etl.ingest.skills.SkillExtractor;
import com.jobmarket.etl.ingest.skills.SkillTaxonomy;
import com.jobmarket.etl.ingest.skills.SkillTaxonomyLoader;
import com.jobmarket.etl.ingest.util.ReasonCodes;
import com.jobmarket.etl.ingest.validation.ConsistencyChecker;
import com.jobmarket.etl.ingest.validation.ControlledVocabulary;
import com.jobmarket.etl.ingest.validation.RawRecordValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JobRecordProcessorTest {

    private JobRecordProcessor processor;
    private CompanyIndex companyIndex;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        ControlledVocabulary vocabulary = new ControlledVocabulary(properties);
        SkillTaxonomy taxonomy = new SkillTaxonomyLoader(new DefaultResourceLoader(), new ObjectMapper())
            .load(properties.getSkills().getTaxonomyLocation());
        processor = new JobRecordProcessor(
            new RawRecordDecoder(),
            new RawRecordValidator(vocabulary),
            new ConsistencyChecker(vocabulary, properties),
            vocabulary,
            new LocationStandardizer(),
            new SeniorityClassifier(),
            new SkillExtractor(taxonomy, properties)
        );
        companyIndex = new CompanyIndex(new CompanyNameNormalizer(properties));
    }

    @Test
    void normalizesCleanRecord() {
        Instant fetchedAt = Instant.parse("2024-01-01T00:00:00Z");

        ProcessedRecord record = processor.process(0, JobFixtures.validRaw("job-1"), companyIndex, fetchedAt);

        assertThat(record.decision().outcome()).isEqualTo(DecisionOutcome.ACCEPTED);
        NormalizedJob job = record.job();
        assertThat(job.company().nameKey()).isEqualTo("acme analytics");
        assertThat(job.state()).isEqualTo("District of Columbia");
        assertThat(job.locationStandardized()).isEqualTo("Washington, District of Columbia");
        assertThat(job.employmentType()).isEqualTo(EmploymentType.FULL_TIME);
        assertThat(job.salaryPeriod()).isEqualTo(SalaryPeriod.YEARLY);
        assertThat(job.avgSalary()).isEqualByComparingTo("60000");
        assertThat(job.salaryRange()).isEqualByComparingTo("20000");
        assertThat(job.seniorityLevel()).isEqualTo("Mid");
        assertThat(job.benefits()).containsExactly("Health insurance", "Paid time off");
        assertThat(job.needsReview()).isFalse();
        assertThat(job.fetchedAt()).isEqualTo(fetchedAt);
    }

    @Test
    void flaggedRecordIsMarkedForReview() {
        Map<String, Object> raw = JobFixtures.validRecord("job-2");
        raw.put("job_employment_type", "Gig");
        raw.put("job_apply_link", "http://acme.example/apply");

        ProcessedRecord record = processor.process(1, JobFixtures.raw(raw), companyIndex, Instant.now());

        assertThat(record.decision().outcome()).isEqualTo(DecisionOutcome.FLAGGED);
        assertThat(record.decision().reasons())
            .containsExactly(ReasonCodes.EMPLOYMENT_TYPE_UNMAPPED, ReasonCodes.INSECURE_APPLY_LINK);
        assertThat(record.job().employmentType()).isEqualTo(EmploymentType.OTHER);
        assertThat(record.job().needsReview()).isTrue();
        assertThat(record.job().reviewReasons()).isEqualTo(record.decision().reasons());
    }

    @Test
    void rejectedRecordHasNoJob() {
        Map<String, Object> raw = JobFixtures.validRecord("job-3");
        raw.remove("employer_name");

        ProcessedRecord record = processor.process(2, JobFixtures.raw(raw), companyIndex, Instant.now());

        assertThat(record.decision().isRejected()).isTrue();
        assertThat(record.decision().reasons()).isEqualTo(List.of("missing employer_name"));
        assertThat(record.job()).isNull();
        assertThat(companyIndex.size()).isZero();
    }

    @Test
    void unexpectedFailureBecomesProcessingError() {
        ProcessedRecord record = processor.process(3, null, companyIndex, Instant.now());

        assertThat(record.decision().isRejected()).isTrue();
        assertThat(record.decision().reasons()).containsExactly(ReasonCodes.PROCESSING_ERROR);
    }
}
