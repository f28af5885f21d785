package com.jobmarket.etl.ingest.validation;

import com.jobmarket.etl.config.PipelineProperties;
import com.jobmarket.etl.ingest.JobFixtures;
import com.jobmarket.etl.ingest.decode.RawRecordDecoder;
import com.jobmarket.etl.ingest.util.ReasonCodes;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConsistencyCheckerTest {

    private final RawRecordDecoder decoder = new RawRecordDecoder();
    private final PipelineProperties properties = new PipelineProperties();
    private final ConsistencyChecker checker = new ConsistencyChecker(new ControlledVocabulary(properties), properties);

    private List<String> check(Map<String, Object> record) {
        return checker.check(decoder.decode(JobFixtures.raw(record)));
    }

    @Test
    void consistentRecordHasNoFlags() {
        assertThat(check(JobFixtures.validRecord("job-1"))).isEmpty();
    }

    @Test
    void cityWithoutStateIsIncomplete() {
        Map<String, Object> record = JobFixtures.validRecord("job-2");
        record.remove("job_state");

        assertThat(check(record)).containsExactly(ReasonCodes.LOCATION_INCOMPLETE);
    }

    @Test
    void invertedSalaryRangeIsFlagged() {
        Map<String, Object> record = JobFixtures.validRecord("job-3");
        record.put("job_min_salary", 90_000);
        record.put("job_max_salary", 70_000);

        assertThat(check(record)).containsExactly(ReasonCodes.SALARY_RANGE_INVERTED);
    }

    @Test
    void salaryWithoutPeriodIsFlagged() {
        Map<String, Object> record = JobFixtures.validRecord("job-4");
        record.remove("job_salary_period");

        assertThat(check(record)).containsExactly(ReasonCodes.SALARY_MISSING_PERIOD);
    }

    @Test
    void implausibleYearlySalaryIsAnOutlier() {
        Map<String, Object> record = JobFixtures.validRecord("job-5");
        record.put("job_min_salary", 20);
        record.put("job_max_salary", 35);

        assertThat(check(record)).containsExactly(ReasonCodes.SALARY_OUTLIER);
    }

    @Test
    void hourlySalaryIsNotComparedToYearlyBounds() {
        Map<String, Object> record = JobFixtures.validRecord("job-6");
        record.put("job_min_salary", 20);
        record.put("job_max_salary", 35);
        record.put("job_salary_period", "HOUR");

        assertThat(check(record)).isEmpty();
    }

    @Test
    void timestampsMoreThanADayApartMismatch() {
        Map<String, Object> record = JobFixtures.validRecord("job-7");
        record.put("job_posted_at_datetime_utc", "2023-11-20T22:13:20Z");

        assertThat(check(record)).containsExactly(ReasonCodes.POSTED_TIMESTAMP_MISMATCH);
    }

    @Test
    void timestampsWithinToleranceAreConsistent() {
        Map<String, Object> record = JobFixtures.validRecord("job-8");
        record.put("job_posted_at_datetime_utc", "2023-11-15T10:00:00Z");

        assertThat(check(record)).isEmpty();
    }

    @Test
    void unparseableDatetimeIsFlagged() {
        Map<String, Object> record = JobFixtures.validRecord("job-9");
        record.put("job_posted_at_datetime_utc", "last tuesday");

        assertThat(check(record)).containsExactly(ReasonCodes.POSTED_TIMESTAMP_INVALID);
    }

    @Test
    void plainHttpLinksAreInsecure() {
        Map<String, Object> record = JobFixtures.validRecord("job-10");
        record.put("job_apply_link", "http://acme.example/apply");
        record.put("job_google_link", "http://www.google.com/search?q=x");

        assertThat(check(record)).containsExactly(ReasonCodes.INSECURE_APPLY_LINK, ReasonCodes.INSECURE_GOOGLE_LINK);
    }

    @Test
    void shortDescriptionIsAnomalous() {
        Map<String, Object> record = JobFixtures.validRecord("job-11");
        record.put("job_description", "Analyst wanted.");

        assertThat(check(record)).containsExactly(ReasonCodes.DESCRIPTION_LENGTH_ANOMALY);
    }

    @Test
    void descriptionBoundsComeFromConfiguration() {
        PipelineProperties strict = new PipelineProperties();
        strict.getValidation().setDescriptionMinLength(1_000);
        ConsistencyChecker strictChecker = new ConsistencyChecker(new ControlledVocabulary(strict), strict);

        List<String> flags = strictChecker.check(decoder.decode(JobFixtures.validRaw("job-12")));

        assertThat(flags).containsExactly(ReasonCodes.DESCRIPTION_LENGTH_ANOMALY);
    }
}
