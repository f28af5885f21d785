package com.jobmarket.etl.ingest.decode;

import com.jobmarket.etl.ingest.JobFixtures;
import com.jobmarket.etl.ingest.model.DecodedJobRecord;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RawRecordDecoderTest {

    private final RawRecordDecoder decoder = new RawRecordDecoder();

    @Test
    void decodesWellFormedRecord() {
        DecodedJobRecord decoded = decoder.decode(JobFixtures.validRaw("job-1"));

        assertThat(decoded.externalId()).isEqualTo("job-1");
        assertThat(decoded.remote()).isFalse();
        assertThat(decoded.minSalary()).isEqualByComparingTo("50000");
        assertThat(decoded.postedAtUtc()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(decoded.highlights()).containsKeys("Qualifications", "Responsibilities", "Benefits");
        assertThat(decoded.issues()).isEmpty();
    }

    @Test
    void blankStringsBecomeNull() {
        Map<String, Object> record = JobFixtures.validRecord("job-2");
        record.put("job_title", "   ");
        record.put("job_city", "");

        DecodedJobRecord decoded = decoder.decode(JobFixtures.raw(record));

        assertThat(decoded.title()).isNull();
        assertThat(decoded.city()).isNull();
        assertThat(decoded.issues()).isEmpty();
    }

    @Test
    void numericJobIdIsRecordedAsIssue() {
        Map<String, Object> record = JobFixtures.validRecord("ignored");
        record.put("job_id", 12345);

        DecodedJobRecord decoded = decoder.decode(JobFixtures.raw(record));

        assertThat(decoded.externalId()).isNull();
        assertThat(decoded.hasIssue(RawRecordDecoder.FIELD_JOB_ID)).isTrue();
    }

    @Test
    void acceptsCommonBooleanSpellings() {
        Map<String, Object> record = JobFixtures.validRecord("job-3");
        record.put("job_is_remote", "Yes");
        record.put("job_apply_is_direct", 0);

        DecodedJobRecord decoded = decoder.decode(JobFixtures.raw(record));

        assertThat(decoded.remote()).isTrue();
        assertThat(decoded.applyIsDirect()).isFalse();
    }

    @Test
    void unrecognisedBooleanIsAnIssue() {
        Map<String, Object> record = JobFixtures.validRecord("job-4");
        record.put("job_is_remote", "sometimes");

        DecodedJobRecord decoded = decoder.decode(JobFixtures.raw(record));

        assertThat(decoded.remote()).isNull();
        assertThat(decoded.hasIssue(RawRecordDecoder.FIELD_IS_REMOTE)).isTrue();
    }

    @Test
    void parsesFormattedSalaryStrings() {
        Map<String, Object> record = JobFixtures.validRecord("job-5");
        record.put("job_min_salary", "$55,000");
        record.put("job_max_salary", "not disclosed");

        DecodedJobRecord decoded = decoder.decode(JobFixtures.raw(record));

        assertThat(decoded.minSalary()).isEqualByComparingTo(new BigDecimal("55000"));
        assertThat(decoded.maxSalary()).isNull();
        assertThat(decoded.hasIssue(RawRecordDecoder.FIELD_MAX_SALARY)).isTrue();
    }

    @Test
    void millisecondTimestampsAreScaledToSeconds() {
        Map<String, Object> record = JobFixtures.validRecord("job-6");
        record.put("job_posted_at_timestamp", 1_700_000_000_000L);

        DecodedJobRecord decoded = decoder.decode(JobFixtures.raw(record));

        assertThat(decoded.postedAtTimestamp()).isEqualTo(1_700_000_000L);
    }

    @Test
    void zonelessDatetimeIsReadAsUtc() {
        Map<String, Object> record = JobFixtures.validRecord("job-7");
        record.put("job_posted_at_datetime_utc", "2023-11-14T22:13:20");

        DecodedJobRecord decoded = decoder.decode(JobFixtures.raw(record));

        assertThat(decoded.postedAtUtc()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
    }

    @Test
    void missingHighlightsObjectStaysNull() {
        Map<String, Object> record = JobFixtures.validRecord("job-8");
        record.remove("job_highlights");

        DecodedJobRecord decoded = decoder.decode(JobFixtures.raw(record));

        assertThat(decoded.highlights()).isNull();
    }

    @Test
    void singleBenefitStringBecomesList() {
        Map<String, Object> record = JobFixtures.validRecord("job-9");
        record.put("job_benefits", "Dental");

        DecodedJobRecord decoded = decoder.decode(JobFixtures.raw(record));

        assertThat(decoded.benefits()).isEqualTo(List.of("Dental"));
    }

    @Test
    void oversizedOrFractionalTimestampIsAnIssue() {
        Map<String, Object> huge = JobFixtures.validRecord("job-5");
        huge.put("job_posted_at_timestamp", "1e30");
        Map<String, Object> fractional = JobFixtures.validRecord("job-6");
        fractional.put("job_posted_at_timestamp", 1_700_000_000.5d);

        DecodedJobRecord hugeDecoded = decoder.decode(JobFixtures.raw(huge));
        DecodedJobRecord fractionalDecoded = decoder.decode(JobFixtures.raw(fractional));

        assertThat(hugeDecoded.postedAtTimestamp()).isNull();
        assertThat(hugeDecoded.hasIssue(RawRecordDecoder.FIELD_POSTED_AT_TIMESTAMP)).isTrue();
        assertThat(fractionalDecoded.postedAtTimestamp()).isNull();
        assertThat(fractionalDecoded.hasIssue(RawRecordDecoder.FIELD_POSTED_AT_TIMESTAMP)).isTrue();
    }
}
