package com.jobmarket.etl.ingest.validation;

import com.jobmarket.etl.config.PipelineProperties;
import com.jobmarket.etl.ingest.model.DecodedJobRecord;
import com.jobmarket.etl.ingest.model.SalaryPeriod;
import com.jobmarket.etl.ingest.util.ReasonCodes;
import com.jobmarket.etl.ingest.util.TextUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_POSTED_AT_DATETIME;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_POSTED_AT_TIMESTAMP;

/**
 * Cross-field rules for records that passed {@link RawRecordValidator}. Only ever flags; flagged
 * records are still loaded and marked for review.
 */
@Component
public class ConsistencyChecker {
    private final ControlledVocabulary vocabulary;
    private final PipelineProperties properties;

    public ConsistencyChecker(ControlledVocabulary vocabulary, PipelineProperties properties) {
        this.vocabulary = vocabulary;
        this.properties = properties;
    }

    public List<String> check(DecodedJobRecord record) {
        List<String> flags = new ArrayList<>();
        checkLocation(record, flags);
        checkSalary(record, flags);
        checkPostedAt(record, flags);
        checkLinks(record, flags);
        checkDescription(record, flags);
        return flags;
    }

    private void checkLocation(DecodedJobRecord record, List<String> flags) {
        if (record.city() != null && record.state() == null) {
            flags.add(ReasonCodes.LOCATION_INCOMPLETE);
        }
    }

    private void checkSalary(DecodedJobRecord record, List<String> flags) {
        BigDecimal min = record.minSalary();
        BigDecimal max = record.maxSalary();
        if (min == null && max == null) {
            return;
        }
        if (record.salaryPeriod() == null) {
            flags.add(ReasonCodes.SALARY_MISSING_PERIOD);
        }
        if (min != null && max != null && min.compareTo(max) > 0) {
            flags.add(ReasonCodes.SALARY_RANGE_INVERTED);
        }
        if (vocabulary.resolveSalaryPeriod(record.salaryPeriod()) == SalaryPeriod.YEARLY) {
            PipelineProperties.Validation validation = properties.getValidation();
            boolean tooLow = min != null && min.doubleValue() < validation.getSalaryOutlierMinYearly();
            boolean tooHigh = max != null && max.doubleValue() > validation.getSalaryOutlierMaxYearly();
            if (tooLow || tooHigh) {
                flags.add(ReasonCodes.SALARY_OUTLIER);
            }
        }
    }

    private void checkPostedAt(DecodedJobRecord record, List<String> flags) {
        if (record.hasIssue(FIELD_POSTED_AT_TIMESTAMP) || record.hasIssue(FIELD_POSTED_AT_DATETIME)) {
            flags.add(ReasonCodes.POSTED_TIMESTAMP_INVALID);
            return;
        }
        if (record.postedAtTimestamp() == null || record.postedAtUtc() == null) {
            return;
        }
        long toleranceSeconds = properties.getValidation().getTimestampToleranceHours() * 3600L;
        long drift = Math.abs(record.postedAtTimestamp() - record.postedAtUtc().getEpochSecond());
        if (drift > toleranceSeconds) {
            flags.add(ReasonCodes.POSTED_TIMESTAMP_MISMATCH);
        }
    }

    private void checkLinks(DecodedJobRecord record, List<String> flags) {
        if (record.applyLink() != null && !TextUtils.isSecureUrl(record.applyLink())) {
            flags.add(ReasonCodes.INSECURE_APPLY_LINK);
        }
        if (record.googleLink() != null && !TextUtils.isSecureUrl(record.googleLink())) {
            flags.add(ReasonCodes.INSECURE_GOOGLE_LINK);
        }
    }

    private void checkDescription(DecodedJobRecord record, List<String> flags) {
        if (record.description() == null) {
            return;
        }
        int length = record.description().length();
        PipelineProperties.Validation validation = properties.getValidation();
        if (length < validation.getDescriptionMinLength() || length > validation.getDescriptionMaxLength()) {
            flags.add(ReasonCodes.DESCRIPTION_LENGTH_ANOMALY);
        }
    }
}
