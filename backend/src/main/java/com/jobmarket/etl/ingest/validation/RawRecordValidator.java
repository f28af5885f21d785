package com.jobmarket.etl.ingest.validation;

import com.jobmarket.etl.ingest.model.DecodedJobRecord;
import com.jobmarket.etl.ingest.util.ReasonCodes;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_CITY;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_COUNTRY;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_DESCRIPTION;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_EMPLOYER_NAME;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_IS_REMOTE;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_JOB_ID;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_LATITUDE;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_LOCATION;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_LONGITUDE;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_MAX_SALARY;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_MIN_SALARY;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_STATE;
import static com.jobmarket.etl.ingest.decode.RawRecordDecoder.FIELD_TITLE;

/**
 * Field-level completeness and validity rules. Every rule is evaluated so a rejected record lists
 * all of its problems; the vocabulary rules only ever flag.
 */
@Component
public class RawRecordValidator {
    private static final Pattern COUNTRY_CODE = Pattern.compile("^[A-Z]{2}$");

    private final ControlledVocabulary vocabulary;

    public RawRecordValidator(ControlledVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public ValidationResult validate(DecodedJobRecord record) {
        List<String> rejections = new ArrayList<>();
        List<String> flags = new ArrayList<>();

        if (record.hasIssue(FIELD_JOB_ID)) {
            rejections.add(ReasonCodes.JOB_ID_NOT_STRING);
        } else {
            requirePresent(record.externalId(), FIELD_JOB_ID, rejections);
        }
        requirePresent(record.title(), FIELD_TITLE, rejections);
        requirePresent(record.employerName(), FIELD_EMPLOYER_NAME, rejections);
        requirePresent(record.description(), FIELD_DESCRIPTION, rejections);
        requirePresent(record.location(), FIELD_LOCATION, rejections);
        requirePresent(record.city(), FIELD_CITY, rejections);
        requirePresent(record.state(), FIELD_STATE, rejections);
        requirePresent(record.country(), FIELD_COUNTRY, rejections);

        if (record.hasIssue(FIELD_IS_REMOTE)) {
            rejections.add(ReasonCodes.REMOTE_FLAG_NOT_BOOLEAN);
        }

        if (record.hasIssue(FIELD_LATITUDE)) {
            rejections.add(ReasonCodes.LATITUDE_NOT_NUMERIC);
        } else if (record.latitude() != null && !inRange(record.latitude(), 90.0)) {
            rejections.add(ReasonCodes.LATITUDE_OUT_OF_RANGE);
        }
        if (record.hasIssue(FIELD_LONGITUDE)) {
            rejections.add(ReasonCodes.LONGITUDE_NOT_NUMERIC);
        } else if (record.longitude() != null && !inRange(record.longitude(), 180.0)) {
            rejections.add(ReasonCodes.LONGITUDE_OUT_OF_RANGE);
        }

        if (record.country() != null && !isCountryCode(record.country())) {
            rejections.add(ReasonCodes.COUNTRY_CODE_INVALID);
        }

        if (record.employmentType() != null && vocabulary.resolveEmploymentType(record.employmentType()) == null) {
            flags.add(ReasonCodes.EMPLOYMENT_TYPE_UNMAPPED);
        }
        if (record.salaryPeriod() != null && vocabulary.resolveSalaryPeriod(record.salaryPeriod()) == null) {
            flags.add(ReasonCodes.SALARY_PERIOD_UNMAPPED);
        }
        if (record.hasIssue(FIELD_MIN_SALARY) || record.hasIssue(FIELD_MAX_SALARY)) {
            flags.add(ReasonCodes.SALARY_NOT_NUMERIC);
        }
        return new ValidationResult(rejections, flags);
    }

    public static String normalizeCountry(String country) {
        return country == null ? null : country.trim().toUpperCase(Locale.ROOT);
    }

    private boolean isCountryCode(String country) {
        return COUNTRY_CODE.matcher(normalizeCountry(country)).matches();
    }

    private void requirePresent(String value, String field, List<String> rejections) {
        if (value == null || value.isBlank()) {
            rejections.add(ReasonCodes.missing(field));
        }
    }

    private boolean inRange(double value, double bound) {
        return !Double.isNaN(value) && value >= -bound && value <= bound;
    }
}
