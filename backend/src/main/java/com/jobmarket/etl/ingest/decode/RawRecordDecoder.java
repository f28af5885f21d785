package com.jobmarket.etl.ingest.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobmarket.etl.ingest.model.DecodeIssue;
import com.jobmarket.etl.ingest.model.DecodedJobRecord;
import com.jobmarket.etl.ingest.model.RawJobRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class RawRecordDecoder {
    public static final String FIELD_JOB_ID = "job_id";
    public static final String FIELD_TITLE = "job_title";
    public static final String FIELD_EMPLOYER_NAME = "employer_name";
    public static final String FIELD_DESCRIPTION = "job_description";
    public static final String FIELD_LOCATION = "job_location";
    public static final String FIELD_CITY = "job_city";
    public static final String FIELD_STATE = "job_state";
    public static final String FIELD_COUNTRY = "job_country";
    public static final String FIELD_IS_REMOTE = "job_is_remote";
    public static final String FIELD_LATITUDE = "job_latitude";
    public static final String FIELD_LONGITUDE = "job_longitude";
    public static final String FIELD_MIN_SALARY = "job_min_salary";
    public static final String FIELD_MAX_SALARY = "job_max_salary";
    public static final String FIELD_POSTED_AT_TIMESTAMP = "job_posted_at_timestamp";
    public static final String FIELD_POSTED_AT_DATETIME = "job_posted_at_datetime_utc";

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes");
    private static final Set<String> FALSE_VALUES = Set.of("false", "0", "no");
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    public DecodedJobRecord decode(RawJobRecord raw) {
        List<DecodeIssue> issues = new ArrayList<>();
        BigDecimal latitude = decimal(raw.jobLatitude(), FIELD_LATITUDE, issues);
        BigDecimal longitude = decimal(raw.jobLongitude(), FIELD_LONGITUDE, issues);
        return new DecodedJobRecord(
            externalId(raw.jobId(), issues),
            text(raw.jobTitle(), FIELD_TITLE, issues),
            text(raw.employerName(), FIELD_EMPLOYER_NAME, issues),
            text(raw.employerLogo(), "employer_logo", issues),
            text(raw.employerWebsite(), "employer_website", issues),
            text(raw.jobPublisher(), "job_publisher", issues),
            text(raw.jobEmploymentType(), "job_employment_type", issues),
            text(raw.jobApplyLink(), "job_apply_link", issues),
            bool(raw.jobApplyIsDirect(), "job_apply_is_direct", issues),
            text(raw.jobGoogleLink(), "job_google_link", issues),
            description(raw.jobDescription(), issues),
            bool(raw.jobIsRemote(), FIELD_IS_REMOTE, issues),
            epochSeconds(raw.jobPostedAtTimestamp(), issues),
            instant(raw.jobPostedAtDatetimeUtc(), issues),
            text(raw.jobLocation(), FIELD_LOCATION, issues),
            text(raw.jobCity(), FIELD_CITY, issues),
            text(raw.jobState(), FIELD_STATE, issues),
            text(raw.jobCountry(), FIELD_COUNTRY, issues),
            latitude == null ? null : latitude.doubleValue(),
            longitude == null ? null : longitude.doubleValue(),
            stringList(raw.jobBenefits(), "job_benefits", issues),
            decimal(raw.jobMinSalary(), FIELD_MIN_SALARY, issues),
            decimal(raw.jobMaxSalary(), FIELD_MAX_SALARY, issues),
            text(raw.jobSalaryPeriod(), "job_salary_period", issues),
            highlights(raw.jobHighlights(), issues),
            text(raw.jobOnetSoc(), "job_onet_soc", issues),
            text(raw.jobOnetJobZone(), "job_onet_job_zone", issues),
            List.copyOf(issues)
        );
    }

    private String externalId(JsonNode node, List<DecodeIssue> issues) {
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isTextual()) {
            issues.add(new DecodeIssue(FIELD_JOB_ID, node.toString()));
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private String text(JsonNode node, String field, List<DecodeIssue> issues) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isContainerNode()) {
            issues.add(new DecodeIssue(field, abbreviate(node.toString())));
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    // Descriptions keep their internal layout; only the outer whitespace goes.
    private String description(JsonNode node, List<DecodeIssue> issues) {
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isTextual()) {
            issues.add(new DecodeIssue(FIELD_DESCRIPTION, abbreviate(node.toString())));
            return null;
        }
        String value = node.asText().strip();
        return value.isEmpty() ? null : value;
    }

    private Boolean bool(JsonNode node, String field, List<DecodeIssue> issues) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        String candidate = null;
        if (node.isIntegralNumber()) {
            candidate = node.asText();
        } else if (node.isTextual()) {
            candidate = node.asText().trim().toLowerCase(Locale.ROOT);
            if (candidate.isEmpty()) {
                return null;
            }
        }
        if (candidate != null && TRUE_VALUES.contains(candidate)) {
            return Boolean.TRUE;
        }
        if (candidate != null && FALSE_VALUES.contains(candidate)) {
            return Boolean.FALSE;
        }
        issues.add(new DecodeIssue(field, abbreviate(node.toString())));
        return null;
    }

    private BigDecimal decimal(JsonNode node, String field, List<DecodeIssue> issues) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            String cleaned = node.asText().trim().replace(",", "").replace("$", "");
            if (cleaned.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(cleaned);
            } catch (NumberFormatException e) {
                issues.add(new DecodeIssue(field, abbreviate(node.asText())));
                return null;
            }
        }
        issues.add(new DecodeIssue(field, abbreviate(node.toString())));
        return null;
    }

    private Long epochSeconds(JsonNode node, List<DecodeIssue> issues) {
        BigDecimal value = decimal(node, FIELD_POSTED_AT_TIMESTAMP, issues);
        if (value == null) {
            return null;
        }
        long epoch;
        try {
            epoch = value.longValueExact();
        } catch (ArithmeticException e) {
            issues.add(new DecodeIssue(FIELD_POSTED_AT_TIMESTAMP, abbreviate(value.toPlainString())));
            return null;
        }
        if (Math.abs(epoch) >= EPOCH_MILLIS_THRESHOLD) {
            return epoch / 1000L;
        }
        return epoch;
    }

    private Instant instant(JsonNode node, List<DecodeIssue> issues) {
        String value = text(node, FIELD_POSTED_AT_DATETIME, issues);
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to the zone-less form
        }
        try {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            issues.add(new DecodeIssue(FIELD_POSTED_AT_DATETIME, abbreviate(value)));
            return null;
        }
    }

    private List<String> stringList(JsonNode node, String field, List<DecodeIssue> issues) {
        if (isAbsent(node)) {
            return List.of();
        }
        if (node.isTextual()) {
            String value = node.asText().trim();
            return value.isEmpty() ? List.of() : List.of(value);
        }
        if (!node.isArray()) {
            issues.add(new DecodeIssue(field, abbreviate(node.toString())));
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode child : node) {
            if (child == null || child.isNull() || child.isContainerNode()) {
                continue;
            }
            String value = child.asText().trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return List.copyOf(values);
    }

    private Map<String, List<String>> highlights(JsonNode node, List<DecodeIssue> issues) {
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isObject()) {
            issues.add(new DecodeIssue("job_highlights", abbreviate(node.toString())));
            return null;
        }
        Map<String, List<String>> blocks = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry ->
            blocks.put(entry.getKey(), stringList(entry.getValue(), "job_highlights." + entry.getKey(), issues))
        );
        return blocks;
    }

    private boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private String abbreviate(String value) {
        if (value == null || value.length() <= 80) {
            return value;
        }
        return value.substring(0, 80);
    }
}
