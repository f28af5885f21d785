package com.jobmarket.etl.ingest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One job record as delivered by the aggregation API. Every field may be absent, JSON null or of an
 * unexpected type; {@link com.jobmarket.etl.ingest.decode.RawRecordDecoder} turns it into a
 * {@link DecodedJobRecord} before any rule runs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawJobRecord(
    @JsonProperty("job_id") JsonNode jobId,
    @JsonProperty("job_title") JsonNode jobTitle,
    @JsonProperty("employer_name") JsonNode employerName,
    @JsonProperty("employer_logo") JsonNode employerLogo,
    @JsonProperty("employer_website") JsonNode employerWebsite,
    @JsonProperty("job_publisher") JsonNode jobPublisher,
    @JsonProperty("job_employment_type") JsonNode jobEmploymentType,
    @JsonProperty("job_apply_link") JsonNode jobApplyLink,
    @JsonProperty("job_apply_is_direct") JsonNode jobApplyIsDirect,
    @JsonProperty("job_google_link") JsonNode jobGoogleLink,
    @JsonProperty("job_description") JsonNode jobDescription,
    @JsonProperty("job_is_remote") JsonNode jobIsRemote,
    @JsonProperty("job_posted_at_timestamp") JsonNode jobPostedAtTimestamp,
    @JsonProperty("job_posted_at_datetime_utc") JsonNode jobPostedAtDatetimeUtc,
    @JsonProperty("job_location") JsonNode jobLocation,
    @JsonProperty("job_city") JsonNode jobCity,
    @JsonProperty("job_state") JsonNode jobState,
    @JsonProperty("job_country") JsonNode jobCountry,
    @JsonProperty("job_latitude") JsonNode jobLatitude,
    @JsonProperty("job_longitude") JsonNode jobLongitude,
    @JsonProperty("job_benefits") JsonNode jobBenefits,
    @JsonProperty("job_min_salary") JsonNode jobMinSalary,
    @JsonProperty("job_max_salary") JsonNode jobMaxSalary,
    @JsonProperty("job_salary_period") JsonNode jobSalaryPeriod,
    @JsonProperty("job_highlights") JsonNode jobHighlights,
    @JsonProperty("job_onet_soc") JsonNode jobOnetSoc,
    @JsonProperty("job_onet_job_zone") JsonNode jobOnetJobZone
) {
}
