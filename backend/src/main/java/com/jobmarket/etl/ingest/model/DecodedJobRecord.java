package com.jobmarket.etl.ingest.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Strongly typed view of a {@link RawJobRecord}. Blank strings are {@code null}; values that could
 * not be decoded are {@code null} and listed in {@link #issues()}. {@code highlights} is
 * {@code null} when the source carried no highlights object at all.
 */
public record DecodedJobRecord(
    String externalId,
    String title,
    String employerName,
    String employerLogo,
    String employerWebsite,
    String publisher,
    String employmentType,
    String applyLink,
    Boolean applyIsDirect,
    String googleLink,
    String description,
    Boolean remote,
    Long postedAtTimestamp,
    Instant postedAtUtc,
    String location,
    String city,
    String state,
    String country,
    Double latitude,
    Double longitude,
    List<String> benefits,
    BigDecimal minSalary,
    BigDecimal maxSalary,
    String salaryPeriod,
    Map<String, List<String>> highlights,
    String onetSoc,
    String onetJobZone,
    List<DecodeIssue> issues
) {

    public boolean hasIssue(String field) {
        for (DecodeIssue issue : issues) {
            if (issue.field().equals(field)) {
                return true;
            }
        }
        return false;
    }
}
