package com.jobmarket.etl.ingest.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record NormalizedJob(
    String externalId,
    CompanyRef company,
    String title,
    String description,
    String descriptionPlain,
    String locationText,
    String city,
    String state,
    String country,
    String locationStandardized,
    Double latitude,
    Double longitude,
    Boolean remote,
    EmploymentType employmentType,
    String publisher,
    String applyLink,
    Boolean applyIsDirect,
    String googleLink,
    BigDecimal minSalary,
    BigDecimal maxSalary,
    BigDecimal avgSalary,
    BigDecimal salaryRange,
    SalaryPeriod salaryPeriod,
    String onetSoc,
    String onetJobZone,
    String seniorityLevel,
    Long postedAtTimestamp,
    Instant postedAtUtc,
    Instant fetchedAt,
    boolean needsReview,
    List<String> reviewReasons,
    List<ExtractedSkill> skills,
    List<String> benefits,
    List<JobHighlight> highlights
) {

    public NormalizedJob withCompany(CompanyRef resolved) {
        return new NormalizedJob(
            externalId, resolved, title, description, descriptionPlain, locationText, city, state, country,
            locationStandardized, latitude, longitude, remote, employmentType, publisher, applyLink, applyIsDirect,
            googleLink, minSalary, maxSalary, avgSalary, salaryRange, salaryPeriod, onetSoc, onetJobZone,
            seniorityLevel, postedAtTimestamp, postedAtUtc, fetchedAt, needsReview, reviewReasons, skills, benefits,
            highlights
        );
    }
}
