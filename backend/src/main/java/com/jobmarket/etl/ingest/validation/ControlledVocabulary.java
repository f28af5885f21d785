package com.jobmarket.etl.ingest.validation;

import com.jobmarket.etl.config.PipelineProperties;
import com.jobmarket.etl.ingest.model.EmploymentType;
import com.jobmarket.etl.ingest.model.SalaryPeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Synonym tables for employment types and salary periods. Built once from the defaults plus any
 * configured overrides and never modified afterwards.
 */
@Component
public class ControlledVocabulary {
    private static final Logger log = LoggerFactory.getLogger(ControlledVocabulary.class);

    private final Map<String, EmploymentType> employmentTypes;
    private final Map<String, SalaryPeriod> salaryPeriods;

    public ControlledVocabulary(PipelineProperties properties) {
        Map<String, EmploymentType> types = new HashMap<>();
        types.put("FULLTIME", EmploymentType.FULL_TIME);
        types.put("PERMANENT", EmploymentType.FULL_TIME);
        types.put("PARTTIME", EmploymentType.PART_TIME);
        types.put("CONTRACT", EmploymentType.CONTRACT);
        types.put("CONTRACTOR", EmploymentType.CONTRACT);
        types.put("CONTRACTTOHIRE", EmploymentType.CONTRACT);
        types.put("FREELANCE", EmploymentType.CONTRACT);
        types.put("TEMPORARY", EmploymentType.TEMPORARY);
        types.put("TEMP", EmploymentType.TEMPORARY);
        types.put("SEASONAL", EmploymentType.TEMPORARY);
        types.put("INTERN", EmploymentType.INTERNSHIP);
        types.put("INTERNSHIP", EmploymentType.INTERNSHIP);
        for (Map.Entry<String, String> entry : properties.getVocabulary().getEmploymentTypeSynonyms().entrySet()) {
            EmploymentType target = employmentTypeByName(entry.getValue());
            if (target == null) {
                log.warn("Ignoring employment type synonym {} -> {}: unknown target", entry.getKey(), entry.getValue());
                continue;
            }
            types.put(key(entry.getKey()), target);
        }

        Map<String, SalaryPeriod> periods = new HashMap<>();
        periods.put("YEAR", SalaryPeriod.YEARLY);
        periods.put("YEARLY", SalaryPeriod.YEARLY);
        periods.put("PERYEAR", SalaryPeriod.YEARLY);
        periods.put("ANNUAL", SalaryPeriod.YEARLY);
        periods.put("ANNUALLY", SalaryPeriod.YEARLY);
        periods.put("MONTH", SalaryPeriod.MONTHLY);
        periods.put("MONTHLY", SalaryPeriod.MONTHLY);
        periods.put("PERMONTH", SalaryPeriod.MONTHLY);
        periods.put("HOUR", SalaryPeriod.HOURLY);
        periods.put("HOURLY", SalaryPeriod.HOURLY);
        periods.put("PERHOUR", SalaryPeriod.HOURLY);
        for (Map.Entry<String, String> entry : properties.getVocabulary().getSalaryPeriodSynonyms().entrySet()) {
            SalaryPeriod target = salaryPeriodByName(entry.getValue());
            if (target == null) {
                log.warn("Ignoring salary period synonym {} -> {}: unknown target", entry.getKey(), entry.getValue());
                continue;
            }
            periods.put(key(entry.getKey()), target);
        }

        this.employmentTypes = Collections.unmodifiableMap(types);
        this.salaryPeriods = Collections.unmodifiableMap(periods);
    }

    /** Returns {@code null} when the value has no mapping. */
    public EmploymentType resolveEmploymentType(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return employmentTypes.get(key(raw));
    }

    /** Returns {@code null} when the value has no mapping. */
    public SalaryPeriod resolveSalaryPeriod(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return salaryPeriods.get(key(raw));
    }

    private static String key(String raw) {
        StringBuilder out = new StringBuilder(raw.length());
        for (char c : raw.toUpperCase(Locale.ROOT).toCharArray()) {
            if (Character.isLetterOrDigit(c)) {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static EmploymentType employmentTypeByName(String value) {
        if (value == null) {
            return null;
        }
        for (EmploymentType type : EmploymentType.values()) {
            if (type.name().equalsIgnoreCase(value.trim()) || type.label().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }

    private static SalaryPeriod salaryPeriodByName(String value) {
        if (value == null) {
            return null;
        }
        for (SalaryPeriod period : SalaryPeriod.values()) {
            if (period.name().equalsIgnoreCase(value.trim())) {
                return period;
            }
        }
        return null;
    }
}
