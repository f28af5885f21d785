package com.jobmarket.etl.ingest.service;

import com.jobmarket.etl.ingest.decode.RawRecordDecoder;
import com.jobmarket.etl.ingest.model.CompanyRef;
import com.jobmarket.etl.ingest.model.DecodedJobRecord;
import com.jobmarket.etl.ingest.model.EmploymentType;
import com.jobmarket.etl.ingest.model.NormalizedJob;
import com.jobmarket.etl.ingest.model.ProcessedRecord;
import com.jobmarket.etl.ingest.model.RawJobRecord;
import com.jobmarket.etl.ingest.model.RecordDecision;
import com.jobmarket.etl.ingest.model.SalaryPeriod;
import com.jobmarket.etl.ingest.normalize.CompanyIndex;
import com.jobmarket.etl.ingest.normalize.LocationStandardizer;
import com.jobmarket.etl.ingest.normalize.SeniorityClassifier;
import com.jobmarket.etl.ingest.skills.SkillExtraction;
import com.jobmarket.etl.ingest.skills.SkillExtractor;
import com.jobmarket.etl.ingest.util.ReasonCodes;
import com.jobmarket.etl.ingest.util.TextUtils;
import com.jobmarket.etl.ingest.validation.ConsistencyChecker;
import com.jobmarket.etl.ingest.validation.ControlledVocabulary;
import com.jobmarket.etl.ingest.validation.RawRecordValidator;
import com.jobmarket.etl.ingest.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs the per-record stages: decode, validate, consistency check, normalize and skill
 * extraction. Touches no shared state apart from the batch's {@link CompanyIndex}, so records can
 * be processed on any worker thread.
 */
@Component
public class JobRecordProcessor {
    private static final Logger log = LoggerFactory.getLogger(JobRecordProcessor.class);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final RawRecordDecoder decoder;
    private final RawRecordValidator validator;
    private final ConsistencyChecker consistencyChecker;
    private final ControlledVocabulary vocabulary;
    private final LocationStandardizer locationStandardizer;
    private final SeniorityClassifier seniorityClassifier;
    private final SkillExtractor skillExtractor;

    public JobRecordProcessor(
        RawRecordDecoder decoder,
        RawRecordValidator validator,
        ConsistencyChecker consistencyChecker,
        ControlledVocabulary vocabulary,
        LocationStandardizer locationStandardizer,
        SeniorityClassifier seniorityClassifier,
        SkillExtractor skillExtractor
    ) {
        this.decoder = decoder;
        this.validator = validator;
        this.consistencyChecker = consistencyChecker;
        this.vocabulary = vocabulary;
        this.locationStandardizer = locationStandardizer;
        this.seniorityClassifier = seniorityClassifier;
        this.skillExtractor = skillExtractor;
    }

    public ProcessedRecord process(int recordIndex, RawJobRecord raw, CompanyIndex companyIndex, Instant fetchedAt) {
        DecodedJobRecord decoded = null;
        try {
            if (raw == null) {
                throw new IllegalArgumentException("record is null");
            }
            decoded = decoder.decode(raw);
            ValidationResult validation = validator.validate(decoded);
            if (validation.isRejected()) {
                log.debug("Record {} ({}) rejected: {}", recordIndex, decoded.externalId(), validation.rejections());
                return new ProcessedRecord(
                    recordIndex,
                    decoded,
                    RecordDecision.rejected(recordIndex, decoded.externalId(), validation.rejections()),
                    null
                );
            }

            Set<String> flags = new LinkedHashSet<>(validation.flags());
            flags.addAll(consistencyChecker.check(decoded));
            String descriptionPlain = TextUtils.plainText(decoded.description());
            SkillExtraction extraction = skillExtractor.extract(decoded, descriptionPlain);
            flags.addAll(extraction.flags());

            List<String> reasons = List.copyOf(flags);
            NormalizedJob job = normalize(decoded, descriptionPlain, extraction, reasons, companyIndex, fetchedAt);
            return new ProcessedRecord(
                recordIndex,
                decoded,
                RecordDecision.loadable(recordIndex, decoded.externalId(), reasons),
                job
            );
        } catch (RuntimeException e) {
            String externalId = decoded == null ? null : decoded.externalId();
            log.warn("Record {} ({}) failed during processing", recordIndex, externalId, e);
            return new ProcessedRecord(
                recordIndex,
                decoded,
                RecordDecision.rejected(recordIndex, externalId, List.of(ReasonCodes.PROCESSING_ERROR)),
                null
            );
        }
    }

    private NormalizedJob normalize(
        DecodedJobRecord decoded,
        String descriptionPlain,
        SkillExtraction extraction,
        List<String> reasons,
        CompanyIndex companyIndex,
        Instant fetchedAt
    ) {
        CompanyRef company = companyIndex.resolve(decoded.employerName(), decoded.employerWebsite(), decoded.employerLogo());
        String country = RawRecordValidator.normalizeCountry(decoded.country());
        String state = locationStandardizer.expandState(decoded.state(), country);

        EmploymentType employmentType = null;
        if (decoded.employmentType() != null) {
            employmentType = vocabulary.resolveEmploymentType(decoded.employmentType());
            if (employmentType == null) {
                employmentType = EmploymentType.OTHER;
            }
        }
        SalaryPeriod salaryPeriod = vocabulary.resolveSalaryPeriod(decoded.salaryPeriod());
        BigDecimal minSalary = money(decoded.minSalary());
        BigDecimal maxSalary = money(decoded.maxSalary());
        BigDecimal avgSalary = null;
        BigDecimal salaryRange = null;
        if (minSalary != null && maxSalary != null) {
            avgSalary = minSalary.add(maxSalary).divide(TWO, 2, RoundingMode.HALF_UP);
            salaryRange = maxSalary.subtract(minSalary);
        }

        return new NormalizedJob(
            decoded.externalId(),
            company,
            decoded.title(),
            decoded.description(),
            descriptionPlain,
            decoded.location(),
            decoded.city(),
            state,
            country,
            locationStandardizer.standardize(decoded.city(), state),
            decoded.latitude(),
            decoded.longitude(),
            decoded.remote(),
            employmentType,
            decoded.publisher(),
            decoded.applyLink(),
            decoded.applyIsDirect(),
            decoded.googleLink(),
            minSalary,
            maxSalary,
            avgSalary,
            salaryRange,
            salaryPeriod,
            decoded.onetSoc(),
            decoded.onetJobZone(),
            seniorityClassifier.classify(decoded.title()),
            decoded.postedAtTimestamp(),
            decoded.postedAtUtc(),
            fetchedAt,
            !reasons.isEmpty(),
            reasons,
            extraction.skills(),
            distinctBenefits(decoded.benefits()),
            extraction.highlights()
        );
    }

    private BigDecimal money(BigDecimal value) {
        return value == null ? null : value.setScale(2, RoundingMode.HALF_UP);
    }

    private List<String> distinctBenefits(List<String> benefits) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String benefit : benefits) {
            String trimmed = benefit == null ? null : benefit.trim();
            if (trimmed != null && !trimmed.isEmpty()) {
                distinct.add(trimmed);
            }
        }
        return List.copyOf(distinct);
    }
}
