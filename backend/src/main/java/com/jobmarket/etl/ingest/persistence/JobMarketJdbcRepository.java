package com.jobmarket.etl.ingest.persistence;

import com.jobmarket.etl.ingest.model.CompanyRef;
import com.jobmarket.etl.ingest.model.ExtractedSkill;
import com.jobmarket.etl.ingest.model.JobHighlight;
import com.jobmarket.etl.ingest.model.NormalizedJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Repository
public class JobMarketJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(JobMarketJdbcRepository.class);
    private static final List<String> TABLES = List.of(
        "companies", "jobs", "skills", "job_skills", "job_benefits", "job_highlights"
    );
    private static final String REVIEW_REASON_SEPARATOR = "; ";

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;

    public JobMarketJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String table : TABLES) {
            counts.put(table, countTable(table));
        }
        return counts;
    }

    public long countTable(String tableName) {
        if (!TABLES.contains(tableName)) {
            throw new IllegalArgumentException("Unknown table " + tableName);
        }
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    /**
     * Inserts the company or, when its key already exists, keeps the stored display name and only
     * fills in a missing website or logo.
     */
    public long upsertCompany(CompanyRef company) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", company.displayName())
            .addValue("nameKey", company.nameKey())
            .addValue("website", company.website())
            .addValue("logoUrl", company.logoUrl());

        if (postgres) {
            Long id = jdbc.queryForObject(
                """
                    INSERT INTO companies (name, name_key, website, logo_url)
                    VALUES (:name, :nameKey, :website, :logoUrl)
                    ON CONFLICT (name_key)
                    DO UPDATE SET
                        website = COALESCE(companies.website, EXCLUDED.website),
                        logo_url = COALESCE(companies.logo_url, EXCLUDED.logo_url)
                    RETURNING id
                    """,
                params,
                Long.class
            );
            return id == null ? 0L : id;
        }

        int updated = fillCompanyGaps(params);
        if (updated == 0) {
            try {
                jdbc.update(
                    """
                        INSERT INTO companies (name, name_key, website, logo_url)
                        VALUES (:name, :nameKey, :website, :logoUrl)
                        """,
                    params
                );
            } catch (DataIntegrityViolationException ignored) {
                fillCompanyGaps(params);
            }
        }
        Long id = jdbc.queryForObject(
            "SELECT id FROM companies WHERE name_key = :nameKey",
            params,
            Long.class
        );
        return id == null ? 0L : id;
    }

    private int fillCompanyGaps(MapSqlParameterSource params) {
        return jdbc.update(
            """
                UPDATE companies
                SET website = COALESCE(website, :website),
                    logo_url = COALESCE(logo_url, :logoUrl)
                WHERE name_key = :nameKey
                """,
            params
        );
    }

    public long upsertSkill(ExtractedSkill skill) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", skill.name())
            .addValue("category", skill.category().name());

        if (postgres) {
            Long id = jdbc.queryForObject(
                """
                    INSERT INTO skills (name, category)
                    VALUES (:name, :category)
                    ON CONFLICT (name)
                    DO UPDATE SET category = EXCLUDED.category
                    RETURNING id
                    """,
                params,
                Long.class
            );
            return id == null ? 0L : id;
        }

        Long existing = findSkillId(params);
        if (existing != null) {
            return existing;
        }
        try {
            jdbc.update("INSERT INTO skills (name, category) VALUES (:name, :category)", params);
        } catch (DataIntegrityViolationException e) {
            log.debug("Skill {} was inserted concurrently; reusing the stored row", skill.name());
        }
        Long id = findSkillId(params);
        return id == null ? 0L : id;
    }

    private Long findSkillId(MapSqlParameterSource params) {
        List<Long> ids = jdbc.queryForList("SELECT id FROM skills WHERE name = :name", params, Long.class);
        return ids.isEmpty() ? null : ids.get(0);
    }

    public Long findJobIdByExternalId(String externalId) {
        List<Long> ids = jdbc.queryForList(
            "SELECT id FROM jobs WHERE external_id = :externalId",
            new MapSqlParameterSource("externalId", externalId),
            Long.class
        );
        return ids.isEmpty() ? null : ids.get(0);
    }

    public Set<String> findExistingExternalIds(Collection<String> externalIds) {
        if (externalIds == null || externalIds.isEmpty()) {
            return Set.of();
        }
        List<String> ids = new ArrayList<>(externalIds);
        Set<String> existing = new LinkedHashSet<>();
        int batchSize = 1000;
        for (int i = 0; i < ids.size(); i += batchSize) {
            List<String> slice = ids.subList(i, Math.min(ids.size(), i + batchSize));
            jdbc.query(
                "SELECT external_id FROM jobs WHERE external_id IN (:externalIds)",
                new MapSqlParameterSource("externalIds", slice),
                rs -> {
                    existing.add(rs.getString("external_id"));
                }
            );
        }
        return existing;
    }

    /** Deletes the job; skills links, benefits and highlights go with it. */
    public int deleteJob(long jobId) {
        return jdbc.update("DELETE FROM jobs WHERE id = :jobId", new MapSqlParameterSource("jobId", jobId));
    }

    public long insertJob(NormalizedJob job, long companyId, String batchId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("externalId", job.externalId())
            .addValue("companyId", companyId)
            .addValue("batchId", batchId)
            .addValue("title", job.title())
            .addValue("description", job.description())
            .addValue("descriptionPlain", job.descriptionPlain())
            .addValue("locationText", job.locationText())
            .addValue("city", job.city())
            .addValue("state", job.state())
            .addValue("country", job.country())
            .addValue("locationStandardized", job.locationStandardized())
            .addValue("latitude", job.latitude())
            .addValue("longitude", job.longitude())
            .addValue("isRemote", job.remote())
            .addValue("employmentType", job.employmentType() == null ? null : job.employmentType().label())
            .addValue("publisher", job.publisher())
            .addValue("applyLink", job.applyLink())
            .addValue("applyIsDirect", job.applyIsDirect())
            .addValue("googleLink", job.googleLink())
            .addValue("minSalary", job.minSalary())
            .addValue("maxSalary", job.maxSalary())
            .addValue("avgSalary", job.avgSalary())
            .addValue("salaryRange", job.salaryRange())
            .addValue("salaryPeriod", job.salaryPeriod() == null ? null : job.salaryPeriod().name())
            .addValue("onetSoc", job.onetSoc())
            .addValue("onetJobZone", job.onetJobZone())
            .addValue("seniorityLevel", job.seniorityLevel())
            .addValue("postedAtTimestamp", job.postedAtTimestamp())
            .addValue("postedAtUtc", toTimestamp(job.postedAtUtc()))
            .addValue("fetchedAt", toTimestamp(job.fetchedAt() == null ? Instant.now() : job.fetchedAt()))
            .addValue("needsReview", job.needsReview())
            .addValue("reviewReasons", job.reviewReasons().isEmpty()
                ? null
                : String.join(REVIEW_REASON_SEPARATOR, job.reviewReasons()));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO jobs (
                    external_id, company_id, batch_id, title, description, description_plain, location_text,
                    city, state, country, location_standardized, latitude, longitude, is_remote,
                    employment_type, publisher, apply_link, apply_is_direct, google_link,
                    min_salary, max_salary, avg_salary, salary_range, salary_period,
                    onet_soc, onet_job_zone, seniority_level, posted_at_timestamp, posted_at_utc,
                    fetched_at, needs_review, review_reasons
                )
                VALUES (
                    :externalId, :companyId, :batchId, :title, :description, :descriptionPlain, :locationText,
                    :city, :state, :country, :locationStandardized, :latitude, :longitude, :isRemote,
                    :employmentType, :publisher, :applyLink, :applyIsDirect, :googleLink,
                    :minSalary, :maxSalary, :avgSalary, :salaryRange, :salaryPeriod,
                    :onetSoc, :onetJobZone, :seniorityLevel, :postedAtTimestamp, :postedAtUtc,
                    :fetchedAt, :needsReview, :reviewReasons
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id generated for job " + job.externalId());
        }
        return key.longValue();
    }

    public void insertJobSkills(long jobId, Map<Long, Boolean> requiredBySkillId) {
        if (requiredBySkillId == null || requiredBySkillId.isEmpty()) {
            return;
        }
        List<MapSqlParameterSource> batch = new ArrayList<>();
        for (Map.Entry<Long, Boolean> entry : requiredBySkillId.entrySet()) {
            batch.add(new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("skillId", entry.getKey())
                .addValue("isRequired", Boolean.TRUE.equals(entry.getValue())));
        }
        jdbc.batchUpdate(
            """
                INSERT INTO job_skills (job_id, skill_id, is_required)
                VALUES (:jobId, :skillId, :isRequired)
                """,
            batch.toArray(new MapSqlParameterSource[0])
        );
    }

    public void insertBenefits(long jobId, List<String> benefits) {
        if (benefits == null || benefits.isEmpty()) {
            return;
        }
        List<MapSqlParameterSource> batch = new ArrayList<>();
        for (String benefit : benefits) {
            batch.add(new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("benefit", benefit));
        }
        jdbc.batchUpdate(
            "INSERT INTO job_benefits (job_id, benefit) VALUES (:jobId, :benefit)",
            batch.toArray(new MapSqlParameterSource[0])
        );
    }

    public void insertHighlights(long jobId, List<JobHighlight> highlights) {
        if (highlights == null || highlights.isEmpty()) {
            return;
        }
        List<MapSqlParameterSource> batch = new ArrayList<>();
        for (JobHighlight highlight : highlights) {
            batch.add(new MapSqlParameterSource()
                .addValue("jobId", jobId)
                .addValue("highlightType", highlight.type().name())
                .addValue("lineNumber", highlight.lineNumber())
                .addValue("highlightText", highlight.text()));
        }
        jdbc.batchUpdate(
            """
                INSERT INTO job_highlights (job_id, highlight_type, line_number, highlight_text)
                VALUES (:jobId, :highlightType, :lineNumber, :highlightText)
                """,
            batch.toArray(new MapSqlParameterSource[0])
        );
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; falling back to portable upserts", e);
            return false;
        }
    }
}
