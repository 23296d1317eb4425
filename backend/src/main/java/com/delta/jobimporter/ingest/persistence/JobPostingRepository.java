package com.delta.jobimporter.ingest.persistence;

import com.delta.jobimporter.ingest.model.JobCandidate;
import com.delta.jobimporter.ingest.model.JobPosting;
import com.delta.jobimporter.ingest.model.JobStats;
import com.delta.jobimporter.ingest.model.JobType;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JobPostingRepository {
    private static final String SELECT_COLUMNS =
        """
            SELECT id, external_id, url, title, company, category, job_type, location,
                   description, posted_at, created_at, updated_at
            FROM job_postings
            """;

    private static final RowMapper<JobPosting> ROW_MAPPER = (rs, rowNum) -> new JobPosting(
        rs.getLong("id"),
        rs.getString("external_id"),
        rs.getString("url"),
        rs.getString("title"),
        rs.getString("company"),
        rs.getString("category"),
        JobType.fromLabel(rs.getString("job_type")),
        rs.getString("location"),
        rs.getString("description"),
        toInstant(rs.getTimestamp("posted_at")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public JobPostingRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Finds the stored job sharing either identity field. An external id match wins over a url
     * match when the two point at different rows.
     */
    public Optional<JobPosting> findByExternalIdOrUrl(String externalId, String url) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("externalId", externalId)
            .addValue("url", url);
        List<JobPosting> matches = jdbc.query(
            SELECT_COLUMNS
                + """
                WHERE external_id = :externalId
                   OR url = :url
                ORDER BY CASE WHEN external_id = :externalId THEN 0 ELSE 1 END, id
                LIMIT 1
                """,
            params,
            ROW_MAPPER
        );
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    public Optional<JobPosting> findByExternalId(String externalId) {
        List<JobPosting> matches = jdbc.query(
            SELECT_COLUMNS + " WHERE external_id = :externalId",
            new MapSqlParameterSource().addValue("externalId", externalId),
            ROW_MAPPER
        );
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    public long insert(JobCandidate candidate, Instant now) {
        MapSqlParameterSource params = candidateParams(candidate)
            .addValue("createdAt", Timestamp.from(now))
            .addValue("updatedAt", Timestamp.from(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO job_postings (
                    external_id, url, title, company, category, job_type, location,
                    description, posted_at, created_at, updated_at
                )
                VALUES (
                    :externalId, :url, :title, :company, :category, :jobType, :location,
                    :description, :postedAt, :createdAt, :updatedAt
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key != null) {
            return key.longValue();
        }
        return findByExternalId(candidate.externalId())
            .map(JobPosting::id)
            .orElseThrow(() -> new IllegalStateException("Failed to insert job " + candidate.externalId()));
    }

    public int update(long id, JobCandidate candidate, Instant now) {
        MapSqlParameterSource params = candidateParams(candidate)
            .addValue("id", id)
            .addValue("updatedAt", Timestamp.from(now));
        return jdbc.update(
            """
                UPDATE job_postings
                SET external_id = :externalId,
                    url = :url,
                    title = :title,
                    company = :company,
                    category = :category,
                    job_type = :jobType,
                    location = :location,
                    description = :description,
                    posted_at = :postedAt,
                    updated_at = :updatedAt
                WHERE id = :id
                """,
            params
        );
    }

    public long countJobs() {
        Long value = jdbc.queryForObject("SELECT COUNT(*) FROM job_postings", new MapSqlParameterSource(), Long.class);
        return value == null ? 0L : value;
    }

    public JobStats fetchJobStats(Instant recentSince) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("since", Timestamp.from(recentSince));
        Long recent = jdbc.queryForObject(
            "SELECT COUNT(*) FROM job_postings WHERE created_at >= :since",
            params,
            Long.class
        );
        Long companies = jdbc.queryForObject(
            "SELECT COUNT(DISTINCT company) FROM job_postings",
            params,
            Long.class
        );
        Long categories = jdbc.queryForObject(
            "SELECT COUNT(DISTINCT category) FROM job_postings",
            params,
            Long.class
        );
        return new JobStats(
            countJobs(),
            recent == null ? 0L : recent,
            companies == null ? 0L : companies,
            categories == null ? 0L : categories
        );
    }

    public int deleteNotUpdatedSince(Instant cutoff) {
        return jdbc.update(
            "DELETE FROM job_postings WHERE updated_at < :cutoff",
            new MapSqlParameterSource().addValue("cutoff", Timestamp.from(cutoff))
        );
    }

    private MapSqlParameterSource candidateParams(JobCandidate candidate) {
        JobType type = candidate.type() == null ? JobType.OTHER : candidate.type();
        return new MapSqlParameterSource()
            .addValue("externalId", candidate.externalId())
            .addValue("url", candidate.url())
            .addValue("title", candidate.title())
            .addValue("company", candidate.company())
            .addValue("category", candidate.category() == null ? "General" : candidate.category())
            .addValue("jobType", type.label())
            .addValue("location", candidate.location() == null ? "Remote" : candidate.location())
            .addValue("description", candidate.description() == null ? "" : candidate.description())
            .addValue("postedAt", Timestamp.from(candidate.postedAt() == null ? Instant.now() : candidate.postedAt()));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
