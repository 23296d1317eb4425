package com.delta.jobimporter.ingest.persistence;

import com.delta.jobimporter.ingest.model.ImportRun;
import com.delta.jobimporter.ingest.model.ImportRunStatus;
import com.delta.jobimporter.ingest.model.ProcessAction;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class ImportRunRepository {
    private static final int MAX_REASON_LENGTH = 2000;
    private static final String SELECT_COLUMNS =
        """
            SELECT id, source_label, started_at, finished_at, status, total_fetched, queued_jobs,
                   new_jobs, updated_jobs, failed_jobs, duration_ms
            FROM import_runs
            """;

    private final NamedParameterJdbcTemplate jdbc;

    public ImportRunRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertRun(String sourceLabel, Instant startedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceLabel", sourceLabel)
            .addValue("startedAt", Timestamp.from(startedAt))
            .addValue("status", ImportRunStatus.IN_PROGRESS.dbValue());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO import_runs (source_label, started_at, status)
                VALUES (:sourceLabel, :startedAt, :status)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert import run");
        }
        return key.longValue();
    }

    public int updateFetchPhase(long runId, int totalFetched, long durationMs, ImportRunStatus status, Instant finishedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("totalFetched", totalFetched)
            .addValue("durationMs", durationMs)
            .addValue("status", status.dbValue())
            .addValue("finishedAt", finishedAt == null ? null : Timestamp.from(finishedAt));
        return jdbc.update(
            """
                UPDATE import_runs
                SET total_fetched = :totalFetched,
                    duration_ms = :durationMs,
                    status = :status,
                    finished_at = :finishedAt
                WHERE id = :runId
                """,
            params
        );
    }

    public int updateQueued(long runId, int queuedJobs, long durationMs) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("queuedJobs", queuedJobs)
            .addValue("durationMs", durationMs);
        return jdbc.update(
            """
                UPDATE import_runs
                SET queued_jobs = :queuedJobs,
                    duration_ms = :durationMs
                WHERE id = :runId
                """,
            params
        );
    }

    /**
     * Adds one resolved item to the counters of an in-progress run. The increment happens in SQL
     * so concurrent workers never lose updates. Returns 0 when the run is already terminal.
     */
    public int incrementOutcome(long runId, ProcessAction action) {
        String column = switch (action) {
            case CREATED -> "new_jobs";
            case UPDATED -> "updated_jobs";
            case FAILED -> "failed_jobs";
        };
        return jdbc.update(
            "UPDATE import_runs SET " + column + " = " + column + " + 1 WHERE id = :runId AND status = :inProgress",
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("inProgress", ImportRunStatus.IN_PROGRESS.dbValue())
        );
    }

    /**
     * Completes an in-progress run once every queued item has resolved. Returns 0 when the run
     * is still waiting on items, was never queued, or is already terminal.
     */
    public int completeIfResolved(long runId, Instant finishedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("finishedAt", Timestamp.from(finishedAt))
            .addValue("inProgress", ImportRunStatus.IN_PROGRESS.dbValue())
            .addValue("completed", ImportRunStatus.COMPLETED.dbValue());
        return jdbc.update(
            """
                UPDATE import_runs
                SET status = :completed,
                    finished_at = :finishedAt
                WHERE id = :runId
                  AND status = :inProgress
                  AND queued_jobs IS NOT NULL
                  AND new_jobs + updated_jobs + failed_jobs >= queued_jobs
                """,
            params
        );
    }

    public int markFailed(long runId, long durationMs, Instant finishedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", runId)
            .addValue("durationMs", durationMs)
            .addValue("finishedAt", Timestamp.from(finishedAt))
            .addValue("status", ImportRunStatus.FAILED.dbValue());
        return jdbc.update(
            """
                UPDATE import_runs
                SET status = :status,
                    duration_ms = :durationMs,
                    finished_at = :finishedAt
                WHERE id = :runId
                """,
            params
        );
    }

    public void appendFailedReasons(long runId, List<String> reasons, Instant createdAt) {
        if (reasons == null || reasons.isEmpty()) {
            return;
        }
        List<MapSqlParameterSource> batch = new ArrayList<>(reasons.size());
        for (String reason : reasons) {
            batch.add(new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("reason", truncateReason(reason))
                .addValue("createdAt", Timestamp.from(createdAt)));
        }
        jdbc.batchUpdate(
            """
                INSERT INTO import_run_failed_reasons (import_run_id, reason, created_at)
                VALUES (:runId, :reason, :createdAt)
                """,
            batch.toArray(new MapSqlParameterSource[0])
        );
    }

    public void clearFailedReasons(long runId) {
        jdbc.update(
            "DELETE FROM import_run_failed_reasons WHERE import_run_id = :runId",
            new MapSqlParameterSource().addValue("runId", runId)
        );
    }

    public ImportRun findById(long runId) {
        List<RunRow> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE id = :runId",
            new MapSqlParameterSource().addValue("runId", runId),
            (rs, rowNum) -> mapRow(rs)
        );
        if (rows.isEmpty()) {
            return null;
        }
        return withReasons(rows).get(0);
    }

    public ImportRun findMostRecent() {
        List<RunRow> rows = jdbc.query(
            SELECT_COLUMNS + " ORDER BY started_at DESC, id DESC LIMIT 1",
            new MapSqlParameterSource(),
            (rs, rowNum) -> mapRow(rs)
        );
        if (rows.isEmpty()) {
            return null;
        }
        return withReasons(rows).get(0);
    }

    public List<ImportRun> findPage(int offset, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("offset", Math.max(0, offset))
            .addValue("limit", Math.max(1, limit));
        List<RunRow> rows = jdbc.query(
            SELECT_COLUMNS + " ORDER BY started_at DESC, id DESC LIMIT :limit OFFSET :offset",
            params,
            (rs, rowNum) -> mapRow(rs)
        );
        return withReasons(rows);
    }

    public long countRuns() {
        Long value = jdbc.queryForObject("SELECT COUNT(*) FROM import_runs", new MapSqlParameterSource(), Long.class);
        return value == null ? 0L : value;
    }

    public long countRunsSince(Instant since) {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM import_runs WHERE started_at >= :since",
            new MapSqlParameterSource().addValue("since", Timestamp.from(since)),
            Long.class
        );
        return value == null ? 0L : value;
    }

    public long countByStatus(ImportRunStatus status) {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM import_runs WHERE status = :status",
            new MapSqlParameterSource().addValue("status", status.dbValue()),
            Long.class
        );
        return value == null ? 0L : value;
    }

    public int deleteStartedBefore(Instant cutoff) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cutoff", Timestamp.from(cutoff));
        jdbc.update(
            """
                DELETE FROM import_run_failed_reasons
                WHERE import_run_id IN (SELECT id FROM import_runs WHERE started_at < :cutoff)
                """,
            params
        );
        return jdbc.update("DELETE FROM import_runs WHERE started_at < :cutoff", params);
    }

    private List<ImportRun> withReasons(List<RunRow> rows) {
        if (rows.isEmpty()) {
            return List.of();
        }
        Map<Long, List<String>> reasons = new LinkedHashMap<>();
        List<Long> ids = new ArrayList<>(rows.size());
        for (RunRow row : rows) {
            ids.add(row.id());
            reasons.put(row.id(), new ArrayList<>());
        }
        jdbc.query(
            """
                SELECT import_run_id, reason
                FROM import_run_failed_reasons
                WHERE import_run_id IN (:ids)
                ORDER BY import_run_id, id
                """,
            new MapSqlParameterSource().addValue("ids", ids),
            rs -> {
                List<String> bucket = reasons.get(rs.getLong("import_run_id"));
                if (bucket != null) {
                    bucket.add(rs.getString("reason"));
                }
            }
        );
        List<ImportRun> runs = new ArrayList<>(rows.size());
        for (RunRow row : rows) {
            runs.add(row.toRun(List.copyOf(reasons.get(row.id()))));
        }
        return runs;
    }

    private RunRow mapRow(ResultSet rs) throws SQLException {
        Timestamp finishedAt = rs.getTimestamp("finished_at");
        int queued = rs.getInt("queued_jobs");
        Integer queuedJobs = rs.wasNull() ? null : queued;
        return new RunRow(
            rs.getLong("id"),
            rs.getString("source_label"),
            rs.getTimestamp("started_at").toInstant(),
            finishedAt == null ? null : finishedAt.toInstant(),
            ImportRunStatus.fromDbValue(rs.getString("status")),
            rs.getInt("total_fetched"),
            queuedJobs,
            rs.getInt("new_jobs"),
            rs.getInt("updated_jobs"),
            rs.getInt("failed_jobs"),
            rs.getLong("duration_ms")
        );
    }

    private String truncateReason(String reason) {
        if (reason == null) {
            return "unknown_error";
        }
        String trimmed = reason.trim();
        if (trimmed.length() > MAX_REASON_LENGTH) {
            return trimmed.substring(0, MAX_REASON_LENGTH);
        }
        return trimmed;
    }

    private record RunRow(
        long id,
        String sourceLabel,
        Instant startedAt,
        Instant finishedAt,
        ImportRunStatus status,
        int totalFetched,
        Integer queuedJobs,
        int newJobs,
        int updatedJobs,
        int failedJobs,
        long durationMs
    ) {
        ImportRun toRun(List<String> failedReasons) {
            return new ImportRun(
                id,
                sourceLabel,
                startedAt,
                finishedAt,
                status,
                totalFetched,
                queuedJobs,
                newJobs,
                updatedJobs,
                failedJobs,
                failedReasons,
                durationMs
            );
        }
    }
}
