package com.delta.jobimporter.ingest.persistence;

import com.delta.jobimporter.ingest.model.QueueItemStatus;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Repository
public class ImportQueueRepository {
    private static final int CLAIM_SCAN_LIMIT = 10;
    private static final int MAX_ERROR_LENGTH = 2000;
    private static final String CLAIMABLE =
        """
            ((status = 'WAITING' AND next_attempt_at <= :now)
              OR (status = 'ACTIVE' AND locked_until < :now))
            """;

    private final NamedParameterJdbcTemplate jdbc;

    public ImportQueueRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Inserts a waiting item unless one with the same idempotency key is already queued.
     *
     * @return {@code false} when the key was already present
     */
    public boolean insertIfAbsent(
        String idempotencyKey,
        String name,
        long importRunId,
        String payload,
        int maxAttempts,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("idempotencyKey", idempotencyKey)
            .addValue("name", name)
            .addValue("importRunId", importRunId)
            .addValue("payload", payload)
            .addValue("maxAttempts", maxAttempts)
            .addValue("now", Timestamp.from(now));
        try {
            return jdbc.update(
                """
                    INSERT INTO import_queue (
                        idempotency_key, name, import_run_id, payload, status, attempts, max_attempts,
                        next_attempt_at, created_at, updated_at
                    )
                    VALUES (
                        :idempotencyKey, :name, :importRunId, :payload, 'WAITING', 0, :maxAttempts,
                        :now, :now, :now
                    )
                    """,
                params
            ) > 0;
        } catch (DuplicateKeyException ignored) {
            return false;
        }
    }

    /**
     * Leases the next due item to {@code lockOwner}. Waiting items whose backoff has elapsed and
     * active items whose lease expired are both eligible. Claims are compare-and-set updates, so
     * concurrent workers in any process never receive the same item.
     */
    public ClaimedRow claimNext(String lockOwner, Instant now, Instant lockedUntil) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("now", Timestamp.from(now))
            .addValue("lockedUntil", Timestamp.from(lockedUntil))
            .addValue("lockOwner", lockOwner)
            .addValue("limit", CLAIM_SCAN_LIMIT);
        List<Long> candidates = jdbc.query(
            "SELECT id FROM import_queue WHERE " + CLAIMABLE + " ORDER BY next_attempt_at ASC, id ASC LIMIT :limit",
            params,
            (rs, rowNum) -> rs.getLong("id")
        );
        for (Long id : candidates) {
            params.addValue("id", id);
            int updated = jdbc.update(
                """
                    UPDATE import_queue
                    SET status = 'ACTIVE',
                        attempts = attempts + 1,
                        locked_until = :lockedUntil,
                        lock_owner = :lockOwner,
                        updated_at = :now
                    WHERE id = :id
                      AND """ + CLAIMABLE,
                params
            );
            if (updated == 1) {
                return findClaimed(id);
            }
        }
        return null;
    }

    public void markCompleted(long id, String result, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("result", result)
            .addValue("now", Timestamp.from(now));
        jdbc.update(
            """
                UPDATE import_queue
                SET status = 'COMPLETED',
                    result = :result,
                    locked_until = NULL,
                    lock_owner = NULL,
                    last_error = NULL,
                    finished_at = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    public void scheduleRetry(long id, Instant nextAttemptAt, String error, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("nextAttemptAt", Timestamp.from(nextAttemptAt))
            .addValue("lastError", truncate(error))
            .addValue("now", Timestamp.from(now));
        jdbc.update(
            """
                UPDATE import_queue
                SET status = 'WAITING',
                    next_attempt_at = :nextAttemptAt,
                    locked_until = NULL,
                    lock_owner = NULL,
                    last_error = :lastError,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    public void markFailed(long id, String error, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("lastError", truncate(error))
            .addValue("now", Timestamp.from(now));
        jdbc.update(
            """
                UPDATE import_queue
                SET status = 'FAILED',
                    result = 'failed',
                    locked_until = NULL,
                    lock_owner = NULL,
                    last_error = :lastError,
                    finished_at = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    /**
     * Returns leased items of {@code lockOwner} to the waiting state without consuming an attempt.
     */
    public int releaseOwned(String lockOwner, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("lockOwner", lockOwner)
            .addValue("now", Timestamp.from(now));
        return jdbc.update(
            """
                UPDATE import_queue
                SET status = 'WAITING',
                    attempts = CASE WHEN attempts > 0 THEN attempts - 1 ELSE 0 END,
                    next_attempt_at = :now,
                    locked_until = NULL,
                    lock_owner = NULL,
                    updated_at = :now
                WHERE status = 'ACTIVE'
                  AND lock_owner = :lockOwner
                """,
            params
        );
    }

    public int deleteFinishedBefore(QueueItemStatus status, Instant cutoff) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("cutoff", Timestamp.from(cutoff));
        return jdbc.update(
            "DELETE FROM import_queue WHERE status = :status AND finished_at < :cutoff",
            params
        );
    }

    /**
     * Keeps the {@code keep} most recently finished items of {@code status} and deletes the rest.
     */
    public int deleteFinishedBeyond(QueueItemStatus status, int keep) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("status", status.name())
            .addValue("keep", Math.max(0, keep));
        return jdbc.update(
            """
                DELETE FROM import_queue
                WHERE status = :status
                  AND id NOT IN (
                      SELECT id FROM (
                          SELECT id
                          FROM import_queue
                          WHERE status = :status
                          ORDER BY finished_at DESC, id DESC
                          LIMIT :keep
                      ) retained
                  )
                """,
            params
        );
    }

    public Map<QueueItemStatus, Long> countByStatus() {
        Map<QueueItemStatus, Long> counts = new EnumMap<>(QueueItemStatus.class);
        for (QueueItemStatus status : QueueItemStatus.values()) {
            counts.put(status, 0L);
        }
        jdbc.query(
            "SELECT status, COUNT(*) AS total FROM import_queue GROUP BY status",
            new MapSqlParameterSource(),
            rs -> {
                counts.put(QueueItemStatus.valueOf(rs.getString("status")), rs.getLong("total"));
            }
        );
        return counts;
    }

    public long countDelayed(Instant now) {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM import_queue WHERE status = 'WAITING' AND next_attempt_at > :now",
            new MapSqlParameterSource().addValue("now", Timestamp.from(now)),
            Long.class
        );
        return value == null ? 0L : value;
    }

    public boolean isPaused() {
        Boolean paused = jdbc.queryForObject(
            "SELECT paused FROM import_queue_state WHERE id = 1",
            new MapSqlParameterSource(),
            Boolean.class
        );
        return Boolean.TRUE.equals(paused);
    }

    public void setPaused(boolean paused, Instant now) {
        jdbc.update(
            "UPDATE import_queue_state SET paused = :paused, updated_at = :now WHERE id = 1",
            new MapSqlParameterSource()
                .addValue("paused", paused)
                .addValue("now", Timestamp.from(now))
        );
    }

    private ClaimedRow findClaimed(long id) {
        List<ClaimedRow> rows = jdbc.query(
            """
                SELECT id, idempotency_key, name, import_run_id, payload, attempts, max_attempts
                FROM import_queue
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", id),
            (rs, rowNum) -> new ClaimedRow(
                rs.getLong("id"),
                rs.getString("idempotency_key"),
                rs.getString("name"),
                rs.getLong("import_run_id"),
                rs.getString("payload"),
                rs.getInt("attempts"),
                rs.getInt("max_attempts")
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    private String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }

    public record ClaimedRow(
        long id,
        String idempotencyKey,
        String name,
        long importRunId,
        String payload,
        int attempts,
        int maxAttempts
    ) {
    }
}
