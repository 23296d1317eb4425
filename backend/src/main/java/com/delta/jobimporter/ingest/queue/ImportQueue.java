package com.delta.jobimporter.ingest.queue;

import com.delta.jobimporter.config.ImporterProperties;
import com.delta.jobimporter.ingest.model.JobCandidate;
import com.delta.jobimporter.ingest.model.ProcessOutcome;
import com.delta.jobimporter.ingest.model.QueueItem;
import com.delta.jobimporter.ingest.model.QueueItemStatus;
import com.delta.jobimporter.ingest.model.QueueStats;
import com.delta.jobimporter.ingest.persistence.ImportQueueRepository;
import com.delta.jobimporter.ingest.persistence.ImportQueueRepository.ClaimedRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Durable work queue backed by the {@code import_queue} table. Items survive restarts and are
 * handed out through expiring leases.
 */
@Service
public class ImportQueue {
    public static final String JOB_NAME = "process-job";

    private static final Logger log = LoggerFactory.getLogger(ImportQueue.class);

    private final ImportQueueRepository repository;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;
    private final ImporterProperties properties;
    private final Clock clock;

    public ImportQueue(
        ImportQueueRepository repository,
        RetryPolicy retryPolicy,
        ObjectMapper objectMapper,
        ImporterProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.retryPolicy = retryPolicy;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public static String idempotencyKey(long importRunId, String externalId) {
        return importRunId + "-" + externalId;
    }

    /**
     * Enqueues one item per candidate. A candidate whose key is already queued is skipped.
     *
     * @return number of items accepted
     * @throws IllegalStateException when a candidate cannot be serialized
     */
    public int enqueueBulk(List<JobCandidate> candidates, long importRunId) {
        if (candidates == null || candidates.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        int maxAttempts = properties.getQueue().getMaxAttempts();
        int accepted = 0;
        for (JobCandidate candidate : candidates) {
            String key = idempotencyKey(importRunId, candidate.externalId());
            boolean inserted = repository.insertIfAbsent(
                key,
                JOB_NAME,
                importRunId,
                serialize(new QueuePayload(candidate, importRunId)),
                maxAttempts,
                now
            );
            if (inserted) {
                accepted++;
            } else {
                log.debug("Skipping duplicate queue item {}", key);
            }
        }
        log.info("Queued {} of {} jobs for import run {}", accepted, candidates.size(), importRunId);
        return accepted;
    }

    /**
     * Leases the next due item to {@code owner}, or returns {@code null} when nothing is due.
     * An item whose payload cannot be read comes back with a {@code null} candidate.
     */
    public QueueItem claimNext(String owner) {
        Instant now = clock.instant();
        Instant lockedUntil = now.plusSeconds(properties.getQueue().getLeaseSeconds());
        ClaimedRow row = repository.claimNext(owner, now, lockedUntil);
        if (row == null) {
            return null;
        }
        return new QueueItem(
            row.id(),
            row.idempotencyKey(),
            row.name(),
            row.importRunId(),
            readCandidate(row),
            row.attempts(),
            row.maxAttempts()
        );
    }

    public void complete(QueueItem item, ProcessOutcome outcome) {
        repository.markCompleted(item.id(), outcome.action().jsonValue(), clock.instant());
    }

    /**
     * Records a failed attempt. Retryable failures with attempts left go back to waiting after
     * the backoff delay; everything else fails terminally.
     *
     * @return {@code true} when the item is now terminally failed
     */
    public boolean fail(QueueItem item, String reason, boolean retryable) {
        Instant now = clock.instant();
        if (retryable && item.hasAttemptsLeft()) {
            Duration delay = retryPolicy.delayAfter(item.attempts());
            repository.scheduleRetry(item.id(), now.plus(delay), reason, now);
            log.info(
                "Retrying queue item {} in {} ms (attempt {}/{}): {}",
                item.idempotencyKey(),
                delay.toMillis(),
                item.attempts(),
                item.maxAttempts(),
                reason
            );
            return false;
        }
        repository.markFailed(item.id(), reason, now);
        log.warn("Queue item {} failed after {} attempt(s): {}", item.idempotencyKey(), item.attempts(), reason);
        return true;
    }

    public int releaseOwned(String owner) {
        int released = repository.releaseOwned(owner, clock.instant());
        if (released > 0) {
            log.info("Released {} leased queue item(s) held by {}", released, owner);
        }
        return released;
    }

    /**
     * Applies the retention policy to finished items.
     *
     * @return number of items deleted
     */
    public int purgeExpired() {
        ImporterProperties.Queue config = properties.getQueue();
        Instant now = clock.instant();
        int deleted = repository.deleteFinishedBefore(
            QueueItemStatus.COMPLETED,
            now.minusSeconds(config.getCompletedRetentionSeconds())
        );
        deleted += repository.deleteFinishedBeyond(QueueItemStatus.COMPLETED, config.getCompletedRetentionCount());
        deleted += repository.deleteFinishedBefore(
            QueueItemStatus.FAILED,
            now.minusSeconds(config.getFailedRetentionSeconds())
        );
        return deleted;
    }

    public QueueStats stats() {
        Map<QueueItemStatus, Long> counts = repository.countByStatus();
        long waiting = counts.get(QueueItemStatus.WAITING);
        long active = counts.get(QueueItemStatus.ACTIVE);
        long completed = counts.get(QueueItemStatus.COMPLETED);
        long failed = counts.get(QueueItemStatus.FAILED);
        return new QueueStats(
            waiting,
            active,
            completed,
            failed,
            repository.countDelayed(clock.instant()),
            waiting + active + completed + failed,
            repository.isPaused()
        );
    }

    public boolean isPaused() {
        return repository.isPaused();
    }

    public void pause() {
        repository.setPaused(true, clock.instant());
        log.info("Import queue paused");
    }

    public void resume() {
        repository.setPaused(false, clock.instant());
        log.info("Import queue resumed");
    }

    private String serialize(QueuePayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize queue payload for run " + payload.importRunId(), e);
        }
    }

    private JobCandidate readCandidate(ClaimedRow row) {
        try {
            QueuePayload payload = objectMapper.readValue(row.payload(), QueuePayload.class);
            return payload.jobCandidate();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Unreadable payload for queue item {}", row.idempotencyKey(), e);
            return null;
        }
    }
}
