package com.delta.jobimporter.ingest.run;

import com.delta.jobimporter.ingest.model.FetchPhaseResult;
import com.delta.jobimporter.ingest.model.ImportRun;
import com.delta.jobimporter.ingest.model.ImportRunPage;
import com.delta.jobimporter.ingest.model.ImportRunStats;
import com.delta.jobimporter.ingest.model.ImportRunStatus;
import com.delta.jobimporter.ingest.model.ProcessOutcome;
import com.delta.jobimporter.ingest.persistence.ImportRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Keeps the audit record of every import run. Counters are only ever incremented in the
 * database, so workers on several threads or hosts can report outcomes for the same run.
 */
@Service
public class ImportRunTracker {
    private static final Logger log = LoggerFactory.getLogger(ImportRunTracker.class);
    private static final int MAX_SOURCE_LABEL_LENGTH = 4000;
    private static final int MAX_PAGE_SIZE = 100;
    private static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final ImportRunRepository repository;
    private final Clock clock;

    public ImportRunTracker(ImportRunRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public long start(String sourceLabel) {
        String label = sourceLabel == null ? "" : sourceLabel;
        if (label.length() > MAX_SOURCE_LABEL_LENGTH) {
            label = label.substring(0, MAX_SOURCE_LABEL_LENGTH);
        }
        long runId = repository.insertRun(label, clock.instant());
        log.info("Started import run {} for {}", runId, label);
        return runId;
    }

    /**
     * Stores the counts of the fetch phase. A terminal status closes the run right away; an
     * in-progress run waits for its queued items.
     */
    public void recordFetchPhase(long runId, FetchPhaseResult result) {
        Instant now = clock.instant();
        repository.updateFetchPhase(
            runId,
            result.totalFetched(),
            result.durationMs(),
            result.status(),
            result.status().isTerminal() ? now : null
        );
        repository.appendFailedReasons(runId, result.failedReasons(), now);
        if (result.status().isTerminal()) {
            log.info("Import run {} finished during fetch with status {}", runId, result.status().dbValue());
        }
    }

    /**
     * Records how many items were accepted by the queue. From here on the run completes as soon
     * as that many outcomes have been reported.
     */
    public void recordQueued(long runId, int queuedJobs, long durationMs) {
        repository.updateQueued(runId, queuedJobs, durationMs);
        completeIfResolved(runId);
    }

    /**
     * Counts one resolved item. Outcomes for a run that is no longer in progress are dropped so
     * a closed run stays unchanged.
     */
    public void recordOutcome(long runId, ProcessOutcome outcome) {
        if (repository.incrementOutcome(runId, outcome.action()) == 0) {
            log.debug("Ignoring {} outcome for import run {} that is no longer in progress", outcome.action(), runId);
            return;
        }
        if (!outcome.isSuccess() && outcome.reason() != null) {
            repository.appendFailedReasons(runId, List.of(outcome.reason()), clock.instant());
        }
        completeIfResolved(runId);
    }

    /**
     * Fails the run with {@code reason} as its only recorded reason.
     */
    public void markFailed(long runId, String reason, long durationMs) {
        Instant now = clock.instant();
        repository.clearFailedReasons(runId);
        repository.markFailed(runId, durationMs, now);
        repository.appendFailedReasons(runId, List.of(reason == null ? "unknown_error" : reason), now);
        log.error("Import run {} failed: {}", runId, reason);
    }

    public ImportRun getById(long runId) {
        ImportRun run = repository.findById(runId);
        if (run == null) {
            throw new ImportRunNotFoundException(runId);
        }
        return run;
    }

    /**
     * Most recent runs first. {@code page} is 1-based.
     */
    public ImportRunPage list(int page, int pageSize) {
        int safePage = Math.max(1, page);
        int safeSize = Math.min(MAX_PAGE_SIZE, Math.max(1, pageSize));
        long total = repository.countRuns();
        List<ImportRun> runs = repository.findPage((safePage - 1) * safeSize, safeSize);
        int totalPages = (int) ((total + safeSize - 1) / safeSize);
        return new ImportRunPage(runs, safePage, safeSize, total, totalPages);
    }

    public ImportRunStats getAggregateStats() {
        long totalRuns = repository.countRuns();
        long recentRuns = repository.countRunsSince(clock.instant().minus(RECENT_WINDOW));
        long completedRuns = repository.countByStatus(ImportRunStatus.COMPLETED);
        return new ImportRunStats(totalRuns, recentRuns, successRate(completedRuns, totalRuns), repository.findMostRecent());
    }

    static BigDecimal successRate(long completedRuns, long totalRuns) {
        if (totalRuns <= 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(completedRuns)
            .multiply(BigDecimal.valueOf(100))
            .divide(BigDecimal.valueOf(totalRuns), 2, RoundingMode.HALF_UP);
    }

    private void completeIfResolved(long runId) {
        if (repository.completeIfResolved(runId, clock.instant()) > 0) {
            log.info("Import run {} completed", runId);
        }
    }
}
