package com.delta.jobimporter.ingest.run;

import com.delta.jobimporter.ingest.model.FetchPhaseResult;
import com.delta.jobimporter.ingest.model.ImportRun;
import com.delta.jobimporter.ingest.model.ImportRunPage;
import com.delta.jobimporter.ingest.model.ImportRunStats;
import com.delta.jobimporter.ingest.model.ImportRunStatus;
import com.delta.jobimporter.ingest.model.ProcessOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ImportRunTrackerTest {

    @Autowired
    private ImportRunTracker tracker;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @BeforeEach
    void clearRuns() {
        jdbc.update("DELETE FROM import_runs", new MapSqlParameterSource());
    }

    @Test
    void newRunStartsInProgress() {
        long runId = tracker.start("https://a.example.com/feed.xml");

        ImportRun run = tracker.getById(runId);

        assertThat(run.status()).isEqualTo(ImportRunStatus.IN_PROGRESS);
        assertThat(run.sourceLabel()).isEqualTo("https://a.example.com/feed.xml");
        assertThat(run.queuedJobs()).isNull();
        assertThat(run.finishedAt()).isNull();
    }

    @Test
    void completesOnceEveryQueuedItemIsReported() {
        long runId = tracker.start("feeds");
        tracker.recordFetchPhase(runId, new FetchPhaseResult(3, 40, ImportRunStatus.IN_PROGRESS, List.of()));
        tracker.recordQueued(runId, 3, 55);

        tracker.recordOutcome(runId, ProcessOutcome.created());
        tracker.recordOutcome(runId, ProcessOutcome.updated());
        assertThat(tracker.getById(runId).status()).isEqualTo(ImportRunStatus.IN_PROGRESS);

        tracker.recordOutcome(runId, ProcessOutcome.failed("validation_failed: missing required fields (url)", false));

        ImportRun run = tracker.getById(runId);
        assertThat(run.status()).isEqualTo(ImportRunStatus.COMPLETED);
        assertThat(run.totalFetched()).isEqualTo(3);
        assertThat(run.queuedJobs()).isEqualTo(3);
        assertThat(run.newJobs()).isEqualTo(1);
        assertThat(run.updatedJobs()).isEqualTo(1);
        assertThat(run.failedJobs()).isEqualTo(1);
        assertThat(run.newJobs() + run.updatedJobs() + run.failedJobs()).isLessThanOrEqualTo(run.totalFetched());
        assertThat(run.failedReasons()).containsExactly("validation_failed: missing required fields (url)");
        assertThat(run.finishedAt()).isNotNull();
    }

    @Test
    void outcomesReportedBeforeQueueCountDoNotCompleteTheRun() {
        long runId = tracker.start("early");
        tracker.recordFetchPhase(runId, new FetchPhaseResult(1, 10, ImportRunStatus.IN_PROGRESS, List.of()));

        tracker.recordOutcome(runId, ProcessOutcome.created());
        assertThat(tracker.getById(runId).status()).isEqualTo(ImportRunStatus.IN_PROGRESS);

        tracker.recordQueued(runId, 1, 12);
        assertThat(tracker.getById(runId).status()).isEqualTo(ImportRunStatus.COMPLETED);
    }

    @Test
    void zeroFetchedWithErrorsIsFailed() {
        long runId = tracker.start("broken feeds");

        tracker.recordFetchPhase(runId, new FetchPhaseResult(
            0,
            20,
            ImportRunStatus.FAILED,
            List.of("https://x.example.com: Request failed with status code 500")
        ));

        ImportRun run = tracker.getById(runId);
        assertThat(run.status()).isEqualTo(ImportRunStatus.FAILED);
        assertThat(run.totalFetched()).isZero();
        assertThat(run.failedReasons()).hasSize(1);
        assertThat(run.finishedAt()).isNotNull();
    }

    @Test
    void markFailedKeepsOnlyTheGivenReason() {
        long runId = tracker.start("queue down");
        tracker.recordFetchPhase(runId, new FetchPhaseResult(2, 5, ImportRunStatus.IN_PROGRESS, List.of("feed b: timeout")));

        tracker.markFailed(runId, "Failed to queue jobs: connection refused", 99);

        ImportRun run = tracker.getById(runId);
        assertThat(run.status()).isEqualTo(ImportRunStatus.FAILED);
        assertThat(run.failedReasons()).containsExactly("Failed to queue jobs: connection refused");
        assertThat(run.durationMs()).isEqualTo(99);
    }

    @Test
    void outcomesAfterMarkFailedLeaveTheRunUntouched() {
        long runId = tracker.start("partial enqueue");
        tracker.recordFetchPhase(runId, new FetchPhaseResult(2, 5, ImportRunStatus.IN_PROGRESS, List.of()));
        tracker.markFailed(runId, "Failed to queue jobs: broker down", 30);

        tracker.recordOutcome(runId, ProcessOutcome.failed("validation_failed: missing required fields (url)", false));
        tracker.recordOutcome(runId, ProcessOutcome.created());

        ImportRun run = tracker.getById(runId);
        assertThat(run.status()).isEqualTo(ImportRunStatus.FAILED);
        assertThat(run.failedReasons()).containsExactly("Failed to queue jobs: broker down");
        assertThat(run.newJobs()).isZero();
        assertThat(run.failedJobs()).isZero();
    }

    @Test
    void successRateIsCompletedShareOfAllRuns() {
        for (int i = 0; i < 3; i++) {
            long runId = tracker.start("ok " + i);
            tracker.recordFetchPhase(runId, new FetchPhaseResult(0, 1, ImportRunStatus.COMPLETED, List.of()));
        }
        long failed = tracker.start("bad");
        tracker.markFailed(failed, "boom", 1);

        ImportRunStats stats = tracker.getAggregateStats();

        assertThat(stats.totalRuns()).isEqualTo(4);
        assertThat(stats.recentRuns()).isEqualTo(4);
        assertThat(stats.successRate()).isEqualTo(new BigDecimal("75.00"));
        assertThat(stats.lastRun()).isNotNull();
    }

    @Test
    void successRateIsZeroWithoutRuns() {
        ImportRunStats stats = tracker.getAggregateStats();

        assertThat(stats.totalRuns()).isZero();
        assertThat(stats.successRate()).isEqualTo(new BigDecimal("0.00"));
        assertThat(stats.lastRun()).isNull();
    }

    @Test
    void roundsSuccessRateToTwoDecimals() {
        assertThat(ImportRunTracker.successRate(2, 3)).isEqualTo(new BigDecimal("66.67"));
        assertThat(ImportRunTracker.successRate(1, 1)).isEqualTo(new BigDecimal("100.00"));
    }

    @Test
    void listsMostRecentRunsFirst() {
        long first = tracker.start("first");
        long second = tracker.start("second");
        long third = tracker.start("third");

        ImportRunPage page = tracker.list(1, 2);

        assertThat(page.total()).isEqualTo(3);
        assertThat(page.totalPages()).isEqualTo(2);
        assertThat(page.runs()).extracting(ImportRun::id).containsExactly(third, second);
        assertThat(tracker.list(2, 2).runs()).extracting(ImportRun::id).containsExactly(first);
    }

    @Test
    void unknownRunIsReportedAsNotFound() {
        assertThatThrownBy(() -> tracker.getById(987654L))
            .isInstanceOf(ImportRunNotFoundException.class)
            .hasMessageContaining("987654");
    }
}
