package com.delta.jobimporter.ingest.queue;

import com.delta.jobimporter.config.ImporterProperties;
import com.delta.jobimporter.ingest.model.JobCandidate;
import com.delta.jobimporter.ingest.model.JobType;
import com.delta.jobimporter.ingest.model.ProcessOutcome;
import com.delta.jobimporter.ingest.model.QueueItem;
import com.delta.jobimporter.ingest.processor.JobReconciliationService;
import com.delta.jobimporter.ingest.run.ImportRunTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class QueueWorkerServiceTest {
    private static final JobCandidate CANDIDATE = new JobCandidate(
        "job-1",
        "https://example.com/jobs/1",
        "Engineer",
        "Acme",
        "Engineering",
        JobType.FULL_TIME,
        "Remote",
        "",
        Instant.parse("2026-01-01T00:00:00Z")
    );

    @Mock
    private ImportQueue queue;

    @Mock
    private JobReconciliationService reconciliationService;

    @Mock
    private ImportRunTracker runTracker;

    private QueueWorkerService workerService;

    @BeforeEach
    void setUp() {
        ImporterProperties properties = new ImporterProperties();
        properties.getWorker().setEnabled(false);
        properties.getWorker().setConcurrency(2);
        properties.getWorker().setPollIntervalMs(10);
        properties.getWorker().setShutdownTimeoutSeconds(1);
        workerService = new QueueWorkerService(
            queue,
            reconciliationService,
            runTracker,
            new ThroughputLimiter(properties, Clock.systemUTC()),
            properties
        );
    }

    @AfterEach
    void tearDown() {
        workerService.stop();
    }

    @Test
    void successfulItemIsCompletedAndReported() {
        QueueItem item = item(1, 3);
        when(reconciliationService.process(CANDIDATE)).thenReturn(ProcessOutcome.created());

        workerService.handle(item);

        verify(queue).complete(item, ProcessOutcome.created());
        verify(runTracker).recordOutcome(42L, ProcessOutcome.created());
    }

    @Test
    void retryableFailureIsNotReportedUntilTerminal() {
        QueueItem item = item(1, 3);
        ProcessOutcome outcome = ProcessOutcome.failed("store_error: timeout", true);
        when(reconciliationService.process(CANDIDATE)).thenReturn(outcome);
        when(queue.fail(item, "store_error: timeout", true)).thenReturn(false);

        workerService.handle(item);

        verify(runTracker, never()).recordOutcome(eq(42L), any());
    }

    @Test
    void terminalFailureIsReported() {
        QueueItem item = item(3, 3);
        ProcessOutcome outcome = ProcessOutcome.failed("store_error: timeout", true);
        when(reconciliationService.process(CANDIDATE)).thenReturn(outcome);
        when(queue.fail(item, "store_error: timeout", true)).thenReturn(true);

        workerService.handle(item);

        verify(runTracker).recordOutcome(42L, outcome);
    }

    @Test
    void trackerErrorDoesNotSendCompletedItemBack() {
        QueueItem item = item(1, 3);
        when(reconciliationService.process(CANDIDATE)).thenReturn(ProcessOutcome.updated());
        doThrow(new IllegalStateException("db down")).when(runTracker).recordOutcome(42L, ProcessOutcome.updated());

        workerService.handle(item);

        verify(queue).complete(item, ProcessOutcome.updated());
        verify(queue, never()).fail(any(), anyString(), anyBoolean());
    }

    @Test
    void runningWorkersDrainTheQueueAndReleaseOnStop() {
        QueueItem item = item(1, 3);
        when(queue.isPaused()).thenReturn(false);
        when(queue.claimNext(anyString())).thenReturn(item).thenReturn(null);
        when(reconciliationService.process(CANDIDATE)).thenReturn(ProcessOutcome.created());

        workerService.start();
        assertThat(workerService.isRunning()).isTrue();
        verify(runTracker, timeout(2000)).recordOutcome(42L, ProcessOutcome.created());

        workerService.stop();

        assertThat(workerService.isRunning()).isFalse();
        verify(queue).releaseOwned(workerService.getInstanceId());
    }

    @Test
    void pausedQueueIsNotClaimed() throws Exception {
        when(queue.isPaused()).thenReturn(true);

        workerService.start();
        Thread.sleep(100);
        workerService.stop();

        verify(queue, never()).claimNext(anyString());
    }

    private QueueItem item(int attempts, int maxAttempts) {
        return new QueueItem(100L, "42-job-1", ImportQueue.JOB_NAME, 42L, CANDIDATE, attempts, maxAttempts);
    }
}
