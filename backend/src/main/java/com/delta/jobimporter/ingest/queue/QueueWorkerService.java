package com.delta.jobimporter.ingest.queue;

import com.delta.jobimporter.config.ImporterProperties;
import com.delta.jobimporter.ingest.model.ProcessOutcome;
import com.delta.jobimporter.ingest.model.QueueItem;
import com.delta.jobimporter.ingest.processor.JobReconciliationService;
import com.delta.jobimporter.ingest.run.ImportRunTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.lang.management.ManagementFactory;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool of queue consumers. Each worker claims one item at a time, reconciles it and reports
 * terminal outcomes to the run tracker.
 */
@Service
public class QueueWorkerService {
    private static final Logger log = LoggerFactory.getLogger(QueueWorkerService.class);
    private static final long FORCED_STOP_WAIT_SECONDS = 5;

    private final ImportQueue queue;
    private final JobReconciliationService reconciliationService;
    private final ImportRunTracker runTracker;
    private final ThroughputLimiter limiter;
    private final ImporterProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Object lifecycleLock = new Object();
    private final String instanceId;

    private ExecutorService executor;
    private int activeWorkerCount;

    public QueueWorkerService(
        ImportQueue queue,
        JobReconciliationService reconciliationService,
        ImportRunTracker runTracker,
        ThroughputLimiter limiter,
        ImporterProperties properties
    ) {
        this.queue = queue;
        this.reconciliationService = reconciliationService;
        this.runTracker = runTracker;
        this.limiter = limiter;
        this.properties = properties;
        this.instanceId = "worker-" + ManagementFactory.getRuntimeMXBean().getName()
            + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorker().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getActiveWorkerCount() {
        return activeWorkerCount;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int workerCount = properties.getWorker().getConcurrency();
            int pollIntervalMs = properties.getWorker().getPollIntervalMs();
            activeWorkerCount = workerCount;
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("import-queue-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex, pollIntervalMs));
            }
            log.info("Started {} import queue worker(s) as {}", workerCount, instanceId);
        }
    }

    /**
     * Stops claiming new items and waits for in-flight items up to the shutdown timeout. Workers
     * still busy after that are interrupted and their leased items go back to waiting.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdown();
                try {
                    int timeout = properties.getWorker().getShutdownTimeoutSeconds();
                    if (!executor.awaitTermination(timeout, TimeUnit.SECONDS)) {
                        log.warn("Queue workers still busy after {}s, interrupting {} in-flight item(s)", timeout, inFlight.get());
                        executor.shutdownNow();
                        executor.awaitTermination(FORCED_STOP_WAIT_SECONDS, TimeUnit.SECONDS);
                    }
                } catch (InterruptedException ignored) {
                    executor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
            try {
                queue.releaseOwned(instanceId);
            } catch (Exception e) {
                log.warn("Failed to release leased queue items for {}", instanceId, e);
            }
            log.info("Stopped import queue workers");
        }
    }

    private void workerLoop(int workerIndex, int pollIntervalMs) {
        Thread.currentThread().setName("import-queue-worker-" + workerIndex);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            QueueItem item;
            try {
                if (queue.isPaused()) {
                    sleep(pollIntervalMs);
                    continue;
                }
                item = queue.claimNext(instanceId);
            } catch (Exception e) {
                log.warn("Queue worker {} failed to claim queue item", workerIndex, e);
                sleep(pollIntervalMs);
                continue;
            }

            if (item == null) {
                sleep(pollIntervalMs);
                continue;
            }

            inFlight.incrementAndGet();
            try {
                limiter.acquire();
                handle(item);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.warn("Queue worker {} failed while processing {}", workerIndex, item.idempotencyKey(), e);
                recordUnexpectedFailure(item, e);
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }

    void handle(QueueItem item) {
        ProcessOutcome outcome = reconciliationService.process(item.candidate());
        if (outcome.isSuccess()) {
            queue.complete(item, outcome);
            reportOutcome(item, outcome);
            return;
        }
        if (queue.fail(item, outcome.reason(), outcome.retryable())) {
            reportOutcome(item, outcome);
        }
    }

    // the queue item is already settled here, so a tracker error must not send it back for retry
    private void reportOutcome(QueueItem item, ProcessOutcome outcome) {
        try {
            runTracker.recordOutcome(item.importRunId(), outcome);
        } catch (Exception e) {
            log.error("Failed to record outcome of {} for import run {}", item.idempotencyKey(), item.importRunId(), e);
        }
    }

    private void recordUnexpectedFailure(QueueItem item, Exception error) {
        String reason = "worker_exception: " + error.getClass().getSimpleName();
        try {
            if (queue.fail(item, reason, true)) {
                reportOutcome(item, ProcessOutcome.failed(reason, true));
            }
        } catch (Exception ex) {
            log.warn("Failed to record worker failure for {}", item.idempotencyKey(), ex);
        }
    }

    private void sleep(int millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
