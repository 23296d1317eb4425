package com.delta.jobimporter.ingest.queue;

import com.delta.jobimporter.config.ImporterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-window limiter shared by every queue worker, so the cap applies to aggregate
 * consumption rather than per thread.
 */
@Component
public class ThroughputLimiter {
    private static final Logger log = LoggerFactory.getLogger(ThroughputLimiter.class);
    private static final long WAIT_STEP_MS = 10;

    private final int limitForPeriod;
    private final long periodMs;
    private final Clock clock;
    private final AtomicInteger permits;
    private final AtomicLong lastRefreshTime;

    public ThroughputLimiter(ImporterProperties properties, Clock clock) {
        this.limitForPeriod = Math.max(1, properties.getQueue().getRateLimitMax());
        this.periodMs = Math.max(1, properties.getQueue().getRateLimitPeriodMs());
        this.clock = clock;
        this.permits = new AtomicInteger(this.limitForPeriod);
        this.lastRefreshTime = new AtomicLong(clock.millis());
    }

    public boolean tryAcquire() {
        refreshIfNeeded();
        int current;
        do {
            current = permits.get();
            if (current < 1) {
                return false;
            }
        } while (!permits.compareAndSet(current, current - 1));
        return true;
    }

    /**
     * Blocks until a permit is available.
     *
     * @throws InterruptedException when the waiting worker is interrupted
     */
    public void acquire() throws InterruptedException {
        while (!tryAcquire()) {
            Thread.sleep(WAIT_STEP_MS);
        }
    }

    public int availablePermits() {
        refreshIfNeeded();
        return permits.get();
    }

    private void refreshIfNeeded() {
        long now = clock.millis();
        long lastRefresh = lastRefreshTime.get();
        if (now - lastRefresh >= periodMs && lastRefreshTime.compareAndSet(lastRefresh, now)) {
            permits.set(limitForPeriod);
            log.trace("Throughput window refreshed with {} permits", limitForPeriod);
        }
    }
}
