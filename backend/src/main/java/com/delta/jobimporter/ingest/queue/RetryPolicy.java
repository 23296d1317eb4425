package com.delta.jobimporter.ingest.queue;

import com.delta.jobimporter.config.ImporterProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential backoff: the delay after the n-th failed attempt is {@code base * 2^(n-1)},
 * capped at the configured maximum.
 */
@Component
public class RetryPolicy {
    private final long baseMs;
    private final long maxMs;

    public RetryPolicy(ImporterProperties properties) {
        this.baseMs = Math.max(0, properties.getQueue().getBackoffBaseMs());
        this.maxMs = Math.max(this.baseMs, properties.getQueue().getBackoffMaxMs());
    }

    public Duration delayAfter(int failedAttempts) {
        int exponent = Math.max(0, failedAttempts - 1);
        if (baseMs == 0) {
            return Duration.ZERO;
        }
        // 2^62 already overflows any sane base
        if (exponent >= 62 || baseMs > (maxMs >> exponent)) {
            return Duration.ofMillis(maxMs);
        }
        return Duration.ofMillis(Math.min(maxMs, baseMs << exponent));
    }
}
