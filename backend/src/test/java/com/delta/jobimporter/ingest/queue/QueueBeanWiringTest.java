package com.delta.jobimporter.ingest.queue;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class QueueBeanWiringTest {

    @Autowired
    private RetryPolicy retryPolicy;

    @Autowired
    private ThroughputLimiter throughputLimiter;

    @Autowired
    private ImportQueue importQueue;

    @Test
    void queueBeansAreBuiltFromConfiguredProperties() {
        assertThat(importQueue).isNotNull();
        assertThat(retryPolicy.delayAfter(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(throughputLimiter.availablePermits()).isBetween(1, 100);
    }
}
