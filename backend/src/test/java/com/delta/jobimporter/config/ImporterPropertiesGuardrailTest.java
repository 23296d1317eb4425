package com.delta.jobimporter.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ImporterPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToDefault() {
        ImporterProperties properties = new ImporterProperties();
        properties.getFeed().setUserAgent("   ");
        assertEquals("Job-Importer-Bot/1.0", properties.getFeed().getUserAgent());
    }

    @Test
    void queueDefaultsMatchDeliveryPolicy() {
        ImporterProperties.Queue queue = new ImporterProperties().getQueue();
        assertEquals(3, queue.getMaxAttempts());
        assertEquals(2000, queue.getBackoffBaseMs());
        assertEquals(100, queue.getRateLimitMax());
        assertEquals(1000, queue.getRateLimitPeriodMs());
        assertEquals(3600, queue.getCompletedRetentionSeconds());
        assertEquals(1000, queue.getCompletedRetentionCount());
        assertEquals(86_400, queue.getFailedRetentionSeconds());
    }

    @Test
    void workerSettingsAreClamped() {
        ImporterProperties properties = new ImporterProperties();
        properties.getWorker().setConcurrency(0);
        properties.getWorker().setPollIntervalMs(1);
        properties.getQueue().setMaxAttempts(-2);
        assertEquals(1, properties.getWorker().getConcurrency());
        assertEquals(10, properties.getWorker().getPollIntervalMs());
        assertEquals(1, properties.getQueue().getMaxAttempts());
    }
}
