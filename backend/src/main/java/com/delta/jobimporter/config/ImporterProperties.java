package com.delta.jobimporter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "importer")
public class ImporterProperties {
    private static final String DEFAULT_USER_AGENT = "Job-Importer-Bot/1.0";

    private Feed feed = new Feed();
    private Queue queue = new Queue();
    private Worker worker = new Worker();
    private Schedule schedule = new Schedule();
    private Retention retention = new Retention();

    public Feed getFeed() {
        return feed;
    }

    public void setFeed(Feed feed) {
        this.feed = feed;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Feed {
        private String userAgent;
        private int requestTimeoutSeconds = 30;
        private int maxParallelFetches = 8;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxParallelFetches() {
            return Math.max(1, maxParallelFetches);
        }

        public void setMaxParallelFetches(int maxParallelFetches) {
            this.maxParallelFetches = Math.max(1, maxParallelFetches);
        }
    }

    public static class Queue {
        private int maxAttempts = 3;
        private long backoffBaseMs = 2000;
        private long backoffMaxMs = 300_000;
        private int rateLimitMax = 100;
        private long rateLimitPeriodMs = 1000;
        private long completedRetentionSeconds = 3600;
        private int completedRetentionCount = 1000;
        private long failedRetentionSeconds = 86_400;
        private long leaseSeconds = 120;
        private long purgeIntervalMs = 60_000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getBackoffBaseMs() {
            return Math.max(0, backoffBaseMs);
        }

        public void setBackoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = Math.max(0, backoffBaseMs);
        }

        public long getBackoffMaxMs() {
            return Math.max(getBackoffBaseMs(), backoffMaxMs);
        }

        public void setBackoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
        }

        public int getRateLimitMax() {
            return Math.max(1, rateLimitMax);
        }

        public void setRateLimitMax(int rateLimitMax) {
            this.rateLimitMax = Math.max(1, rateLimitMax);
        }

        public long getRateLimitPeriodMs() {
            return Math.max(1, rateLimitPeriodMs);
        }

        public void setRateLimitPeriodMs(long rateLimitPeriodMs) {
            this.rateLimitPeriodMs = Math.max(1, rateLimitPeriodMs);
        }

        public long getCompletedRetentionSeconds() {
            return completedRetentionSeconds;
        }

        public void setCompletedRetentionSeconds(long completedRetentionSeconds) {
            this.completedRetentionSeconds = completedRetentionSeconds;
        }

        public int getCompletedRetentionCount() {
            return Math.max(0, completedRetentionCount);
        }

        public void setCompletedRetentionCount(int completedRetentionCount) {
            this.completedRetentionCount = Math.max(0, completedRetentionCount);
        }

        public long getFailedRetentionSeconds() {
            return failedRetentionSeconds;
        }

        public void setFailedRetentionSeconds(long failedRetentionSeconds) {
            this.failedRetentionSeconds = failedRetentionSeconds;
        }

        public long getLeaseSeconds() {
            return Math.max(1, leaseSeconds);
        }

        public void setLeaseSeconds(long leaseSeconds) {
            this.leaseSeconds = Math.max(1, leaseSeconds);
        }

        public long getPurgeIntervalMs() {
            return purgeIntervalMs;
        }

        public void setPurgeIntervalMs(long purgeIntervalMs) {
            this.purgeIntervalMs = purgeIntervalMs;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private int concurrency = 5;
        private int pollIntervalMs = 1000;
        private int shutdownTimeoutSeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getPollIntervalMs() {
            return Math.max(10, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getShutdownTimeoutSeconds() {
            return Math.max(1, shutdownTimeoutSeconds);
        }

        public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
            this.shutdownTimeoutSeconds = Math.max(1, shutdownTimeoutSeconds);
        }
    }

    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 * * * *";
        private List<String> feedUrls = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public List<String> getFeedUrls() {
            return feedUrls;
        }

        public void setFeedUrls(List<String> feedUrls) {
            this.feedUrls = feedUrls == null ? new ArrayList<>() : feedUrls;
        }
    }

    public static class Retention {
        private boolean enabled = true;
        private String cron = "0 0 3 * * *";
        private int jobMaxAgeDays = 90;
        private int runMaxAgeDays = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public int getJobMaxAgeDays() {
            return Math.max(1, jobMaxAgeDays);
        }

        public void setJobMaxAgeDays(int jobMaxAgeDays) {
            this.jobMaxAgeDays = Math.max(1, jobMaxAgeDays);
        }

        public int getRunMaxAgeDays() {
            return Math.max(1, runMaxAgeDays);
        }

        public void setRunMaxAgeDays(int runMaxAgeDays) {
            this.runMaxAgeDays = Math.max(1, runMaxAgeDays);
        }
    }
}
