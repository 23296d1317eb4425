package com.delta.jobimporter.ingest.service;

import com.delta.jobimporter.config.ImporterProperties;
import com.delta.jobimporter.ingest.model.RetentionResult;
import com.delta.jobimporter.ingest.persistence.ImportRunRepository;
import com.delta.jobimporter.ingest.persistence.JobPostingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
public class RetentionService {
    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    private final JobPostingRepository jobRepository;
    private final ImportRunRepository runRepository;
    private final ImporterProperties properties;
    private final Clock clock;

    public RetentionService(
        JobPostingRepository jobRepository,
        ImportRunRepository runRepository,
        ImporterProperties properties,
        Clock clock
    ) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${importer.retention.cron:0 0 3 * * *}")
    public void scheduledCleanup() {
        if (!properties.getRetention().isEnabled()) {
            return;
        }
        try {
            cleanup();
        } catch (RuntimeException e) {
            log.error("Retention cleanup failed", e);
        }
    }

    /**
     * Deletes jobs not updated within the job retention window and runs started before the
     * run retention window.
     */
    public RetentionResult cleanup() {
        Instant now = clock.instant();
        ImporterProperties.Retention retention = properties.getRetention();
        int jobsDeleted = jobRepository.deleteNotUpdatedSince(now.minus(Duration.ofDays(retention.getJobMaxAgeDays())));
        int runsDeleted = runRepository.deleteStartedBefore(now.minus(Duration.ofDays(retention.getRunMaxAgeDays())));
        log.info("Retention cleanup removed {} job(s) and {} import run(s)", jobsDeleted, runsDeleted);
        return new RetentionResult(jobsDeleted, runsDeleted);
    }
}
