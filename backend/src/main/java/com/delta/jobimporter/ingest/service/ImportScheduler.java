package com.delta.jobimporter.ingest.service;

import com.delta.jobimporter.config.ImporterProperties;
import com.delta.jobimporter.ingest.model.ImportRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Cron-driven import over the configured feed URLs.
 */
@Service
public class ImportScheduler {
    static final String AUTOMATED_LABEL_PREFIX = "Automated: ";

    private static final Logger log = LoggerFactory.getLogger(ImportScheduler.class);

    private final ImportPipelineService pipelineService;
    private final ImporterProperties properties;

    public ImportScheduler(ImportPipelineService pipelineService, ImporterProperties properties) {
        this.pipelineService = pipelineService;
        this.properties = properties;
    }

    @Scheduled(cron = "${importer.schedule.cron:0 0 * * * *}")
    public void scheduledImport() {
        if (!properties.getSchedule().isEnabled()) {
            return;
        }
        runAutomatedImport();
    }

    public ImportRunSummary runAutomatedImport() {
        List<String> feedUrls = properties.getSchedule().getFeedUrls();
        if (feedUrls == null || feedUrls.isEmpty()) {
            log.warn("No feed URLs configured for automated import");
            return null;
        }
        log.info("Starting automated import from {} source(s)", feedUrls.size());
        try {
            ImportRunSummary summary = pipelineService.runImport(
                feedUrls,
                AUTOMATED_LABEL_PREFIX + String.join(", ", feedUrls)
            );
            log.info(
                "Automated import run {} finished fetching: {} jobs found, {} queued",
                summary.importRunId(),
                summary.totalJobs(),
                summary.queuedJobs()
            );
            return summary;
        } catch (RuntimeException e) {
            log.error("Error in automated import: {}", e.getMessage(), e);
            return null;
        }
    }
}
