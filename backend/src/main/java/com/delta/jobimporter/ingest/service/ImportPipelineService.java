package com.delta.jobimporter.ingest.service;

import com.delta.jobimporter.ingest.extract.FeedItemExtractor;
import com.delta.jobimporter.ingest.feed.FeedClient;
import com.delta.jobimporter.ingest.feed.FeedDocumentParser;
import com.delta.jobimporter.ingest.feed.FeedParseException;
import com.delta.jobimporter.ingest.model.FeedFetchError;
import com.delta.jobimporter.ingest.model.FeedFetchResult;
import com.delta.jobimporter.ingest.model.FeedSweepResult;
import com.delta.jobimporter.ingest.model.FetchPhaseResult;
import com.delta.jobimporter.ingest.model.ImportRunStatus;
import com.delta.jobimporter.ingest.model.ImportRunSummary;
import com.delta.jobimporter.ingest.model.JobCandidate;
import com.delta.jobimporter.ingest.normalize.JobNormalizer;
import com.delta.jobimporter.ingest.queue.ImportQueue;
import com.delta.jobimporter.ingest.run.ImportRunTracker;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of an import: fetches every feed, normalizes the items, records the fetch
 * phase and hands the jobs to the queue.
 */
@Service
public class ImportPipelineService {
    private static final Logger log = LoggerFactory.getLogger(ImportPipelineService.class);

    private final FeedClient feedClient;
    private final FeedDocumentParser documentParser;
    private final FeedItemExtractor extractor;
    private final JobNormalizer normalizer;
    private final ImportQueue queue;
    private final ImportRunTracker runTracker;
    private final Clock clock;

    public ImportPipelineService(
        FeedClient feedClient,
        FeedDocumentParser documentParser,
        FeedItemExtractor extractor,
        JobNormalizer normalizer,
        ImportQueue queue,
        ImportRunTracker runTracker,
        Clock clock
    ) {
        this.feedClient = feedClient;
        this.documentParser = documentParser;
        this.extractor = extractor;
        this.normalizer = normalizer;
        this.queue = queue;
        this.runTracker = runTracker;
        this.clock = clock;
    }

    public ImportRunSummary runImport(List<String> urls) {
        return runImport(urls, null);
    }

    /**
     * Runs one import over {@code urls}. The run is labelled with {@code sourceLabel}, or with
     * the joined URLs when no label is given.
     *
     * @throws IllegalArgumentException when no URL is given
     * @throws ImportFailedException when the jobs could not be queued
     */
    public ImportRunSummary runImport(List<String> urls, String sourceLabel) {
        List<String> feedUrls = cleanUrls(urls);
        if (feedUrls.isEmpty()) {
            throw new IllegalArgumentException("At least one feed URL is required");
        }
        String label = sourceLabel == null || sourceLabel.isBlank() ? String.join(", ", feedUrls) : sourceLabel;

        Instant startedAt = clock.instant();
        long runId = runTracker.start(label);
        FeedSweepResult sweep = sweep(feedUrls);
        List<JobCandidate> candidates = sweep.candidates();
        List<String> reasons = new ArrayList<>(sweep.errors().size());
        for (FeedFetchError error : sweep.errors()) {
            reasons.add(error.url() + ": " + error.error());
        }

        ImportRunStatus fetchStatus;
        if (!candidates.isEmpty()) {
            fetchStatus = ImportRunStatus.IN_PROGRESS;
        } else if (sweep.errors().isEmpty()) {
            fetchStatus = ImportRunStatus.COMPLETED;
        } else {
            fetchStatus = ImportRunStatus.FAILED;
        }
        runTracker.recordFetchPhase(
            runId,
            new FetchPhaseResult(candidates.size(), elapsedMs(startedAt), fetchStatus, reasons)
        );
        if (candidates.isEmpty()) {
            log.info("Import run {} found no jobs in {} feed(s)", runId, feedUrls.size());
            return new ImportRunSummary(runId, 0, 0, fetchStatus, sweep.errors());
        }

        int queued;
        try {
            queued = queue.enqueueBulk(candidates, runId);
        } catch (RuntimeException e) {
            String message = "Failed to queue jobs: " + describe(e);
            runTracker.markFailed(runId, message, elapsedMs(startedAt));
            throw new ImportFailedException(runId, message, e);
        }
        runTracker.recordQueued(runId, queued, elapsedMs(startedAt));
        log.info("Import run {} queued {} of {} jobs", runId, queued, candidates.size());
        return new ImportRunSummary(
            runId,
            candidates.size(),
            queued,
            queued == 0 ? ImportRunStatus.COMPLETED : ImportRunStatus.IN_PROGRESS,
            sweep.errors()
        );
    }

    /**
     * Fetches all feeds concurrently and normalizes whatever they contain. A failing feed
     * contributes an error entry and no jobs.
     */
    FeedSweepResult sweep(List<String> urls) {
        List<JobCandidate> candidates = new ArrayList<>();
        List<FeedFetchError> errors = new ArrayList<>();
        for (FeedFetchResult result : feedClient.fetchAll(urls)) {
            if (!result.success()) {
                errors.add(new FeedFetchError(result.url(), result.error()));
                continue;
            }
            try {
                JsonNode document = documentParser.parse(result.body());
                List<JsonNode> items = extractor.extract(document, result.url());
                for (JsonNode item : items) {
                    candidates.add(normalizer.normalize(item, result.url()));
                }
                log.info("Fetched {} jobs from {}", items.size(), result.url());
            } catch (FeedParseException e) {
                log.error("Error parsing feed {}: {}", result.url(), e.getMessage());
                errors.add(new FeedFetchError(result.url(), e.getMessage()));
            }
        }
        return new FeedSweepResult(List.copyOf(candidates), List.copyOf(errors));
    }

    private List<String> cleanUrls(List<String> urls) {
        if (urls == null) {
            return List.of();
        }
        List<String> cleaned = new ArrayList<>(urls.size());
        for (String url : urls) {
            if (url != null && !url.isBlank()) {
                cleaned.add(url.trim());
            }
        }
        return cleaned;
    }

    private long elapsedMs(Instant startedAt) {
        return Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
    }

    private String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
