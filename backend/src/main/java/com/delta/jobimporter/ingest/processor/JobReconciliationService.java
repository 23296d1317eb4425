package com.delta.jobimporter.ingest.processor;

import com.delta.jobimporter.ingest.model.BatchProcessSummary;
import com.delta.jobimporter.ingest.model.JobCandidate;
import com.delta.jobimporter.ingest.model.JobPosting;
import com.delta.jobimporter.ingest.model.ProcessAction;
import com.delta.jobimporter.ingest.model.ProcessOutcome;
import com.delta.jobimporter.ingest.persistence.JobPostingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Creates or updates stored jobs from normalized candidates. A stored job matches a candidate
 * when either its external id or its url is equal, so reprocessing never duplicates a job.
 */
@Service
public class JobReconciliationService {
    private static final Logger log = LoggerFactory.getLogger(JobReconciliationService.class);
    private static final String VALIDATION_FAILED = "validation_failed";
    private static final String PERSISTENCE_CONFLICT = "persistence_conflict";

    private final JobPostingRepository repository;
    private final ExecutorService batchExecutor;
    private final Clock clock;

    public JobReconciliationService(
        JobPostingRepository repository,
        @Qualifier("batchExecutor") ExecutorService batchExecutor,
        Clock clock
    ) {
        this.repository = repository;
        this.batchExecutor = batchExecutor;
        this.clock = clock;
    }

    public ProcessOutcome process(JobCandidate candidate) {
        List<String> missing = missingFields(candidate);
        if (!missing.isEmpty()) {
            return ProcessOutcome.failed(
                VALIDATION_FAILED + ": missing required fields (" + String.join(", ", missing) + ")",
                false
            );
        }

        Instant now = clock.instant();
        try {
            Optional<JobPosting> existing = repository.findByExternalIdOrUrl(candidate.externalId(), candidate.url());
            if (existing.isPresent()) {
                repository.update(existing.get().id(), candidate, now);
                return ProcessOutcome.updated();
            }
            return insertOrRecover(candidate, now);
        } catch (DataIntegrityViolationException e) {
            log.warn("Conflicting job {} could not be stored", candidate.externalId(), e);
            return ProcessOutcome.failed(PERSISTENCE_CONFLICT + ": " + describe(e), false);
        } catch (DataAccessException e) {
            log.warn("Store error while processing job {}", candidate.externalId(), e);
            return ProcessOutcome.failed("store_error: " + describe(e), true);
        }
    }

    /**
     * Processes candidates concurrently. One failing candidate never affects the others.
     */
    public BatchProcessSummary processBatch(List<JobCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return new BatchProcessSummary(0, 0, 0, 0, List.of());
        }
        List<CompletableFuture<ProcessOutcome>> futures = new ArrayList<>(candidates.size());
        for (JobCandidate candidate : candidates) {
            futures.add(
                CompletableFuture.supplyAsync(() -> process(candidate), batchExecutor)
                    .exceptionally(e -> ProcessOutcome.failed("unexpected_error: " + describe(e), true))
            );
        }

        int created = 0;
        int updated = 0;
        int failed = 0;
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            ProcessOutcome outcome = futures.get(i).join();
            if (outcome.action() == ProcessAction.CREATED) {
                created++;
            } else if (outcome.action() == ProcessAction.UPDATED) {
                updated++;
            } else {
                failed++;
                JobCandidate candidate = candidates.get(i);
                String label = candidate == null || candidate.externalId() == null ? "item " + i : candidate.externalId();
                errors.add(label + ": " + outcome.reason());
            }
        }
        log.info("Processed batch of {} jobs: {} created, {} updated, {} failed", candidates.size(), created, updated, failed);
        return new BatchProcessSummary(candidates.size(), created, updated, failed, List.copyOf(errors));
    }

    private ProcessOutcome insertOrRecover(JobCandidate candidate, Instant now) {
        try {
            repository.insert(candidate, now);
            return ProcessOutcome.created();
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent insert of the same job
            Optional<JobPosting> winner = repository.findByExternalIdOrUrl(candidate.externalId(), candidate.url());
            if (winner.isEmpty()) {
                return ProcessOutcome.failed(PERSISTENCE_CONFLICT + ": " + describe(e), false);
            }
            repository.update(winner.get().id(), candidate, now);
            return ProcessOutcome.updated();
        }
    }

    private List<String> missingFields(JobCandidate candidate) {
        if (candidate == null) {
            return List.of("externalId", "title", "company", "url");
        }
        List<String> missing = new ArrayList<>(4);
        if (isBlank(candidate.externalId())) {
            missing.add("externalId");
        }
        if (isBlank(candidate.title())) {
            missing.add("title");
        }
        if (isBlank(candidate.company())) {
            missing.add("company");
        }
        if (isBlank(candidate.url())) {
            missing.add("url");
        }
        return missing;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String describe(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }
}
