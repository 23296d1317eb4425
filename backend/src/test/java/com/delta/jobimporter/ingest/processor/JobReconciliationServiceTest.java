package com.delta.jobimporter.ingest.processor;

import com.delta.jobimporter.ingest.model.JobCandidate;
import com.delta.jobimporter.ingest.model.JobPosting;
import com.delta.jobimporter.ingest.model.JobType;
import com.delta.jobimporter.ingest.model.ProcessAction;
import com.delta.jobimporter.ingest.model.ProcessOutcome;
import com.delta.jobimporter.ingest.persistence.JobPostingRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JobReconciliationServiceTest {

    @Autowired
    private JobReconciliationService service;

    @Autowired
    private JobPostingRepository repository;

    @Test
    void createsThenUpdatesTheSameJob() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        JobCandidate candidate = candidate("ext-" + suffix, "https://example.com/jobs/" + suffix, "Engineer");
        long before = repository.countJobs();

        ProcessOutcome first = service.process(candidate);
        ProcessOutcome second = service.process(candidate);

        assertThat(first.action()).isEqualTo(ProcessAction.CREATED);
        assertThat(second.action()).isEqualTo(ProcessAction.UPDATED);
        assertThat(repository.countJobs()).isEqualTo(before + 1);
    }

    @Test
    void matchesExistingJobByUrlWhenExternalIdChanged() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        String url = "https://example.com/jobs/" + suffix;
        service.process(candidate("old-" + suffix, url, "Engineer"));

        ProcessOutcome outcome = service.process(candidate("new-" + suffix, url, "Senior Engineer"));

        assertThat(outcome.action()).isEqualTo(ProcessAction.UPDATED);
        JobPosting stored = repository.findByExternalId("new-" + suffix).orElseThrow();
        assertThat(stored.url()).isEqualTo(url);
        assertThat(stored.title()).isEqualTo("Senior Engineer");
        assertThat(repository.findByExternalId("old-" + suffix)).isEmpty();
    }

    @Test
    void updateOverwritesMutableFields() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        service.process(candidate("ext-" + suffix, "https://example.com/a/" + suffix, "Engineer"));
        JobCandidate changed = new JobCandidate(
            "ext-" + suffix,
            "https://example.com/b/" + suffix,
            "Staff Engineer",
            "Acme",
            "Platform",
            JobType.REMOTE,
            "Lisbon",
            "new description",
            Instant.parse("2026-02-01T00:00:00Z")
        );

        service.process(changed);

        JobPosting stored = repository.findByExternalId("ext-" + suffix).orElseThrow();
        assertThat(stored.url()).isEqualTo("https://example.com/b/" + suffix);
        assertThat(stored.title()).isEqualTo("Staff Engineer");
        assertThat(stored.category()).isEqualTo("Platform");
        assertThat(stored.type()).isEqualTo(JobType.REMOTE);
        assertThat(stored.location()).isEqualTo("Lisbon");
        assertThat(stored.postedAt()).isEqualTo(Instant.parse("2026-02-01T00:00:00Z"));
        assertThat(stored.updatedAt()).isAfterOrEqualTo(stored.createdAt());
    }

    @Test
    void missingRequiredFieldsFailWithoutRetry() {
        JobCandidate incomplete = new JobCandidate(
            "ext-missing",
            null,
            " ",
            "Acme",
            "General",
            JobType.OTHER,
            "Remote",
            "",
            Instant.now()
        );
        long before = repository.countJobs();

        ProcessOutcome outcome = service.process(incomplete);

        assertThat(outcome.action()).isEqualTo(ProcessAction.FAILED);
        assertThat(outcome.retryable()).isFalse();
        assertThat(outcome.reason()).startsWith("validation_failed: missing required fields").contains("title", "url");
        assertThat(repository.countJobs()).isEqualTo(before);
    }

    @Test
    void conflictingIdentitiesFailAsPersistenceConflict() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        service.process(candidate("a-" + suffix, "https://example.com/a/" + suffix, "A"));
        service.process(candidate("b-" + suffix, "https://example.com/b/" + suffix, "B"));

        // id of the first job, url of the second
        ProcessOutcome outcome = service.process(candidate("a-" + suffix, "https://example.com/b/" + suffix, "A2"));

        assertThat(outcome.action()).isEqualTo(ProcessAction.FAILED);
        assertThat(outcome.reason()).startsWith("persistence_conflict");
        assertThat(outcome.retryable()).isFalse();
    }

    static JobCandidate candidate(String externalId, String url, String title) {
        return new JobCandidate(
            externalId,
            url,
            title,
            "Acme",
            "Engineering",
            JobType.FULL_TIME,
            "Remote",
            "Build reliable systems",
            Instant.parse("2026-01-10T00:00:00Z")
        );
    }
}
