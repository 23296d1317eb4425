package com.delta.jobimporter.ingest.service;

import com.delta.jobimporter.ingest.model.JobCandidate;
import com.delta.jobimporter.ingest.model.JobType;
import com.delta.jobimporter.ingest.model.RetentionResult;
import com.delta.jobimporter.ingest.persistence.ImportRunRepository;
import com.delta.jobimporter.ingest.persistence.JobPostingRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class RetentionServiceTest {

    @Autowired
    private RetentionService retentionService;

    @Autowired
    private JobPostingRepository jobRepository;

    @Autowired
    private ImportRunRepository runRepository;

    @Autowired
    private JobStatsService jobStatsService;

    @Test
    void removesStaleJobsAndOldRuns() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        Instant now = Instant.now();
        jobRepository.insert(job("stale-" + suffix), now.minus(Duration.ofDays(91)));
        jobRepository.insert(job("fresh-" + suffix), now.minus(Duration.ofDays(2)));
        long oldRun = runRepository.insertRun("old", now.minus(Duration.ofDays(31)));
        long recentRun = runRepository.insertRun("recent", now.minus(Duration.ofDays(1)));

        RetentionResult result = retentionService.cleanup();

        assertThat(result.jobsDeleted()).isGreaterThanOrEqualTo(1);
        assertThat(result.runsDeleted()).isGreaterThanOrEqualTo(1);
        assertThat(jobRepository.findByExternalId("stale-" + suffix)).isEmpty();
        assertThat(jobRepository.findByExternalId("fresh-" + suffix)).isPresent();
        assertThat(runRepository.findById(oldRun)).isNull();
        assertThat(runRepository.findById(recentRun)).isNotNull();
    }

    @Test
    void jobStatsCountRecentJobsAndDistinctValues() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        long totalBefore = jobStatsService.getStats().totalJobs();
        jobRepository.insert(job("s1-" + suffix), Instant.now());
        jobRepository.insert(job("s2-" + suffix), Instant.now().minus(Duration.ofDays(3)));

        var stats = jobStatsService.getStats();

        assertThat(stats.totalJobs()).isEqualTo(totalBefore + 2);
        assertThat(stats.recentJobs()).isGreaterThanOrEqualTo(1);
        assertThat(stats.companiesCount()).isGreaterThanOrEqualTo(1);
        assertThat(stats.categoriesCount()).isGreaterThanOrEqualTo(1);
    }

    private JobCandidate job(String externalId) {
        return new JobCandidate(
            externalId,
            "https://example.com/retention/" + externalId,
            "Role",
            "Retention Co",
            "Operations",
            JobType.PART_TIME,
            "Remote",
            "",
            Instant.now()
        );
    }
}
