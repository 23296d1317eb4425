package com.delta.jobimporter.ingest.service;

import com.delta.jobimporter.ingest.model.JobStats;
import com.delta.jobimporter.ingest.persistence.JobPostingRepository;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

@Service
public class JobStatsService {
    private static final Duration RECENT_WINDOW = Duration.ofHours(24);

    private final JobPostingRepository repository;
    private final Clock clock;

    public JobStatsService(JobPostingRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public JobStats getStats() {
        return repository.fetchJobStats(clock.instant().minus(RECENT_WINDOW));
    }
}
