package com.delta.jobimporter.ingest.model;

import java.time.Instant;
import java.util.List;

public record ImportRun(
    long id,
    String sourceLabel,
    Instant startedAt,
    Instant finishedAt,
    ImportRunStatus status,
    int totalFetched,
    Integer queuedJobs,
    int newJobs,
    int updatedJobs,
    int failedJobs,
    List<String> failedReasons,
    long durationMs
) {
}
