package com.delta.jobimporter.ingest.model;

import java.util.List;

public record ImportRunSummary(
    long importRunId,
    int totalJobs,
    int queuedJobs,
    ImportRunStatus status,
    List<FeedFetchError> fetchErrors
) {
}
