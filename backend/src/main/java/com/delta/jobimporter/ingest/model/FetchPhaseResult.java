package com.delta.jobimporter.ingest.model;

import java.util.List;

/**
 * Counts known once every feed of a run has been fetched and normalized.
 */
public record FetchPhaseResult(
    int totalFetched,
    long durationMs,
    ImportRunStatus status,
    List<String> failedReasons
) {
}
