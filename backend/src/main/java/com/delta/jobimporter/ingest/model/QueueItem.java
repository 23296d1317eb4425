package com.delta.jobimporter.ingest.model;

public record QueueItem(
    long id,
    String idempotencyKey,
    String name,
    long importRunId,
    JobCandidate candidate,
    int attempts,
    int maxAttempts
) {
    public boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }
}
