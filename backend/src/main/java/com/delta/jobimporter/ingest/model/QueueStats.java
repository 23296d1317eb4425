package com.delta.jobimporter.ingest.model;

public record QueueStats(
    long waiting,
    long active,
    long completed,
    long failed,
    long delayed,
    long total,
    boolean paused
) {
}
