package com.delta.jobimporter.ingest.model;

public enum QueueItemStatus {
    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED
}
