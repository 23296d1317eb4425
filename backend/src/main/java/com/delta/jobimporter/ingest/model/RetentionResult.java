package com.delta.jobimporter.ingest.model;

public record RetentionResult(int jobsDeleted, int runsDeleted) {}
