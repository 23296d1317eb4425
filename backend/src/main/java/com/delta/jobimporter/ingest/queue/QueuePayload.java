package com.delta.jobimporter.ingest.queue;

import com.delta.jobimporter.ingest.model.JobCandidate;

/**
 * Serialized body of a {@code process-job} queue item.
 */
public record QueuePayload(JobCandidate jobCandidate, long importRunId) {}
