package com.delta.jobimporter.ingest.model;

import java.time.Instant;

public record JobPosting(
    long id,
    String externalId,
    String url,
    String title,
    String company,
    String category,
    JobType type,
    String location,
    String description,
    Instant postedAt,
    Instant createdAt,
    Instant updatedAt
) {
}
