package com.delta.jobimporter.ingest.model;

import java.util.List;

public record FeedSweepResult(List<JobCandidate> candidates, List<FeedFetchError> errors) {}
