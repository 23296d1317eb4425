package com.delta.jobimporter.ingest.model;

public record FeedFetchError(String url, String error) {}
