package com.delta.jobimporter.ingest.model;

import java.time.Duration;

public record FeedFetchResult(
    String url,
    boolean success,
    String body,
    String error,
    int statusCode,
    Duration duration
) {
    public static FeedFetchResult succeeded(String url, String body, int statusCode, Duration duration) {
        return new FeedFetchResult(url, true, body, null, statusCode, duration);
    }

    public static FeedFetchResult failed(String url, String error, int statusCode, Duration duration) {
        return new FeedFetchResult(url, false, null, error, statusCode, duration);
    }
}
