package com.delta.jobimporter.ingest.feed;

import com.delta.jobimporter.config.ImporterProperties;
import com.delta.jobimporter.ingest.model.FeedFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Fetches raw feed documents. Every failure mode is reported through {@link FeedFetchResult}
 * so a bad feed never takes down a sweep.
 */
@Service
public class FeedClient {
    private static final Logger log = LoggerFactory.getLogger(FeedClient.class);
    private static final String ACCEPT_XML = "application/rss+xml,application/atom+xml,application/xml,text/xml;q=0.9,*/*;q=0.1";

    private final ImporterProperties properties;
    private final HttpClient client;
    private final ExecutorService feedExecutor;

    public FeedClient(
        ImporterProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        @Qualifier("feedExecutor") ExecutorService feedExecutor
    ) {
        this.properties = properties;
        this.feedExecutor = feedExecutor;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getFeed().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public FeedFetchResult fetch(String url) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return FeedFetchResult.failed(url, "Invalid feed URL: " + url, 0, elapsed(startedAt));
        }

        log.info("Fetching jobs from: {}", url);
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getFeed().getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getFeed().getUserAgent())
            .header("Accept", ACCEPT_XML)
            .GET()
            .build();
        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                log.error("Error fetching from {}: HTTP {}", url, status);
                return FeedFetchResult.failed(url, "Request failed with status code " + status, status, elapsed(startedAt));
            }
            byte[] bytes = response.body();
            String body = bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
            if (body == null || body.isBlank()) {
                log.error("Error fetching from {}: empty body", url);
                return FeedFetchResult.failed(url, "No data received from XML feed", status, elapsed(startedAt));
            }
            return FeedFetchResult.succeeded(url, body, status, elapsed(startedAt));
        } catch (HttpTimeoutException e) {
            log.error("Error fetching from {}: timeout", url);
            return FeedFetchResult.failed(url, "Timeout after " + properties.getFeed().getRequestTimeoutSeconds() + "s", 0, elapsed(startedAt));
        } catch (IOException e) {
            log.error("Error fetching from {}: {}", url, e.getMessage());
            return FeedFetchResult.failed(url, describe(e), 0, elapsed(startedAt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FeedFetchResult.failed(url, "Interrupted while fetching feed", 0, elapsed(startedAt));
        } catch (RuntimeException e) {
            log.error("Error fetching from {}: {}", url, e.getMessage());
            return FeedFetchResult.failed(url, describe(e), 0, elapsed(startedAt));
        }
    }

    /**
     * Fetches every URL concurrently. The returned list follows the input order but callers
     * must not rely on it.
     */
    public List<FeedFetchResult> fetchAll(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<FeedFetchResult>> futures = new ArrayList<>(urls.size());
        for (String url : urls) {
            futures.add(
                CompletableFuture.supplyAsync(() -> fetch(url), feedExecutor)
                    .exceptionally(e -> FeedFetchResult.failed(url, describe(e), 0, Duration.ZERO))
            );
        }
        List<FeedFetchResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<FeedFetchResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private String describe(Throwable e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }

    private Duration elapsed(Instant startedAt) {
        return Duration.between(startedAt, Instant.now());
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
