package com.delta.jobimporter.ingest.extract;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Known item layouts, declared in match priority order. Feeds can satisfy more than one
 * layout, so the order is significant.
 */
public enum FeedShape {
    RSS_CHANNEL_ITEM("rss", "channel", "item"),
    ATOM_FEED_ENTRY("feed", "entry"),
    JOBS_JOB("jobs", "job"),
    BARE_JOB("job"),
    TOP_LEVEL_ARRAY;

    private final List<String> path;

    FeedShape(String... path) {
        this.path = List.of(path);
    }

    /**
     * Returns the node holding the repeating items, or {@code null} when this layout does not apply.
     */
    JsonNode locate(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return null;
        }
        if (path.isEmpty()) {
            return root.isArray() ? root : null;
        }
        JsonNode current = root;
        for (String segment : path) {
            if (!current.isObject()) {
                return null;
            }
            current = current.get(segment);
            if (current == null || current.isNull() || (current.isTextual() && current.asText().isEmpty())) {
                return null;
            }
        }
        return current;
    }
}
