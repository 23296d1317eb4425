package com.delta.jobimporter.ingest.extract;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class FeedItemExtractor {
    private static final Logger log = LoggerFactory.getLogger(FeedItemExtractor.class);

    /**
     * Finds the raw item records of a parsed feed. An unrecognised layout yields an empty list.
     */
    public List<JsonNode> extract(JsonNode parsedFeed, String sourceUrl) {
        for (FeedShape shape : FeedShape.values()) {
            JsonNode items = shape.locate(parsedFeed);
            if (items == null) {
                continue;
            }
            List<JsonNode> records = toRecords(items);
            log.info("Extracted {} jobs from {} using {}", records.size(), sourceUrl, shape);
            return records;
        }
        log.info("No known item structure found in {}", sourceUrl);
        return List.of();
    }

    private List<JsonNode> toRecords(JsonNode items) {
        if (!items.isArray()) {
            return List.of(items);
        }
        List<JsonNode> records = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            if (item != null && !item.isNull()) {
                records.add(item);
            }
        }
        return records;
    }
}
