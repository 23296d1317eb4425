package com.delta.jobimporter.ingest.normalize;

import com.delta.jobimporter.ingest.feed.FeedDocumentParser;
import com.delta.jobimporter.ingest.model.JobCandidate;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Maps a raw feed item onto the canonical job shape. Never rejects an item: missing values
 * fall back to defaults and oversized values are truncated.
 */
@Component
public class JobNormalizer {
    private static final String[] LINK_ATTRIBUTES = {
        FeedDocumentParser.TEXT_KEY,
        FeedDocumentParser.ATTRIBUTE_PREFIX + "href",
        FeedDocumentParser.ATTRIBUTE_PREFIX + "url"
    };

    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
        value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant(),
        value -> OffsetDateTime.parse(value).toInstant(),
        value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
        value -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private final Clock clock;

    public JobNormalizer(Clock clock) {
        this.clock = clock;
    }

    public JobCandidate normalize(JsonNode item, String sourceUrl) {
        String title = resolve(item, CanonicalField.TITLE);
        String company = resolve(item, CanonicalField.COMPANY);
        String url = firstNonBlank(resolve(item, CanonicalField.URL), sourceUrl);
        String externalId = firstNonBlank(
            resolve(item, CanonicalField.EXTERNAL_ID),
            synthesizeExternalId(sourceUrl, title, company)
        );

        return new JobCandidate(
            CanonicalField.EXTERNAL_ID.truncate(externalId),
            CanonicalField.URL.truncate(url),
            CanonicalField.TITLE.truncate(title),
            CanonicalField.COMPANY.truncate(company),
            CanonicalField.CATEGORY.truncate(resolve(item, CanonicalField.CATEGORY)),
            JobTypeNormalizer.normalize(resolve(item, CanonicalField.TYPE)),
            CanonicalField.LOCATION.truncate(resolve(item, CanonicalField.LOCATION)),
            CanonicalField.DESCRIPTION.truncate(resolve(item, CanonicalField.DESCRIPTION)),
            parsePostedAt(resolve(item, CanonicalField.POSTED_AT))
        );
    }

    /**
     * Same source, title and company always give the same identifier.
     */
    static String synthesizeExternalId(String sourceUrl, String title, String company) {
        String raw = sourceUrl + "-" + title + "-" + company;
        return raw.replaceAll("[^a-zA-Z0-9]", "-").toLowerCase(Locale.ROOT);
    }

    String resolve(JsonNode item, CanonicalField field) {
        for (String alias : field.aliases()) {
            String value = text(lookup(item, alias));
            if (value != null) {
                return value;
            }
        }
        return field.defaultValue();
    }

    private JsonNode lookup(JsonNode item, String alias) {
        if (item == null || item.isNull()) {
            return null;
        }
        if (item.isValueNode()) {
            return FeedDocumentParser.TEXT_KEY.equals(alias) ? item : null;
        }
        return item.get(alias);
    }

    private String text(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isValueNode()) {
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }
        if (value.isArray()) {
            for (JsonNode element : value) {
                String text = text(element);
                if (text != null) {
                    return text;
                }
            }
            return null;
        }
        for (String key : LINK_ATTRIBUTES) {
            String text = text(value.get(key));
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    private Instant parsePostedAt(String raw) {
        if (raw == null || raw.isBlank()) {
            return clock.instant();
        }
        String candidate = raw.trim();
        for (Function<String, Instant> parser : DATE_PARSERS) {
            try {
                return parser.apply(candidate);
            } catch (DateTimeParseException ignored) {
                // fall through to the next accepted format
            }
        }
        return clock.instant();
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
