package com.delta.jobimporter.ingest.normalize;

import java.util.List;

/**
 * Alias rules for every canonical job field. Aliases are tried in declaration order and the
 * first non-blank value wins; {@code defaultValue} applies when none is present.
 */
public enum CanonicalField {
    EXTERNAL_ID(200, null, "id", "guid", "@_id"),
    TITLE(200, "Untitled Position", "title", "jobTitle", "position", "#text"),
    COMPANY(200, "Unknown Company", "company", "companyName", "employer", "organization"),
    DESCRIPTION(5000, "", "description", "summary", "content", "content:encoded"),
    URL(500, null, "link", "url", "applyUrl", "apply_url", "guid"),
    LOCATION(200, "Remote", "location", "jobLocation", "city", "country"),
    CATEGORY(100, "General", "category", "jobCategory", "department", "sector"),
    TYPE(-1, "Other", "type", "jobType", "employmentType"),
    POSTED_AT(-1, null, "pubDate", "published", "date", "postedDate");

    // negative when unbounded
    private final int maxLength;
    private final String defaultValue;
    private final List<String> aliases;

    CanonicalField(int maxLength, String defaultValue, String... aliases) {
        this.maxLength = maxLength;
        this.defaultValue = defaultValue;
        this.aliases = List.of(aliases);
    }

    public List<String> aliases() {
        return aliases;
    }

    public String defaultValue() {
        return defaultValue;
    }

    public String truncate(String value) {
        if (value == null || maxLength < 0 || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
