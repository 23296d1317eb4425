package com.delta.jobimporter.ingest.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeedDocumentParserTest {
    private final FeedDocumentParser parser = new FeedDocumentParser(new ObjectMapper());

    @Test
    void repeatedElementsBecomeArraysAndSingleOnesStayObjects() {
        JsonNode root = parser.parse("""
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0">
              <channel>
                <title>Jobs</title>
                <item><title>A</title></item>
                <item><title>B</title></item>
              </channel>
            </rss>
            """);

        JsonNode channel = root.path("rss").path("channel");
        assertThat(root.path("rss").path("@_version").asText()).isEqualTo("2.0");
        assertThat(channel.path("title").asText()).isEqualTo("Jobs");
        assertThat(channel.path("item").isArray()).isTrue();
        assertThat(channel.path("item").get(1).path("title").asText()).isEqualTo("B");
    }

    @Test
    void keepsAttributesAndTextOfMixedElements() {
        JsonNode root = parser.parse("""
            <feed>
              <entry>
                <link href="https://example.com/jobs/1"/>
                <id type="urn">job-1</id>
              </entry>
            </feed>
            """);

        JsonNode entry = root.path("feed").path("entry");
        assertThat(entry.path("link").path("@_href").asText()).isEqualTo("https://example.com/jobs/1");
        assertThat(entry.path("id").path("#text").asText()).isEqualTo("job-1");
        assertThat(entry.path("id").path("@_type").asText()).isEqualTo("urn");
    }

    @Test
    void rejectsBlankDocument() {
        assertThatThrownBy(() -> parser.parse("  "))
            .isInstanceOf(FeedParseException.class);
    }

    @Test
    void rejectsDocumentWithoutElements() {
        assertThatThrownBy(() -> parser.parse("just some text"))
            .isInstanceOf(FeedParseException.class)
            .hasMessageContaining("no elements");
    }
}
