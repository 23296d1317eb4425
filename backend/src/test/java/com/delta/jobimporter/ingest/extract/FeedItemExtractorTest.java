package com.delta.jobimporter.ingest.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FeedItemExtractorTest {
    private static final String SOURCE = "https://example.com/feed.xml";

    private final ObjectMapper mapper = new ObjectMapper();
    private final FeedItemExtractor extractor = new FeedItemExtractor();

    @Test
    void extractsRssItems() throws Exception {
        JsonNode feed = mapper.readTree("""
            {"rss": {"channel": {"item": [{"title": "A"}, {"title": "B"}]}}}
            """);

        List<JsonNode> items = extractor.extract(feed, SOURCE);

        assertThat(items).extracting(item -> item.path("title").asText()).containsExactly("A", "B");
    }

    @Test
    void singleItemBecomesOneElementList() throws Exception {
        JsonNode feed = mapper.readTree("""
            {"feed": {"entry": {"title": "Only"}}}
            """);

        List<JsonNode> items = extractor.extract(feed, SOURCE);

        assertThat(items).hasSize(1);
        assertThat(items.get(0).path("title").asText()).isEqualTo("Only");
    }

    @Test
    void rssWinsOverOtherShapesInTheSameDocument() throws Exception {
        JsonNode feed = mapper.readTree("""
            {
              "rss": {"channel": {"item": [{"title": "from rss"}]}},
              "jobs": {"job": [{"title": "from jobs"}]},
              "job": {"title": "bare"}
            }
            """);

        List<JsonNode> items = extractor.extract(feed, SOURCE);

        assertThat(items).extracting(item -> item.path("title").asText()).containsExactly("from rss");
    }

    @Test
    void jobsJobWinsOverBareJob() throws Exception {
        JsonNode feed = mapper.readTree("""
            {"jobs": {"job": [{"title": "nested"}]}, "job": {"title": "bare"}}
            """);

        assertThat(extractor.extract(feed, SOURCE))
            .extracting(item -> item.path("title").asText())
            .containsExactly("nested");
    }

    @Test
    void fallsBackToBareJob() throws Exception {
        JsonNode feed = mapper.readTree("""
            {"job": [{"title": "one"}, {"title": "two"}]}
            """);

        assertThat(extractor.extract(feed, SOURCE)).hasSize(2);
    }

    @Test
    void acceptsTopLevelArray() throws Exception {
        JsonNode feed = mapper.readTree("""
            [{"title": "x"}, {"title": "y"}, {"title": "z"}]
            """);

        assertThat(extractor.extract(feed, SOURCE)).hasSize(3);
    }

    @Test
    void emptyRssChannelIsSkipped() throws Exception {
        JsonNode feed = mapper.readTree("""
            {"rss": {"channel": ""}, "job": {"title": "bare"}}
            """);

        assertThat(extractor.extract(feed, SOURCE))
            .extracting(item -> item.path("title").asText())
            .containsExactly("bare");
    }

    @Test
    void unknownLayoutYieldsNoItems() throws Exception {
        JsonNode feed = mapper.readTree("""
            {"catalog": {"product": [{"name": "widget"}]}}
            """);

        assertThat(extractor.extract(feed, SOURCE)).isEmpty();
    }
}
