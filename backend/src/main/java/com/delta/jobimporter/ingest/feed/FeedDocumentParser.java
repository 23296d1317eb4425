package com.delta.jobimporter.ingest.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

/**
 * Converts an XML feed into a generic tree: elements holding only text become strings,
 * other elements become objects, repeated siblings become arrays, attributes are keyed
 * {@code @_name} and text mixed with child elements is keyed {@code #text}.
 */
@Component
public class FeedDocumentParser {
    public static final String ATTRIBUTE_PREFIX = "@_";
    public static final String TEXT_KEY = "#text";

    private final ObjectMapper objectMapper;

    public FeedDocumentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode parse(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new FeedParseException("No data received from XML feed");
        }
        Document document;
        try {
            document = Jsoup.parse(xml, "", Parser.xmlParser());
        } catch (RuntimeException e) {
            throw new FeedParseException("Unable to parse XML feed: " + e.getMessage(), e);
        }

        ObjectNode root = objectMapper.createObjectNode();
        for (Element child : document.children()) {
            addChild(root, child.tagName(), convert(child));
        }
        if (root.isEmpty()) {
            throw new FeedParseException("XML feed contains no elements");
        }
        return root;
    }

    private JsonNode convert(Element element) {
        if (element.attributesSize() == 0 && element.childrenSize() == 0) {
            return TextNode.valueOf(element.text().trim());
        }

        ObjectNode node = objectMapper.createObjectNode();
        for (Attribute attribute : element.attributes()) {
            node.put(ATTRIBUTE_PREFIX + attribute.getKey(), attribute.getValue());
        }
        for (Element child : element.children()) {
            addChild(node, child.tagName(), convert(child));
        }
        String ownText = element.ownText().trim();
        if (!ownText.isEmpty()) {
            node.put(TEXT_KEY, ownText);
        }
        return node;
    }

    private void addChild(ObjectNode parent, String name, JsonNode value) {
        JsonNode existing = parent.get(name);
        if (existing == null) {
            parent.set(name, value);
            return;
        }
        if (existing.isArray()) {
            ((ArrayNode) existing).add(value);
            return;
        }
        ArrayNode repeated = objectMapper.createArrayNode();
        repeated.add(existing);
        repeated.add(value);
        parent.set(name, repeated);
    }
}
