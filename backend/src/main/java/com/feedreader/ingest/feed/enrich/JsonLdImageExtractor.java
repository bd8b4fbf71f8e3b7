package com.feedreader.ingest.feed.enrich;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code image} property of JSON-LD blocks. The value may be a URL string, an ImageObject with a
 * {@code url}, or an array of either.
 */
@Component
public class JsonLdImageExtractor {
    private static final Pattern IMAGE_STRING = Pattern.compile("\"image\"\\s*:\\s*\"([^\"]+)\"");
    private static final Pattern IMAGE_OBJECT = Pattern.compile("\"image\"\\s*:\\s*\\{[\\s\\S]*?\"url\"\\s*:\\s*\"([^\"]+)\"");
    private static final Pattern IMAGE_ARRAY = Pattern.compile("\"image\"\\s*:\\s*\\[[\\s\\S]*?\"([^\"]+)\"");

    private final ObjectMapper objectMapper;

    public JsonLdImageExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<String> extract(Document document) {
        if (document == null) {
            return Optional.empty();
        }
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            Optional<String> found;
            try {
                JsonNode root = objectMapper.readTree(payload);
                found = Optional.ofNullable(findImage(root));
            } catch (JsonProcessingException e) {
                // publishers ship trailing commas and raw newlines; scan the text instead
                found = scanRaw(payload);
            }
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private String findImage(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                String found = findImage(child);
                if (found != null) {
                    return found;
                }
            }
            return null;
        }
        if (!node.isObject()) {
            return null;
        }
        String direct = imageValue(node.get("image"));
        if (direct != null) {
            return direct;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            JsonNode value = fields.next().getValue();
            if (value.isArray() || value.isObject()) {
                String nested = findImage(value);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    private String imageValue(JsonNode image) {
        if (image == null || image.isNull()) {
            return null;
        }
        if (image.isTextual()) {
            String value = image.asText().trim();
            return value.isEmpty() ? null : value;
        }
        if (image.isObject()) {
            String url = image.path("url").asText("").trim();
            if (url.isEmpty()) {
                url = image.path("contentUrl").asText("").trim();
            }
            return url.isEmpty() ? null : url;
        }
        if (image.isArray()) {
            for (JsonNode child : image) {
                String value = imageValue(child);
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    private Optional<String> scanRaw(String payload) {
        for (Pattern pattern : new Pattern[] {IMAGE_STRING, IMAGE_OBJECT, IMAGE_ARRAY}) {
            Matcher matcher = pattern.matcher(payload);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }
}
