package dev.workflows.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;
import java.util.Optional;

/**
 * JSON authored as text. The text is kept verbatim for editing; when it parses
 * the parsed tree is kept too, and two values are equal when their trees are.
 * Unparseable text compares by its raw characters.
 */
public final class JsonText {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final String text;
    private final JsonNode node; // null when text is not valid JSON
    private final String parseError; // null when text is valid JSON

    private JsonText(String text, JsonNode node, String parseError) {
        this.text = text;
        this.node = node;
        this.parseError = parseError;
    }

    public static JsonText of(String text) {
        Objects.requireNonNull(text, "text");
        try {
            JsonNode parsed = MAPPER.readTree(text);
            if (parsed == null || parsed.isMissingNode()) {
                return new JsonText(text, null, "no JSON content");
            }
            return new JsonText(text, parsed, null);
        } catch (JsonProcessingException e) {
            return new JsonText(text, null, e.getOriginalMessage());
        }
    }

    /** Wraps an already structured value, rendering it as indented text. */
    public static JsonText of(JsonNode node) {
        Objects.requireNonNull(node, "node");
        try {
            return new JsonText(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node), node, null);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render JSON tree", e);
        }
    }

    public static JsonText nullValue() {
        return of("null");
    }

    public String text() { return text; }

    public boolean isValid() {
        return node != null;
    }

    public boolean isObject() {
        return node != null && node.isObject();
    }

    public Optional<JsonNode> node() {
        return Optional.ofNullable(node);
    }

    /** Parser message for invalid text, empty when the text parses. */
    public Optional<String> parseError() {
        return Optional.ofNullable(parseError);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JsonText other)) return false;
        if (node != null && other.node != null) {
            return node.equals(other.node);
        }
        return node == null && other.node == null && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return node != null ? node.hashCode() : text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
