package com.tessera.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads JSON that a model embedded in free text: strips markdown fences and
 * surrounding prose, then deserializes leniently.
 */
@Component
public class JsonResponseReader {

    private static final Logger log = LoggerFactory.getLogger(JsonResponseReader.class);

    private final ObjectMapper mapper;

    public JsonResponseReader() {
        this.mapper = JsonMapper.builder()
                .addModule(new ParameterNamesModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .build();
    }

    /**
     * Deserializes the JSON object or array found in {@code raw}.
     *
     * @return the value, or empty when no JSON could be read
     */
    public <T> Optional<T> read(String label, String raw, Class<T> type) {
        return extract(raw).flatMap(json -> {
            try {
                return Optional.ofNullable(mapper.readValue(json, type));
            } catch (Exception e) {
                log.warn("Failed to read {} as {} ({}), snippet: {}", label, type.getSimpleName(),
                        e.getMessage(), truncate(raw, 240));
                return Optional.empty();
            }
        });
    }

    /**
     * Reads the JSON found in {@code raw} as a tree.
     */
    public Optional<JsonNode> readTree(String label, String raw) {
        return extract(raw).flatMap(json -> {
            try {
                return Optional.ofNullable(mapper.readTree(json));
            } catch (Exception e) {
                log.warn("Failed to read {} as JSON tree ({}), snippet: {}", label, e.getMessage(), truncate(raw, 240));
                return Optional.empty();
            }
        });
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    static Optional<String> extract(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        int firstBrace = cleaned.indexOf('{');
        int firstBracket = cleaned.indexOf('[');
        boolean arrayFirst = firstBracket >= 0 && (firstBrace < 0 || firstBracket < firstBrace);
        char open = arrayFirst ? '[' : '{';
        char close = arrayFirst ? ']' : '}';
        int start = cleaned.indexOf(open);
        int end = cleaned.lastIndexOf(close);
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(cleaned.substring(start, end + 1));
    }

    private static String truncate(String value, int maxLength) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }
}
