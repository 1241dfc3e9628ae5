package dev.autoresume.ai.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.autoresume.exception.GenerationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Field accessors that fail with INVALID_OUTPUT instead of returning defaults.
 */
final class SchemaSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SchemaSupport() {
    }

    static JsonNode parse(String schema) {
        try {
            return MAPPER.readTree(schema);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid built-in JSON schema", e);
        }
    }

    static GenerationException invalid(String format, Object... args) {
        return GenerationException.invalidOutput(String.format(format, args));
    }

    static JsonNode requireArray(JsonNode parent, String field, String where) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isArray()) {
            throw invalid("%s: '%s' must be an array", where, field);
        }
        return node;
    }

    static String requireText(JsonNode parent, String field, String where) {
        String value = text(parent, field, where);
        if (value.isBlank()) {
            throw invalid("%s: '%s' must be a non-empty string", where, field);
        }
        return value;
    }

    /**
     * Optional string field; absent or null reads as empty.
     */
    static String text(JsonNode parent, String field, String where) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        if (!node.isTextual()) {
            throw invalid("%s: '%s' must be a string", where, field);
        }
        return node.asText().trim();
    }

    /**
     * Required array of strings; blank entries are dropped.
     */
    static List<String> stringList(JsonNode parent, String field, String where) {
        List<String> values = new ArrayList<>();
        for (JsonNode item : requireArray(parent, field, where)) {
            if (!item.isTextual()) {
                throw invalid("%s: '%s' must only contain strings", where, field);
            }
            if (!item.asText().isBlank()) {
                values.add(item.asText().trim());
            }
        }
        return values;
    }

    static List<String> optionalStringList(JsonNode parent, String field, String where) {
        JsonNode node = parent.get(field);
        return node == null || node.isNull() ? List.of() : stringList(parent, field, where);
    }

    static void requireObject(JsonNode node, String where) {
        if (node == null || !node.isObject()) {
            throw invalid("%s must be a JSON object", where);
        }
    }
}
