package com.mathide.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.mathide.exception.MissingFieldException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed field access over decoded model responses.
 *
 * Every accessor takes the canonical field name first and optional legacy aliases after it;
 * the first name present on the node wins. The require* variants throw
 * {@link MissingFieldException} naming the canonical field.
 */
public final class ResponseFields {

    private ResponseFields() {}

    public static JsonNode find(JsonNode node, String field, String... aliases) {
        if (node == null || !node.isObject()) return null;
        JsonNode value = node.get(field);
        if (value != null && !value.isNull()) return value;
        for (String alias : aliases) {
            value = node.get(alias);
            if (value != null && !value.isNull()) return value;
        }
        return null;
    }

    public static boolean has(JsonNode node, String field, String... aliases) {
        return find(node, field, aliases) != null;
    }

    // =========================================================================
    // Required
    // =========================================================================

    public static String requireText(JsonNode node, String field, String... aliases) {
        JsonNode value = find(node, field, aliases);
        if (value == null) {
            throw new MissingFieldException(field, "Required field '" + field + "' is missing");
        }
        if (!value.isTextual()) {
            throw new MissingFieldException(field, "Field '" + field + "' must be a string");
        }
        return value.textValue();
    }

    public static boolean requireBoolean(JsonNode node, String field, String... aliases) {
        JsonNode value = find(node, field, aliases);
        if (value == null) {
            throw new MissingFieldException(field, "Required field '" + field + "' is missing");
        }
        if (value.isBoolean()) return value.booleanValue();
        if (value.isTextual()) {
            String text = value.asText().trim();
            if ("true".equalsIgnoreCase(text))  return true;
            if ("false".equalsIgnoreCase(text)) return false;
        }
        throw new MissingFieldException(field, "Field '" + field + "' must be a boolean");
    }

    public static double requireNumber(JsonNode node, String field, String... aliases) {
        JsonNode value = find(node, field, aliases);
        if (value == null) {
            throw new MissingFieldException(field, "Required field '" + field + "' is missing");
        }
        if (value.isNumber()) return value.doubleValue();
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new MissingFieldException(field, "Field '" + field + "' must be numeric");
            }
        }
        throw new MissingFieldException(field, "Field '" + field + "' must be numeric");
    }

    // =========================================================================
    // Optional
    // =========================================================================

    public static String optionalText(JsonNode node, String field, String... aliases) {
        JsonNode value = find(node, field, aliases);
        return value != null && value.isValueNode() ? value.asText() : null;
    }

    public static boolean optionalBoolean(JsonNode node, boolean fallback, String field, String... aliases) {
        JsonNode value = find(node, field, aliases);
        if (value == null) return fallback;
        if (value.isBoolean()) return value.booleanValue();
        if (value.isTextual()) return Boolean.parseBoolean(value.asText().trim());
        return fallback;
    }

    public static double optionalNumber(JsonNode node, double fallback, String field, String... aliases) {
        JsonNode value = find(node, field, aliases);
        if (value == null) return fallback;
        if (value.isNumber()) return value.doubleValue();
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    public static Integer optionalInteger(JsonNode node, String field, String... aliases) {
        JsonNode value = find(node, field, aliases);
        if (value == null) return null;
        if (value.isIntegralNumber()) return value.intValue();
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** Array of scalars as strings; non-array values yield an empty list. */
    public static List<String> textList(JsonNode node, String field, String... aliases) {
        JsonNode value = find(node, field, aliases);
        if (value == null || !value.isArray()) return Collections.emptyList();
        List<String> items = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (item.isValueNode() && !item.isNull()) items.add(item.asText());
        }
        return items;
    }

    /** Object of scalars as a string map, insertion ordered. Nested values keep their JSON text. */
    public static Map<String, String> textMap(JsonNode node, String field, String... aliases) {
        JsonNode value = find(node, field, aliases);
        if (value == null || !value.isObject()) return Collections.emptyMap();
        Map<String, String> map = new LinkedHashMap<>();
        value.fields().forEachRemaining(e ->
                map.put(e.getKey(), e.getValue().isValueNode() ? e.getValue().asText() : e.getValue().toString()));
        return map;
    }
}
