package com.dredd.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashMap;
import java.util.Map;

/**
 * Factory for creating a RuleContext seeded from a JSON payload.
 * Nested JSON objects are flattened using dot notation (e.g., {"x":{"y":"z"}} becomes "x.y" -> "z").
 * Arrays are kept as lists. JSON nulls are dropped, since a context never holds null values.
 */
public final class RuleContextFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private RuleContextFactory() {
    }

    /**
     * Create a RuleContext from a JSON object payload.
     *
     * @param jsonPayload JSON object; null or blank yields an empty context
     * @return context holding the flattened values
     */
    public static RuleContext<Object> fromJson(String jsonPayload) {
        if (jsonPayload == null || jsonPayload.isBlank()) {
            return new RuleContext<>();
        }
        return RuleContext.of(flatten(parseJson(jsonPayload)));
    }

    /**
     * Create a RuleContext from a JSON payload and add extra entries (e.g., headers, metadata) on top.
     */
    public static RuleContext<Object> fromJson(String jsonPayload, Map<String, ?> extras) {
        RuleContext<Object> context = fromJson(jsonPayload);
        if (extras != null) {
            extras.forEach((key, value) -> {
                if (key != null && value != null) {
                    context.set(key, value);
                }
            });
        }
        return context;
    }

    private static Map<String, Object> parseJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Object> flatten(Map<String, Object> map) {
        Map<String, Object> result = new HashMap<>();
        flattenRecursive("", map, result);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void flattenRecursive(String prefix, Map<String, Object> map, Map<String, Object> result) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map) {
                flattenRecursive(key, (Map<String, Object>) value, result);
            } else if (value != null) {
                result.put(key, value);
            }
        }
    }
}
