package com.blockforge.core.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes block attributes into the JSON object embedded in the opening block comment.
 *
 * <p>Encoding rules:
 * <ul>
 *   <li>Top-level keys whose value is {@code null} or an empty string are dropped</li>
 *   <li>{@code null} values nested in maps and lists are pruned</li>
 *   <li>Map keys are written in sorted order, so equal maps always encode to the same text</li>
 *   <li>Values that are not JSON types (String, Number, Boolean, Map, Collection) are written
 *       as their string form</li>
 * </ul>
 *
 * <p>An attribute map that is empty after filtering encodes to an empty string.
 */
public final class AttributeEncoder {

    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
        .build();

    private AttributeEncoder() {
        // Utility class
    }

    /**
     * Encodes attributes to compact JSON.
     *
     * @param attributes block attributes, may be null
     * @return JSON object text, or {@code ""} when nothing remains after filtering
     */
    public static String encode(Map<String, ?> attributes) {
        Map<String, Object> filtered = filter(attributes);
        if (filtered.isEmpty()) {
            return "";
        }
        try {
            return JSON_MAPPER.writeValueAsString(filtered);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode block attributes: " + filtered.keySet(), e);
        }
    }

    /**
     * Removes empty attributes and prunes nested nulls.
     *
     * @param attributes block attributes, may be null
     * @return filtered copy preserving insertion order
     */
    public static Map<String, Object> filter(Map<String, ?> attributes) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (attributes == null) {
            return result;
        }
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            Object value = entry.getValue();
            if (value == null || "".equals(value)) {
                continue;
            }
            result.put(entry.getKey(), prune(value));
        }
        return result;
    }

    private static Object prune(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getValue() != null) {
                    copy.put(String.valueOf(entry.getKey()), prune(entry.getValue()));
                }
            }
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                if (element != null) {
                    copy.add(prune(element));
                }
            }
            return copy;
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return String.valueOf(value);
    }
}
