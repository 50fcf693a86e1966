package com.architecture.memory.codegraph.model.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Normalizes property maps so that values compare equal regardless of which store produced them.
 * Integral numbers become {@link Long}, collections become unmodifiable lists of strings and
 * null values are dropped.
 */
public final class PropertyValues {

    private PropertyValues() {
    }

    public static Map<String, Object> normalize(Map<String, ?> properties) {
        if (properties == null || properties.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        properties.forEach((key, value) -> {
            Object v = normalizeValue(value);
            if (v != null) {
                normalized.put(key, v);
            }
        });
        return Collections.unmodifiableMap(normalized);
    }

    public static Object normalizeValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                    .map(String::valueOf)
                    .collect(Collectors.toUnmodifiableList());
        }
        if (value instanceof Object[] array) {
            return normalizeValue(List.of(array));
        }
        return value;
    }
}
