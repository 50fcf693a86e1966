package com.architecture.memory.codegraph.model.graph;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable node of the code property graph.
 *
 * The {@code changed} flag is bookkeeping for incremental validation; it is not one of the
 * node's properties and never shows up in snapshot diffs.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GraphNode {

    String id;
    NodeKind kind;
    String moduleId;
    Map<String, Object> properties;
    boolean changed;

    public static GraphNode of(String id, NodeKind kind, String moduleId, Map<String, ?> properties) {
        return new GraphNode(id, kind, moduleId, PropertyValues.normalize(properties), false);
    }

    public static GraphNode of(String id, NodeKind kind, String moduleId, Map<String, ?> properties, boolean changed) {
        return new GraphNode(id, kind, moduleId, PropertyValues.normalize(properties), changed);
    }

    public GraphNode withChanged(boolean flag) {
        return flag == changed ? this : new GraphNode(id, kind, moduleId, properties, flag);
    }

    public GraphNode withProperties(Map<String, ?> newProperties) {
        return new GraphNode(id, kind, moduleId, PropertyValues.normalize(newProperties), changed);
    }

    public GraphNode withProperty(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(properties);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return withProperties(copy);
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    public Object property(String key) {
        return properties.get(key);
    }

    public String stringProperty(String key) {
        Object value = properties.get(key);
        return value != null ? value.toString() : null;
    }

    public Integer intProperty(String key) {
        Object value = properties.get(key);
        return value instanceof Number number ? number.intValue() : null;
    }

    public boolean booleanProperty(String key) {
        return Boolean.TRUE.equals(properties.get(key));
    }

    @SuppressWarnings("unchecked")
    public List<String> listProperty(String key) {
        Object value = properties.get(key);
        return value instanceof List<?> ? (List<String>) value : Collections.emptyList();
    }

    public String getName() {
        return stringProperty(NodeProperties.NAME);
    }

    public String getQualifiedName() {
        return stringProperty(NodeProperties.QUALIFIED_NAME);
    }
}
