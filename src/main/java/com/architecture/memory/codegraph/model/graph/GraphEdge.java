package com.architecture.memory.codegraph.model.graph;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Map;

/**
 * Immutable directed edge of the code property graph.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GraphEdge {

    String sourceId;
    EdgeKind kind;
    String targetId;
    Map<String, Object> properties;

    public static GraphEdge of(String sourceId, EdgeKind kind, String targetId) {
        return new GraphEdge(sourceId, kind, targetId, Map.of());
    }

    public static GraphEdge of(String sourceId, EdgeKind kind, String targetId, Map<String, ?> properties) {
        return new GraphEdge(sourceId, kind, targetId, PropertyValues.normalize(properties));
    }

    public EdgeKey key() {
        return new EdgeKey(sourceId, kind, targetId);
    }

    public String stringProperty(String key) {
        Object value = properties.get(key);
        return value != null ? value.toString() : null;
    }

    public Integer intProperty(String key) {
        Object value = properties.get(key);
        return value instanceof Number number ? number.intValue() : null;
    }
}
