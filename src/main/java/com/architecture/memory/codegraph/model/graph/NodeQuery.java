package com.architecture.memory.codegraph.model.graph;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Backend-neutral node predicate. Null fields match everything.
 */
@Value
@Builder
public class NodeQuery {

    Set<NodeKind> kinds;
    String moduleId;
    String name;
    String qualifiedName;
    Boolean changed;

    public static NodeQuery all() {
        return NodeQuery.builder().build();
    }

    public boolean matches(GraphNode node) {
        return (kinds == null || kinds.contains(node.getKind()))
                && (moduleId == null || moduleId.equals(node.getModuleId()))
                && (name == null || name.equals(node.getName()))
                && (qualifiedName == null || qualifiedName.equals(node.getQualifiedName()))
                && (changed == null || changed == node.isChanged());
    }
}
