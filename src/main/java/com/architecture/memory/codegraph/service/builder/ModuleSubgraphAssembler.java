package com.architecture.memory.codegraph.service.builder;

import com.architecture.memory.codegraph.dto.extraction.RawEntity;
import com.architecture.memory.codegraph.dto.extraction.RawEntityKind;
import com.architecture.memory.codegraph.dto.extraction.RawRelationship;
import com.architecture.memory.codegraph.dto.extraction.RawRelationshipKind;
import com.architecture.memory.codegraph.dto.extraction.SourceLocation;
import com.architecture.memory.codegraph.exception.MalformedExtractionException;
import com.architecture.memory.codegraph.model.graph.EdgeKey;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import com.architecture.memory.codegraph.model.graph.ParameterKind;
import com.architecture.memory.codegraph.model.graph.Resolution;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a validated extraction payload into the module's desired subgraph.
 *
 * The result is not linked yet: symbolic edges point at placeholder ids and call sites are
 * unresolved. {@link ModuleLinker} fills those in against the graph.
 */
@Component
@RequiredArgsConstructor
class ModuleSubgraphAssembler {

    private final CanonicalIdGenerator idGenerator;

    ModuleSubgraph assemble(String moduleQualifiedName, List<RawEntity> entities, List<RawRelationship> relationships) {
        String moduleNodeId = idGenerator.moduleId(moduleQualifiedName);
        Map<String, RawEntity> byQualifiedName = new HashMap<>();
        entities.forEach(e -> byQualifiedName.put(e.getQualifiedName(), e));

        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        Map<EdgeKey, GraphEdge> edges = new LinkedHashMap<>();

        for (RawEntity entity : entities) {
            String id = idOf(entity);
            nodes.put(id, GraphNode.of(id, entity.getKind().getNodeKind(), moduleNodeId, entityProperties(entity, entities)));

            if (entity.getKind() != RawEntityKind.MODULE) {
                String parentQn = entity.getParent() != null ? entity.getParent() : moduleQualifiedName;
                String parentId = idOf(byQualifiedName.get(parentQn));
                put(edges, GraphEdge.of(parentId, EdgeKind.DECLARES, id));
                if (entity.getKind() == RawEntityKind.PARAMETER) {
                    put(edges, GraphEdge.of(parentId, EdgeKind.HAS_PARAMETER, id,
                            Map.of(NodeProperties.POSITION, entity.getPosition())));
                }
            }
            addTypeEdge(moduleQualifiedName, moduleNodeId, id, EdgeKind.HAS_TYPE, entity.getTypeAnnotation(), nodes, edges);
            if (entity.getKind() == RawEntityKind.FUNCTION) {
                addTypeEdge(moduleQualifiedName, moduleNodeId, id, EdgeKind.RETURNS_TYPE, entity.getReturnType(), nodes, edges);
            }
        }

        Map<String, Integer> ordinals = new HashMap<>();
        for (RawRelationship relationship : relationships) {
            String sourceId = idOf(byQualifiedName.get(relationship.getFrom()));
            if (relationship.getKind() == RawRelationshipKind.CALLS) {
                addCallSite(moduleQualifiedName, moduleNodeId, sourceId, relationship, ordinals, nodes, edges);
            } else {
                put(edges, GraphEdge.of(sourceId, relationship.getKind().getEdgeKind(),
                        idGenerator.placeholderId(relationship.getTo()), relationshipProperties(relationship)));
            }
        }
        return new ModuleSubgraph(moduleNodeId, nodes, edges);
    }

    private String idOf(RawEntity entity) {
        return idGenerator.nodeId(entity.getKind().getNodeKind(), entity.getQualifiedName());
    }

    // ========== NODE PROPERTIES ==========

    private Map<String, Object> entityProperties(RawEntity entity, List<RawEntity> entities) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(NodeProperties.NAME, entity.getName());
        props.put(NodeProperties.QUALIFIED_NAME, entity.getQualifiedName());
        props.put(NodeProperties.LOCATION, format(entity.getLocation()));

        switch (entity.getKind()) {
            case MODULE -> props.put(NodeProperties.PATH, entity.getPath() != null
                    ? entity.getPath()
                    : entity.getLocation() != null ? entity.getLocation().getFile() : null);
            case FUNCTION -> {
                props.put(NodeProperties.VISIBILITY, visibilityOf(entity));
                props.put(NodeProperties.RETURN_TYPE, annotation(entity.getReturnType()));
                props.put(NodeProperties.PARAMETERS, entities.stream()
                        .filter(e -> e.getKind() == RawEntityKind.PARAMETER)
                        .filter(e -> entity.getQualifiedName().equals(e.getParent()))
                        .sorted(Comparator.comparing(RawEntity::getPosition))
                        .map(RawEntity::getName)
                        .toList());
            }
            case PARAMETER -> {
                props.put(NodeProperties.POSITION, entity.getPosition());
                props.put(NodeProperties.PARAMETER_KIND,
                        (entity.getParameterKind() != null ? entity.getParameterKind() : ParameterKind.POSITIONAL).name());
                props.put(NodeProperties.HAS_DEFAULT, Boolean.TRUE.equals(entity.getHasDefault()));
            }
            case CLASS, VARIABLE, TYPE -> props.put(NodeProperties.VISIBILITY, visibilityOf(entity));
        }
        props.put(NodeProperties.TYPE_ANNOTATION, annotation(entity.getTypeAnnotation()));
        if (entity.getDecorators() != null && !entity.getDecorators().isEmpty()) {
            props.put(NodeProperties.DECORATORS, entity.getDecorators());
        }
        return props;
    }

    private static String visibilityOf(RawEntity entity) {
        return NodeProperties.VISIBILITY_PRIVATE.equalsIgnoreCase(entity.getVisibility())
                ? NodeProperties.VISIBILITY_PRIVATE
                : NodeProperties.VISIBILITY_PUBLIC;
    }

    private void addTypeEdge(String moduleQualifiedName, String moduleNodeId, String ownerId, EdgeKind kind,
                             String annotation, Map<String, GraphNode> nodes, Map<EdgeKey, GraphEdge> edges) {
        if (annotation == null || annotation.isBlank()) {
            return;
        }
        String normalized = idGenerator.normalizeAnnotation(annotation);
        String typeId = idGenerator.typeId(moduleQualifiedName, normalized);
        nodes.putIfAbsent(typeId, GraphNode.of(typeId, NodeKind.TYPE, moduleNodeId,
                Map.of(NodeProperties.NAME, normalized)));
        put(edges, GraphEdge.of(moduleNodeId, EdgeKind.DECLARES, typeId));
        put(edges, GraphEdge.of(ownerId, kind, typeId));
    }

    // ========== CALL SITES ==========

    private void addCallSite(String moduleQualifiedName, String moduleNodeId, String callerId, RawRelationship call,
                             Map<String, Integer> ordinals, Map<String, GraphNode> nodes, Map<EdgeKey, GraphEdge> edges) {
        SourceLocation location = call.getLocation();
        int ordinal = 0;
        if (location == null || location.getLine() == null) {
            ordinal = ordinals.merge(call.getFrom(), 1, Integer::sum) - 1;
        } else if (location.getColumn() == null) {
            ordinal = ordinals.merge(call.getFrom() + "@" + location.getLine(), 1, Integer::sum) - 1;
        }
        String id = idGenerator.callSiteId(call.getFrom(), location, ordinal);
        if (nodes.containsKey(id)) {
            throw new MalformedExtractionException(moduleQualifiedName, List.of("duplicate id " + id));
        }
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(NodeProperties.NAME, call.getTo());
        props.put(NodeProperties.CALLEE_NAME, call.getTo());
        props.put(NodeProperties.ARG_COUNT, call.getArgCount() != null ? call.getArgCount() : 0);
        props.put(NodeProperties.KEYWORD_NAMES, call.getKeywordNames() != null ? call.getKeywordNames() : List.of());
        props.put(NodeProperties.ARG_TYPES, call.getArgTypes() != null ? call.getArgTypes() : List.of());
        props.put(NodeProperties.LOCATION, format(call.getLocation()));
        props.put(NodeProperties.RESOLUTION_STATUS, Resolution.Status.UNRESOLVED.name());

        nodes.put(id, GraphNode.of(id, NodeKind.CALL_SITE, moduleNodeId, props));
        put(edges, GraphEdge.of(callerId, EdgeKind.HAS_CALLSITE, id));
    }

    // ========== RELATIONSHIPS ==========

    private static Map<String, Object> relationshipProperties(RawRelationship relationship) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(NodeProperties.TARGET_QUALIFIED_NAME, relationship.getTo());
        if (relationship.getKind() == RawRelationshipKind.IMPORTS) {
            props.put(NodeProperties.ALIAS, relationship.getAlias() != null
                    ? relationship.getAlias()
                    : lastSegment(relationship.getTo()));
        }
        props.put(NodeProperties.ACCESS_KIND, relationship.getAccessKind());
        props.put(NodeProperties.OBSERVED_TYPE, relationship.getObservedType());
        props.put(NodeProperties.LOCATION, format(relationship.getLocation()));
        return props;
    }

    private static void put(Map<EdgeKey, GraphEdge> edges, GraphEdge edge) {
        edges.put(edge.key(), edge);
    }

    private static String format(SourceLocation location) {
        return location != null ? location.format() : null;
    }

    private String annotation(String value) {
        return value == null || value.isBlank() ? null : idGenerator.normalizeAnnotation(value);
    }

    private static String lastSegment(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        return dot >= 0 ? qualifiedName.substring(dot + 1) : qualifiedName;
    }
}
