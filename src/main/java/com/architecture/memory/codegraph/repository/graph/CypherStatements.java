package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.NodeKind;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cypher used by {@link Neo4jGraphStore}. Code graph nodes carry the {@code :CodeNode} label plus one
 * label per kind; edge targets that do not exist yet are kept as {@code :Placeholder} nodes.
 * The commit counter lives on a single {@code :GraphMeta} node outside the code graph.
 * Labels and relationship types are only ever built from enum constants.
 */
final class CypherStatements {

    static final Set<String> RESERVED_KEYS = Set.of("id", "kind", "moduleId", "changed");

    static final String READ_NODES = """
            MATCH (n:CodeNode)
            RETURN n.id AS id, n.kind AS kind, n.moduleId AS moduleId, n.changed AS changed, properties(n) AS props
            """;

    static final String READ_EDGES = """
            MATCH (a:CodeNode)-[r]->(b)
            RETURN a.id AS source, type(r) AS kind, b.id AS target, properties(r) AS props
            """;

    static final String READ_VERSION = """
            OPTIONAL MATCH (m:GraphMeta {name: 'codegraph'})
            RETURN coalesce(m.version, 0) AS version
            """;

    static final String WRITE_VERSION = "MERGE (m:GraphMeta {name: 'codegraph'}) SET m.version = $version";

    static final String DELETE_OUTGOING = "MATCH (n:CodeNode {id: $id})-[r]->() DELETE r";

    static final String DELETE_UNREFERENCED_NODE = "MATCH (n:CodeNode {id: $id}) WHERE NOT (n)<--() DELETE n";

    static final String MARK_CHANGED = "MATCH (n:CodeNode) WHERE n.id IN $ids SET n.changed = true";

    static final String CLEAR_CHANGED = "MATCH (n:CodeNode) WHERE n.id IN $ids SET n.changed = false";

    static final String CLEAR_ALL_CHANGED = "MATCH (n:CodeNode) WHERE n.changed = true SET n.changed = false";

    static final String DELETE_ALL = "MATCH (n) WHERE n:CodeNode OR n:Placeholder DETACH DELETE n";

    static final String DELETE_STRAY_PLACEHOLDERS = "MATCH (p:Placeholder) WHERE NOT (p)--() DELETE p";

    private CypherStatements() {
    }

    static String label(NodeKind kind) {
        return Arrays.stream(kind.name().split("_"))
                .map(part -> part.charAt(0) + part.substring(1).toLowerCase())
                .collect(Collectors.joining());
    }

    static String upsertNode(NodeKind kind) {
        return """
                OPTIONAL MATCH (p:Placeholder {id: $id})
                REMOVE p:Placeholder
                WITH count(p) AS promoted
                MERGE (n:CodeNode {id: $id})
                SET n = $props
                SET n.id = $id, n.kind = $kind, n.moduleId = $moduleId, n.changed = $changed, n:%s
                """.formatted(label(kind));
    }

    /**
     * Turns a deleted node that is still referenced into a placeholder so incoming references
     * stay visible as dangling.
     */
    static String demoteToPlaceholder() {
        String kindLabels = Arrays.stream(NodeKind.values())
                .map(CypherStatements::label)
                .collect(Collectors.joining(":"));
        return "MATCH (n:CodeNode {id: $id}) REMOVE n:CodeNode:" + kindLabels + " SET n = {id: $id}, n:Placeholder";
    }

    static String upsertEdge(EdgeKind kind) {
        return """
                MATCH (a:CodeNode {id: $source})
                MERGE (b {id: $target})
                ON CREATE SET b:Placeholder
                MERGE (a)-[r:%s]->(b)
                SET r = $props
                """.formatted(kind.name());
    }

    static String deleteEdge(EdgeKind kind) {
        return "MATCH (a:CodeNode {id: $source})-[r:%s]->(b {id: $target}) DELETE r".formatted(kind.name());
    }
}
