package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CypherStatementsTest {

    @Test
    void labels_areCamelCasedKindNames() {
        assertThat(CypherStatements.label(NodeKind.FUNCTION)).isEqualTo("Function");
        assertThat(CypherStatements.label(NodeKind.CALL_SITE)).isEqualTo("CallSite");
    }

    @Test
    void upsertNode_promotesPlaceholderAndSetsKindLabel() {
        String cypher = CypherStatements.upsertNode(NodeKind.CALL_SITE);

        assertThat(cypher)
                .contains("REMOVE p:Placeholder")
                .contains("MERGE (n:CodeNode {id: $id})")
                .contains("n:CallSite");
    }

    @Test
    void upsertEdge_createsPlaceholderForMissingTarget() {
        String cypher = CypherStatements.upsertEdge(EdgeKind.RESOLVES_TO);

        assertThat(cypher)
                .contains("ON CREATE SET b:Placeholder")
                .contains("MERGE (a)-[r:RESOLVES_TO]->(b)");
    }

    @Test
    void demoteToPlaceholder_removesEveryKindLabel() {
        String cypher = CypherStatements.demoteToPlaceholder();

        for (NodeKind kind : NodeKind.values()) {
            assertThat(cypher).contains(CypherStatements.label(kind));
        }
        assertThat(cypher).endsWith("n:Placeholder");
    }

    @Test
    void reservedKeys_coverNodeBookkeeping() {
        assertThat(CypherStatements.RESERVED_KEYS).containsExactlyInAnyOrder("id", "kind", "moduleId", "changed");
    }
}
