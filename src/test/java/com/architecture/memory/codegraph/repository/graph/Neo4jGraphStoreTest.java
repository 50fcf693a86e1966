package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.model.graph.GraphMutation;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionCallback;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.Values;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class Neo4jGraphStoreTest {

    @Mock
    private Driver neo4jDriver;

    @Mock
    private Session session;

    @Mock
    private TransactionContext tx;

    @InjectMocks
    private Neo4jGraphStore neo4jGraphStore;

    @BeforeEach
    void setUp() {
        when(neo4jDriver.session()).thenReturn(session);

        Record versionRecord = mock(Record.class);
        when(versionRecord.get("version")).thenReturn(Values.value(4L));
        Result versionResult = mock(Result.class);
        when(versionResult.single()).thenReturn(versionRecord);
        when(tx.run(CypherStatements.READ_VERSION)).thenReturn(versionResult);

        Result empty = mock(Result.class);
        when(empty.list()).thenReturn(List.of());
        when(tx.run(CypherStatements.READ_NODES)).thenReturn(empty);
        when(tx.run(CypherStatements.READ_EDGES)).thenReturn(empty);
    }

    @Test
    void readView_carriesStoredVersion() {
        when(session.executeRead(any())).thenAnswer(inv -> inv.<TransactionCallback<GraphState>>getArgument(0).execute(tx));

        GraphState view = neo4jGraphStore.readView();

        assertThat(view.getVersion()).isEqualTo(4L);
        assertThat(view.nodeCount()).isZero();
    }

    @Test
    void commit_writesIncrementedVersion() {
        when(session.executeWrite(any())).thenAnswer(inv -> inv.<TransactionCallback<GraphState>>getArgument(0).execute(tx));

        GraphState next = neo4jGraphStore.commit(state -> GraphMutation.empty()
                .createOrUpdateNode(NodeKind.MODULE, "module:app", "module:app", Map.of()));

        assertThat(next.getVersion()).isEqualTo(5L);
        assertThat(next.hasNode("module:app")).isTrue();
        verify(tx).run(CypherStatements.WRITE_VERSION, Map.<String, Object>of("version", 5L));
    }

    @Test
    void emptyCommit_leavesVersionUntouched() {
        when(session.executeWrite(any())).thenAnswer(inv -> inv.<TransactionCallback<GraphState>>getArgument(0).execute(tx));

        GraphState same = neo4jGraphStore.commit(state -> GraphMutation.empty());

        assertThat(same.getVersion()).isEqualTo(4L);
        verify(tx, never()).run(eq(CypherStatements.WRITE_VERSION), anyMap());
    }
}
