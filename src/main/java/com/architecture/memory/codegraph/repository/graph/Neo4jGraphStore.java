package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.exception.GraphStoreException;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphMutation;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Graph store backed by Neo4j. Each commit reads the graph, plans and writes inside one write
 * transaction, so a failure rolls everything back.
 */
@Repository
@ConditionalOnProperty(prefix = "codegraph.store", name = "type", havingValue = "neo4j")
@RequiredArgsConstructor
@Slf4j
public class Neo4jGraphStore implements GraphStore {

    private final Driver neo4jDriver;
    private final ReentrantLock writeLock = new ReentrantLock();

    @Override
    public GraphState readView() {
        try (Session session = neo4jDriver.session()) {
            return session.executeRead(this::loadState);
        } catch (Neo4jException e) {
            throw new GraphStoreException("Failed to read graph from Neo4j: " + e.getMessage(), e);
        }
    }

    @Override
    public GraphState commit(Function<GraphState, GraphMutation> planner) {
        writeLock.lock();
        try (Session session = neo4jDriver.session()) {
            return session.executeWrite(tx -> {
                GraphState current = loadState(tx);
                GraphMutation mutation = planner.apply(current);
                if (mutation == null || mutation.isEmpty()) {
                    return current;
                }
                GraphState next = current.apply(mutation);
                write(tx, mutation);
                tx.run(CypherStatements.WRITE_VERSION, Map.of("version", next.getVersion()));
                log.debug("[neo4j-store] committed version={} operations={} nodes={} edges={}",
                        next.getVersion(), mutation.size(), next.nodeCount(), next.edgeCount());
                return next;
            });
        } catch (Neo4jException e) {
            throw new GraphStoreException("Neo4j commit failed: " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    // ========================= READ =========================

    private GraphState loadState(TransactionContext tx) {
        long version = tx.run(CypherStatements.READ_VERSION).single().get("version").asLong(0L);

        List<GraphNode> nodes = new ArrayList<>();
        for (Record record : tx.run(CypherStatements.READ_NODES).list()) {
            Map<String, Object> props = new HashMap<>(record.get("props").asMap());
            CypherStatements.RESERVED_KEYS.forEach(props::remove);
            nodes.add(GraphNode.of(
                    record.get("id").asString(),
                    NodeKind.valueOf(record.get("kind").asString()),
                    record.get("moduleId").asString(null),
                    props,
                    record.get("changed").asBoolean(false)));
        }

        List<GraphEdge> edges = new ArrayList<>();
        for (Record record : tx.run(CypherStatements.READ_EDGES).list()) {
            edges.add(GraphEdge.of(
                    record.get("source").asString(),
                    EdgeKind.valueOf(record.get("kind").asString()),
                    record.get("target").asString(),
                    record.get("props").asMap()));
        }
        return GraphState.of(version, nodes, edges);
    }

    // ========================= WRITE =========================

    private void write(TransactionContext tx, GraphMutation mutation) {
        for (GraphMutation.Operation op : mutation.getOperations()) {
            switch (op.getType()) {
                case UPSERT_NODE -> upsertNode(tx, op.getNode());
                case DELETE_NODE -> deleteNode(tx, op.getNodeId());
                case UPSERT_EDGE -> upsertEdge(tx, op.getEdge());
                case DELETE_EDGE -> tx.run(CypherStatements.deleteEdge(op.getEdgeKey().getKind()), Map.of(
                        "source", op.getEdgeKey().getSourceId(),
                        "target", op.getEdgeKey().getTargetId()));
                case MARK_CHANGED -> tx.run(CypherStatements.MARK_CHANGED, Map.of("ids", List.copyOf(op.getNodeIds())));
                case CLEAR_CHANGED -> tx.run(CypherStatements.CLEAR_CHANGED, Map.of("ids", List.copyOf(op.getNodeIds())));
                case CLEAR_ALL_CHANGED -> tx.run(CypherStatements.CLEAR_ALL_CHANGED);
                case REPLACE_ALL -> {
                    tx.run(CypherStatements.DELETE_ALL);
                    op.getNodes().forEach(node -> upsertNode(tx, node));
                    op.getEdges().forEach(edge -> upsertEdge(tx, edge));
                }
                default -> throw new GraphStoreException("Unsupported operation " + op.getType());
            }
        }
        tx.run(CypherStatements.DELETE_STRAY_PLACEHOLDERS);
    }

    private void upsertNode(TransactionContext tx, GraphNode node) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", node.getId());
        params.put("kind", node.getKind().name());
        params.put("moduleId", node.getModuleId());
        params.put("changed", node.isChanged());
        params.put("props", node.getProperties());
        tx.run(CypherStatements.upsertNode(node.getKind()), params);
    }

    private void deleteNode(TransactionContext tx, String id) {
        Map<String, Object> params = Map.of("id", id);
        tx.run(CypherStatements.DELETE_OUTGOING, params);
        tx.run(CypherStatements.DELETE_UNREFERENCED_NODE, params);
        tx.run(CypherStatements.demoteToPlaceholder(), params);
    }

    private void upsertEdge(TransactionContext tx, GraphEdge edge) {
        tx.run(CypherStatements.upsertEdge(edge.getKind()), Map.of(
                "source", edge.getSourceId(),
                "target", edge.getTargetId(),
                "props", edge.getProperties()));
    }
}
