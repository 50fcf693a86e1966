package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.exception.GraphStoreException;
import com.architecture.memory.codegraph.model.graph.GraphMutation;
import com.architecture.memory.codegraph.model.graph.GraphState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Copy-on-write graph store. Commits build a new {@link GraphState} and swap it in under a lock;
 * readers simply take the current reference and are never blocked.
 */
@Repository
@ConditionalOnProperty(prefix = "codegraph.store", name = "type", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryGraphStore implements GraphStore {

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile GraphState state = GraphState.empty();

    @Override
    public GraphState readView() {
        return state;
    }

    @Override
    public GraphState commit(Function<GraphState, GraphMutation> planner) {
        writeLock.lock();
        try {
            GraphState current = state;
            GraphMutation mutation = planner.apply(current);
            if (mutation == null || mutation.isEmpty()) {
                return current;
            }
            GraphState next;
            try {
                next = current.apply(mutation);
            } catch (GraphStoreException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new GraphStoreException("Failed to apply mutation: " + e.getMessage(), e);
            }
            state = next;
            log.debug("[graph-store] committed version={} operations={} nodes={} edges={}",
                    next.getVersion(), mutation.size(), next.nodeCount(), next.edgeCount());
            return next;
        } finally {
            writeLock.unlock();
        }
    }
}
