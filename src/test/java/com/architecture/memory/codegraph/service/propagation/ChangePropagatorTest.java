package com.architecture.memory.codegraph.service.propagation;

import com.architecture.memory.codegraph.model.graph.GraphMutation;
import com.architecture.memory.codegraph.repository.graph.InMemoryGraphStore;
import com.architecture.memory.codegraph.service.builder.GraphBuilder;
import com.architecture.memory.codegraph.service.builder.GraphFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static com.architecture.memory.codegraph.service.builder.GraphFixtures.call;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.classEntity;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.function;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.imports;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.inherits;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.module;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.payload;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChangePropagatorTest {

    private InMemoryGraphStore store;
    private GraphBuilder graphBuilder;
    private ChangePropagator propagator;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        graphBuilder = GraphFixtures.graphBuilder(store);
        propagator = new ChangePropagator(store);
    }

    /**
     * x.f is called by y.g through an import; y.g is called by z.h.
     */
    private void buildCallChain() {
        graphBuilder.applyExtraction(payload("x",
                List.of(module("x", "x.py"), function("x.f", "x")),
                List.of()));
        graphBuilder.applyExtraction(payload("y",
                List.of(module("y", "y.py"), function("y.g", "y")),
                List.of(imports("y", "x.f"), call("y.g", "f", 0, 3))));
        graphBuilder.applyExtraction(payload("z",
                List.of(module("z", "z.py"), function("z.h", "z")),
                List.of(imports("z", "y.g"), call("z.h", "g", 0, 5))));
        store.commit(state -> GraphMutation.empty().clearAllChanged());
    }

    private void flag(String... ids) {
        store.commit(state -> GraphMutation.empty().markChanged(Set.of(ids)));
    }

    @Test
    void changedFunction_flagsCallersTransitively() {
        buildCallChain();
        flag("function:x.f");

        Set<String> changed = propagator.propagate();

        assertThat(changed).contains(
                "function:x.f",
                "callsite:y.g@3:4", "function:y.g", "module:y",
                "callsite:z.h@5:4", "function:z.h", "module:z");
        assertThat(changed).doesNotContain("module:x");
        assertThat(propagator.changedNodeIds()).isEqualTo(changed);
    }

    @Test
    void propagation_isIdempotent() {
        buildCallChain();
        flag("function:x.f");

        Set<String> first = propagator.propagate();
        long version = store.readView().getVersion();
        Set<String> second = propagator.propagate();

        assertThat(second).isEqualTo(first);
        assertThat(store.readView().getVersion()).isEqualTo(version);
    }

    @Test
    void callCycles_terminate() {
        graphBuilder.applyExtraction(payload("loop",
                List.of(module("loop", "loop.py"), function("loop.ping", "loop"), function("loop.pong", "loop")),
                List.of(call("loop.ping", "pong", 0, 2), call("loop.pong", "ping", 0, 5))));
        store.commit(state -> GraphMutation.empty().clearAllChanged());
        flag("function:loop.ping");

        Set<String> changed = propagator.propagate();

        assertThat(changed).containsExactlyInAnyOrder(
                "function:loop.ping", "function:loop.pong", "callsite:loop.ping@2:4", "callsite:loop.pong@5:4");
    }

    @Test
    void changedBaseClass_flagsSubclasses() {
        graphBuilder.applyExtraction(payload("shapes",
                List.of(module("shapes", "shapes.py"), classEntity("shapes.Shape", "shapes"),
                        classEntity("shapes.Square", "shapes")),
                List.of(inherits("shapes.Square", "Shape"))));
        store.commit(state -> GraphMutation.empty().clearAllChanged());
        flag("class:shapes.Shape");

        assertThat(propagator.propagate()).containsExactlyInAnyOrder("class:shapes.Shape", "class:shapes.Square");
    }

    @Test
    void markChanged_mapsFilePathsToModuleNodes() {
        buildCallChain();

        Set<String> marked = propagator.markChanged(List.of("x.py", "unknown.py"));

        assertThat(marked).containsExactly("function:x.f", "module:x");
        assertThat(propagator.changedNodeIds()).containsExactly("function:x.f", "module:x");
    }

    @Test
    void markChanged_acceptsModuleIdsAndQualifiedNames() {
        buildCallChain();

        assertThat(propagator.markChanged(List.of("module:y", "z"))).contains("module:y", "module:z");
    }

    @Test
    void clearChanged_resetsEveryFlag() {
        buildCallChain();
        propagator.markChanged(List.of("x.py"));
        propagator.propagate();

        propagator.clearChanged();

        assertThat(propagator.changedNodeIds()).isEmpty();
    }

    @Test
    void expand_ignoresUnknownSeedIds() {
        buildCallChain();

        assertThat(propagator.expand(store.readView(), Set.of("function:gone"))).isEmpty();
    }

    @Test
    void interruptedExpansion_isCancelled() {
        buildCallChain();

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> propagator.expand(store.readView(), Set.of("function:x.f")))
                    .isInstanceOf(CancellationException.class);
        } finally {
            Thread.interrupted();
        }
    }
}
