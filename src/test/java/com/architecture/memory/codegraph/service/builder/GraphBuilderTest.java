package com.architecture.memory.codegraph.service.builder;

import com.architecture.memory.codegraph.dto.extraction.BuildResult;
import com.architecture.memory.codegraph.dto.extraction.ExtractionPayload;
import com.architecture.memory.codegraph.dto.extraction.RawRelationship;
import com.architecture.memory.codegraph.exception.MalformedExtractionException;
import com.architecture.memory.codegraph.model.graph.EdgeKey;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import com.architecture.memory.codegraph.model.graph.Resolution;
import com.architecture.memory.codegraph.repository.graph.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.architecture.memory.codegraph.service.builder.GraphFixtures.call;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.classEntity;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.function;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.importsAs;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.module;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.parameter;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.payload;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphBuilderTest {

    private InMemoryGraphStore store;
    private GraphBuilder graphBuilder;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        graphBuilder = GraphFixtures.graphBuilder(store);
    }

    private static ExtractionPayload calcModule() {
        return payload("calc",
                List.of(module("calc", "calc.py"),
                        function("calc.add", "calc"),
                        parameter("calc.add", "a", 0),
                        parameter("calc.add", "b", 1),
                        function("calc.main", "calc")),
                List.of(call("calc.main", "add", 2, 7)));
    }

    @Test
    void buildsModuleSubgraph_withOwnershipEdgesAndResolvedCallSite() {
        BuildResult result = graphBuilder.applyExtraction(calcModule());

        GraphState view = store.readView();
        assertThat(result.getModuleId()).isEqualTo("calc");
        assertThat(result.getNodesAdded()).isEqualTo(6);
        assertThat(view.nodeIds()).contains(
                "module:calc", "function:calc.add", "parameter:calc.add.a", "parameter:calc.add.b",
                "function:calc.main", "callsite:calc.main@7:4");
        assertThat(view.edge(new EdgeKey("function:calc.add", EdgeKind.HAS_PARAMETER, "parameter:calc.add.b")))
                .get().satisfies(edge -> assertThat(edge.intProperty(NodeProperties.POSITION)).isEqualTo(1));

        GraphNode callSite = view.node("callsite:calc.main@7:4").orElseThrow();
        assertThat(Resolution.of(callSite, view)).isEqualTo(Resolution.resolved("function:calc.add"));
        assertThat(view.node("function:calc.add").orElseThrow().listProperty(NodeProperties.PARAMETERS))
                .containsExactly("a", "b");
    }

    @Test
    void reapplyingIdenticalExtraction_commitsNothing() {
        graphBuilder.applyExtraction(calcModule());
        long version = store.readView().getVersion();

        BuildResult second = graphBuilder.applyExtraction(calcModule());

        assertThat(second.isUnchanged()).isTrue();
        assertThat(second.getMutationCount()).isZero();
        assertThat(second.getChangedNodeIds()).isEmpty();
        assertThat(store.readView().getVersion()).isEqualTo(version);
    }

    @Test
    void removingFunctionFromModule_deletesItsParameters() {
        graphBuilder.applyExtraction(calcModule());

        BuildResult result = graphBuilder.applyExtraction(payload("calc",
                List.of(module("calc", "calc.py"), function("calc.main", "calc")),
                List.of()));

        GraphState view = store.readView();
        assertThat(result.getNodesRemoved()).isEqualTo(4);
        assertThat(view.hasNode("function:calc.add")).isFalse();
        assertThat(view.hasNode("parameter:calc.add.a")).isFalse();
        assertThat(view.hasNode("callsite:calc.main@7:4")).isFalse();
        assertThat(view.hasNode("function:calc.main")).isTrue();
    }

    @Test
    void callsOnOneLineWithoutColumns_getDistinctCallSites() {
        RawRelationship first = call("m.f", "g", 0, 3);
        RawRelationship second = call("m.f", "h", 0, 3);
        first.getLocation().setColumn(null);
        second.getLocation().setColumn(null);

        graphBuilder.applyExtraction(payload("m",
                List.of(module("m", "m.py"), function("m.f", "m"), function("m.g", "m"), function("m.h", "m")),
                List.of(first, second)));

        GraphState view = store.readView();
        assertThat(Resolution.of(view.node("callsite:m.f@3#0").orElseThrow(), view))
                .isEqualTo(Resolution.resolved("function:m.g"));
        assertThat(Resolution.of(view.node("callsite:m.f@3#1").orElseThrow(), view))
                .isEqualTo(Resolution.resolved("function:m.h"));
    }

    @Test
    void resolvesCrossModuleCall_onceTargetModuleIsIndexed() {
        graphBuilder.applyExtraction(payload("y",
                List.of(module("y", "y.py"), function("y.g", "y")),
                List.of(importsAs("y", "x.f", "f"), call("y.g", "f", 0, 3))));

        GraphState before = store.readView();
        assertThat(Resolution.of(before.node("callsite:y.g@3:4").orElseThrow(), before))
                .isInstanceOf(Resolution.Unresolved.class);

        BuildResult result = graphBuilder.applyExtraction(payload("x",
                List.of(module("x", "x.py"), function("x.f", "x")),
                List.of()));

        GraphState after = store.readView();
        assertThat(result.getRefreshedModules()).containsExactly("module:y");
        assertThat(Resolution.of(after.node("callsite:y.g@3:4").orElseThrow(), after))
                .isEqualTo(Resolution.resolved("function:x.f"));
        assertThat(after.outgoing("module:y", EdgeKind.IMPORTS))
                .singleElement()
                .satisfies(edge -> assertThat(edge.getTargetId()).isEqualTo("function:x.f"));
    }

    @Test
    void deletingModule_revertsForeignCallSitesToUnresolved() {
        graphBuilder.applyExtraction(payload("x",
                List.of(module("x", "x.py"), function("x.f", "x")), List.of()));
        graphBuilder.applyExtraction(payload("y",
                List.of(module("y", "y.py"), function("y.g", "y")),
                List.of(importsAs("y", "x.f", "f"), call("y.g", "f", 0, 3))));

        BuildResult result = graphBuilder.deleteModule("x");

        GraphState view = store.readView();
        GraphNode callSite = view.node("callsite:y.g@3:4").orElseThrow();
        assertThat(result.getNodesRemoved()).isEqualTo(2);
        assertThat(view.hasNode("function:x.f")).isFalse();
        assertThat(Resolution.of(callSite, view)).isInstanceOf(Resolution.Unresolved.class);
        assertThat(view.outgoing(callSite.getId(), EdgeKind.RESOLVES_TO)).isEmpty();
        assertThat(callSite.isChanged()).isTrue();
    }

    @Test
    void rejectsMalformedExtraction_withoutTouchingTheGraph() {
        graphBuilder.applyExtraction(calcModule());
        long version = store.readView().getVersion();

        ExtractionPayload broken = payload("calc",
                List.of(module("calc", "calc.py"),
                        function("calc.add", "calc"),
                        parameter("calc.add", "a", 0),
                        parameter("calc.add", "c", 2)),
                List.of());

        assertThatThrownBy(() -> graphBuilder.applyExtraction(broken))
                .isInstanceOf(MalformedExtractionException.class)
                .satisfies(e -> assertThat(((MalformedExtractionException) e).getProblems())
                        .anyMatch(problem -> problem.contains("position gap")));
        assertThat(store.readView().getVersion()).isEqualTo(version);
        assertThat(store.readView().hasNode("parameter:calc.add.b")).isTrue();
    }

    @Test
    void rejectsNodeAlreadyOwnedByAnotherModule() {
        graphBuilder.applyExtraction(payload("a",
                List.of(module("a", "a/__init__.py"), classEntity("a.b", "a"), function("a.b.f", "a.b")),
                List.of()));

        ExtractionPayload clashing = payload("a.b",
                List.of(module("a.b", "a/b.py"), function("a.b.f", "a.b")),
                List.of());

        assertThatThrownBy(() -> graphBuilder.applyExtraction(clashing))
                .isInstanceOf(MalformedExtractionException.class)
                .hasMessageContaining("function:a.b.f is already owned by module:a");
        assertThat(store.readView().hasNode("module:a.b")).isFalse();
    }
}
