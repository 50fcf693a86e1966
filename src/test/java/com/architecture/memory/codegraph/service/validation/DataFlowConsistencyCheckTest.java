package com.architecture.memory.codegraph.service.validation;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.validation.ConservationLaw;
import com.architecture.memory.codegraph.dto.validation.Severity;
import com.architecture.memory.codegraph.dto.validation.Violation;
import com.architecture.memory.codegraph.dto.validation.ViolationType;
import com.architecture.memory.codegraph.repository.graph.InMemoryGraphStore;
import com.architecture.memory.codegraph.service.builder.GraphBuilder;
import com.architecture.memory.codegraph.service.builder.GraphFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.architecture.memory.codegraph.service.builder.GraphFixtures.assigns;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.callWithTypes;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.function;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.module;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.parameter;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.payload;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.privateFunction;
import static com.architecture.memory.codegraph.service.builder.GraphFixtures.variable;
import static org.assertj.core.api.Assertions.assertThat;

class DataFlowConsistencyCheckTest {

    private CodeGraphProperties properties;
    private InMemoryGraphStore store;
    private GraphBuilder graphBuilder;

    @BeforeEach
    void setUp() {
        properties = new CodeGraphProperties();
        store = new InMemoryGraphStore();
        graphBuilder = GraphFixtures.graphBuilder(store, properties);
    }

    private List<Violation> dataFlowViolations() {
        return ValidatorFixtures.validator(store, properties).validateFull()
                .violationsOfLaw(ConservationLaw.DATA_FLOW_CONSISTENCY);
    }

    @Test
    void argumentOfWrongBuiltinType_isTypeMismatch() {
        graphBuilder.applyExtraction(payload("geo",
                List.of(module("geo", "geo.py"),
                        function("geo.area", "geo", "float"),
                        parameter("geo.area", "r", 0, "float"),
                        function("geo.main", "geo", "None")),
                List.of(callWithTypes("geo.main", "area", 8, "str"))));

        List<Violation> violations = dataFlowViolations();

        assertThat(violations).hasSize(1);
        Violation violation = violations.get(0);
        assertThat(violation.getType()).isEqualTo(ViolationType.TYPE_MISMATCH);
        assertThat(violation.getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(violation.getAnchorId()).isEqualTo("callsite:geo.main@8:4");
        assertThat(violation.getDetails())
                .containsEntry("parameter", "r")
                .containsEntry("position", 0)
                .containsEntry("declared_type", "float")
                .containsEntry("observed_type", "str");
    }

    @Test
    void optionalParameter_acceptsNoneAndMemberTypeWhenLenient() {
        graphBuilder.applyExtraction(payload("geo",
                List.of(module("geo", "geo.py"),
                        function("geo.scale", "geo", "float"),
                        parameter("geo.scale", "factor", 0, "Optional[int]"),
                        function("geo.main", "geo", "None")),
                List.of(callWithTypes("geo.main", "scale", 8, "None"),
                        callWithTypes("geo.main", "scale", 9, "int"))));

        assertThat(dataFlowViolations()).isEmpty();
    }

    @Test
    void optionalParameter_rejectsMemberTypeWhenExact() {
        properties.getValidation().setTypeCompatibility("exact");
        graphBuilder.applyExtraction(payload("geo",
                List.of(module("geo", "geo.py"),
                        function("geo.scale", "geo", "float"),
                        parameter("geo.scale", "factor", 0, "Optional[int]"),
                        function("geo.main", "geo", "None")),
                List.of(callWithTypes("geo.main", "scale", 9, "int"))));

        assertThat(dataFlowViolations()).extracting(Violation::getType)
                .containsExactly(ViolationType.TYPE_MISMATCH);
    }

    @Test
    void unknownArgumentTypes_areSkipped() {
        graphBuilder.applyExtraction(payload("geo",
                List.of(module("geo", "geo.py"),
                        function("geo.area", "geo", "float"),
                        parameter("geo.area", "r", 0, "float"),
                        function("geo.main", "geo", "None")),
                List.of(callWithTypes("geo.main", "area", 8, "?"))));

        assertThat(dataFlowViolations()).isEmpty();
    }

    @Test
    void assignmentOfWrongType_toAnnotatedVariable_isTypeMismatch() {
        graphBuilder.applyExtraction(payload("app",
                List.of(module("app", "app.py"),
                        variable("app.total", "app", "int"),
                        function("app.main", "app", "None")),
                List.of(assigns("app.main", "total", "str"))));

        List<Violation> violations = dataFlowViolations();

        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).getAnchorId()).isEqualTo("function:app.main");
        assertThat(violations.get(0).getEntityIds()).containsExactly("function:app.main", "variable:app.total");
        assertThat(violations.get(0).getDetails()).containsEntry("edge_kind", "ASSIGNS_TO");
    }

    @Test
    void assignmentToUnannotatedVariable_isNotChecked() {
        graphBuilder.applyExtraction(payload("app",
                List.of(module("app", "app.py"),
                        variable("app.total", "app", null),
                        function("app.main", "app", "None")),
                List.of(assigns("app.main", "total", "str"))));

        assertThat(dataFlowViolations()).isEmpty();
    }

    @Test
    void publicFunctionWithoutAnnotations_isWarned() {
        graphBuilder.applyExtraction(payload("app",
                List.of(module("app", "app.py"),
                        function("app.f", "app"),
                        parameter("app.f", "x", 0)),
                List.of()));

        List<Violation> violations = dataFlowViolations();

        assertThat(violations).hasSize(1);
        Violation violation = violations.get(0);
        assertThat(violation.getType()).isEqualTo(ViolationType.MISSING_ANNOTATION);
        assertThat(violation.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(violation.getDetails())
                .containsEntry("missing_parameters", List.of("x"))
                .containsEntry("missing_return", true);
    }

    @Test
    void privateFunctionsAndReceiverParameters_needNoAnnotations() {
        graphBuilder.applyExtraction(payload("app",
                List.of(module("app", "app.py"),
                        GraphFixtures.classEntity("app.Box", "app"),
                        function("app.Box.size", "app.Box", "int"),
                        parameter("app.Box.size", "self", 0),
                        privateFunction("app._helper", "app"),
                        parameter("app._helper", "x", 0)),
                List.of()));

        assertThat(dataFlowViolations()).isEmpty();
    }
}
