package com.architecture.memory.codegraph.service.validation;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TypeCompatibilityPolicyTest {

    private final CodeGraphProperties properties = new CodeGraphProperties();
    private final TypeCompatibilityPolicy lenient = new TypeCompatibilityPolicy(properties);
    private final TypeCompatibilityPolicy exact = new TypeCompatibilityPolicy(TypeCompatibilityPolicy.Mode.EXACT,
            properties.getValidation().getBuiltinTypes(), properties.getValidation().getWildcardTypes());

    private static GraphNode classNode(String qualifiedName) {
        return GraphNode.of("class:" + qualifiedName, NodeKind.CLASS, "module:shapes", Map.of(
                NodeProperties.NAME, qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1),
                NodeProperties.QUALIFIED_NAME, qualifiedName));
    }

    private static final GraphState SHAPES = GraphState.of(1,
            List.of(classNode("shapes.Shape"), classNode("shapes.Square"), classNode("shapes.Circle")),
            List.of(GraphEdge.of("class:shapes.Square", EdgeKind.INHERITS, "class:shapes.Shape")));

    @Test
    void defaultPolicy_isLenient() {
        assertThat(lenient.getMode()).isEqualTo(TypeCompatibilityPolicy.Mode.LENIENT);
    }

    @Test
    void identicalTypes_matchInBothModes() {
        assertThat(exact.isCompatible(SHAPES, "int", "int")).isTrue();
        assertThat(lenient.isCompatible(SHAPES, "dict[str, int]", "dict[str,int]")).isTrue();
    }

    @Test
    void builtinTypes_neverWiden() {
        assertThat(lenient.isCompatible(SHAPES, "float", "int")).isFalse();
        assertThat(lenient.isCompatible(SHAPES, "str", "bytes")).isFalse();
    }

    @Test
    void wildcards_acceptAnythingOnlyWhenLenient() {
        assertThat(lenient.isCompatible(SHAPES, "Any", "str")).isTrue();
        assertThat(lenient.isCompatible(SHAPES, "object", "shapes.Square")).isTrue();
        assertThat(exact.isCompatible(SHAPES, "Any", "str")).isFalse();
    }

    @Test
    void optionalAndUnions_acceptTheirMembers() {
        assertThat(lenient.isCompatible(SHAPES, "Optional[int]", "None")).isTrue();
        assertThat(lenient.isCompatible(SHAPES, "Optional[int]", "int")).isTrue();
        assertThat(lenient.isCompatible(SHAPES, "Optional[int]", "str")).isFalse();
        assertThat(lenient.isCompatible(SHAPES, "Union[int, str]", "str")).isTrue();
        assertThat(lenient.isCompatible(SHAPES, "int | None", "None")).isTrue();
        assertThat(lenient.isCompatible(SHAPES, "Union[dict[str, int], None]", "dict[str, int]")).isTrue();
    }

    @Test
    void subclass_flowsIntoBaseClass() {
        assertThat(lenient.isCompatible(SHAPES, "Shape", "Square")).isTrue();
        assertThat(lenient.isCompatible(SHAPES, "shapes.Shape", "shapes.Square")).isTrue();
        assertThat(lenient.isCompatible(SHAPES, "Square", "Shape")).isFalse();
        assertThat(lenient.isCompatible(SHAPES, "Shape", "Circle")).isFalse();
        assertThat(exact.isCompatible(SHAPES, "Shape", "Square")).isFalse();
    }
}
