package com.architecture.memory.codegraph.service.validation;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.validation.ConservationLaw;
import com.architecture.memory.codegraph.dto.validation.ParameterSpec;
import com.architecture.memory.codegraph.dto.validation.Severity;
import com.architecture.memory.codegraph.dto.validation.Violation;
import com.architecture.memory.codegraph.dto.validation.ViolationType;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import com.architecture.memory.codegraph.model.graph.ParameterKind;
import com.architecture.memory.codegraph.model.graph.Resolution;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared and observed types must agree along REFERENCES/ASSIGNS_TO edges and at resolved call
 * sites. Unannotated ends are skipped. Public functions should annotate parameters and return type.
 */
@Component
@RequiredArgsConstructor
public class DataFlowConsistencyCheck implements ConservationCheck {

    private static final String UNKNOWN_TYPE = "?";

    private final CodeGraphProperties properties;
    private final TypeCompatibilityPolicy typeCompatibilityPolicy;

    @Override
    public ConservationLaw getLaw() {
        return ConservationLaw.DATA_FLOW_CONSISTENCY;
    }

    @Override
    public void check(ValidationContext context, GraphNode anchor, List<Violation> violations) {
        GraphState view = context.getView();
        checkDataFlowEdges(view, anchor, violations);
        if (anchor.is(NodeKind.CALL_SITE)) {
            checkArgumentTypes(view, anchor, violations);
        }
        if (anchor.is(NodeKind.FUNCTION)) {
            checkAnnotations(view, anchor, violations);
        }
    }

    // ========== REFERENCES / ASSIGNS_TO ==========

    private void checkDataFlowEdges(GraphState view, GraphNode anchor, List<Violation> violations) {
        for (GraphEdge edge : view.outgoing(anchor.getId(), EdgeKind.REFERENCES, EdgeKind.ASSIGNS_TO)) {
            String observed = edge.stringProperty(NodeProperties.OBSERVED_TYPE);
            Optional<GraphNode> target = view.node(edge.getTargetId());
            if (isUnknown(observed) || target.isEmpty()) {
                continue;
            }
            String declared = declaredType(view, target.get());
            if (isUnknown(declared) || typeCompatibilityPolicy.isCompatible(view, declared, observed)) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("declared_type", declared);
            details.put("observed_type", observed);
            details.put("edge_kind", edge.getKind().name());
            violations.add(Violation.builder()
                    .law(ConservationLaw.DATA_FLOW_CONSISTENCY)
                    .type(ViolationType.TYPE_MISMATCH)
                    .severity(Severity.ERROR)
                    .anchorId(anchor.getId())
                    .entityIds(List.of(anchor.getId(), target.get().getId()))
                    .message(ReferenceIntegrityCheck.displayName(target.get()) + " is declared as " + declared
                            + " but receives " + observed)
                    .location(edge.stringProperty(NodeProperties.LOCATION) != null
                            ? edge.stringProperty(NodeProperties.LOCATION)
                            : anchor.stringProperty(NodeProperties.LOCATION))
                    .suggestedFix("Pass a " + declared + " or change the annotation")
                    .details(details)
                    .build());
        }
    }

    /**
     * Annotation text of a variable or parameter, falling back to its HAS_TYPE edge.
     */
    private static String declaredType(GraphState view, GraphNode node) {
        if (!node.is(NodeKind.VARIABLE) && !node.is(NodeKind.PARAMETER)) {
            return null;
        }
        String annotation = node.stringProperty(NodeProperties.TYPE_ANNOTATION);
        if (annotation != null) {
            return annotation;
        }
        return view.targets(node.getId(), EdgeKind.HAS_TYPE).stream()
                .map(GraphNode::getName)
                .findFirst()
                .orElse(null);
    }

    // ========== CALL ARGUMENTS ==========

    private void checkArgumentTypes(GraphState view, GraphNode callSite, List<Violation> violations) {
        if (!(Resolution.of(callSite, view) instanceof Resolution.Resolved resolved)) {
            return;
        }
        Optional<GraphNode> function = view.node(resolved.getTargetId()).filter(n -> n.is(NodeKind.FUNCTION));
        if (function.isEmpty()) {
            return;
        }
        List<ParameterSpec> parameters = SignatureRules.callableParameters(view, function.get(),
                SignatureRules.parametersOf(view, function.get()), properties.getResolution().getReceiverNames());
        List<ParameterSpec> positional = parameters.stream().filter(p -> p.getKind() == ParameterKind.POSITIONAL).toList();
        List<String> argTypes = callSite.listProperty(NodeProperties.ARG_TYPES);

        for (int i = 0; i < Math.min(argTypes.size(), positional.size()); i++) {
            ParameterSpec parameter = positional.get(i);
            String observed = argTypes.get(i);
            String declared = parameter.getTypeAnnotation();
            if (isUnknown(observed) || isUnknown(declared) || typeCompatibilityPolicy.isCompatible(view, declared, observed)) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("parameter", parameter.getName());
            details.put("position", i);
            details.put("declared_type", declared);
            details.put("observed_type", observed);
            violations.add(Violation.builder()
                    .law(ConservationLaw.DATA_FLOW_CONSISTENCY)
                    .type(ViolationType.TYPE_MISMATCH)
                    .severity(Severity.ERROR)
                    .anchorId(callSite.getId())
                    .entityIds(List.of(callSite.getId(), function.get().getId()))
                    .message("Argument " + i + " of call to " + function.get().getQualifiedName() + " is " + observed
                            + " but parameter '" + parameter.getName() + "' expects " + declared)
                    .location(callSite.stringProperty(NodeProperties.LOCATION))
                    .suggestedFix("Pass a " + declared + " for '" + parameter.getName() + "'")
                    .details(details)
                    .build());
        }
    }

    // ========== ANNOTATIONS ==========

    private void checkAnnotations(GraphState view, GraphNode function, List<Violation> violations) {
        if (!NodeProperties.VISIBILITY_PUBLIC.equals(function.stringProperty(NodeProperties.VISIBILITY))) {
            return;
        }
        List<String> exempt = properties.getValidation().getAnnotationExemptParameters();
        List<String> entityIds = new ArrayList<>();
        List<String> missingParameters = new ArrayList<>();
        entityIds.add(function.getId());
        for (GraphNode parameter : view.targets(function.getId(), EdgeKind.HAS_PARAMETER)) {
            if (parameter.stringProperty(NodeProperties.TYPE_ANNOTATION) == null && !exempt.contains(parameter.getName())) {
                missingParameters.add(parameter.getName());
                entityIds.add(parameter.getId());
            }
        }
        boolean missingReturn = function.stringProperty(NodeProperties.RETURN_TYPE) == null;
        if (missingParameters.isEmpty() && !missingReturn) {
            return;
        }
        missingParameters.sort(null);

        List<String> parts = new ArrayList<>();
        if (!missingParameters.isEmpty()) {
            parts.add("parameter(s) " + String.join(", ", missingParameters));
        }
        if (missingReturn) {
            parts.add("return type");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("missing_parameters", missingParameters);
        details.put("missing_return", missingReturn);
        violations.add(Violation.builder()
                .law(ConservationLaw.DATA_FLOW_CONSISTENCY)
                .type(ViolationType.MISSING_ANNOTATION)
                .severity(Severity.WARNING)
                .anchorId(function.getId())
                .entityIds(entityIds.stream().sorted().toList())
                .message("Public function " + function.getQualifiedName() + " has no annotation for "
                        + String.join(" and ", parts))
                .location(function.stringProperty(NodeProperties.LOCATION))
                .suggestedFix("Add type annotations to " + function.getName())
                .details(details)
                .build());
    }

    private static boolean isUnknown(String type) {
        return type == null || type.isBlank() || UNKNOWN_TYPE.equals(type);
    }
}
