package com.architecture.memory.codegraph.service.validation;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.validation.ConservationLaw;
import com.architecture.memory.codegraph.dto.validation.Severity;
import com.architecture.memory.codegraph.dto.validation.Violation;
import com.architecture.memory.codegraph.dto.validation.ViolationType;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import com.architecture.memory.codegraph.model.graph.Resolution;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every symbolic reference lands on an existing node and every call site resolves to exactly one function.
 */
@Component
@RequiredArgsConstructor
public class ReferenceIntegrityCheck implements ConservationCheck {

    private final CodeGraphProperties properties;

    @Override
    public ConservationLaw getLaw() {
        return ConservationLaw.REFERENCE_INTEGRITY;
    }

    @Override
    public void check(ValidationContext context, GraphNode anchor, List<Violation> violations) {
        GraphState view = context.getView();
        for (GraphEdge edge : view.outgoing(anchor.getId())) {
            boolean checked = EdgeKind.SYMBOLIC.contains(edge.getKind()) || edge.getKind() == EdgeKind.RESOLVES_TO;
            if (checked && !view.hasNode(edge.getTargetId())) {
                violations.add(dangling(anchor, edge));
            }
        }
        if (anchor.is(NodeKind.CALL_SITE)) {
            checkResolution(view, anchor, violations);
        }
    }

    private Violation dangling(GraphNode anchor, GraphEdge edge) {
        String name = edge.stringProperty(NodeProperties.TARGET_QUALIFIED_NAME);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("edge_kind", edge.getKind().name());
        details.put("target_id", edge.getTargetId());
        if (name != null) {
            details.put("target_name", name);
        }
        return Violation.builder()
                .law(ConservationLaw.REFERENCE_INTEGRITY)
                .type(ViolationType.DANGLING_REFERENCE)
                .severity(Severity.ERROR)
                .anchorId(anchor.getId())
                .entityIds(List.of(anchor.getId(), edge.getTargetId()))
                .message(displayName(anchor) + " " + edge.getKind() + " " + (name != null ? name : edge.getTargetId())
                        + ", which does not exist")
                .location(edge.stringProperty(NodeProperties.LOCATION) != null
                        ? edge.stringProperty(NodeProperties.LOCATION)
                        : anchor.stringProperty(NodeProperties.LOCATION))
                .suggestedFix("Define " + (name != null ? name : edge.getTargetId()) + " or remove the reference")
                .details(details)
                .build();
    }

    private void checkResolution(GraphState view, GraphNode callSite, List<Violation> violations) {
        Resolution resolution = Resolution.of(callSite, view);
        String callee = callSite.stringProperty(NodeProperties.CALLEE_NAME);
        String caller = view.owner(callSite.getId()).map(GraphNode::getId).orElse(null);
        List<String> entityIds = new ArrayList<>();
        entityIds.add(callSite.getId());
        if (caller != null) {
            entityIds.add(caller);
        }

        if (resolution instanceof Resolution.Unresolved) {
            violations.add(Violation.builder()
                    .law(ConservationLaw.REFERENCE_INTEGRITY)
                    .type(ViolationType.UNRESOLVED_REFERENCE)
                    .severity(Severity.parse(properties.getValidation().getUnresolvedSeverity(), Severity.WARNING))
                    .anchorId(callSite.getId())
                    .entityIds(entityIds)
                    .message("Call to " + callee + " does not resolve to any known function")
                    .location(callSite.stringProperty(NodeProperties.LOCATION))
                    .suggestedFix("Import or define " + callee)
                    .details(new LinkedHashMap<>(Map.of("callee", String.valueOf(callee))))
                    .build());
        } else if (resolution instanceof Resolution.Ambiguous ambiguous) {
            entityIds.addAll(ambiguous.getCandidateIds());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("callee", String.valueOf(callee));
            details.put("candidates", ambiguous.getCandidateIds());
            violations.add(Violation.builder()
                    .law(ConservationLaw.REFERENCE_INTEGRITY)
                    .type(ViolationType.AMBIGUOUS_REFERENCE)
                    .severity(Severity.ERROR)
                    .anchorId(callSite.getId())
                    .entityIds(entityIds)
                    .message("Call to " + callee + " matches " + ambiguous.getCandidateIds().size()
                            + " functions: " + String.join(", ", ambiguous.getCandidateIds()))
                    .location(callSite.stringProperty(NodeProperties.LOCATION))
                    .suggestedFix("Qualify the call so that it names one function")
                    .details(details)
                    .build());
        }
    }

    static String displayName(GraphNode node) {
        return node.getQualifiedName() != null ? node.getQualifiedName() : node.getId();
    }
}
