package com.architecture.memory.codegraph.service.validation;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.validation.ConservationLaw;
import com.architecture.memory.codegraph.dto.validation.ParameterSpec;
import com.architecture.memory.codegraph.dto.validation.Severity;
import com.architecture.memory.codegraph.dto.validation.Violation;
import com.architecture.memory.codegraph.dto.validation.ViolationType;
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
import java.util.Optional;

/**
 * Resolved call sites must fit the target's parameter list, and private functions may only be
 * called from inside their declaring scope.
 */
@Component
@RequiredArgsConstructor
public class SignatureConservationCheck implements ConservationCheck {

    private final CodeGraphProperties properties;

    @Override
    public ConservationLaw getLaw() {
        return ConservationLaw.SIGNATURE_CONSERVATION;
    }

    @Override
    public void check(ValidationContext context, GraphNode anchor, List<Violation> violations) {
        if (!anchor.is(NodeKind.CALL_SITE)) {
            return;
        }
        GraphState view = context.getView();
        if (!(Resolution.of(anchor, view) instanceof Resolution.Resolved resolved)) {
            return;
        }
        Optional<GraphNode> target = view.node(resolved.getTargetId()).filter(n -> n.is(NodeKind.FUNCTION));
        if (target.isEmpty()) {
            return;
        }
        GraphNode function = target.get();

        List<ParameterSpec> parameters = SignatureRules.callableParameters(view, function,
                SignatureRules.parametersOf(view, function), properties.getResolution().getReceiverNames());
        checkArity(anchor, function, parameters).ifPresent(violations::add);
        checkVisibility(view, anchor, function).ifPresent(violations::add);
    }

    Optional<Violation> checkArity(GraphNode callSite, GraphNode function, List<ParameterSpec> parameters) {
        int argCount = Optional.ofNullable(callSite.intProperty(NodeProperties.ARG_COUNT)).orElse(0);
        List<String> keywords = callSite.listProperty(NodeProperties.KEYWORD_NAMES);

        return SignatureRules.checkCall(parameters, argCount, keywords).map(problem -> {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("expected_args", problem.expectedArgs());
            details.put("actual_args", problem.actualArgs());
            details.put("required_args", problem.requiredArgs());
            details.put("total_args", problem.totalArgs() >= 0 ? problem.totalArgs() : "unbounded");
            details.put("parameters", parameters.stream().map(ParameterSpec::getName).toList());

            String name = function.getQualifiedName();
            return Violation.builder()
                    .law(ConservationLaw.SIGNATURE_CONSERVATION)
                    .type(ViolationType.SIGNATURE_MISMATCH)
                    .severity(Severity.ERROR)
                    .anchorId(callSite.getId())
                    .entityIds(List.of(callSite.getId(), function.getId()))
                    .message(name + " " + problem.reason())
                    .location(callSite.stringProperty(NodeProperties.LOCATION))
                    .suggestedFix("Call " + function.getName() + "(" + String.join(", ",
                            parameters.stream().map(ParameterSpec::getName).toList()) + ") with matching arguments")
                    .details(details)
                    .build();
        });
    }

    Optional<Violation> checkVisibility(GraphState view, GraphNode callSite, GraphNode function) {
        if (!NodeProperties.VISIBILITY_PRIVATE.equals(function.stringProperty(NodeProperties.VISIBILITY))) {
            return Optional.empty();
        }
        Optional<GraphNode> declaringScope = view.owner(function.getId());
        if (declaringScope.isEmpty()) {
            return Optional.empty();
        }
        List<String> callerScopes = new ArrayList<>();
        Optional<GraphNode> current = view.owner(callSite.getId());
        while (current.isPresent() && !callerScopes.contains(current.get().getId())) {
            callerScopes.add(current.get().getId());
            current = view.owner(current.get().getId());
        }
        if (callerScopes.contains(declaringScope.get().getId())) {
            return Optional.empty();
        }
        return Optional.of(Violation.builder()
                .law(ConservationLaw.SIGNATURE_CONSERVATION)
                .type(ViolationType.VISIBILITY_VIOLATION)
                .severity(Severity.ERROR)
                .anchorId(callSite.getId())
                .entityIds(List.of(callSite.getId(), function.getId()))
                .message("Private function " + function.getQualifiedName() + " is called from outside "
                        + declaringScope.get().getQualifiedName())
                .location(callSite.stringProperty(NodeProperties.LOCATION))
                .suggestedFix("Make " + function.getName() + " public or call it from within "
                        + declaringScope.get().getName())
                .details(new LinkedHashMap<>(Map.of("declaring_scope", declaringScope.get().getId())))
                .build());
    }
}
