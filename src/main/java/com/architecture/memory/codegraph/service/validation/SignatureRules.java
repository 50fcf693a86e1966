package com.architecture.memory.codegraph.service.validation;

import com.architecture.memory.codegraph.dto.validation.ParameterSpec;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import com.architecture.memory.codegraph.model.graph.ParameterKind;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Argument binding rules shared by the signature check and proposed-change impact analysis.
 */
public final class SignatureRules {

    static final String STATIC_METHOD_DECORATOR = "staticmethod";

    /**
     * Why a call does not fit a parameter list. {@code totalArgs} is -1 when a variadic parameter
     * lifts the upper bound.
     */
    record SignatureProblem(String reason, int expectedArgs, int actualArgs, int requiredArgs, int totalArgs) {
    }

    private SignatureRules() {
    }

    public static List<ParameterSpec> parametersOf(GraphState view, GraphNode function) {
        return view.targets(function.getId(), EdgeKind.HAS_PARAMETER).stream()
                .filter(p -> p.is(NodeKind.PARAMETER))
                .sorted(Comparator.comparing(p -> p.intProperty(NodeProperties.POSITION),
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .map(SignatureRules::toSpec)
                .toList();
    }

    private static ParameterSpec toSpec(GraphNode parameter) {
        String kind = parameter.stringProperty(NodeProperties.PARAMETER_KIND);
        return ParameterSpec.builder()
                .name(parameter.getName())
                .kind(kind != null ? ParameterKind.valueOf(kind) : ParameterKind.POSITIONAL)
                .hasDefault(parameter.booleanProperty(NodeProperties.HAS_DEFAULT))
                .typeAnnotation(parameter.stringProperty(NodeProperties.TYPE_ANNOTATION))
                .build();
    }

    /**
     * Drops the implicit receiver ({@code self}, {@code cls}) of a method, since call sites never pass it.
     */
    static List<ParameterSpec> callableParameters(GraphState view, GraphNode function, List<ParameterSpec> parameters,
                                                  Collection<String> receiverNames) {
        if (parameters.isEmpty() || !receiverNames.contains(parameters.get(0).getName())) {
            return parameters;
        }
        boolean method = view.owner(function.getId()).map(owner -> owner.is(NodeKind.CLASS)).orElse(false);
        boolean staticMethod = function.listProperty(NodeProperties.DECORATORS).contains(STATIC_METHOD_DECORATOR);
        return method && !staticMethod ? parameters.subList(1, parameters.size()) : parameters;
    }

    static Optional<SignatureProblem> checkCall(List<ParameterSpec> parameters, int argCount, List<String> keywordNames) {
        List<ParameterSpec> fixed = parameters.stream().filter(p -> !p.getKind().isVariadic()).toList();
        List<ParameterSpec> positional = fixed.stream().filter(p -> p.getKind() == ParameterKind.POSITIONAL).toList();
        boolean varPositional = parameters.stream().anyMatch(p -> p.getKind() == ParameterKind.VAR_POSITIONAL);
        boolean varKeyword = parameters.stream().anyMatch(p -> p.getKind() == ParameterKind.VAR_KEYWORD);

        int total = fixed.size();
        int required = (int) fixed.stream().filter(p -> !p.isHasDefault()).count();
        boolean unbounded = varPositional || varKeyword;
        int totalArgs = unbounded ? -1 : total;
        int positionalArgs = Math.max(0, argCount - keywordNames.size());

        if (argCount < required) {
            return Optional.of(new SignatureProblem(
                    "expects at least " + required + " argument(s) but the call passes " + argCount,
                    required, argCount, required, totalArgs));
        }
        if (!unbounded && argCount > total) {
            return Optional.of(new SignatureProblem(
                    "expects " + (required == total ? "" : "at most ") + total + " argument(s) but the call passes " + argCount,
                    total, argCount, required, totalArgs));
        }
        if (!varPositional && positionalArgs > positional.size()) {
            return Optional.of(new SignatureProblem(
                    "takes " + positional.size() + " positional argument(s) but the call passes " + positionalArgs,
                    positional.size(), positionalArgs, required, totalArgs));
        }

        Set<String> names = new HashSet<>();
        fixed.forEach(p -> names.add(p.getName()));
        for (String keyword : keywordNames) {
            if (!names.contains(keyword) && !varKeyword) {
                return Optional.of(new SignatureProblem(
                        "has no parameter named '" + keyword + "'", total, argCount, required, totalArgs));
            }
        }

        for (ParameterSpec p : fixed) {
            boolean boundPositionally = p.getKind() == ParameterKind.POSITIONAL && positional.indexOf(p) < positionalArgs;
            if (!p.isHasDefault() && !boundPositionally && !keywordNames.contains(p.getName())) {
                return Optional.of(new SignatureProblem(
                        "is missing required argument '" + p.getName() + "'", required, argCount, required, totalArgs));
            }
        }
        return Optional.empty();
    }
}
