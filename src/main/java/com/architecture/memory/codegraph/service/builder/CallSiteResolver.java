package com.architecture.memory.codegraph.service.builder;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import com.architecture.memory.codegraph.model.graph.Resolution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the callee of a call site to a Function node.
 *
 * Resolution order:
 * 1. Exact qualified name, through the module's import/alias table or as written
 * 2. Bare name along the lexical scope chain (calling function, enclosing classes and functions,
 *    module, wildcard imports); the innermost scope with a match wins
 * 3. Several matches in the winning scope give {@link Resolution.Ambiguous}; no match gives
 *    {@link Resolution.Unresolved}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CallSiteResolver {

    private final CodeGraphProperties properties;

    public Resolution resolve(GraphState view, GraphNode callSite, ImportTable imports) {
        String callee = callSite.stringProperty(NodeProperties.CALLEE_NAME);
        Optional<GraphNode> caller = view.owner(callSite.getId());
        if (callee == null || callee.isBlank() || caller.isEmpty()) {
            return Resolution.unresolved();
        }

        String name = callee;
        boolean receiverCall = false;
        for (String receiver : properties.getResolution().getReceiverNames()) {
            if (callee.startsWith(receiver + ".")) {
                name = callee.substring(receiver.length() + 1);
                receiverCall = true;
                break;
            }
        }

        if (!receiverCall) {
            Optional<String> exact = resolveQualified(view, imports, callSite.getModuleId(), callee);
            if (exact.isPresent()) {
                return Resolution.resolved(exact.get());
            }
        }
        if (name.contains(".")) {
            // Unknown receiver; only the extractor could say which object it is
            return Resolution.unresolved();
        }

        for (GraphNode scope : scopeChain(view, caller.get())) {
            if (receiverCall && !scope.is(NodeKind.CLASS)) {
                continue;
            }
            List<String> matches = functionsDeclaredIn(view, scope.getId(), name);
            if (matches.isEmpty() && scope.is(NodeKind.CLASS)) {
                matches = inheritedMethods(view, scope.getId(), name);
            }
            if (!matches.isEmpty()) {
                return decide(matches);
            }
        }

        if (!receiverCall) {
            List<String> matches = new ArrayList<>();
            for (String module : imports.getWildcardModules()) {
                view.nodeByQualifiedName(module + "." + name, NodeKind.FUNCTION).ifPresent(f -> matches.add(f.getId()));
            }
            if (!matches.isEmpty()) {
                return decide(matches);
            }
        }
        return Resolution.unresolved();
    }

    // ========== STEP 1: QUALIFIED NAMES ==========

    private Optional<String> resolveQualified(GraphState view, ImportTable imports, String moduleNodeId, String callee) {
        Set<String> candidates = new LinkedHashSet<>();
        imports.expand(callee).ifPresent(candidates::add);
        candidates.add(callee);
        view.node(moduleNodeId)
                .map(GraphNode::getQualifiedName)
                .filter(moduleQn -> callee.contains("."))
                .ifPresent(moduleQn -> candidates.add(moduleQn + "." + callee));

        for (String qualifiedName : candidates) {
            Optional<GraphNode> function = view.nodeByQualifiedName(qualifiedName, NodeKind.FUNCTION);
            if (function.isPresent()) {
                return Optional.of(function.get().getId());
            }
        }
        return Optional.empty();
    }

    // ========== STEP 2: SCOPE CHAIN ==========

    /**
     * The caller followed by its enclosing declarations, innermost first, ending at the module.
     */
    List<GraphNode> scopeChain(GraphState view, GraphNode caller) {
        List<GraphNode> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Optional<GraphNode> current = Optional.of(caller);
        while (current.isPresent() && visited.add(current.get().getId())) {
            GraphNode scope = current.get();
            chain.add(scope);
            if (scope.is(NodeKind.MODULE)) {
                break;
            }
            current = view.owner(scope.getId());
        }
        return chain;
    }

    private List<String> functionsDeclaredIn(GraphState view, String scopeId, String name) {
        return view.targets(scopeId, EdgeKind.DECLARES).stream()
                .filter(n -> n.is(NodeKind.FUNCTION))
                .filter(n -> name.equals(n.getName()))
                .map(GraphNode::getId)
                .sorted()
                .toList();
    }

    /**
     * Methods named {@code name} in the nearest base classes that define one, walking INHERITS breadth first.
     */
    private List<String> inheritedMethods(GraphState view, String classId, String name) {
        Set<String> visited = new HashSet<>();
        visited.add(classId);
        List<String> level = List.of(classId);
        while (!level.isEmpty()) {
            List<String> next = new ArrayList<>();
            for (String id : level) {
                for (GraphNode base : view.targets(id, EdgeKind.INHERITS)) {
                    if (base.is(NodeKind.CLASS) && visited.add(base.getId())) {
                        next.add(base.getId());
                    }
                }
            }
            List<String> matches = new ArrayList<>();
            for (String baseId : next) {
                matches.addAll(functionsDeclaredIn(view, baseId, name));
            }
            if (!matches.isEmpty()) {
                return matches;
            }
            level = next;
        }
        return List.of();
    }

    private static Resolution decide(List<String> matches) {
        List<String> distinct = matches.stream().distinct().sorted().toList();
        return distinct.size() == 1 ? Resolution.resolved(distinct.get(0)) : Resolution.ambiguous(distinct);
    }
}
