package com.architecture.memory.codegraph.service.validation;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether an observed type may flow into a declared one.
 *
 * EXACT: the annotation texts must match.
 * LENIENT: built-ins still match exactly, but {@code Any}/{@code object} accept anything,
 * {@code Optional[X]} and unions accept any member or {@code None}, and a user class accepts its
 * subclasses (INHERITS or IS_SUBTYPE_OF).
 */
@Component
public class TypeCompatibilityPolicy {

    public enum Mode {
        EXACT,
        LENIENT
    }

    private final Mode mode;
    private final Set<String> builtinTypes;
    private final Set<String> wildcardTypes;

    @Autowired
    public TypeCompatibilityPolicy(CodeGraphProperties properties) {
        this(Mode.valueOf(properties.getValidation().getTypeCompatibility().trim().toUpperCase()),
                properties.getValidation().getBuiltinTypes(),
                properties.getValidation().getWildcardTypes());
    }

    public TypeCompatibilityPolicy(Mode mode, List<String> builtinTypes, List<String> wildcardTypes) {
        this.mode = mode;
        this.builtinTypes = Set.copyOf(builtinTypes);
        this.wildcardTypes = Set.copyOf(wildcardTypes);
    }

    public Mode getMode() {
        return mode;
    }

    public boolean isCompatible(GraphState view, String declared, String observed) {
        String d = normalize(declared);
        String o = normalize(observed);
        if (d.equals(o)) {
            return true;
        }
        if (mode == Mode.EXACT) {
            return false;
        }
        if (wildcardTypes.contains(d)) {
            return true;
        }
        List<String> members = unionMembers(d);
        if (members.size() > 1) {
            return members.stream().anyMatch(member -> isCompatible(view, member, o));
        }
        if (builtinTypes.contains(d) || builtinTypes.contains(o)) {
            return false;
        }
        return isSubclass(view, o, d);
    }

    private static String normalize(String type) {
        return type == null ? "" : type.replaceAll("\\s+", "");
    }

    /**
     * {@code Optional[X]} is {@code X | None}; {@code Union[A, B]} and {@code A | B} list their members.
     */
    private static List<String> unionMembers(String type) {
        if (type.startsWith("Optional[") && type.endsWith("]")) {
            return List.of(type.substring("Optional[".length(), type.length() - 1), "None");
        }
        if (type.startsWith("Union[") && type.endsWith("]")) {
            return splitTopLevel(type.substring("Union[".length(), type.length() - 1), ',');
        }
        return splitTopLevel(type, '|');
    }

    private static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    private boolean isSubclass(GraphState view, String subName, String superName) {
        List<GraphNode> subs = classesNamed(view, subName);
        List<GraphNode> supers = classesNamed(view, superName);
        if (subs.isEmpty() || supers.isEmpty()) {
            return false;
        }
        Set<String> targets = new HashSet<>();
        supers.forEach(c -> targets.add(c.getId()));

        Deque<String> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        subs.forEach(c -> queue.add(c.getId()));
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!visited.add(id)) {
                continue;
            }
            if (targets.contains(id)) {
                return true;
            }
            view.outgoing(id, EdgeKind.INHERITS, EdgeKind.IS_SUBTYPE_OF)
                    .forEach(edge -> queue.add(edge.getTargetId()));
        }
        return false;
    }

    private static List<GraphNode> classesNamed(GraphState view, String name) {
        List<GraphNode> byQualifiedName = view.nodesByQualifiedName(name).stream()
                .filter(n -> n.is(NodeKind.CLASS) || n.is(NodeKind.TYPE))
                .toList();
        if (!byQualifiedName.isEmpty()) {
            return byQualifiedName;
        }
        return view.nodesOfKind(NodeKind.CLASS).stream()
                .filter(n -> name.equals(n.stringProperty(NodeProperties.NAME)))
                .toList();
    }
}
