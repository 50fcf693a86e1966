package com.architecture.memory.codegraph.service.validation;

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
import com.architecture.memory.codegraph.service.graph.CycleFinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Shape rules of the graph itself:
 * <ul>
 *   <li>parameter positions of a function run 0..n-1 without gaps or duplicates</li>
 *   <li>a parameter belongs to exactly one function</li>
 *   <li>INHERITS between classes is acyclic</li>
 *   <li>every non-module node is reachable from a module over ownership edges</li>
 * </ul>
 */
@Slf4j
@Component
public class StructuralIntegrityCheck implements ConservationCheck {

    private static final String INHERITANCE_CYCLES = "structural.inheritanceCycles";
    private static final String OWNED_NODES = "structural.ownedNodes";

    @Override
    public ConservationLaw getLaw() {
        return ConservationLaw.STRUCTURAL_INTEGRITY;
    }

    @Override
    public void check(ValidationContext context, GraphNode anchor, List<Violation> violations) {
        GraphState view = context.getView();
        switch (anchor.getKind()) {
            case FUNCTION -> checkParameterPositions(view, anchor, violations);
            case PARAMETER -> checkParameterOwnership(view, anchor, violations);
            case CLASS -> checkInheritanceCycles(context, anchor, violations);
            default -> {
            }
        }
        if (!anchor.is(NodeKind.MODULE)) {
            Set<String> owned = context.memo(OWNED_NODES, () -> ownedNodes(view));
            if (!owned.contains(anchor.getId())) {
                violations.add(orphan(anchor));
            }
        }
    }

    // ========== PARAMETERS ==========

    private void checkParameterPositions(GraphState view, GraphNode function, List<Violation> violations) {
        List<Integer> positions = new ArrayList<>();
        for (GraphEdge edge : view.outgoing(function.getId(), EdgeKind.HAS_PARAMETER)) {
            Integer position = view.node(edge.getTargetId())
                    .map(p -> p.intProperty(NodeProperties.POSITION))
                    .orElse(edge.intProperty(NodeProperties.POSITION));
            positions.add(position);
        }
        if (positions.isEmpty()) {
            return;
        }
        List<Integer> missing = new ArrayList<>();
        Set<Integer> seen = new TreeSet<>();
        List<Integer> duplicates = new ArrayList<>();
        boolean unpositioned = false;
        for (Integer position : positions) {
            if (position == null) {
                unpositioned = true;
            } else if (!seen.add(position)) {
                duplicates.add(position);
            }
        }
        for (int i = 0; i < positions.size(); i++) {
            if (!seen.contains(i)) {
                missing.add(i);
            }
        }
        if (missing.isEmpty() && duplicates.isEmpty() && !unpositioned) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("positions", new ArrayList<>(seen));
        details.put("missing_positions", missing);
        details.put("duplicate_positions", duplicates);
        violations.add(Violation.builder()
                .law(ConservationLaw.STRUCTURAL_INTEGRITY)
                .type(ViolationType.PARAMETER_POSITION_GAP)
                .severity(Severity.ERROR)
                .anchorId(function.getId())
                .entityIds(List.of(function.getId()))
                .message("Parameters of " + function.getQualifiedName() + " are not numbered 0.." + (positions.size() - 1)
                        + ", positions present: " + seen)
                .location(function.stringProperty(NodeProperties.LOCATION))
                .suggestedFix("Re-extract " + function.getName() + " so that parameter positions are contiguous")
                .details(details)
                .build());
    }

    private void checkParameterOwnership(GraphState view, GraphNode parameter, List<Violation> violations) {
        List<String> owners = new ArrayList<>();
        boolean ownerIsFunction = true;
        for (GraphEdge edge : view.incoming(parameter.getId(), EdgeKind.HAS_PARAMETER)) {
            owners.add(edge.getSourceId());
            ownerIsFunction &= view.node(edge.getSourceId()).map(n -> n.is(NodeKind.FUNCTION)).orElse(false);
        }
        if (owners.size() == 1 && ownerIsFunction) {
            return;
        }
        Collections.sort(owners);
        String problem = owners.isEmpty() ? "has no owning function"
                : owners.size() > 1 ? "is owned by " + owners.size() + " functions"
                : "is owned by " + owners.get(0) + ", which is not a function";

        List<String> entityIds = new ArrayList<>();
        entityIds.add(parameter.getId());
        entityIds.addAll(owners);
        violations.add(Violation.builder()
                .law(ConservationLaw.STRUCTURAL_INTEGRITY)
                .type(ViolationType.PARAMETER_OWNERSHIP)
                .severity(Severity.ERROR)
                .anchorId(parameter.getId())
                .entityIds(entityIds)
                .message("Parameter " + ReferenceIntegrityCheck.displayName(parameter) + " " + problem)
                .location(parameter.stringProperty(NodeProperties.LOCATION))
                .suggestedFix("Attach the parameter to exactly one function")
                .details(new LinkedHashMap<>(Map.of("owners", owners)))
                .build());
    }

    // ========== INHERITANCE CYCLES ==========

    private void checkInheritanceCycles(ValidationContext context, GraphNode anchor, List<Violation> violations) {
        GraphState view = context.getView();
        List<List<String>> cycles = context.memo(INHERITANCE_CYCLES, () -> findInheritanceCycles(view));
        for (List<String> cycle : cycles) {
            // Each cycle is reported once, on its smallest id
            if (!cycle.get(0).equals(anchor.getId())) {
                continue;
            }
            List<String> names = cycle.stream()
                    .map(id -> view.node(id).map(GraphNode::getName).orElse(id))
                    .toList();
            List<String> path = cycle.stream()
                    .map(id -> view.node(id).map(ReferenceIntegrityCheck::displayName).orElse(id))
                    .collect(Collectors.toCollection(ArrayList::new));
            path.add(path.get(0));

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("cycle", names);
            details.put("cycle_ids", cycle);
            details.put("length", cycle.size());
            violations.add(Violation.builder()
                    .law(ConservationLaw.STRUCTURAL_INTEGRITY)
                    .type(ViolationType.CIRCULAR_INHERITANCE)
                    .severity(Severity.ERROR)
                    .anchorId(anchor.getId())
                    .entityIds(cycle.stream().sorted().toList())
                    .message("Circular inheritance: " + String.join(" -> ", path))
                    .location(anchor.stringProperty(NodeProperties.LOCATION))
                    .suggestedFix("Remove one INHERITS link from the cycle")
                    .details(details)
                    .build());
        }
    }

    /**
     * All distinct INHERITS cycles between classes, each rotated so that its smallest id comes
     * first and without the closing element.
     */
    List<List<String>> findInheritanceCycles(GraphState view) {
        Map<String, Set<String>> adjacency = new TreeMap<>();
        for (GraphNode node : view.nodesOfKind(NodeKind.CLASS)) {
            Set<String> parents = new TreeSet<>();
            for (GraphEdge edge : view.outgoing(node.getId(), EdgeKind.INHERITS)) {
                if (view.node(edge.getTargetId()).map(n -> n.is(NodeKind.CLASS)).orElse(false)) {
                    parents.add(edge.getTargetId());
                }
            }
            adjacency.put(node.getId(), parents);
        }

        List<List<String>> cycles = CycleFinder.findCycles(adjacency);
        if (!cycles.isEmpty()) {
            log.debug("[validator] inheritance cycles found count={}", cycles.size());
        }
        return cycles;
    }

    // ========== ORPHANS ==========

    private static Set<String> ownedNodes(GraphState view) {
        Set<String> owned = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (GraphNode module : view.nodesOfKind(NodeKind.MODULE)) {
            owned.add(module.getId());
            queue.add(module.getId());
        }
        while (!queue.isEmpty()) {
            String id = queue.poll();
            for (GraphEdge edge : view.outgoing(id)) {
                if (edge.getKind().isOwnership() && view.hasNode(edge.getTargetId()) && owned.add(edge.getTargetId())) {
                    queue.add(edge.getTargetId());
                }
            }
        }
        return owned;
    }

    private static Violation orphan(GraphNode node) {
        return Violation.builder()
                .law(ConservationLaw.STRUCTURAL_INTEGRITY)
                .type(ViolationType.ORPHAN_NODE)
                .severity(Severity.ERROR)
                .anchorId(node.getId())
                .entityIds(List.of(node.getId()))
                .message(node.getKind() + " " + ReferenceIntegrityCheck.displayName(node)
                        + " is not reachable from any module")
                .location(node.stringProperty(NodeProperties.LOCATION))
                .suggestedFix("Declare it from its module or remove it")
                .details(new LinkedHashMap<>(Map.of("kind", node.getKind().name())))
                .build();
    }
}
