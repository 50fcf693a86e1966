package com.architecture.memory.codegraph.service.query;

import com.architecture.memory.codegraph.dto.query.CallRelation;
import com.architecture.memory.codegraph.dto.query.ClassHierarchy;
import com.architecture.memory.codegraph.dto.query.EntityReference;
import com.architecture.memory.codegraph.dto.query.FunctionDependencies;
import com.architecture.memory.codegraph.dto.query.FunctionSignature;
import com.architecture.memory.codegraph.dto.query.ImpactAnalysis;
import com.architecture.memory.codegraph.dto.validation.ProposedChange;
import com.architecture.memory.codegraph.exception.CodeGraphException;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import com.architecture.memory.codegraph.repository.graph.GraphStore;
import com.architecture.memory.codegraph.service.graph.CycleFinder;
import com.architecture.memory.codegraph.service.validation.SignatureRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BiFunction;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only questions about the code graph: who calls what, signatures, references, hierarchies,
 * dependency neighbourhoods and change impact.
 * Every method answers from one consistent view of the store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphQueryService {

    static final int RESULT_LIMIT = 100;

    private static final Comparator<GraphNode> BY_ID = Comparator.comparing(GraphNode::getId);

    private final GraphStore graphStore;

    // ========================= Function Queries =========================

    /**
     * Functions by qualified name, else by simple name, else the first {@value #RESULT_LIMIT} by id.
     */
    public List<GraphNode> findFunctions(String name, String qualifiedName) {
        GraphState view = graphStore.readView();
        if (qualifiedName != null) {
            return view.nodeByQualifiedName(qualifiedName, NodeKind.FUNCTION).stream().toList();
        }
        return view.nodesOfKind(NodeKind.FUNCTION).stream()
                .filter(f -> name == null || name.equals(f.getName()))
                .sorted(BY_ID)
                .limit(RESULT_LIMIT)
                .toList();
    }

    /**
     * Call sites resolved to the function, with the function or module that owns each one.
     */
    public List<CallRelation> findCallers(String functionId) {
        return callers(graphStore.readView(), functionId);
    }

    /**
     * Functions that the function's call sites resolve to. Unresolved and ambiguous calls are left out.
     */
    public List<CallRelation> findCallees(String functionId) {
        return callees(graphStore.readView(), functionId);
    }

    public Optional<FunctionSignature> getFunctionSignature(String functionId) {
        GraphState view = graphStore.readView();
        return view.node(functionId)
                .filter(n -> n.is(NodeKind.FUNCTION))
                .map(function -> FunctionSignature.builder()
                        .functionId(function.getId())
                        .qualifiedName(function.getQualifiedName())
                        .returnType(function.stringProperty(NodeProperties.RETURN_TYPE))
                        .visibility(function.stringProperty(NodeProperties.VISIBILITY))
                        .parameters(SignatureRules.parametersOf(view, function))
                        .build());
    }

    /**
     * Functions within {@code depth} resolved calls of the function, in both directions.
     */
    public FunctionDependencies getFunctionDependencies(String functionId, int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1, got " + depth);
        }
        GraphState view = graphStore.readView();
        return FunctionDependencies.builder()
                .functionId(functionId)
                .depth(depth)
                .outbound(walk(view, functionId, depth, this::callees))
                .inbound(walk(view, functionId, depth, this::callers))
                .build();
    }

    // ========================= Reference Queries =========================

    /**
     * Nodes that reference, read, assign or import the entity.
     */
    public List<EntityReference> findReferences(String entityId) {
        return references(graphStore.readView(), entityId);
    }

    public ClassHierarchy getClassHierarchy(String classId) {
        GraphState view = graphStore.readView();
        List<GraphNode> bases = view.targets(classId, EdgeKind.INHERITS).stream()
                .filter(n -> n.is(NodeKind.CLASS))
                .sorted(BY_ID)
                .toList();
        List<GraphNode> derived = view.incoming(classId, EdgeKind.INHERITS).stream()
                .map(edge -> view.node(edge.getSourceId()))
                .flatMap(Optional::stream)
                .filter(n -> n.is(NodeKind.CLASS))
                .sorted(BY_ID)
                .toList();
        return ClassHierarchy.builder().classId(classId).bases(bases).derived(derived).build();
    }

    // ========================= Graph Health =========================

    /**
     * Nodes with no edge in either direction.
     */
    public List<GraphNode> findOrphanedNodes() {
        GraphState view = graphStore.readView();
        return view.nodes().stream()
                .filter(n -> view.outgoing(n.getId()).isEmpty() && view.incoming(n.getId()).isEmpty())
                .sorted(BY_ID)
                .toList();
    }

    /**
     * Cycles in the resolved call graph, each starting at its smallest function id.
     * Direct recursion is a cycle of one.
     */
    public List<List<String>> findCircularDependencies() {
        GraphState view = graphStore.readView();
        Map<String, Set<String>> adjacency = new TreeMap<>();
        for (GraphNode function : view.nodesOfKind(NodeKind.FUNCTION)) {
            adjacency.put(function.getId(), callees(view, function.getId()).stream()
                    .map(CallRelation::getFunction)
                    .filter(n -> n.is(NodeKind.FUNCTION))
                    .map(GraphNode::getId)
                    .collect(Collectors.toCollection(TreeSet::new)));
        }
        List<List<String>> cycles = CycleFinder.findCycles(adjacency);
        log.debug("[query] call cycles found count={}", cycles.size());
        return cycles;
    }

    // ========================= Impact =========================

    /**
     * Callers and referrers of an entity, plus its edge counts by kind when the change is a delete.
     */
    public ImpactAnalysis getImpactAnalysis(String entityId, ProposedChange.ChangeKind changeKind) {
        GraphState view = graphStore.readView();
        GraphNode entity = view.node(entityId)
                .orElseThrow(() -> new CodeGraphException("Unknown entity " + entityId));

        ImpactAnalysis.ImpactAnalysisBuilder impact = ImpactAnalysis.builder()
                .entityId(entityId)
                .changeKind(changeKind)
                .affectedCallers(entity.is(NodeKind.FUNCTION) ? callers(view, entityId) : List.of())
                .affectedReferences(references(view, entityId));

        if (changeKind == ProposedChange.ChangeKind.DELETE) {
            impact.connectionsByKind(Stream.concat(view.outgoing(entityId).stream(), view.incoming(entityId).stream())
                    .collect(Collectors.groupingBy(edge -> edge.getKind().name(), TreeMap::new, Collectors.counting())));
        }
        ImpactAnalysis result = impact.build();
        log.info("[query] impact entity={} change={} affected={}", entityId, changeKind, result.getAffectedCount());
        return result;
    }

    // ========================= Search =========================

    /**
     * Nodes whose name or qualified name contains a match of the regular expression, optionally of one kind.
     */
    public List<GraphNode> searchByPattern(String pattern, NodeKind kind) {
        Pattern regex;
        try {
            regex = Pattern.compile(".*(?:" + pattern + ").*");
        } catch (PatternSyntaxException e) {
            throw new CodeGraphException("Invalid search pattern: " + pattern, e);
        }
        GraphState view = graphStore.readView();
        Stream<GraphNode> candidates = kind != null ? view.nodesOfKind(kind).stream() : view.nodes().stream();
        return candidates
                .filter(n -> matches(regex, n.getName()) || matches(regex, n.getQualifiedName()))
                .sorted(BY_ID)
                .limit(RESULT_LIMIT)
                .toList();
    }

    // ========================= Helpers =========================

    private List<CallRelation> callers(GraphState view, String functionId) {
        List<CallRelation> result = new ArrayList<>();
        for (GraphEdge edge : view.incoming(functionId, EdgeKind.RESOLVES_TO)) {
            view.node(edge.getSourceId())
                    .filter(n -> n.is(NodeKind.CALL_SITE))
                    .ifPresent(callSite -> view.owner(callSite.getId())
                            .ifPresent(caller -> result.add(relation(caller, callSite))));
        }
        result.sort(Comparator.comparing(CallRelation::getCallSiteId));
        return result;
    }

    private List<CallRelation> callees(GraphState view, String functionId) {
        List<CallRelation> result = new ArrayList<>();
        for (GraphNode callSite : view.targets(functionId, EdgeKind.HAS_CALLSITE)) {
            for (GraphNode callee : view.targets(callSite.getId(), EdgeKind.RESOLVES_TO)) {
                result.add(relation(callee, callSite));
            }
        }
        result.sort(Comparator.comparing(CallRelation::getCallSiteId));
        return result;
    }

    private static CallRelation relation(GraphNode function, GraphNode callSite) {
        Integer argCount = callSite.intProperty(NodeProperties.ARG_COUNT);
        return CallRelation.builder()
                .function(function)
                .callSiteId(callSite.getId())
                .argCount(argCount != null ? argCount : 0)
                .location(callSite.stringProperty(NodeProperties.LOCATION))
                .build();
    }

    private List<EntityReference> references(GraphState view, String entityId) {
        List<EntityReference> result = new ArrayList<>();
        for (GraphEdge edge : view.incoming(entityId)) {
            if (!EdgeKind.SYMBOLIC.contains(edge.getKind())) {
                continue;
            }
            view.node(edge.getSourceId()).ifPresent(source -> result.add(EntityReference.builder()
                    .source(source)
                    .kind(edge.getKind())
                    .location(edge.stringProperty(NodeProperties.LOCATION) != null
                            ? edge.stringProperty(NodeProperties.LOCATION)
                            : source.stringProperty(NodeProperties.LOCATION))
                    .build()));
        }
        result.sort(Comparator.comparing((EntityReference r) -> r.getSource().getId()).thenComparing(r -> r.getKind()));
        return result;
    }

    /**
     * Breadth-first walk over calls; each function is listed once, at its first distance.
     */
    private List<FunctionDependencies.Dependency> walk(GraphState view, String start, int depth,
                                                       BiFunction<GraphState, String, List<CallRelation>> step) {
        List<FunctionDependencies.Dependency> result = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(start);
        List<String> frontier = List.of(start);

        for (int distance = 1; distance <= depth && !frontier.isEmpty(); distance++) {
            List<String> next = new ArrayList<>();
            for (String id : frontier) {
                for (CallRelation relation : step.apply(view, id)) {
                    GraphNode function = relation.getFunction();
                    if (function.is(NodeKind.FUNCTION) && visited.add(function.getId())) {
                        result.add(new FunctionDependencies.Dependency(function, distance));
                        next.add(function.getId());
                    }
                }
            }
            frontier = next;
        }
        result.sort(Comparator.comparingInt(FunctionDependencies.Dependency::getDistance)
                .thenComparing(d -> d.getFunction().getId()));
        return result;
    }

    private static boolean matches(Pattern regex, String value) {
        return value != null && regex.matcher(value).matches();
    }
}
