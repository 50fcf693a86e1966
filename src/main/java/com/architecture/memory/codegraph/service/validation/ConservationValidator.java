package com.architecture.memory.codegraph.service.validation;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.validation.ConservationLaw;
import com.architecture.memory.codegraph.dto.validation.ParameterSpec;
import com.architecture.memory.codegraph.dto.validation.ProposedChange;
import com.architecture.memory.codegraph.dto.validation.Severity;
import com.architecture.memory.codegraph.dto.validation.ValidationReport;
import com.architecture.memory.codegraph.dto.validation.Violation;
import com.architecture.memory.codegraph.dto.validation.ViolationType;
import com.architecture.memory.codegraph.exception.CodeGraphException;
import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import com.architecture.memory.codegraph.model.graph.NodeProperties;
import com.architecture.memory.codegraph.repository.graph.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the conservation checks over a consistent view of the graph.
 *
 * Full and incremental runs share one algorithm: every check is evaluated per anchor node, and
 * the {@link ValidationScope} only decides which nodes are anchors. A run is either complete or
 * cancelled; partial reports are never returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConservationValidator {

    private static final int INTERRUPT_CHECK_INTERVAL = 256;

    private final GraphStore graphStore;
    private final List<ConservationCheck> checks;
    private final SignatureConservationCheck signatureCheck;
    private final CodeGraphProperties properties;

    public ValidationReport validateFull() {
        return validate(graphStore.readView(), ValidationScope.full());
    }

    /**
     * Validates changed nodes and their neighbourhood within the configured number of hops.
     */
    public ValidationReport validateIncremental() {
        GraphState view = graphStore.readView();
        return validate(view, ValidationScope.incremental(view, properties.getValidation().getIncrementalHops()));
    }

    public ValidationReport validate(GraphState view, ValidationScope scope) {
        long start = System.currentTimeMillis();
        ValidationContext context = new ValidationContext(view);
        List<Violation> violations = new ArrayList<>();
        int anchors = 0;

        List<GraphNode> ordered = view.nodes().stream()
                .filter(node -> scope.contains(node.getId()))
                .sorted(Comparator.comparing(GraphNode::getId))
                .toList();
        for (GraphNode anchor : ordered) {
            if (anchors++ % INTERRUPT_CHECK_INTERVAL == 0 && Thread.currentThread().isInterrupted()) {
                log.info("[validator] cancelled mode={} graphVersion={} anchorsDone={}",
                        scope.getMode(), view.getVersion(), anchors - 1);
                throw new CancellationException("Validation cancelled at graph version " + view.getVersion());
            }
            for (ConservationCheck check : checks) {
                check.check(context, anchor, violations);
            }
        }

        ValidationReport report = buildReport(view, scope, violations, System.currentTimeMillis() - start);
        log.info("[validator] completed mode={} graphVersion={} scope={} errors={} warnings={} durationMs={}",
                report.getMode(), report.getGraphVersion(), report.getScopeSize(), report.getErrorCount(),
                report.getWarningCount(), report.getDurationMs());
        return report;
    }

    private ValidationReport buildReport(GraphState view, ValidationScope scope, List<Violation> violations,
                                         long durationMs) {
        List<Violation> sorted = new ArrayList<>(violations);
        sorted.sort(Violation.ORDER);

        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        Map<ConservationLaw, Long> byLaw = new EnumMap<>(ConservationLaw.class);
        for (Violation violation : sorted) {
            bySeverity.merge(violation.getSeverity(), 1L, Long::sum);
            byLaw.merge(violation.getLaw(), 1L, Long::sum);
        }
        Map<String, Long> byType = sorted.stream()
                .collect(Collectors.groupingBy(Violation::getCode, TreeMap::new, Collectors.counting()));

        return ValidationReport.builder()
                .mode(scope.getMode())
                .graphVersion(view.getVersion())
                .scopeSize(scope.size(view))
                .durationMs(durationMs)
                .violations(sorted)
                .countsBySeverity(bySeverity)
                .countsByLaw(byLaw)
                .countsByType(byType)
                .build();
    }

    // ========== PROPOSED CHANGES ==========

    /**
     * Reports what would break if {@code change} were applied to the current graph. The graph
     * itself is left untouched.
     */
    public List<Violation> validateChange(ProposedChange change) {
        GraphState view = graphStore.readView();
        GraphNode entity = view.node(change.getEntityId())
                .orElseThrow(() -> new CodeGraphException("No entity with id " + change.getEntityId()));
        if (change.getKind() == null) {
            throw new CodeGraphException("Proposed change for " + change.getEntityId() + " has no kind");
        }

        List<Violation> violations = switch (change.getKind()) {
            case DELETE -> deletionImpact(view, entity);
            case MODIFY_SIGNATURE -> signatureImpact(view, requireFunction(entity), change.getParameters());
            case CHANGE_VISIBILITY -> visibilityImpact(view, requireFunction(entity), change.getVisibility());
        };
        violations.sort(Violation.ORDER);
        log.info("[validator] change impact entity={} kind={} violations={}",
                entity.getId(), change.getKind(), violations.size());
        return violations;
    }

    private List<Violation> deletionImpact(GraphState view, GraphNode entity) {
        Set<String> removed = ownedSubtree(view, entity.getId());
        List<Violation> violations = new ArrayList<>();
        for (String removedId : removed) {
            for (GraphEdge edge : view.incoming(removedId)) {
                boolean reference = EdgeKind.SYMBOLIC.contains(edge.getKind())
                        || edge.getKind() == EdgeKind.RESOLVES_TO
                        || edge.getKind() == EdgeKind.INHERITS;
                if (!reference || removed.contains(edge.getSourceId())) {
                    continue;
                }
                GraphNode target = view.node(removedId).orElseThrow();
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("edge_kind", edge.getKind().name());
                details.put("target_id", removedId);
                violations.add(Violation.builder()
                        .law(ConservationLaw.REFERENCE_INTEGRITY)
                        .type(ViolationType.DANGLING_REFERENCE)
                        .severity(Severity.ERROR)
                        .anchorId(edge.getSourceId())
                        .entityIds(List.of(edge.getSourceId(), removedId))
                        .message("Deleting " + ReferenceIntegrityCheck.displayName(entity) + " leaves "
                                + describeReferrer(view, edge.getSourceId()) + " pointing at "
                                + ReferenceIntegrityCheck.displayName(target))
                        .location(view.node(edge.getSourceId())
                                .map(n -> n.stringProperty(NodeProperties.LOCATION)).orElse(null))
                        .suggestedFix("Update or remove the reference before deleting " + entity.getId())
                        .details(details)
                        .build());
            }
        }
        return violations;
    }

    private List<Violation> signatureImpact(GraphState view, GraphNode function, List<ParameterSpec> proposed) {
        if (proposed == null) {
            throw new CodeGraphException("Signature change for " + function.getId() + " carries no parameters");
        }
        List<ParameterSpec> callable = SignatureRules.callableParameters(view, function, proposed,
                properties.getResolution().getReceiverNames());
        List<Violation> violations = new ArrayList<>();
        for (GraphNode callSite : callersOf(view, function)) {
            signatureCheck.checkArity(callSite, function, callable).ifPresent(violations::add);
        }
        return violations;
    }

    private List<Violation> visibilityImpact(GraphState view, GraphNode function, String visibility) {
        GraphNode proposed = function.withProperty(NodeProperties.VISIBILITY, visibility);
        List<Violation> violations = new ArrayList<>();
        for (GraphNode callSite : callersOf(view, function)) {
            signatureCheck.checkVisibility(view, callSite, proposed).ifPresent(violations::add);
        }
        return violations;
    }

    private static GraphNode requireFunction(GraphNode entity) {
        if (!entity.is(NodeKind.FUNCTION)) {
            throw new CodeGraphException(entity.getId() + " is a " + entity.getKind() + ", not a function");
        }
        return entity;
    }

    private static List<GraphNode> callersOf(GraphState view, GraphNode function) {
        return view.incoming(function.getId(), EdgeKind.RESOLVES_TO).stream()
                .map(GraphEdge::getSourceId)
                .sorted()
                .map(view::node)
                .flatMap(Optional::stream)
                .filter(n -> n.is(NodeKind.CALL_SITE))
                .toList();
    }

    private static Set<String> ownedSubtree(GraphState view, String rootId) {
        Set<String> subtree = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        subtree.add(rootId);
        queue.add(rootId);
        while (!queue.isEmpty()) {
            for (GraphEdge edge : view.outgoing(queue.poll())) {
                if (edge.getKind().isOwnership() && subtree.add(edge.getTargetId())) {
                    queue.add(edge.getTargetId());
                }
            }
        }
        subtree.removeIf(id -> !view.hasNode(id));
        return subtree;
    }

    private static String describeReferrer(GraphState view, String referrerId) {
        Function<GraphNode, String> describe = node -> node.is(NodeKind.CALL_SITE)
                ? "call site " + node.getId()
                : node.getKind().name().toLowerCase() + " " + ReferenceIntegrityCheck.displayName(node);
        return view.node(referrerId).map(describe).orElse(referrerId);
    }
}
