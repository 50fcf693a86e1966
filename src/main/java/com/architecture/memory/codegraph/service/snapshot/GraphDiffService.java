package com.architecture.memory.codegraph.service.snapshot;

import com.architecture.memory.codegraph.dto.diff.DiffSummary;
import com.architecture.memory.codegraph.dto.diff.GraphDiff;
import com.architecture.memory.codegraph.dto.diff.NodeChange;
import com.architecture.memory.codegraph.dto.diff.PropertyDiff;
import com.architecture.memory.codegraph.dto.diff.RelationshipChange;
import com.architecture.memory.codegraph.model.graph.EdgeKey;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.snapshot.GraphSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes the structural diff between two graph states.
 *
 * Nodes are matched by canonical id and edges by (sourceId, kind, targetId). A node or edge present
 * on both sides is modified when at least one property differs; the {@code changed} flag is
 * bookkeeping and never compared.
 */
@Service
@Slf4j
public class GraphDiffService {

    public GraphDiff diff(GraphSnapshot oldSnapshot, GraphSnapshot newSnapshot) {
        GraphDiff diff = diff(oldSnapshot.getNodes(), oldSnapshot.getEdges(), newSnapshot.getNodes(), newSnapshot.getEdges());
        diff.setOldSnapshotId(oldSnapshot.getId());
        diff.setNewSnapshotId(newSnapshot.getId());
        log.info("[snapshot] diff old={} new={} nodesAdded={} nodesModified={} nodesRemoved={} relsAdded={} relsModified={} relsRemoved={}",
                oldSnapshot.getId(), newSnapshot.getId(),
                diff.getAddedNodes().size(), diff.getModifiedNodes().size(), diff.getRemovedNodes().size(),
                diff.getAddedRelationships().size(), diff.getModifiedRelationships().size(),
                diff.getRemovedRelationships().size());
        return diff;
    }

    public GraphDiff diff(Collection<GraphNode> oldNodes, Collection<GraphEdge> oldEdges,
                          Collection<GraphNode> newNodes, Collection<GraphEdge> newEdges) {
        List<NodeChange> added = new ArrayList<>();
        List<NodeChange> modified = new ArrayList<>();
        List<NodeChange> removed = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();
        diffNodes(index(oldNodes, GraphNode::getId), index(newNodes, GraphNode::getId), added, modified, removed, unchanged);

        List<RelationshipChange> addedRels = new ArrayList<>();
        List<RelationshipChange> modifiedRels = new ArrayList<>();
        List<RelationshipChange> removedRels = new ArrayList<>();
        diffEdges(index(oldEdges, GraphEdge::key), index(newEdges, GraphEdge::key), addedRels, modifiedRels, removedRels);

        return GraphDiff.builder()
                .addedNodes(added)
                .modifiedNodes(modified)
                .removedNodes(removed)
                .unchangedNodeIds(unchanged)
                .addedRelationships(addedRels)
                .modifiedRelationships(modifiedRels)
                .removedRelationships(removedRels)
                .summary(buildSummary(added, modified, removed, unchanged, addedRels, modifiedRels, removedRels))
                .build();
    }

    // ========================= NODES =========================

    private void diffNodes(Map<String, GraphNode> oldMap, Map<String, GraphNode> newMap,
                           List<NodeChange> added, List<NodeChange> modified, List<NodeChange> removed,
                           List<String> unchanged) {
        // Added: only in the new state
        for (Map.Entry<String, GraphNode> entry : newMap.entrySet()) {
            if (!oldMap.containsKey(entry.getKey())) {
                added.add(nodeChange(NodeChange.ChangeType.ADDED, entry.getValue())
                        .newProperties(entry.getValue().getProperties())
                        .build());
            }
        }

        // Removed: only in the old state
        for (Map.Entry<String, GraphNode> entry : oldMap.entrySet()) {
            if (!newMap.containsKey(entry.getKey())) {
                removed.add(nodeChange(NodeChange.ChangeType.REMOVED, entry.getValue())
                        .oldProperties(entry.getValue().getProperties())
                        .build());
            }
        }

        // Modified: in both, check for property differences
        for (Map.Entry<String, GraphNode> entry : newMap.entrySet()) {
            GraphNode before = oldMap.get(entry.getKey());
            if (before == null) {
                continue;
            }
            GraphNode after = entry.getValue();
            List<PropertyDiff> diffs = compareProperties(before.getProperties(), after.getProperties());
            if (!Objects.equals(before.getModuleId(), after.getModuleId())) {
                diffs.add(PropertyDiff.builder()
                        .property("moduleId")
                        .oldValue(before.getModuleId())
                        .newValue(after.getModuleId())
                        .build());
            }
            if (diffs.isEmpty()) {
                unchanged.add(entry.getKey());
            } else {
                modified.add(nodeChange(NodeChange.ChangeType.MODIFIED, after)
                        .propertyDiffs(diffs)
                        .oldProperties(before.getProperties())
                        .newProperties(after.getProperties())
                        .build());
            }
        }
    }

    private NodeChange.NodeChangeBuilder nodeChange(NodeChange.ChangeType type, GraphNode node) {
        return NodeChange.builder()
                .changeType(type)
                .nodeId(node.getId())
                .nodeKind(node.getKind().name())
                .displayName(node.getQualifiedName() != null ? node.getQualifiedName() : node.getName());
    }

    // ========================= EDGES =========================

    private void diffEdges(Map<EdgeKey, GraphEdge> oldMap, Map<EdgeKey, GraphEdge> newMap,
                           List<RelationshipChange> added, List<RelationshipChange> modified,
                           List<RelationshipChange> removed) {
        for (Map.Entry<EdgeKey, GraphEdge> entry : newMap.entrySet()) {
            GraphEdge before = oldMap.get(entry.getKey());
            if (before == null) {
                added.add(relationshipChange(RelationshipChange.ChangeType.ADDED, entry.getKey()).build());
                continue;
            }
            List<PropertyDiff> diffs = compareProperties(before.getProperties(), entry.getValue().getProperties());
            if (!diffs.isEmpty()) {
                modified.add(relationshipChange(RelationshipChange.ChangeType.MODIFIED, entry.getKey())
                        .propertyDiffs(diffs)
                        .build());
            }
        }
        for (EdgeKey key : oldMap.keySet()) {
            if (!newMap.containsKey(key)) {
                removed.add(relationshipChange(RelationshipChange.ChangeType.REMOVED, key).build());
            }
        }
    }

    private RelationshipChange.RelationshipChangeBuilder relationshipChange(RelationshipChange.ChangeType type, EdgeKey key) {
        return RelationshipChange.builder()
                .changeType(type)
                .relationshipType(key.getKind().name())
                .sourceId(key.getSourceId())
                .targetId(key.getTargetId())
                .displayDescription(key.getSourceId() + " -" + key.getKind() + "-> " + key.getTargetId());
    }

    // ========================= PROPERTIES =========================

    private List<PropertyDiff> compareProperties(Map<String, Object> before, Map<String, Object> after) {
        List<PropertyDiff> diffs = new ArrayList<>();
        TreeSet<String> keys = new TreeSet<>(before.keySet());
        keys.addAll(after.keySet());

        for (String key : keys) {
            Object oldVal = before.get(key);
            Object newVal = after.get(key);
            if (Objects.equals(oldVal, newVal)) {
                continue;
            }
            PropertyDiff.PropertyDiffBuilder diff = PropertyDiff.builder()
                    .property(key)
                    .oldValue(oldVal)
                    .newValue(newVal);
            if (oldVal instanceof List<?> || newVal instanceof List<?>) {
                List<String> oldList = asStrings(oldVal);
                List<String> newList = asStrings(newVal);
                diff.added(newList.stream().filter(v -> !oldList.contains(v)).toList());
                diff.removed(oldList.stream().filter(v -> !newList.contains(v)).toList());
            }
            diffs.add(diff.build());
        }
        return diffs;
    }

    private static List<String> asStrings(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    // ========================= SUMMARY =========================

    private DiffSummary buildSummary(List<NodeChange> added, List<NodeChange> modified, List<NodeChange> removed,
                                     List<String> unchanged, List<RelationshipChange> addedRels,
                                     List<RelationshipChange> modifiedRels, List<RelationshipChange> removedRels) {
        return DiffSummary.builder()
                .totalChanges(added.size() + modified.size() + removed.size()
                        + addedRels.size() + modifiedRels.size() + removedRels.size())
                .nodesAdded(added.size())
                .nodesModified(modified.size())
                .nodesRemoved(removed.size())
                .nodesUnchanged(unchanged.size())
                .relationshipsAdded(addedRels.size())
                .relationshipsModified(modifiedRels.size())
                .relationshipsRemoved(removedRels.size())
                .addedByKind(countByKind(added))
                .modifiedByKind(countByKind(modified))
                .removedByKind(countByKind(removed))
                .build();
    }

    private Map<String, Integer> countByKind(List<NodeChange> changes) {
        return changes.stream()
                .collect(Collectors.groupingBy(NodeChange::getNodeKind, TreeMap::new, Collectors.summingInt(c -> 1)));
    }

    private static <K extends Comparable<K>, V> Map<K, V> index(Collection<V> values, Function<V, K> key) {
        Map<K, V> map = new TreeMap<>();
        for (V value : values) {
            map.put(key.apply(value), value);
        }
        return map;
    }
}
