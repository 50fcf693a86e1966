package com.architecture.memory.codegraph.service.builder;

import com.architecture.memory.codegraph.model.graph.EdgeKind;
import com.architecture.memory.codegraph.model.graph.GraphEdge;
import com.architecture.memory.codegraph.model.graph.GraphNode;
import com.architecture.memory.codegraph.model.graph.GraphState;
import com.architecture.memory.codegraph.model.graph.NodeProperties;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Static import/alias table of one module, read from its IMPORTS edges.
 */
public final class ImportTable {

    private final Map<String, String> aliases;
    private final List<String> wildcardModules;

    private ImportTable(Map<String, String> aliases, List<String> wildcardModules) {
        this.aliases = aliases;
        this.wildcardModules = wildcardModules;
    }

    public static ImportTable of(GraphState view, String moduleNodeId) {
        Map<String, String> aliases = new TreeMap<>();
        TreeSet<String> wildcards = new TreeSet<>();
        for (GraphNode node : view.nodesInModule(moduleNodeId)) {
            for (GraphEdge edge : view.outgoing(node.getId(), EdgeKind.IMPORTS)) {
                String target = edge.stringProperty(NodeProperties.TARGET_QUALIFIED_NAME);
                String alias = edge.stringProperty(NodeProperties.ALIAS);
                if (target == null) {
                    continue;
                }
                if (NodeProperties.WILDCARD_ALIAS.equals(alias)) {
                    wildcards.add(target);
                } else if (alias != null) {
                    aliases.put(alias, target);
                }
            }
        }
        return new ImportTable(aliases, List.copyOf(wildcards));
    }

    /**
     * Replaces a leading alias segment with the imported qualified name, e.g. {@code np.array}
     * becomes {@code numpy.array} when the module imports {@code numpy as np}.
     */
    public Optional<String> expand(String name) {
        int dot = name.indexOf('.');
        String head = dot >= 0 ? name.substring(0, dot) : name;
        String target = aliases.get(head);
        if (target == null) {
            return Optional.empty();
        }
        return Optional.of(dot >= 0 ? target + name.substring(dot) : target);
    }

    public List<String> getWildcardModules() {
        return wildcardModules;
    }

    public Map<String, String> getAliases() {
        return aliases;
    }
}
