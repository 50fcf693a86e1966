package com.architecture.memory.codegraph.service.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finds cycles in a directed graph given as an adjacency map, using DFS with a recursion stack.
 *
 * Each cycle is returned once, rotated so that its smallest id comes first and without the
 * closing element. A self-loop is a cycle of length one.
 */
public final class CycleFinder {

    private CycleFinder() {
    }

    public static List<List<String>> findCycles(Map<String, ? extends Set<String>> adjacency) {
        // Sorted traversal keeps the result stable between runs
        Map<String, Set<String>> sorted = new TreeMap<>(adjacency);
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> inStack = new HashSet<>();
        Map<String, String> parent = new HashMap<>();
        Set<List<String>> reported = new HashSet<>();

        for (String node : sorted.keySet()) {
            if (!visited.contains(node)) {
                dfs(node, sorted, visited, inStack, parent, cycles, reported);
            }
        }
        return cycles;
    }

    private static void dfs(String node, Map<String, Set<String>> adjacency,
                            Set<String> visited, Set<String> inStack,
                            Map<String, String> parent,
                            List<List<String>> cycles, Set<List<String>> reported) {
        visited.add(node);
        inStack.add(node);

        for (String neighbor : adjacency.getOrDefault(node, Collections.emptySet())) {
            if (!visited.contains(neighbor)) {
                parent.put(neighbor, node);
                dfs(neighbor, adjacency, visited, inStack, parent, cycles, reported);
            } else if (inStack.contains(neighbor)) {
                List<String> cycle = normalizeCycle(reconstructCycle(neighbor, node, parent));
                if (reported.add(cycle)) {
                    cycles.add(cycle);
                }
            }
        }

        inStack.remove(node);
    }

    /**
     * Walks parent links back from {@code end} to {@code start}; the result starts at {@code start}.
     */
    private static List<String> reconstructCycle(String start, String end, Map<String, String> parent) {
        List<String> cycle = new ArrayList<>();
        cycle.add(end);
        String current = end;
        while (!current.equals(start)) {
            current = parent.get(current);
            cycle.add(current);
        }
        Collections.reverse(cycle);
        return cycle;
    }

    private static List<String> normalizeCycle(List<String> cycle) {
        int minIdx = cycle.indexOf(Collections.min(cycle));
        List<String> normalized = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            normalized.add(cycle.get((minIdx + i) % cycle.size()));
        }
        return List.copyOf(normalized);
    }
}
