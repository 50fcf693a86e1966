package com.architecture.memory.codegraph.service.builder;

import com.architecture.memory.codegraph.dto.extraction.RawEntity;
import com.architecture.memory.codegraph.dto.extraction.RawEntityKind;
import com.architecture.memory.codegraph.dto.extraction.RawRelationship;
import com.architecture.memory.codegraph.dto.extraction.RawRelationshipKind;
import com.architecture.memory.codegraph.exception.MalformedExtractionException;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Rejects extractor output that cannot be turned into a well-formed module subgraph.
 * All problems of a payload are collected before failing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExtractionValidator {

    private static final Set<RawEntityKind> CONTAINERS =
            EnumSet.of(RawEntityKind.MODULE, RawEntityKind.CLASS, RawEntityKind.FUNCTION);

    private final CanonicalIdGenerator idGenerator;

    public void validate(String moduleId, List<RawEntity> entities, List<RawRelationship> relationships) {
        List<String> problems = new ArrayList<>();
        if (moduleId == null || moduleId.isBlank()) {
            throw new MalformedExtractionException(moduleId, List.of("module id is blank"));
        }
        List<RawEntity> safeEntities = entities != null ? entities : List.of();
        List<RawRelationship> safeRelationships = relationships != null ? relationships : List.of();

        Map<String, RawEntity> byQualifiedName = checkEntities(moduleId, safeEntities, problems);
        checkParents(moduleId, safeEntities, byQualifiedName, problems);
        checkParameterPositions(safeEntities, problems);
        checkRelationships(safeRelationships, byQualifiedName, problems);

        if (!problems.isEmpty()) {
            log.warn("[builder] rejected extraction module={} problems={}", moduleId, problems.size());
            throw new MalformedExtractionException(moduleId, problems);
        }
    }

    // ========== ENTITIES ==========

    private Map<String, RawEntity> checkEntities(String moduleId, List<RawEntity> entities, List<String> problems) {
        Map<String, RawEntity> byQualifiedName = new HashMap<>();
        int modules = 0;
        for (RawEntity entity : entities) {
            if (entity == null || entity.getKind() == null) {
                problems.add("entity without kind");
                continue;
            }
            String qn = entity.getQualifiedName();
            if (qn == null || qn.isBlank() || entity.getName() == null || entity.getName().isBlank()) {
                problems.add("entity of kind " + entity.getKind() + " without name or qualified name");
                continue;
            }
            if (entity.getKind() == RawEntityKind.MODULE) {
                modules++;
                if (!qn.equals(moduleId)) {
                    problems.add("module entity " + qn + " does not match module id " + moduleId);
                }
            } else if (!qn.startsWith(moduleId + ".")) {
                problems.add("entity " + qn + " lies outside module " + moduleId);
            }
            RawEntity previous = byQualifiedName.put(qn, entity);
            if (previous != null) {
                problems.add("duplicate id " + idGenerator.nodeId(entity.getKind().getNodeKind(), qn));
            }
        }
        if (modules != 1) {
            problems.add("expected exactly one MODULE entity, found " + modules);
        }
        return byQualifiedName;
    }

    private void checkParents(String moduleId, List<RawEntity> entities, Map<String, RawEntity> byQualifiedName,
                              List<String> problems) {
        for (RawEntity entity : entities) {
            if (entity == null || entity.getKind() == null || entity.getKind() == RawEntityKind.MODULE
                    || entity.getQualifiedName() == null) {
                continue;
            }
            String parentName = entity.getParent() != null ? entity.getParent() : moduleId;
            RawEntity parent = byQualifiedName.get(parentName);
            if (parent == null) {
                problems.add("entity " + entity.getQualifiedName() + " has unknown parent " + parentName);
                continue;
            }
            boolean parameter = entity.getKind() == RawEntityKind.PARAMETER;
            if (parameter && parent.getKind() != RawEntityKind.FUNCTION) {
                problems.add("parameter " + entity.getQualifiedName() + " is not owned by a function");
            } else if (!parameter && !CONTAINERS.contains(parent.getKind())) {
                problems.add("entity " + entity.getQualifiedName() + " cannot be declared in a " + parent.getKind());
            }
        }
    }

    private void checkParameterPositions(List<RawEntity> entities, List<String> problems) {
        Map<String, List<Integer>> positionsByFunction = new TreeMap<>();
        for (RawEntity entity : entities) {
            if (entity == null || entity.getKind() != RawEntityKind.PARAMETER || entity.getParent() == null) {
                continue;
            }
            if (entity.getPosition() == null || entity.getPosition() < 0) {
                problems.add("parameter " + entity.getQualifiedName() + " has no valid position");
                continue;
            }
            positionsByFunction.computeIfAbsent(entity.getParent(), k -> new ArrayList<>()).add(entity.getPosition());
        }
        positionsByFunction.forEach((function, positions) -> {
            Set<Integer> seen = new HashSet<>();
            for (Integer position : positions) {
                if (!seen.add(position)) {
                    problems.add("function " + function + " has duplicate parameter position " + position);
                }
            }
            Set<Integer> sorted = new TreeSet<>(seen);
            int expected = 0;
            for (Integer position : sorted) {
                if (position != expected) {
                    problems.add("function " + function + " has a parameter position gap at " + expected);
                    break;
                }
                expected++;
            }
        });
    }

    // ========== RELATIONSHIPS ==========

    private void checkRelationships(List<RawRelationship> relationships, Map<String, RawEntity> byQualifiedName,
                                    List<String> problems) {
        for (RawRelationship relationship : relationships) {
            if (relationship == null || relationship.getKind() == null) {
                problems.add("relationship without kind");
                continue;
            }
            RawEntity source = byQualifiedName.get(relationship.getFrom());
            if (source == null) {
                problems.add(relationship.getKind() + " relationship has unknown source " + relationship.getFrom());
                continue;
            }
            if (relationship.getTo() == null || relationship.getTo().isBlank()) {
                problems.add(relationship.getKind() + " relationship from " + relationship.getFrom() + " has no target");
            }
            if (relationship.getArgCount() != null && relationship.getArgCount() < 0) {
                problems.add("call from " + relationship.getFrom() + " has negative argument count");
            }
            if (relationship.getKind() == RawRelationshipKind.CALLS
                    && source.getKind() != RawEntityKind.FUNCTION && source.getKind() != RawEntityKind.MODULE) {
                problems.add("call from " + relationship.getFrom() + " is not made by a function or module");
            }
        }
    }
}
