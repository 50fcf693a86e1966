package com.architecture.memory.codegraph.service.builder;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.extraction.ExtractionPayload;
import com.architecture.memory.codegraph.dto.extraction.RawEntity;
import com.architecture.memory.codegraph.dto.extraction.RawEntityKind;
import com.architecture.memory.codegraph.dto.extraction.RawRelationship;
import com.architecture.memory.codegraph.dto.extraction.RawRelationshipKind;
import com.architecture.memory.codegraph.dto.extraction.SourceLocation;
import com.architecture.memory.codegraph.model.graph.ParameterKind;
import com.architecture.memory.codegraph.repository.graph.GraphStore;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for extraction payloads and a fully wired {@link GraphBuilder} used across test packages.
 */
public final class GraphFixtures {

    private GraphFixtures() {
    }

    public static GraphBuilder graphBuilder(GraphStore store, CodeGraphProperties properties) {
        CanonicalIdGenerator ids = new CanonicalIdGenerator();
        return new GraphBuilder(store, new ExtractionValidator(ids), new ModuleSubgraphAssembler(ids),
                new ModuleLinker(new CallSiteResolver(properties), ids), ids);
    }

    public static GraphBuilder graphBuilder(GraphStore store) {
        return graphBuilder(store, new CodeGraphProperties());
    }

    // ========== ENTITIES ==========

    public static RawEntity module(String qualifiedName, String path) {
        return RawEntity.builder()
                .kind(RawEntityKind.MODULE)
                .name(lastSegment(qualifiedName))
                .qualifiedName(qualifiedName)
                .path(path)
                .location(SourceLocation.builder().file(path).line(1).column(0).build())
                .build();
    }

    public static RawEntity classEntity(String qualifiedName, String parent) {
        return RawEntity.builder()
                .kind(RawEntityKind.CLASS)
                .name(lastSegment(qualifiedName))
                .qualifiedName(qualifiedName)
                .parent(parent)
                .build();
    }

    public static RawEntity function(String qualifiedName, String parent) {
        return RawEntity.builder()
                .kind(RawEntityKind.FUNCTION)
                .name(lastSegment(qualifiedName))
                .qualifiedName(qualifiedName)
                .parent(parent)
                .build();
    }

    public static RawEntity function(String qualifiedName, String parent, String returnType) {
        RawEntity entity = function(qualifiedName, parent);
        entity.setReturnType(returnType);
        return entity;
    }

    public static RawEntity privateFunction(String qualifiedName, String parent) {
        RawEntity entity = function(qualifiedName, parent);
        entity.setVisibility("private");
        return entity;
    }

    public static RawEntity parameter(String functionQualifiedName, String name, int position) {
        return RawEntity.builder()
                .kind(RawEntityKind.PARAMETER)
                .name(name)
                .qualifiedName(functionQualifiedName + "." + name)
                .parent(functionQualifiedName)
                .position(position)
                .build();
    }

    public static RawEntity parameter(String functionQualifiedName, String name, int position, String typeAnnotation) {
        RawEntity entity = parameter(functionQualifiedName, name, position);
        entity.setTypeAnnotation(typeAnnotation);
        return entity;
    }

    public static RawEntity parameterWithDefault(String functionQualifiedName, String name, int position) {
        RawEntity entity = parameter(functionQualifiedName, name, position);
        entity.setHasDefault(true);
        return entity;
    }

    public static RawEntity variadic(String functionQualifiedName, String name, int position, ParameterKind kind) {
        RawEntity entity = parameter(functionQualifiedName, name, position);
        entity.setParameterKind(kind);
        return entity;
    }

    public static RawEntity variable(String qualifiedName, String parent, String typeAnnotation) {
        return RawEntity.builder()
                .kind(RawEntityKind.VARIABLE)
                .name(lastSegment(qualifiedName))
                .qualifiedName(qualifiedName)
                .parent(parent)
                .typeAnnotation(typeAnnotation)
                .build();
    }

    // ========== RELATIONSHIPS ==========

    public static RawRelationship call(String from, String callee, int argCount, int line) {
        return RawRelationship.builder()
                .kind(RawRelationshipKind.CALLS)
                .from(from)
                .to(callee)
                .argCount(argCount)
                .location(SourceLocation.builder().file(fileOf(from)).line(line).column(4).build())
                .build();
    }

    public static RawRelationship callWithTypes(String from, String callee, int line, String... argTypes) {
        RawRelationship call = call(from, callee, argTypes.length, line);
        call.setArgTypes(new ArrayList<>(Arrays.asList(argTypes)));
        return call;
    }

    public static RawRelationship callWithKeywords(String from, String callee, int argCount, int line, String... keywords) {
        RawRelationship call = call(from, callee, argCount, line);
        call.setKeywordNames(new ArrayList<>(Arrays.asList(keywords)));
        return call;
    }

    public static RawRelationship inherits(String from, String base) {
        return relationship(RawRelationshipKind.INHERITS, from, base);
    }

    public static RawRelationship imports(String fromModule, String target) {
        return relationship(RawRelationshipKind.IMPORTS, fromModule, target);
    }

    public static RawRelationship importsAs(String fromModule, String target, String alias) {
        RawRelationship relationship = imports(fromModule, target);
        relationship.setAlias(alias);
        return relationship;
    }

    public static RawRelationship assigns(String from, String target, String observedType) {
        RawRelationship relationship = relationship(RawRelationshipKind.ASSIGNS_TO, from, target);
        relationship.setObservedType(observedType);
        return relationship;
    }

    public static RawRelationship relationship(RawRelationshipKind kind, String from, String to) {
        return RawRelationship.builder().kind(kind).from(from).to(to).build();
    }

    // ========== PAYLOADS ==========

    public static ExtractionPayload payload(String moduleId, List<RawEntity> entities, List<RawRelationship> relationships) {
        return ExtractionPayload.builder()
                .moduleId(moduleId)
                .entities(new ArrayList<>(entities))
                .relationships(new ArrayList<>(relationships))
                .build();
    }

    private static String lastSegment(String qualifiedName) {
        return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
    }

    private static String fileOf(String qualifiedName) {
        int dot = qualifiedName.indexOf('.');
        return (dot >= 0 ? qualifiedName.substring(0, dot) : qualifiedName) + ".py";
    }
}
