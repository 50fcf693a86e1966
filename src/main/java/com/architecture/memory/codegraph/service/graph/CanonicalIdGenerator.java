package com.architecture.memory.codegraph.service.graph;

import com.architecture.memory.codegraph.dto.extraction.SourceLocation;
import com.architecture.memory.codegraph.model.graph.NodeKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Generates stable, deterministic canonical ids for graph nodes.
 *
 * Canonical ids are:
 * - Deterministic: the same logical entity always produces the same id
 * - Stable: unchanged when the entity moves inside its file, so a moved function is modified, not re-added
 * - Readable: the qualified name is part of the id
 *
 * Format Rules:
 * - Module, Class, Function, Variable, Parameter: {kind}:{qualifiedName}
 * - Type (derived from annotation text): type:{moduleQualifiedName}/{normalizedAnnotation}
 * - CallSite: callsite:{callerQualifiedName}@{line}:{column}; callsite:{callerQualifiedName}@{line}#{ordinal}
 *   when the extractor reports no column; callsite:{callerQualifiedName}#{ordinal} when it reports no line
 * - Placeholder for a name that matches no node yet: unresolved:{qualifiedName}
 *
 * Edges carry no id of their own: they are keyed by (sourceId, kind, targetId).
 */
@Component
@Slf4j
public class CanonicalIdGenerator {

    public static final String PLACEHOLDER_PREFIX = "unresolved:";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Generate canonical id for an entity node.
     * Format: {kind}:{qualifiedName}
     */
    public String nodeId(NodeKind kind, String qualifiedName) {
        if (kind == null || qualifiedName == null || qualifiedName.isBlank()) {
            log.warn("Cannot generate canonical id for {} with blank qualified name", kind);
            return (kind != null ? kind.getIdPrefix() : "node") + ":unknown";
        }
        return kind.getIdPrefix() + ":" + qualifiedName.trim();
    }

    public String moduleId(String moduleQualifiedName) {
        return nodeId(NodeKind.MODULE, moduleQualifiedName);
    }

    /**
     * Generate canonical id for a module-scoped Type node derived from annotation text.
     * Format: type:{moduleQualifiedName}/{annotation}
     */
    public String typeId(String moduleQualifiedName, String annotation) {
        return NodeKind.TYPE.getIdPrefix() + ":" + moduleQualifiedName + "/" + normalizeAnnotation(annotation);
    }

    /**
     * Generate canonical id for a CallSite node.
     * The ordinal counts calls of the same caller that share the missing part of the location.
     */
    public String callSiteId(String callerQualifiedName, SourceLocation location, int ordinal) {
        String prefix = NodeKind.CALL_SITE.getIdPrefix() + ":" + callerQualifiedName;
        if (location == null || location.getLine() == null) {
            return prefix + "#" + ordinal;
        }
        return location.getColumn() != null
                ? prefix + "@" + location.getLine() + ":" + location.getColumn()
                : prefix + "@" + location.getLine() + "#" + ordinal;
    }

    public String placeholderId(String qualifiedName) {
        return PLACEHOLDER_PREFIX + qualifiedName;
    }

    public boolean isPlaceholder(String id) {
        return id != null && id.startsWith(PLACEHOLDER_PREFIX);
    }

    /**
     * Collapses whitespace so that {@code Dict[str,  int]} and {@code Dict[str, int]} share one Type node.
     */
    public String normalizeAnnotation(String annotation) {
        if (annotation == null) {
            return "";
        }
        return WHITESPACE.matcher(annotation.trim()).replaceAll(" ").replace(", ", ",").replace(",", ", ");
    }
}
