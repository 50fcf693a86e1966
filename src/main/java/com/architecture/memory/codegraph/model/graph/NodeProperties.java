package com.architecture.memory.codegraph.model.graph;

/**
 * Property keys stored on graph nodes and edges.
 */
public final class NodeProperties {

    // Common
    public static final String NAME = "name";
    public static final String QUALIFIED_NAME = "qualifiedName";
    public static final String LOCATION = "location";
    public static final String VISIBILITY = "visibility";
    public static final String DECORATORS = "decorators";
    public static final String TYPE_ANNOTATION = "typeAnnotation";

    // Module
    public static final String PATH = "path";

    // Function
    public static final String RETURN_TYPE = "returnType";
    public static final String PARAMETERS = "parameters";

    // Parameter
    public static final String POSITION = "position";
    public static final String PARAMETER_KIND = "parameterKind";
    public static final String HAS_DEFAULT = "hasDefault";

    // CallSite
    public static final String CALLEE_NAME = "calleeName";
    public static final String ARG_COUNT = "argCount";
    public static final String KEYWORD_NAMES = "keywordNames";
    public static final String ARG_TYPES = "argTypes";
    public static final String RESOLUTION_STATUS = "resolutionStatus";
    public static final String CANDIDATES = "candidates";

    // Edges
    public static final String ALIAS = "alias";
    public static final String TARGET_QUALIFIED_NAME = "targetQualifiedName";
    public static final String ACCESS_KIND = "accessKind";
    public static final String OBSERVED_TYPE = "observedType";

    public static final String VISIBILITY_PUBLIC = "public";
    public static final String VISIBILITY_PRIVATE = "private";
    public static final String WILDCARD_ALIAS = "*";

    private NodeProperties() {
    }
}
