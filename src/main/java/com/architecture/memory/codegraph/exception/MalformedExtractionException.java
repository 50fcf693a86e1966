package com.architecture.memory.codegraph.exception;

import java.util.List;

/**
 * Extraction payload rejected by the builder. Only the named module's update is aborted.
 */
public class MalformedExtractionException extends CodeGraphException {

    private final String moduleId;
    private final List<String> problems;

    public MalformedExtractionException(String moduleId, List<String> problems) {
        super("Malformed extraction for module " + moduleId + ": " + String.join("; ", problems));
        this.moduleId = moduleId;
        this.problems = List.copyOf(problems);
    }

    public String getModuleId() {
        return moduleId;
    }

    public List<String> getProblems() {
        return problems;
    }
}
