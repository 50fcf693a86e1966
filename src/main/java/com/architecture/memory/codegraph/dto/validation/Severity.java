package com.architecture.memory.codegraph.dto.validation;

public enum Severity {
    ERROR,
    WARNING,
    INFO;

    public static Severity parse(String value, Severity fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return Severity.valueOf(value.trim().toUpperCase());
    }
}
