package com.architecture.memory.codegraph.dto.validation;

public enum ValidationMode {
    FULL,
    INCREMENTAL
}
