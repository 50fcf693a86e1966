package com.architecture.memory.codegraph.dto.validation;

public enum ConservationLaw {
    SIGNATURE_CONSERVATION,
    REFERENCE_INTEGRITY,
    DATA_FLOW_CONSISTENCY,
    STRUCTURAL_INTEGRITY
}
