package com.architecture.memory.codegraph.dto.validation;

/**
 * Kinds of conservation-law violations, each belonging to one law.
 */
public enum ViolationType {
    SIGNATURE_MISMATCH("signature_mismatch", ConservationLaw.SIGNATURE_CONSERVATION),
    VISIBILITY_VIOLATION("visibility_violation", ConservationLaw.SIGNATURE_CONSERVATION),
    DANGLING_REFERENCE("dangling_reference", ConservationLaw.REFERENCE_INTEGRITY),
    UNRESOLVED_REFERENCE("unresolved_reference", ConservationLaw.REFERENCE_INTEGRITY),
    AMBIGUOUS_REFERENCE("ambiguous_reference", ConservationLaw.REFERENCE_INTEGRITY),
    TYPE_MISMATCH("type_mismatch", ConservationLaw.DATA_FLOW_CONSISTENCY),
    MISSING_ANNOTATION("missing_annotation", ConservationLaw.DATA_FLOW_CONSISTENCY),
    PARAMETER_POSITION_GAP("parameter_position_gap", ConservationLaw.STRUCTURAL_INTEGRITY),
    PARAMETER_OWNERSHIP("parameter_ownership", ConservationLaw.STRUCTURAL_INTEGRITY),
    CIRCULAR_INHERITANCE("circular_inheritance", ConservationLaw.STRUCTURAL_INTEGRITY),
    ORPHAN_NODE("orphan_node", ConservationLaw.STRUCTURAL_INTEGRITY);

    private final String code;
    private final ConservationLaw law;

    ViolationType(String code, ConservationLaw law) {
        this.code = code;
        this.law = law;
    }

    public String getCode() {
        return code;
    }

    public ConservationLaw getLaw() {
        return law;
    }
}
