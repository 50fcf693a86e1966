package com.architecture.memory.codegraph.dto.validation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * An edit an agent intends to make, checked against the current graph before it is applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposedChange {

    public enum ChangeKind {
        DELETE,
        MODIFY_SIGNATURE,
        CHANGE_VISIBILITY
    }

    private String entityId;
    private ChangeKind kind;

    // MODIFY_SIGNATURE: the new parameter list in declaration order
    private List<ParameterSpec> parameters;

    // CHANGE_VISIBILITY: public | private
    private String visibility;
}
