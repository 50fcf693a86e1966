package com.architecture.memory.codegraph.dto.query;

import com.architecture.memory.codegraph.dto.validation.ProposedChange;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Who is affected if an entity changes. Read-only: nothing is validated or applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpactAnalysis {
    private String entityId;
    private ProposedChange.ChangeKind changeKind;
    private List<CallRelation> affectedCallers;
    private List<EntityReference> affectedReferences;

    // DELETE only: edges touching the entity, by edge kind
    private Map<String, Long> connectionsByKind;

    public int getAffectedCount() {
        return (affectedCallers != null ? affectedCallers.size() : 0)
                + (affectedReferences != null ? affectedReferences.size() : 0);
    }
}
