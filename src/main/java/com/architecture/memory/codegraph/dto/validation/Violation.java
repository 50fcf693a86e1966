package com.architecture.memory.codegraph.dto.validation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One broken conservation law. Violations are results, never thrown.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Violation {

    public static final Comparator<Violation> ORDER = Comparator
            .comparing(Violation::getSeverity)
            .thenComparing(Violation::getLaw)
            .thenComparing(Violation::getType)
            .thenComparing(Violation::getAnchorId)
            .thenComparing(v -> String.join(",", v.getEntityIds()));

    private ConservationLaw law;
    private ViolationType type;
    private Severity severity;

    // Node the check was evaluated on; decides membership in an incremental run
    private String anchorId;

    @Builder.Default
    private List<String> entityIds = new ArrayList<>();
    private String message;
    private String location;
    private String suggestedFix;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    public String getCode() {
        return type != null ? type.getCode() : null;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
