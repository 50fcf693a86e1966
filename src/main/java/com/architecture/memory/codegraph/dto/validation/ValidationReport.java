package com.architecture.memory.codegraph.dto.validation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Complete result of one validation run. A report is only ever produced for a run that finished.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {

    private ValidationMode mode;
    private long graphVersion;
    private int scopeSize;
    private long durationMs;

    @Builder.Default
    private List<Violation> violations = new ArrayList<>();

    private Map<Severity, Long> countsBySeverity;
    private Map<ConservationLaw, Long> countsByLaw;
    private Map<String, Long> countsByType;

    public boolean isValid() {
        return violations.stream().noneMatch(Violation::isError);
    }

    public long getErrorCount() {
        return violations.stream().filter(v -> v.getSeverity() == Severity.ERROR).count();
    }

    public long getWarningCount() {
        return violations.stream().filter(v -> v.getSeverity() == Severity.WARNING).count();
    }

    public List<Violation> violationsOfType(ViolationType type) {
        return violations.stream().filter(v -> v.getType() == type).collect(Collectors.toList());
    }

    public List<Violation> violationsOfLaw(ConservationLaw law) {
        return violations.stream().filter(v -> v.getLaw() == law).collect(Collectors.toList());
    }
}
