package com.architecture.memory.codegraph.dto.query;

import com.architecture.memory.codegraph.dto.validation.ParameterSpec;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A function with its parameters in position order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunctionSignature {
    private String functionId;
    private String qualifiedName;
    private String returnType;
    private String visibility;
    private List<ParameterSpec> parameters;

    /**
     * Renders as {@code name(a: int, b=...) -> str}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder(qualifiedName).append('(');
        for (int i = 0; i < parameters.size(); i++) {
            ParameterSpec p = parameters.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(p.getKind().prefix()).append(p.getName());
            if (p.getTypeAnnotation() != null) {
                sb.append(": ").append(p.getTypeAnnotation());
            }
            if (p.isHasDefault()) {
                sb.append("=...");
            }
        }
        sb.append(')');
        if (returnType != null) {
            sb.append(" -> ").append(returnType);
        }
        return sb.toString();
    }
}
