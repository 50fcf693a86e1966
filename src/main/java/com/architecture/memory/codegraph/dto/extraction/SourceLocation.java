package com.architecture.memory.codegraph.dto.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceLocation {

    private String file;
    private Integer line;
    private Integer column;

    /**
     * Renders as {@code file:line:column}, omitting missing parts.
     */
    public String format() {
        StringBuilder sb = new StringBuilder(file != null ? file : "");
        if (line != null) {
            sb.append(':').append(line);
            if (column != null) {
                sb.append(':').append(column);
            }
        }
        return sb.toString();
    }
}
