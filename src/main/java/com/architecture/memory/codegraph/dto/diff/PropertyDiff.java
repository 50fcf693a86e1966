package com.architecture.memory.codegraph.dto.diff;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One property that differs between two versions of a node or edge. For list-valued properties
 * {@code added} and {@code removed} hold the elements that appeared or disappeared.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertyDiff {
    private String property;
    private Object oldValue;
    private Object newValue;
    private List<String> added;
    private List<String> removed;
}
