package com.architecture.memory.codegraph.service.validation;

import com.architecture.memory.codegraph.model.graph.GraphState;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Per-run state handed to every check: the consistent graph view plus results of whole-graph
 * computations that several anchors share (inheritance cycles, ownership reachability).
 */
public final class ValidationContext {

    private final GraphState view;
    private final Map<String, Object> memo = new HashMap<>();

    public ValidationContext(GraphState view) {
        this.view = view;
    }

    public GraphState getView() {
        return view;
    }

    @SuppressWarnings("unchecked")
    <T> T memo(String key, Supplier<T> supplier) {
        Object value = memo.get(key);
        if (value == null) {
            value = supplier.get();
            memo.put(key, value);
        }
        return (T) value;
    }
}
