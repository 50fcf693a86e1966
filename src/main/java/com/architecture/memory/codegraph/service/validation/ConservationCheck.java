package com.architecture.memory.codegraph.service.validation;

import com.architecture.memory.codegraph.dto.validation.ConservationLaw;
import com.architecture.memory.codegraph.dto.validation.Violation;
import com.architecture.memory.codegraph.model.graph.GraphNode;

import java.util.List;

/**
 * One conservation law, evaluated node by node. A check may read anything in the context's view
 * but only reports violations anchored on {@code anchor}, which keeps incremental and full runs
 * consistent with each other.
 */
public interface ConservationCheck {

    ConservationLaw getLaw();

    void check(ValidationContext context, GraphNode anchor, List<Violation> violations);
}
