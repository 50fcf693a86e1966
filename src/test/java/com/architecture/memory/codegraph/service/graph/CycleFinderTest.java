package com.architecture.memory.codegraph.service.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CycleFinderTest {

    @Test
    void acyclicGraph_hasNoCycles() {
        assertThat(CycleFinder.findCycles(Map.of("a", Set.of("b"), "b", Set.of("c")))).isEmpty();
    }

    @Test
    void cycle_startsAtSmallestId() {
        List<List<String>> cycles = CycleFinder.findCycles(Map.of(
                "c", Set.of("a"),
                "a", Set.of("b"),
                "b", Set.of("c")));

        assertThat(cycles).containsExactly(List.of("a", "b", "c"));
    }

    @Test
    void selfLoop_isCycleOfOne() {
        assertThat(CycleFinder.findCycles(Map.of("f", Set.of("f")))).containsExactly(List.of("f"));
    }
}
