package com.blueprint.depgraph.model;

import java.util.List;

/**
 * Structural findings of the validator. Neither a disconnected graph nor a
 * cycle is an error; both are reported here for the caller to act on.
 *
 * @param connected      true iff exactly one component covers all nodes
 * @param numComponents  number of weakly connected components
 * @param componentSizes component sizes in discovery order
 * @param cycles         each cycle as the ordered edges forming it
 */
public record CheckResults(boolean connected, int numComponents, List<Integer> componentSizes,
        List<List<GraphEdge>> cycles) {

    public CheckResults {
        componentSizes = List.copyOf(componentSizes);
        cycles = cycles.stream().map(List::copyOf).toList();
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }
}
