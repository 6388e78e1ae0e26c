package com.blueprint.depgraph.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.blueprint.depgraph.api.NodeStatus;

/** Number of nodes per status; the counts always sum to the node count. */
public final class StatusCounts {
    private final EnumMap<NodeStatus, Integer> counts = new EnumMap<>(NodeStatus.class);
    private final int total;

    private StatusCounts(int total) {
        this.total = total;
        for (NodeStatus s : NodeStatus.values())
            counts.put(s, 0);
    }

    /** Tallies the resolved statuses; nodes without status count as not ready. */
    public static StatusCounts of(DependencyGraph graph) {
        StatusCounts sc = new StatusCounts(graph.nodeCount());
        for (GraphNode node : graph.nodes()) {
            NodeStatus s = node.status() != null ? node.status() : NodeStatus.NOT_READY;
            sc.counts.merge(s, 1, Integer::sum);
        }
        return sc;
    }

    public int get(NodeStatus status) {
        return counts.get(status);
    }

    public int total() {
        return total;
    }

    public Map<NodeStatus, Integer> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    @Override
    public String toString() {
        return "StatusCounts" + counts + " total=" + total;
    }
}
