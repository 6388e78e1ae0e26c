package com.blueprint.depgraph.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The logical dependency graph: a node arena indexed by integer, an edge list,
 * and the id and label lookup tables used to resolve references.
 *
 * <p>
 * Instances are produced by {@code GraphBuilder} and satisfy two invariants:
 * every edge endpoint is a node of this graph, and no two edges share the same
 * (source, target, kind) triple. Node and edge identity never changes after
 * build; later stages only fill in derived fields.
 */
public final class DependencyGraph {
    private final List<GraphNode> nodes;
    private final List<GraphEdge> edges;
    private final Map<String, Integer> idToIndex;
    private final Map<String, Integer> labelToIndex;
    private final Adjacency adjacency;

    public DependencyGraph(List<GraphNode> nodes, List<GraphEdge> edges, Map<String, Integer> idToIndex,
            Map<String, Integer> labelToIndex) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.edges = Collections.unmodifiableList(edges);
        this.idToIndex = Collections.unmodifiableMap(idToIndex);
        this.labelToIndex = Collections.unmodifiableMap(labelToIndex);

        int[] from = new int[edges.size()];
        int[] to = new int[edges.size()];
        for (int e = 0; e < edges.size(); e++) {
            GraphEdge edge = edges.get(e);
            if (edge.index() != e)
                throw new IllegalArgumentException("Edge index mismatch at " + e + ": " + edge);
            from[e] = edge.sourceIndex();
            to[e] = edge.targetIndex();
        }
        this.adjacency = Adjacency.of(nodes.size(), from, to);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public GraphNode node(int index) {
        return nodes.get(index);
    }

    public GraphEdge edge(int index) {
        return edges.get(index);
    }

    public List<GraphNode> nodes() {
        return nodes;
    }

    public List<GraphEdge> edges() {
        return edges;
    }

    public Adjacency adjacency() {
        return adjacency;
    }

    public boolean contains(String id) {
        return idToIndex.containsKey(id);
    }

    /** Resolves a node id to its arena index. */
    public int indexOf(String id) {
        Integer idx = idToIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return idx;
    }

    public GraphNode node(String id) {
        return nodes.get(indexOf(id));
    }

    /** Secondary label lookup; {@code -1} when the label is unknown. */
    public int indexOfLabel(String label) {
        return labelToIndex.getOrDefault(label, -1);
    }
}
