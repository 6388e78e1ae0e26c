package com.blueprint.depgraph.util;

import com.blueprint.depgraph.api.EdgeKind;
import com.blueprint.depgraph.model.Adjacency;
import com.blueprint.depgraph.model.DependencyGraph;
import com.blueprint.depgraph.model.GraphEdge;
import com.blueprint.depgraph.model.GraphNode;

/**
 * Diagnostic utility for inspecting graph state and topology.
 *
 * <p>
 * This class generates human-readable string representations of the graph
 * structure and the derived state (status, layer) of specific nodes.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging errors, or
 * "toString()" style diagnostics. Allocates freely.
 */
public final class GraphExplain {
    private final DependencyGraph graph;
    private final Adjacency adj;

    public GraphExplain(DependencyGraph graph) {
        if (graph == null)
            throw new IllegalArgumentException("Null graph");
        this.graph = graph;
        this.adj = graph.adjacency();
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(String id) {
        int idx = graph.indexOf(id);
        GraphNode node = graph.node(idx);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(id).append('\n')
                .append("  Index: ").append(idx).append('\n')
                .append("  Label: ").append(node.label()).append('\n')
                .append("  Shape: ").append(node.shape().jsonName()).append('\n')
                .append("  Status: ").append(node.status() == null ? "-" : node.status().jsonName()).append('\n')
                .append("  Layer: ").append(node.layer()).append('\n');
        int out = adj.outDegree(idx);
        sb.append("  Uses (").append(out).append("): ");
        appendNeighbours(sb, idx, true);
        sb.append('\n');
        int in = adj.inDegree(idx);
        sb.append("  Used by (").append(in).append("): ");
        appendNeighbours(sb, idx, false);
        return sb.append('\n').toString();
    }

    /**
     * Dumps the entire graph in an indented text format.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.nodeCount()).append(" nodes, ").append(graph.edgeCount())
                .append(" edges):\n");
        for (int i = 0; i < graph.nodeCount(); i++) {
            GraphNode node = graph.node(i);
            sb.append("  [").append(i).append("] ").append(node.id());
            if (node.status() != null)
                sb.append(" (").append(node.status().jsonName()).append(')');
            if (node.layer() >= 0)
                sb.append(" L").append(node.layer());
            if (adj.outDegree(i) > 0) {
                sb.append(" -> ");
                appendNeighbours(sb, i, true);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram.
     * <p>
     * Nodes are keyed by index ({@code n0, n1, ...}) and show their label, so
     * distinct ids never collide. Statement edges are dashed, proof edges
     * solid. Nodes carry their status as a class so a stylesheet can colour
     * them.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes in index order
        for (GraphNode node : graph.nodes()) {
            String safeName = mermaidId(node.index());
            String label = node.label().replace("\"", "'");
            switch (node.shape()) {
                case BOX -> sb.append("  ").append(safeName).append("[\"").append(label).append("\"]");
                case ELLIPSE -> sb.append("  ").append(safeName).append("([\"").append(label).append("\"])");
            }
            if (node.status() != null)
                sb.append(":::").append(node.status().jsonName());
            sb.append(";\n");
        }

        // 2. Declare all edges afterwards
        for (GraphEdge edge : graph.edges()) {
            String arrow = edge.kind() == EdgeKind.STATEMENT ? " -.-> " : " --> ";
            sb.append("  ").append(mermaidId(edge.sourceIndex())).append(arrow).append(mermaidId(edge.targetIndex()))
                    .append(";\n");
        }
        return sb.toString();
    }

    private void appendNeighbours(StringBuilder sb, int v, boolean outgoing) {
        int n = outgoing ? adj.outDegree(v) : adj.inDegree(v);
        for (int j = 0; j < n; j++) {
            int e = outgoing ? adj.outEdge(v, j) : adj.inEdge(v, j);
            sb.append(graph.node(adj.opposite(e, v)).id());
            if (j < n - 1)
                sb.append(", ");
        }
    }

    static String mermaidId(int index) {
        return "n" + index;
    }
}
