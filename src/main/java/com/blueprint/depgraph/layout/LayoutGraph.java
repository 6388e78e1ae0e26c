package com.blueprint.depgraph.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.blueprint.depgraph.api.NodeShape;
import com.blueprint.depgraph.model.Adjacency;
import com.blueprint.depgraph.model.DependencyGraph;
import com.blueprint.depgraph.model.GraphEdge;
import com.blueprint.depgraph.model.GraphNode;
import com.blueprint.depgraph.model.Point;

/**
 * Layout-only view of a {@link DependencyGraph}.
 *
 * <p>
 * Shares node and edge indices with the logical graph but owns its own edge
 * directions, so cycle breaking can reverse edges here without touching the
 * graph used for status and validation. Also holds the working state of the
 * layout stages: layers, in-layer order, node centres and sizes, and routes.
 * {@link #applyTo()} copies the results back into the logical graph.
 */
public final class LayoutGraph {
    private final DependencyGraph graph;
    private final int[] from;
    private final int[] to;
    private final boolean[] reversed;
    private final boolean[] loop;
    private Adjacency adjacency;

    private int[] layer;
    private List<List<Integer>> layers = List.of();

    private final double[] cx;
    private final double[] cy;
    private final double[] width;
    private final double[] height;

    private final List<List<Point>> routes;

    LayoutGraph(DependencyGraph graph) {
        this.graph = graph;
        int n = graph.nodeCount();
        int m = graph.edgeCount();
        this.from = new int[m];
        this.to = new int[m];
        this.reversed = new boolean[m];
        this.loop = new boolean[m];
        for (int e = 0; e < m; e++) {
            GraphEdge edge = graph.edge(e);
            from[e] = edge.sourceIndex();
            to[e] = edge.targetIndex();
            loop[e] = from[e] == to[e];
        }
        this.cx = new double[n];
        this.cy = new double[n];
        this.width = new double[n];
        this.height = new double[n];
        this.routes = new ArrayList<>(m);
        for (int e = 0; e < m; e++)
            routes.add(null);
    }

    public DependencyGraph graph() {
        return graph;
    }

    public int nodeCount() {
        return graph.nodeCount();
    }

    public int edgeCount() {
        return from.length;
    }

    /** Layout-direction tail of an edge. */
    public int from(int e) {
        return from[e];
    }

    /** Layout-direction head of an edge. */
    public int to(int e) {
        return to[e];
    }

    public boolean isReversed(int e) {
        return reversed[e];
    }

    /** Self loops take no part in cycle breaking, layering or ordering. */
    public boolean isLoop(int e) {
        return loop[e];
    }

    boolean[] loops() {
        return loop;
    }

    /** Flips the layout direction of an edge and toggles its reversed flag. */
    void reverse(int e) {
        int t = from[e];
        from[e] = to[e];
        to[e] = t;
        reversed[e] = !reversed[e];
        adjacency = null;
    }

    /** Index over the current layout directions. */
    public Adjacency adjacency() {
        if (adjacency == null)
            adjacency = Adjacency.of(nodeCount(), from, to);
        return adjacency;
    }

    public int layer(int v) {
        return layer[v];
    }

    void setLayers(int[] layerOf, List<List<Integer>> layers) {
        this.layer = layerOf;
        this.layers = layers;
    }

    /** Node indices per layer, in current in-layer order. */
    public List<List<Integer>> layers() {
        return layers;
    }

    public int layerCount() {
        return layers.size();
    }

    public boolean isLayered() {
        return layer != null;
    }

    public NodeShape shape(int v) {
        return graph.node(v).shape();
    }

    public double centerX(int v) {
        return cx[v];
    }

    public double centerY(int v) {
        return cy[v];
    }

    public double width(int v) {
        return width[v];
    }

    public double height(int v) {
        return height[v];
    }

    void setCenter(int v, double x, double y) {
        cx[v] = x;
        cy[v] = y;
    }

    void setSize(int v, double w, double h) {
        width[v] = w;
        height[v] = h;
    }

    public Point center(int v) {
        return new Point(cx[v], cy[v]);
    }

    public List<Point> route(int e) {
        return routes.get(e);
    }

    void setRoute(int e, List<Point> points) {
        routes.set(e, points);
    }

    /** Bounding box extent including the right and bottom padding. */
    public double totalWidth(double padding) {
        double max = 0;
        for (int v = 0; v < nodeCount(); v++)
            max = Math.max(max, cx[v] + width[v] / 2);
        return nodeCount() == 0 ? 2 * padding : max + padding;
    }

    public double totalHeight(double padding) {
        double max = 0;
        for (int v = 0; v < nodeCount(); v++)
            max = Math.max(max, cy[v] + height[v] / 2);
        return nodeCount() == 0 ? 2 * padding : max + padding;
    }

    /**
     * Writes layer, order, bounds, reversed flags and routes into the logical
     * graph. Routes are stored in logical direction.
     */
    public void applyTo() {
        for (int i = 0; i < layers.size(); i++) {
            List<Integer> row = layers.get(i);
            for (int pos = 0; pos < row.size(); pos++) {
                int v = row.get(pos);
                GraphNode node = graph.node(v);
                node.setRank(i, pos);
                node.setBounds(cx[v] - width[v] / 2, cy[v] - height[v] / 2, width[v], height[v]);
            }
        }
        for (int e = 0; e < edgeCount(); e++) {
            List<Point> pts = routes.get(e);
            if (pts == null)
                throw new IllegalStateException("Edge " + graph.edge(e) + " has not been routed");
            if (reversed[e]) {
                List<Point> logical = new ArrayList<>(pts);
                Collections.reverse(logical);
                pts = logical;
            }
            graph.edge(e).setRoute(reversed[e], pts);
        }
    }
}
