package com.blueprint.depgraph.model;

import com.blueprint.depgraph.api.Declaration;
import com.blueprint.depgraph.api.NodeShape;
import com.blueprint.depgraph.api.NodeStatus;

/**
 * A node in the dependency graph arena.
 *
 * <p>
 * Identity ({@link #index()}, {@link #id()}) is fixed at build time. Status and
 * layout fields are derived and filled in place by later pipeline stages; until
 * then {@link #status()} is {@code null}, {@link #layer()} is {@code -1} and
 * coordinates are {@code NaN}.
 *
 * <p>
 * {@link #x()} and {@link #y()} denote the top-left corner of the node's
 * bounding box.
 */
public final class GraphNode {
    private final int index;
    private final Declaration declaration;
    private final NodeShape shape;

    private NodeStatus status;

    private int layer = -1;
    private int order = -1;
    private double x = Double.NaN;
    private double y = Double.NaN;
    private double width = Double.NaN;
    private double height = Double.NaN;

    public GraphNode(int index, Declaration declaration) {
        if (declaration == null || declaration.getId() == null)
            throw new IllegalArgumentException("Declaration with id required");
        this.index = index;
        this.declaration = declaration;
        this.shape = declaration.resolvedShape();
    }

    public int index() {
        return index;
    }

    public String id() {
        return declaration.getId();
    }

    public String label() {
        return declaration.displayLabel();
    }

    public NodeShape shape() {
        return shape;
    }

    public Declaration declaration() {
        return declaration;
    }

    public NodeStatus status() {
        return status;
    }

    public void setStatus(NodeStatus status) {
        this.status = status;
    }

    public int layer() {
        return layer;
    }

    public int order() {
        return order;
    }

    public void setRank(int layer, int order) {
        this.layer = layer;
        this.order = order;
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public double width() {
        return width;
    }

    public double height() {
        return height;
    }

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }

    public void setBounds(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public boolean hasLayout() {
        return !Double.isNaN(x);
    }

    @Override
    public String toString() {
        return "GraphNode[" + id() + ", " + status + "]";
    }
}
