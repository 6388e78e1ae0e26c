package com.blueprint.depgraph.model;

import java.util.List;

import com.blueprint.depgraph.api.EdgeKind;

/**
 * A dependency edge: {@code source} uses {@code target}.
 *
 * <p>
 * The logical direction never changes. {@link #reversed()} only records that
 * the layout drew this edge against the layer direction to break a cycle;
 * {@link #points()} holds the routed cubic curve, ordered from source to
 * target, as {@code 3k + 1} points (start, then control, control, end per
 * segment).
 */
public final class GraphEdge {
    private final int index;
    private final int sourceIndex;
    private final int targetIndex;
    private final String source;
    private final String target;
    private final EdgeKind kind;

    private boolean reversed;
    private List<Point> points;

    public GraphEdge(int index, int sourceIndex, String source, int targetIndex, String target, EdgeKind kind) {
        this.index = index;
        this.sourceIndex = sourceIndex;
        this.targetIndex = targetIndex;
        this.source = source;
        this.target = target;
        this.kind = kind;
    }

    public int index() {
        return index;
    }

    public int sourceIndex() {
        return sourceIndex;
    }

    public int targetIndex() {
        return targetIndex;
    }

    public String source() {
        return source;
    }

    public String target() {
        return target;
    }

    public EdgeKind kind() {
        return kind;
    }

    public boolean reversed() {
        return reversed;
    }

    public List<Point> points() {
        return points;
    }

    public void setRoute(boolean reversed, List<Point> points) {
        this.reversed = reversed;
        this.points = List.copyOf(points);
    }

    @Override
    public String toString() {
        return source + " -" + kind.jsonName() + "-> " + target;
    }
}
