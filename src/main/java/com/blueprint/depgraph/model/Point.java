package com.blueprint.depgraph.model;

/** Immutable 2D point in layout coordinates (y grows downwards). */
public record Point(double x, double y) {

    public Point plus(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }

    public Point minus(Point o) {
        return new Point(x - o.x, y - o.y);
    }

    public double distance(Point o) {
        return Math.hypot(x - o.x, y - o.y);
    }
}
