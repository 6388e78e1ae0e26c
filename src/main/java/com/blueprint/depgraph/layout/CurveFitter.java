package com.blueprint.depgraph.layout;

import java.util.ArrayList;
import java.util.List;

import com.blueprint.depgraph.model.Point;

/**
 * Converts polylines into piecewise cubic Bezier curves.
 *
 * <p>
 * Output is always {@code 3k + 1} points: the start point, then per segment
 * two control points and the segment end point.
 */
final class CurveFitter {

    private CurveFitter() {
        // Utility class
    }

    /**
     * Uniform Catmull-Rom spline through every polyline vertex, expressed as
     * cubic Bezier segments. The end tangents use the duplicated end points.
     */
    static List<Point> catmullRom(List<Point> poly) {
        if (poly.size() < 2)
            throw new IllegalArgumentException("Polyline needs at least two points: " + poly);
        if (poly.size() == 2)
            return straight(poly.get(0), poly.get(1));
        List<Point> out = new ArrayList<>(3 * (poly.size() - 1) + 1);
        out.add(poly.get(0));
        int last = poly.size() - 1;
        for (int i = 0; i < last; i++) {
            Point p0 = poly.get(Math.max(i - 1, 0));
            Point p1 = poly.get(i);
            Point p2 = poly.get(i + 1);
            Point p3 = poly.get(Math.min(i + 2, last));
            out.add(new Point(p1.x() + (p2.x() - p0.x()) / 6, p1.y() + (p2.y() - p0.y()) / 6));
            out.add(new Point(p2.x() - (p3.x() - p1.x()) / 6, p2.y() - (p3.y() - p1.y()) / 6));
            out.add(p2);
        }
        return out;
    }

    /** A straight segment as a single cubic with control points at thirds. */
    static List<Point> straight(Point a, Point b) {
        double dx = b.x() - a.x(), dy = b.y() - a.y();
        return List.of(a, new Point(a.x() + dx / 3, a.y() + dy / 3), new Point(a.x() + 2 * dx / 3,
                a.y() + 2 * dy / 3), b);
    }

    /**
     * Single cubic for degraded routing: control points are offset from the
     * endpoints along the straight-line vector, mostly in its vertical
     * component, giving the usual S-shape between layers.
     */
    static List<Point> direct(Point a, Point b) {
        double dx = b.x() - a.x(), dy = b.y() - a.y();
        return List.of(a, new Point(a.x() + dx * 0.1, a.y() + dy * 0.5), new Point(b.x() - dx * 0.1,
                b.y() - dy * 0.5), b);
    }
}
