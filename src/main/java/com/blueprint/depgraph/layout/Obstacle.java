package com.blueprint.depgraph.layout;

import java.util.ArrayList;
import java.util.List;

import com.blueprint.depgraph.api.NodeShape;
import com.blueprint.depgraph.model.Point;

/**
 * A node's shape as seen by the edge router: an axis-aligned rectangle or an
 * axis-aligned ellipse around the node centre. All intersection tests are
 * closed form.
 */
final class Obstacle {
    private static final double EPS = 1e-9;

    final int node;
    final NodeShape shape;
    final double cx, cy, hw, hh;

    Obstacle(int node, NodeShape shape, double cx, double cy, double hw, double hh) {
        this.node = node;
        this.shape = shape;
        this.cx = cx;
        this.cy = cy;
        this.hw = hw;
        this.hh = hh;
    }

    static Obstacle of(LayoutGraph lg, int v) {
        return new Obstacle(v, lg.shape(v), lg.centerX(v), lg.centerY(v), lg.width(v) / 2, lg.height(v) / 2);
    }

    Point center() {
        return new Point(cx, cy);
    }

    /** True if {@code p} lies strictly inside the shape. */
    boolean contains(Point p) {
        double dx = p.x() - cx, dy = p.y() - cy;
        if (shape == NodeShape.BOX)
            return Math.abs(dx) < hw - EPS && Math.abs(dy) < hh - EPS;
        double nx = dx / hw, ny = dy / hh;
        return nx * nx + ny * ny < 1 - EPS;
    }

    /** True if the segment {@code a-b} passes through the interior. */
    boolean intersects(Point a, Point b) {
        // Cheap bounding-box rejection first
        if (Math.max(a.x(), b.x()) <= cx - hw || Math.min(a.x(), b.x()) >= cx + hw
                || Math.max(a.y(), b.y()) <= cy - hh || Math.min(a.y(), b.y()) >= cy + hh)
            return false;
        return shape == NodeShape.BOX ? intersectsRect(a, b) : intersectsEllipse(a, b);
    }

    /** Liang-Barsky clip of the segment against the open rectangle. */
    private boolean intersectsRect(Point a, Point b) {
        double dx = b.x() - a.x(), dy = b.y() - a.y();
        double t0 = 0, t1 = 1;
        double[] p = { -dx, dx, -dy, dy };
        double[] q = { a.x() - (cx - hw) - EPS, (cx + hw) - a.x() - EPS, a.y() - (cy - hh) - EPS,
                (cy + hh) - a.y() - EPS };
        for (int i = 0; i < 4; i++) {
            if (p[i] == 0) {
                if (q[i] <= 0)
                    return false;
            } else {
                double t = q[i] / p[i];
                if (p[i] < 0) {
                    if (t > t1)
                        return false;
                    t0 = Math.max(t0, t);
                } else {
                    if (t < t0)
                        return false;
                    t1 = Math.min(t1, t);
                }
            }
        }
        return t1 - t0 > EPS;
    }

    /** Solves |a + t(b - a)| = 1 in ellipse-normalised coordinates. */
    private boolean intersectsEllipse(Point a, Point b) {
        double ax = (a.x() - cx) / hw, ay = (a.y() - cy) / hh;
        double dx = (b.x() - a.x()) / hw, dy = (b.y() - a.y()) / hh;
        double qa = dx * dx + dy * dy;
        double qb = 2 * (ax * dx + ay * dy);
        double qc = ax * ax + ay * ay - 1;
        if (qc < -EPS)
            return true;
        if (qa < EPS)
            return false;
        double disc = qb * qb - 4 * qa * qc;
        if (disc <= EPS)
            return false;
        double sq = Math.sqrt(disc);
        double t0 = (-qb - sq) / (2 * qa);
        double t1 = (-qb + sq) / (2 * qa);
        return t0 < 1 && t1 > 0;
    }

    /**
     * Waypoints around the shape, {@code margin} away from it: the four
     * corners of a box, or {@code samples} points on a polygon circumscribing
     * the enlarged ellipse.
     */
    List<Point> waypoints(double margin, int samples) {
        List<Point> pts = new ArrayList<>();
        if (shape == NodeShape.BOX) {
            pts.add(new Point(cx - hw - margin, cy - hh - margin));
            pts.add(new Point(cx + hw + margin, cy - hh - margin));
            pts.add(new Point(cx + hw + margin, cy + hh + margin));
            pts.add(new Point(cx - hw - margin, cy + hh + margin));
        } else {
            double scale = 1 / Math.cos(Math.PI / samples);
            double rx = (hw + margin) * scale, ry = (hh + margin) * scale;
            for (int k = 0; k < samples; k++) {
                double angle = 2 * Math.PI * k / samples;
                pts.add(new Point(cx + rx * Math.cos(angle), cy + ry * Math.sin(angle)));
            }
        }
        return pts;
    }

    /** Point where the ray from the centre toward {@code p} leaves the shape. */
    Point boundaryToward(Point p) {
        double dx = p.x() - cx, dy = p.y() - cy;
        if (Math.abs(dx) < EPS && Math.abs(dy) < EPS)
            return center();
        double t;
        if (shape == NodeShape.BOX) {
            double tx = Math.abs(dx) < EPS ? Double.POSITIVE_INFINITY : hw / Math.abs(dx);
            double ty = Math.abs(dy) < EPS ? Double.POSITIVE_INFINITY : hh / Math.abs(dy);
            t = Math.min(tx, ty);
        } else {
            t = 1 / Math.sqrt((dx / hw) * (dx / hw) + (dy / hh) * (dy / hh));
        }
        return new Point(cx + t * dx, cy + t * dy);
    }
}
