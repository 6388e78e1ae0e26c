package com.blueprint.depgraph.layout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.blueprint.depgraph.model.Point;

/**
 * Visibility graph over node obstacles, used for obstacle-avoiding routes.
 *
 * <p>
 * Vertices are waypoints placed a margin outside every node shape; two
 * waypoints are linked when the straight segment between them crosses no node.
 * Waypoint-to-waypoint visibility is computed once and shared by all edges
 * (read-only afterwards, so concurrent queries are safe). A query adds the
 * two endpoint centres, whose visibility is tested against every node except
 * the edge's own endpoints, and runs an O(V^2) array-based Dijkstra.
 */
final class VisibilityGraph {
    private final Obstacle[] obstacles;
    private final Point[] waypoints;
    private final boolean[][] visible;

    VisibilityGraph(LayoutGraph lg, LayoutConfig config) {
        int n = lg.nodeCount();
        this.obstacles = new Obstacle[n];
        for (int v = 0; v < n; v++)
            obstacles[v] = Obstacle.of(lg, v);

        List<Point> pts = new ArrayList<>();
        for (Obstacle o : obstacles) {
            for (Point p : o.waypoints(config.getObstacleMargin(), config.getEllipseSamples())) {
                if (!insideAny(p))
                    pts.add(p);
            }
        }
        this.waypoints = pts.toArray(new Point[0]);

        int w = waypoints.length;
        this.visible = new boolean[w][w];
        for (int i = 0; i < w; i++) {
            for (int j = i + 1; j < w; j++) {
                boolean vis = clear(waypoints[i], waypoints[j], -1, -1);
                visible[i][j] = vis;
                visible[j][i] = vis;
            }
        }
    }

    int waypointCount() {
        return waypoints.length;
    }

    Obstacle obstacle(int v) {
        return obstacles[v];
    }

    private boolean insideAny(Point p) {
        for (Obstacle o : obstacles)
            if (o.contains(p))
                return true;
        return false;
    }

    /** True if segment a-b crosses no node other than {@code skipA} and {@code skipB}. */
    boolean clear(Point a, Point b, int skipA, int skipB) {
        for (Obstacle o : obstacles) {
            if (o.node == skipA || o.node == skipB)
                continue;
            if (o.intersects(a, b))
                return false;
        }
        return true;
    }

    /**
     * Shortest obstacle-avoiding polyline from the centre of {@code src} to the
     * centre of {@code tgt}, or {@code null} if no such path exists. Distance
     * ties go to the lower vertex index.
     */
    List<Point> shortestPath(int src, int tgt) {
        Point s = obstacles[src].center();
        Point t = obstacles[tgt].center();
        if (clear(s, t, src, tgt))
            return List.of(s, t);

        int w = waypoints.length;
        int start = w, end = w + 1, total = w + 2;
        boolean[] fromStart = new boolean[w];
        boolean[] toEnd = new boolean[w];
        for (int i = 0; i < w; i++) {
            fromStart[i] = clear(s, waypoints[i], src, tgt);
            toEnd[i] = clear(waypoints[i], t, src, tgt);
        }

        double[] dist = new double[total];
        int[] prev = new int[total];
        boolean[] done = new boolean[total];
        Arrays.fill(dist, Double.POSITIVE_INFINITY);
        Arrays.fill(prev, -1);
        dist[start] = 0;

        while (true) {
            int u = -1;
            for (int i = 0; i < total; i++)
                if (!done[i] && (u < 0 || dist[i] < dist[u]))
                    u = i;
            if (u < 0 || dist[u] == Double.POSITIVE_INFINITY)
                return null;
            if (u == end)
                break;
            done[u] = true;
            Point pu = point(u, s, t);
            for (int v = 0; v < total; v++) {
                if (done[v] || !linked(u, v, fromStart, toEnd))
                    continue;
                double d = dist[u] + pu.distance(point(v, s, t));
                if (d < dist[v]) {
                    dist[v] = d;
                    prev[v] = u;
                }
            }
        }

        List<Point> path = new ArrayList<>();
        for (int v = end; v >= 0; v = prev[v])
            path.add(point(v, s, t));
        Collections.reverse(path);
        return path;
    }

    private boolean linked(int u, int v, boolean[] fromStart, boolean[] toEnd) {
        int w = waypoints.length;
        if (u == v)
            return false;
        if (u < w && v < w)
            return visible[u][v];
        if (u == w)
            return v < w && fromStart[v];
        if (v == w)
            return u < w && fromStart[u];
        if (u == w + 1)
            return v < w && toEnd[v];
        return u < w && toEnd[u];
    }

    private Point point(int v, Point s, Point t) {
        int w = waypoints.length;
        return v < w ? waypoints[v] : v == w ? s : t;
    }
}
