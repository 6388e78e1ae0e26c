package com.blueprint.depgraph.layout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.blueprint.depgraph.api.NodeShape;
import com.blueprint.depgraph.model.Point;
import com.lmax.disruptor.util.DaemonThreadFactory;

import lombok.extern.log4j.Log4j2;

/**
 * Edge Router -- computes a cubic curve for every edge.
 *
 * Small graphs (at most the large-graph threshold): shortest obstacle-avoiding
 * polyline through the {@link VisibilityGraph}, clipped to the source and
 * target shapes, smoothed with Catmull-Rom.
 *
 * Large graphs: one direct cubic per edge from boundary to boundary, O(E).
 *
 * Routes are computed in layout direction. Edges are independent, so with
 * {@code routingThreads > 1} they are routed on a pool of daemon threads; the
 * results are still collected in edge order, so output does not depend on
 * scheduling.
 */
@Log4j2
public final class EdgeRouter {
    private static final double LOOP_REACH = 30;

    private final LayoutGraph lg;
    private final LayoutStats stats;
    private final VisibilityGraph visibility;

    private EdgeRouter(LayoutGraph lg, LayoutConfig config, LayoutStats stats) {
        this.lg = lg;
        this.stats = stats;
        this.visibility = config.isLarge(lg.nodeCount()) ? null : new VisibilityGraph(lg, config);
    }

    public static void route(LayoutGraph lg, LayoutConfig config, LayoutStats stats) {
        if (lg.nodeCount() > 0 && !(lg.width(0) > 0))
            throw new IllegalStateException("Coordinates must be assigned before routing");
        EdgeRouter router = new EdgeRouter(lg, config, stats);
        int m = lg.edgeCount();
        int threads = Math.min(config.getRoutingThreads(), Math.max(1, m));
        if (threads <= 1) {
            for (int e = 0; e < m; e++)
                lg.setRoute(e, router.routeEdge(e));
        } else {
            router.routeParallel(threads);
        }
        log.debug("Routed {} edge(s): {} via visibility graph, {} direct", m, stats.visibilityRoutes(),
                stats.directRoutes());
    }

    private void routeParallel(int threads) {
        ExecutorService pool = Executors.newFixedThreadPool(threads, DaemonThreadFactory.INSTANCE);
        try {
            List<Future<List<Point>>> futures = new ArrayList<>(lg.edgeCount());
            for (int e = 0; e < lg.edgeCount(); e++) {
                final int edge = e;
                futures.add(pool.submit(() -> routeEdge(edge)));
            }
            for (int e = 0; e < futures.size(); e++)
                lg.setRoute(e, futures.get(e).get());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while routing edges", ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Edge routing failed", ex.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    List<Point> routeEdge(int e) {
        int u = lg.from(e), v = lg.to(e);
        Obstacle src = Obstacle.of(lg, u);
        if (lg.isLoop(e))
            return loop(src);
        Obstacle tgt = Obstacle.of(lg, v);

        if (visibility == null) {
            stats.onDirectRoute();
            Point a = src.boundaryToward(tgt.center());
            Point b = tgt.boundaryToward(src.center());
            return CurveFitter.direct(a, b);
        }

        stats.onVisibilityRoute();
        List<Point> poly = visibility.shortestPath(u, v);
        if (poly == null) {
            log.debug("No obstacle-free path for edge {}, drawing it straight", lg.graph().edge(e));
            poly = List.of(src.center(), tgt.center());
        }
        List<Point> clipped = new ArrayList<>(poly);
        clipped.set(0, src.boundaryToward(poly.get(1)));
        clipped.set(clipped.size() - 1, tgt.boundaryToward(poly.get(poly.size() - 2)));
        return CurveFitter.catmullRom(clipped);
    }

    /** Small loop on the right-hand side of the node, ends on its boundary. */
    static List<Point> loop(Obstacle o) {
        // ends sit at hh / 2 from the centre, where an ellipse reaches hw * sqrt(3) / 2
        double x = o.cx + (o.shape == NodeShape.ELLIPSE ? o.hw * Math.sqrt(0.75) : o.hw);
        return List.of(new Point(x, o.cy - o.hh / 2), new Point(x + LOOP_REACH, o.cy - o.hh - LOOP_REACH / 3),
                new Point(x + LOOP_REACH, o.cy + o.hh + LOOP_REACH / 3), new Point(x, o.cy + o.hh / 2));
    }
}
