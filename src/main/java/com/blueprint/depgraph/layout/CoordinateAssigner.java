package com.blueprint.depgraph.layout;

import java.util.Arrays;
import java.util.List;

import com.blueprint.depgraph.model.Adjacency;

import lombok.extern.log4j.Log4j2;

/**
 * Coordinate Assigner -- turns layers and in-layer order into coordinates.
 *
 * 1. Size: width from the label length, fixed height.
 * 2. Rows: y from the layer index and the fixed layer spacing.
 * 3. Initial x: layer 0 is packed left to right; each lower layer places every
 * node at the barycenter of its neighbours in the layer above, then resolves
 * overlaps.
 * 4. Refinement: alternating downward and upward passes pull each node toward
 * the median x of its neighbours in both adjacent layers, then re-resolve
 * overlaps. Stops on convergence or at the iteration cap (2 for large graphs).
 * 5. Normalization: everything is shifted so the bounding box starts at
 * (padding, padding).
 *
 * Overlap resolution keeps the in-layer order and enforces the minimum
 * spacing between neighbouring boxes. It averages a left-to-right and a
 * right-to-left packing of the desired positions; both are feasible, so their
 * mean is too, and neither side is favoured.
 */
@Log4j2
public final class CoordinateAssigner {
    private static final double CONVERGENCE_EPSILON = 0.5;

    private CoordinateAssigner() {
        // Utility class
    }

    public static void assign(LayoutGraph lg, LayoutConfig config, LayoutStats stats) {
        if (!lg.isLayered())
            throw new IllegalStateException("Layers must be assigned before coordinates");
        int n = lg.nodeCount();
        if (n == 0)
            return;

        for (int v = 0; v < n; v++) {
            String label = lg.graph().node(v).label();
            double w = Math.max(config.getMinNodeWidth(), label.length() * config.getCharWidth()
                    + config.getLabelPadding());
            lg.setSize(v, w, config.getNodeHeight());
        }

        Adjacency adj = lg.adjacency();
        List<List<Integer>> layers = lg.layers();
        double[] x = new double[n];

        // Initial barycenter placement
        for (int r = 0; r < layers.size(); r++) {
            List<Integer> row = layers.get(r);
            double[] desired = new double[row.size()];
            for (int i = 0; i < row.size(); i++) {
                int v = row.get(i);
                desired[i] = r == 0 ? Double.NaN : barycenter(lg, adj, v, x);
            }
            resolveOverlaps(lg, row, desired, x, config.getNodeSpacing());
        }

        // Median refinement
        int cap = config.refinementIterationsFor(n);
        int it = 0;
        for (; it < cap; it++) {
            stats.onRefinementIteration();
            boolean down = it % 2 == 0;
            double moved = 0;
            for (int k = 0; k < layers.size(); k++) {
                int r = down ? k : layers.size() - 1 - k;
                List<Integer> row = layers.get(r);
                double[] desired = new double[row.size()];
                double[] before = new double[row.size()];
                for (int i = 0; i < row.size(); i++) {
                    int v = row.get(i);
                    before[i] = x[v];
                    double m = neighbourMedian(lg, adj, v, x);
                    desired[i] = Double.isNaN(m) ? x[v] : m;
                }
                resolveOverlaps(lg, row, desired, x, config.getNodeSpacing());
                for (int i = 0; i < row.size(); i++)
                    moved = Math.max(moved, Math.abs(x[row.get(i)] - before[i]));
            }
            if (moved < CONVERGENCE_EPSILON) {
                it++;
                break;
            }
        }
        log.debug("Coordinate refinement: {} iteration(s) of at most {}", it, cap);

        // Normalize to (padding, padding)
        double minLeft = Double.POSITIVE_INFINITY, minTop = Double.POSITIVE_INFINITY;
        for (int v = 0; v < n; v++) {
            minLeft = Math.min(minLeft, x[v] - lg.width(v) / 2);
            minTop = Math.min(minTop, rowCenter(lg.layer(v), config) - lg.height(v) / 2);
        }
        double dx = config.getPadding() - minLeft;
        double dy = config.getPadding() - minTop;
        for (int v = 0; v < n; v++)
            lg.setCenter(v, x[v] + dx, rowCenter(lg.layer(v), config) + dy);
    }

    private static double rowCenter(int layer, LayoutConfig config) {
        return layer * config.getLayerSpacing() + config.getNodeHeight() / 2;
    }

    /** Mean x of the already placed neighbours one layer up, NaN if none. */
    private static double barycenter(LayoutGraph lg, Adjacency adj, int v, double[] x) {
        double sum = 0;
        int count = 0;
        for (int i = 0; i < adj.inDegree(v); i++) {
            int e = adj.inEdge(v, i);
            int u = adj.from(e);
            if (!lg.isLoop(e) && lg.layer(u) == lg.layer(v) - 1) {
                sum += x[u];
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    /** Median x of neighbours in both adjacent layers, NaN if none. */
    private static double neighbourMedian(LayoutGraph lg, Adjacency adj, int v, double[] x) {
        int layer = lg.layer(v);
        double[] buf = new double[adj.inDegree(v) + adj.outDegree(v)];
        int k = 0;
        for (int i = 0; i < adj.inDegree(v); i++) {
            int e = adj.inEdge(v, i);
            if (!lg.isLoop(e) && lg.layer(adj.from(e)) == layer - 1)
                buf[k++] = x[adj.from(e)];
        }
        for (int i = 0; i < adj.outDegree(v); i++) {
            int e = adj.outEdge(v, i);
            if (!lg.isLoop(e) && lg.layer(adj.to(e)) == layer + 1)
                buf[k++] = x[adj.to(e)];
        }
        if (k == 0)
            return Double.NaN;
        Arrays.sort(buf, 0, k);
        return (k & 1) == 1 ? buf[k / 2] : (buf[k / 2 - 1] + buf[k / 2]) / 2;
    }

    /**
     * Places the nodes of one row as close to {@code desired} as the order and
     * spacing allow. NaN entries mean "directly after the left neighbour".
     */
    static void resolveOverlaps(LayoutGraph lg, List<Integer> row, double[] desired, double[] x, double spacing) {
        int k = row.size();
        if (k == 0)
            return;
        double[] left = new double[k];
        for (int i = 0; i < k; i++) {
            int v = row.get(i);
            double min = i == 0 ? Double.NEGATIVE_INFINITY : left[i - 1] + gap(lg, row.get(i - 1), v, spacing);
            double want = Double.isNaN(desired[i]) ? (i == 0 ? lg.width(v) / 2 : min) : desired[i];
            left[i] = Math.max(want, min);
        }
        double[] right = new double[k];
        for (int i = k - 1; i >= 0; i--) {
            int v = row.get(i);
            double max = i == k - 1 ? Double.POSITIVE_INFINITY : right[i + 1] - gap(lg, v, row.get(i + 1), spacing);
            double want = Double.isNaN(desired[i]) ? left[i] : desired[i];
            right[i] = Math.min(want, max);
        }
        for (int i = 0; i < k; i++)
            x[row.get(i)] = (left[i] + right[i]) / 2;
    }

    private static double gap(LayoutGraph lg, int a, int b, double spacing) {
        return lg.width(a) / 2 + spacing + lg.width(b) / 2;
    }
}
