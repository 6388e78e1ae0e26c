package com.blueprint.depgraph.layout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Crossing Reducer -- reorders nodes within layers.
 *
 * Each iteration runs one median sweep, alternating downwards (each layer
 * sorted by the median position of its neighbours in the layer above) and
 * upwards (neighbours in the layer below), followed by a transpose pass that
 * swaps adjacent nodes while that strictly reduces their crossings. The best
 * ordering seen is kept.
 *
 * Ties are broken by the current position, so nodes with equal medians, and
 * nodes without neighbours in the reference layer, keep their relative order.
 * The initial order is node index order, which makes the result a function of
 * the input order alone.
 *
 * Large graphs skip the transpose pass (quadratic in swaps) and run at most
 * the configured number of large-graph sweeps.
 */
@Log4j2
public final class CrossingReducer {
    private static final int MAX_TRANSPOSE_ROUNDS = 64;

    private final LayoutGraph lg;
    private final LayoutStats stats;
    private final int[][] order;
    private final int[] pos;
    private final int[][] upper;
    private final int[][] lower;

    private CrossingReducer(LayoutGraph lg, LayoutStats stats) {
        this.lg = lg;
        this.stats = stats;
        int n = lg.nodeCount();
        this.order = new int[lg.layerCount()][];
        this.pos = new int[n];
        for (int r = 0; r < lg.layerCount(); r++) {
            List<Integer> row = lg.layers().get(r);
            order[r] = new int[row.size()];
            for (int i = 0; i < row.size(); i++) {
                order[r][i] = row.get(i);
                pos[row.get(i)] = i;
            }
        }

        int[] upCount = new int[n], lowCount = new int[n];
        for (int e = 0; e < lg.edgeCount(); e++) {
            if (isAdjacentLayerEdge(e)) {
                lowCount[lg.from(e)]++;
                upCount[lg.to(e)]++;
            }
        }
        this.upper = new int[n][];
        this.lower = new int[n][];
        for (int v = 0; v < n; v++) {
            upper[v] = new int[upCount[v]];
            lower[v] = new int[lowCount[v]];
        }
        Arrays.fill(upCount, 0);
        Arrays.fill(lowCount, 0);
        for (int e = 0; e < lg.edgeCount(); e++) {
            if (isAdjacentLayerEdge(e)) {
                int u = lg.from(e), w = lg.to(e);
                lower[u][lowCount[u]++] = w;
                upper[w][upCount[w]++] = u;
            }
        }
    }

    private boolean isAdjacentLayerEdge(int e) {
        return !lg.isLoop(e) && lg.layer(lg.to(e)) == lg.layer(lg.from(e)) + 1;
    }

    /** Reorders the layers of {@code lg} in place. */
    public static void reduce(LayoutGraph lg, LayoutConfig config, LayoutStats stats) {
        if (!lg.isLayered())
            throw new IllegalStateException("Layers must be assigned before crossing reduction");
        new CrossingReducer(lg, stats).run(config.crossingIterationsFor(lg.nodeCount()),
                !config.isLarge(lg.nodeCount()));
    }

    private void run(int iterations, boolean transpose) {
        int[][] best = snapshot();
        int bestCrossings = totalCrossings();
        int initial = bestCrossings;
        for (int it = 0; it < iterations; it++) {
            medianSweep(it % 2 == 0);
            if (transpose)
                transpose();
            int c = totalCrossings();
            if (c < bestCrossings) {
                bestCrossings = c;
                best = snapshot();
            }
            if (bestCrossings == 0)
                break;
        }
        restore(best);
        log.debug("Crossing reduction: {} -> {} crossing(s)", initial, bestCrossings);

        List<List<Integer>> layers = lg.layers();
        for (int r = 0; r < order.length; r++) {
            List<Integer> row = layers.get(r);
            row.clear();
            for (int v : order[r])
                row.add(v);
        }
    }

    private void medianSweep(boolean down) {
        stats.onMedianSweep();
        if (down) {
            for (int r = 1; r < order.length; r++)
                sortByMedian(order[r], upper);
        } else {
            for (int r = order.length - 2; r >= 0; r--)
                sortByMedian(order[r], lower);
        }
    }

    private void sortByMedian(int[] row, int[][] neighbours) {
        int k = row.length;
        if (k < 2)
            return;
        double[] key = new double[k];
        Integer[] idx = new Integer[k];
        for (int i = 0; i < k; i++) {
            idx[i] = i;
            double m = median(neighbours[row[i]]);
            key[i] = Double.isNaN(m) ? i : m;
        }
        Arrays.sort(idx, (a, b) -> {
            int c = Double.compare(key[a], key[b]);
            return c != 0 ? c : Integer.compare(a, b);
        });
        int[] sorted = new int[k];
        for (int i = 0; i < k; i++)
            sorted[i] = row[idx[i]];
        for (int i = 0; i < k; i++) {
            row[i] = sorted[i];
            pos[row[i]] = i;
        }
    }

    private double median(int[] neighbours) {
        int d = neighbours.length;
        if (d == 0)
            return Double.NaN;
        int[] p = new int[d];
        for (int i = 0; i < d; i++)
            p[i] = pos[neighbours[i]];
        Arrays.sort(p);
        return (d & 1) == 1 ? p[d / 2] : (p[d / 2 - 1] + p[d / 2]) / 2.0;
    }

    private void transpose() {
        stats.onTransposePass();
        boolean improved = true;
        for (int round = 0; improved && round < MAX_TRANSPOSE_ROUNDS; round++) {
            improved = false;
            for (int[] row : order) {
                for (int i = 0; i + 1 < row.length; i++) {
                    int v = row[i], w = row[i + 1];
                    if (pairCrossings(v, w) > pairCrossings(w, v)) {
                        row[i] = w;
                        row[i + 1] = v;
                        pos[w] = i;
                        pos[v] = i + 1;
                        improved = true;
                    }
                }
            }
        }
    }

    /** Crossings among the edges of {@code v} and {@code w} with {@code v} placed left of {@code w}. */
    private int pairCrossings(int v, int w) {
        return inversions(upper[v], upper[w]) + inversions(lower[v], lower[w]);
    }

    private int inversions(int[] left, int[] right) {
        int c = 0;
        for (int a : left)
            for (int b : right)
                if (pos[a] > pos[b])
                    c++;
        return c;
    }

    int totalCrossings() {
        int total = 0;
        for (int r = 0; r + 1 < order.length; r++) {
            List<int[]> segs = new ArrayList<>();
            for (int u : order[r])
                for (int w : lower[u])
                    segs.add(new int[] { pos[u], pos[w] });
            for (int i = 0; i < segs.size(); i++) {
                int[] s = segs.get(i);
                for (int j = i + 1; j < segs.size(); j++) {
                    int[] t = segs.get(j);
                    if ((long) (s[0] - t[0]) * (s[1] - t[1]) < 0)
                        total++;
                }
            }
        }
        return total;
    }

    /** Crossings between adjacent layers for the current order of {@code lg}. */
    public static int countCrossings(LayoutGraph lg) {
        return new CrossingReducer(lg, new LayoutStats()).totalCrossings();
    }

    private int[][] snapshot() {
        int[][] copy = new int[order.length][];
        for (int r = 0; r < order.length; r++)
            copy[r] = order[r].clone();
        return copy;
    }

    private void restore(int[][] saved) {
        for (int r = 0; r < order.length; r++) {
            order[r] = saved[r];
            for (int i = 0; i < order[r].length; i++)
                pos[order[r][i]] = i;
        }
    }
}
