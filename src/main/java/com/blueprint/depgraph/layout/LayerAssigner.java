package com.blueprint.depgraph.layout;

import java.util.ArrayList;
import java.util.List;

import com.blueprint.depgraph.model.Adjacency;

/**
 * Longest-path layering of the acyclic layout view.
 *
 * <p>
 * Nodes without incoming edges sit on layer 0; every other node sits one layer
 * below its deepest predecessor, so each non-loop edge points strictly
 * downwards. Nodes are visited in Kahn order seeded by node index; the initial
 * in-layer order is node index order.
 */
public final class LayerAssigner {

    private LayerAssigner() {
        // Utility class
    }

    public static void assign(LayoutGraph lg) {
        Adjacency adj = lg.adjacency();
        int n = lg.nodeCount();
        int[] inDegree = new int[n];
        for (int e = 0; e < lg.edgeCount(); e++)
            if (!lg.isLoop(e))
                inDegree[lg.to(e)]++;

        int[] queue = new int[n];
        int head = 0, tail = 0;
        for (int v = 0; v < n; v++)
            if (inDegree[v] == 0)
                queue[tail++] = v;

        int[] layerOf = new int[n];
        int maxLayer = n == 0 ? -1 : 0;
        while (head < tail) {
            int u = queue[head++];
            for (int i = 0; i < adj.outDegree(u); i++) {
                int e = adj.outEdge(u, i);
                if (lg.isLoop(e))
                    continue;
                int v = adj.to(e);
                layerOf[v] = Math.max(layerOf[v], layerOf[u] + 1);
                maxLayer = Math.max(maxLayer, layerOf[v]);
                if (--inDegree[v] == 0)
                    queue[tail++] = v;
            }
        }
        if (tail != n)
            throw new IllegalStateException("Layout view is not acyclic: layered " + tail + " of " + n);

        List<List<Integer>> layers = new ArrayList<>(maxLayer + 1);
        for (int i = 0; i <= maxLayer; i++)
            layers.add(new ArrayList<>());
        for (int v = 0; v < n; v++)
            layers.get(layerOf[v]).add(v);
        lg.setLayers(layerOf, layers);
    }
}
