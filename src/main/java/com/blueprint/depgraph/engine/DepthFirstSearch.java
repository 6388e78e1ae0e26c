package com.blueprint.depgraph.engine;

import java.util.ArrayList;
import java.util.List;

import com.blueprint.depgraph.model.Adjacency;

/**
 * Iterative three-colour depth-first search over an {@link Adjacency}.
 *
 * <p>
 * White nodes are unvisited, gray nodes are on the current path, black nodes
 * are finished. An edge into a gray node is a back-edge; the cycle it closes is
 * read off the explicit path stack. The traversal uses an explicit frame stack
 * instead of recursion, so depth is bounded only by the node count, and starts
 * from nodes in index order so results are deterministic.
 */
public final class DepthFirstSearch {
    private static final byte WHITE = 0, GRAY = 1, BLACK = 2;

    private DepthFirstSearch() {
        // Utility class
    }

    /** Receives back-edges in discovery order; return false to stop the search. */
    @FunctionalInterface
    public interface BackEdgeVisitor {
        boolean onBackEdge(int edge, int[] pathEdges, int from, int to);
    }

    /**
     * Reports one cycle per back-edge, each as the ordered list of edge indices
     * starting at the back-edge's target. O(V + E) plus the size of the output.
     */
    public static List<List<Integer>> findCycles(Adjacency adj) {
        List<List<Integer>> cycles = new ArrayList<>();
        traverse(adj, null, (edge, pathEdges, from, to) -> {
            List<Integer> cycle = new ArrayList<>(to - from + 1);
            for (int k = from; k < to; k++)
                cycle.add(pathEdges[k]);
            cycle.add(edge);
            cycles.add(cycle);
            return true;
        });
        return cycles;
    }

    /**
     * First back-edge in traversal order, or {@code -1} if the graph is acyclic.
     * Edges flagged in {@code ignored} are not followed.
     */
    public static int firstBackEdge(Adjacency adj, boolean[] ignored) {
        int[] found = { -1 };
        traverse(adj, ignored, (edge, pathEdges, from, to) -> {
            found[0] = edge;
            return false;
        });
        return found[0];
    }

    /** Collects every back-edge of a single traversal. */
    public static List<Integer> backEdges(Adjacency adj, boolean[] ignored) {
        List<Integer> result = new ArrayList<>();
        traverse(adj, ignored, (edge, pathEdges, from, to) -> result.add(edge));
        return result;
    }

    /**
     * Core traversal. For a back-edge {@code e} into the node at stack depth
     * {@code d}, the visitor receives {@code pathEdges} where entries
     * {@code [d, top)} are the tree edges from that node down to the current one.
     */
    static void traverse(Adjacency adj, boolean[] ignored, BackEdgeVisitor visitor) {
        int n = adj.nodeCount();
        byte[] color = new byte[n];
        int[] depthOf = new int[n];
        int[] stackNode = new int[n];
        int[] stackNext = new int[n];
        int[] pathEdges = new int[n];

        for (int start = 0; start < n; start++) {
            if (color[start] != WHITE)
                continue;
            int top = 0;
            stackNode[0] = start;
            stackNext[0] = 0;
            color[start] = GRAY;
            depthOf[start] = 0;

            while (top >= 0) {
                int u = stackNode[top];
                if (stackNext[top] < adj.outDegree(u)) {
                    int e = adj.outEdge(u, stackNext[top]++);
                    if (ignored != null && ignored[e])
                        continue;
                    int v = adj.to(e);
                    if (color[v] == WHITE) {
                        pathEdges[top] = e;
                        top++;
                        stackNode[top] = v;
                        stackNext[top] = 0;
                        color[v] = GRAY;
                        depthOf[v] = top;
                    } else if (color[v] == GRAY) {
                        if (!visitor.onBackEdge(e, pathEdges, depthOf[v], top))
                            return;
                    }
                } else {
                    color[u] = BLACK;
                    top--;
                }
            }
        }
    }
}
