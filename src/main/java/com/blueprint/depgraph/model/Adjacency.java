package com.blueprint.depgraph.model;

/**
 * Adjacency -- CSR-encoded edge index over a node arena.
 *
 * <p>
 * Nodes and edges are identified by their integer index. Instead of each node
 * holding lists of edge objects, the outgoing and incoming edge indices of all
 * nodes are stored in two flat int arrays with offset tables:
 * <ul>
 * <li>{@code outEdges[outOffset[v] .. outOffset[v+1])} are the edges leaving
 * {@code v}, in input edge order.</li>
 * <li>{@code inEdges[inOffset[v] .. inOffset[v+1])} are the edges entering
 * {@code v}, in input edge order.</li>
 * </ul>
 * Iteration order is therefore fully determined by the edge list, which keeps
 * every traversal built on top of it deterministic.
 *
 * <p>
 * Cycles are fine: edges are plain indices, nothing is owned.
 */
public final class Adjacency {
    private final int nodeCount;
    private final int[] from;
    private final int[] to;
    private final int[] outOffset;
    private final int[] outEdges;
    private final int[] inOffset;
    private final int[] inEdges;

    private Adjacency(int nodeCount, int[] from, int[] to, int[] outOffset, int[] outEdges, int[] inOffset,
            int[] inEdges) {
        this.nodeCount = nodeCount;
        this.from = from;
        this.to = to;
        this.outOffset = outOffset;
        this.outEdges = outEdges;
        this.inOffset = inOffset;
        this.inEdges = inEdges;
    }

    /**
     * Builds the index. {@code from[e]} and {@code to[e]} are the endpoints of
     * edge {@code e}; both arrays are copied.
     */
    public static Adjacency of(int nodeCount, int[] from, int[] to) {
        if (from.length != to.length)
            throw new IllegalArgumentException("Endpoint arrays differ in length");
        int m = from.length;
        int[] outOffset = new int[nodeCount + 1];
        int[] inOffset = new int[nodeCount + 1];
        for (int e = 0; e < m; e++) {
            checkNode(from[e], nodeCount);
            checkNode(to[e], nodeCount);
            outOffset[from[e] + 1]++;
            inOffset[to[e] + 1]++;
        }
        for (int v = 0; v < nodeCount; v++) {
            outOffset[v + 1] += outOffset[v];
            inOffset[v + 1] += inOffset[v];
        }
        int[] outEdges = new int[m];
        int[] inEdges = new int[m];
        int[] outFill = new int[nodeCount];
        int[] inFill = new int[nodeCount];
        for (int e = 0; e < m; e++) {
            outEdges[outOffset[from[e]] + outFill[from[e]]++] = e;
            inEdges[inOffset[to[e]] + inFill[to[e]]++] = e;
        }
        return new Adjacency(nodeCount, from.clone(), to.clone(), outOffset, outEdges, inOffset, inEdges);
    }

    private static void checkNode(int v, int nodeCount) {
        if (v < 0 || v >= nodeCount)
            throw new IllegalArgumentException("Edge endpoint out of range: " + v);
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int edgeCount() {
        return from.length;
    }

    public int from(int edge) {
        return from[edge];
    }

    public int to(int edge) {
        return to[edge];
    }

    public int outDegree(int v) {
        return outOffset[v + 1] - outOffset[v];
    }

    /** The i-th outgoing edge index of {@code v}. */
    public int outEdge(int v, int i) {
        return outEdges[outOffset[v] + i];
    }

    public int inDegree(int v) {
        return inOffset[v + 1] - inOffset[v];
    }

    /** The i-th incoming edge index of {@code v}. */
    public int inEdge(int v, int i) {
        return inEdges[inOffset[v] + i];
    }

    /** Endpoint of {@code edge} opposite to {@code v}. */
    public int opposite(int edge, int v) {
        return from[edge] == v ? to[edge] : from[edge];
    }
}
