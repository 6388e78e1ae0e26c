package com.blueprint.depgraph.model;

import static org.junit.Assert.*;

import org.junit.Test;

public class AdjacencyTest {

    @Test
    public void testEmpty() {
        Adjacency adj = Adjacency.of(0, new int[0], new int[0]);
        assertEquals(0, adj.nodeCount());
        assertEquals(0, adj.edgeCount());
    }

    @Test
    public void testDegreesAndOrder() {
        // 0 -> 1, 0 -> 2, 2 -> 1
        Adjacency adj = Adjacency.of(3, new int[] { 0, 0, 2 }, new int[] { 1, 2, 1 });
        assertEquals(2, adj.outDegree(0));
        assertEquals(0, adj.outDegree(1));
        assertEquals(2, adj.inDegree(1));
        assertEquals(0, adj.outEdge(0, 0));
        assertEquals(1, adj.outEdge(0, 1));
        assertEquals(0, adj.inEdge(1, 0));
        assertEquals(2, adj.inEdge(1, 1));
        assertEquals(2, adj.opposite(2, 1));
        assertEquals(1, adj.opposite(2, 2));
    }

    @Test
    public void testArraysCopied() {
        int[] from = { 0 };
        int[] to = { 1 };
        Adjacency adj = Adjacency.of(2, from, to);
        from[0] = 1;
        assertEquals(0, adj.from(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEndpointOutOfRange() {
        Adjacency.of(2, new int[] { 0 }, new int[] { 2 });
    }

    @Test(expected = IllegalArgumentException.class)
    public void testLengthMismatch() {
        Adjacency.of(2, new int[] { 0, 1 }, new int[] { 1 });
    }
}
