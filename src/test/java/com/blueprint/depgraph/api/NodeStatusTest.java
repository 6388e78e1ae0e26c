package com.blueprint.depgraph.api;

import static org.junit.Assert.*;

import org.junit.Test;

public class NodeStatusTest {

    @Test
    public void testColorTable() {
        assertEquals("#F4A460", NodeStatus.NOT_READY.color());
        assertEquals("#20B2AA", NodeStatus.READY.color());
        assertEquals("#8B0000", NodeStatus.SORRY.color());
        assertEquals("#90EE90", NodeStatus.PROVEN.color());
        assertEquals("#228B22", NodeStatus.FULLY_PROVEN.color());
        assertEquals("#87CEEB", NodeStatus.MATHLIB_READY.color());
    }

    @Test
    public void testJsonNames() {
        for (NodeStatus s : NodeStatus.values())
            assertSame(s, NodeStatus.fromString(s.jsonName()));
        assertSame(NodeStatus.MATHLIB_READY, NodeStatus.fromString("mathlibready"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownStatus() {
        NodeStatus.fromString("done");
    }

    @Test
    public void testShapeForEnvType() {
        assertEquals(NodeShape.BOX, NodeShape.forEnvType("Definition"));
        assertEquals(NodeShape.BOX, NodeShape.forEnvType("structure"));
        assertEquals(NodeShape.ELLIPSE, NodeShape.forEnvType("lemma"));
        assertEquals(NodeShape.ELLIPSE, NodeShape.forEnvType(null));
    }

    @Test
    public void testEdgeKindStyle() {
        assertEquals("dashed", EdgeKind.STATEMENT.style());
        assertEquals("solid", EdgeKind.PROOF.style());
        assertSame(EdgeKind.PROOF, EdgeKind.fromString("proof"));
    }
}
