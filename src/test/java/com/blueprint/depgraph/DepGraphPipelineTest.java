package com.blueprint.depgraph;

import static com.blueprint.depgraph.Fixtures.chain;
import static com.blueprint.depgraph.Fixtures.lattice;
import static com.blueprint.depgraph.Fixtures.proven;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import com.blueprint.depgraph.api.Declaration;
import com.blueprint.depgraph.api.NodeStatus;
import com.blueprint.depgraph.io.GraphDescription;
import com.blueprint.depgraph.io.GraphWriter;
import com.blueprint.depgraph.layout.LayoutConfig;
import com.blueprint.depgraph.model.GraphEdge;
import com.blueprint.depgraph.model.GraphNode;
import org.junit.Test;

public class DepGraphPipelineTest {

    private static List<Declaration> tangled() {
        List<Declaration> decls = new ArrayList<>(lattice());
        decls.add(proven("loopA", "loopB", "main"));
        decls.add(proven("loopB", "loopC"));
        decls.add(proven("loopC", "loopA", "ghost"));
        return decls;
    }

    @Test
    public void testDeterministic() throws Exception {
        List<Declaration> decls = tangled();
        PipelineResult first = DepGraph.run(decls);
        PipelineResult second = DepGraph.run(decls);

        for (int i = 0; i < first.graph().nodeCount(); i++) {
            GraphNode a = first.graph().node(i), b = second.graph().node(i);
            assertEquals(Double.doubleToRawLongBits(a.x()), Double.doubleToRawLongBits(b.x()));
            assertEquals(Double.doubleToRawLongBits(a.y()), Double.doubleToRawLongBits(b.y()));
            assertEquals(a.order(), b.order());
        }
        for (int e = 0; e < first.graph().edgeCount(); e++)
            assertEquals(first.graph().edge(e).points(), second.graph().edge(e).points());
        assertEquals(GraphWriter.toJson(GraphDescription.from(first)),
                GraphWriter.toJson(GraphDescription.from(second)));
    }

    @Test
    public void testMalformedInputIsNotFatal() {
        PipelineResult r = DepGraph.run(tangled());
        assertEquals(1, r.droppedReferences());
        assertTrue(r.checkResults().hasCycles());
        assertTrue(r.checkResults().connected());
        assertTrue(r.layoutStats().reversedEdges() > 0);
        for (GraphEdge e : r.graph().edges())
            assertNotNull(e.points());
    }

    @Test
    public void testStatusCountsMatchNodes() {
        PipelineResult r = DepGraph.run(tangled());
        assertEquals(r.graph().nodeCount(), r.statusCounts().total());
        int sum = 0;
        for (NodeStatus s : NodeStatus.values())
            sum += r.statusCounts().get(s);
        assertEquals(r.graph().nodeCount(), sum);
        // loop nodes sit on a cycle
        assertEquals(NodeStatus.PROVEN, r.graph().node("loopA").status());
        assertEquals(NodeStatus.FULLY_PROVEN, r.graph().node("main").status());
    }

    @Test
    public void testCustomConfig() {
        LayoutConfig config = LayoutConfig.defaults();
        config.setLargeGraphThreshold(5);
        PipelineResult r = DepGraph.pipeline().withConfig(config).run(chain(6));
        assertTrue(r.layoutStats().largeGraph());
        assertEquals(5, r.layoutStats().directRoutes());
    }

    @Test
    public void testEmptyInput() {
        PipelineResult r = DepGraph.run(List.of());
        assertEquals(0, r.graph().nodeCount());
        assertFalse(r.checkResults().connected());
        assertEquals(40, r.width(), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidConfig() {
        LayoutConfig config = LayoutConfig.defaults();
        config.setEllipseSamples(2);
        DepGraph.pipeline().withConfig(config);
    }
}
