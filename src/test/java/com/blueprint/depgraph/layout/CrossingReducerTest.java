package com.blueprint.depgraph.layout;

import static com.blueprint.depgraph.Fixtures.build;
import static com.blueprint.depgraph.Fixtures.lattice;
import static com.blueprint.depgraph.Fixtures.proven;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import com.blueprint.depgraph.api.Declaration;
import com.blueprint.depgraph.model.DependencyGraph;
import org.junit.Test;

public class CrossingReducerTest {

    private static LayoutGraph layered(DependencyGraph g) {
        LayoutGraph lg = AcyclicTransform.apply(g, new LayoutStats());
        LayerAssigner.assign(lg);
        return lg;
    }

    @Test
    public void testSimpleCrossingRemoved() {
        // A -> D and B -> C cross in index order
        LayoutGraph lg = layered(build(proven("A", "D"), proven("B", "C"), proven("C"), proven("D")));
        assertEquals(1, CrossingReducer.countCrossings(lg));

        LayoutStats stats = new LayoutStats();
        CrossingReducer.reduce(lg, LayoutConfig.defaults(), stats);
        assertEquals(0, CrossingReducer.countCrossings(lg));
        assertTrue(stats.transposePasses() > 0);
    }

    @Test
    public void testNeverWorseThanInitialOrder() {
        List<Declaration> decls = new ArrayList<>();
        // two interleaved bipartite layers
        for (int i = 0; i < 8; i++)
            decls.add(proven("top" + i, "bot" + ((i * 5) % 8), "bot" + ((i * 3 + 1) % 8)));
        for (int i = 0; i < 8; i++)
            decls.add(proven("bot" + i));
        LayoutGraph lg = layered(build(decls));
        int before = CrossingReducer.countCrossings(lg);
        CrossingReducer.reduce(lg, LayoutConfig.defaults(), new LayoutStats());
        assertTrue(CrossingReducer.countCrossings(lg) <= before);
    }

    @Test
    public void testLayerMembershipPreserved() {
        LayoutGraph lg = layered(build(lattice()));
        List<HashSet<Integer>> before = new ArrayList<>();
        for (List<Integer> row : lg.layers())
            before.add(new HashSet<>(row));
        CrossingReducer.reduce(lg, LayoutConfig.defaults(), new LayoutStats());
        for (int r = 0; r < lg.layerCount(); r++)
            assertEquals(before.get(r), new HashSet<>(lg.layers().get(r)));
    }

    @Test
    public void testLargeGraphSkipsTranspose() {
        LayoutConfig config = LayoutConfig.defaults();
        config.setLargeGraphThreshold(3);
        LayoutGraph lg = layered(build(proven("A", "D"), proven("B", "C"), proven("C"), proven("D")));
        LayoutStats stats = new LayoutStats();
        CrossingReducer.reduce(lg, config, stats);
        assertEquals(0, stats.transposePasses());
        assertTrue(stats.medianSweeps() <= 2);
    }

    @Test
    public void testDeterministic() {
        LayoutGraph a = layered(build(lattice()));
        LayoutGraph b = layered(build(lattice()));
        CrossingReducer.reduce(a, LayoutConfig.defaults(), new LayoutStats());
        CrossingReducer.reduce(b, LayoutConfig.defaults(), new LayoutStats());
        assertEquals(a.layers(), b.layers());
    }

    @Test(expected = IllegalStateException.class)
    public void testRequiresLayers() {
        CrossingReducer.reduce(new LayoutGraph(build(proven("A"))), LayoutConfig.defaults(), new LayoutStats());
    }
}
