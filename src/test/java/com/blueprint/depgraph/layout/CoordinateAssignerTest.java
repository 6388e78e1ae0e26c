package com.blueprint.depgraph.layout;

import static com.blueprint.depgraph.Fixtures.build;
import static com.blueprint.depgraph.Fixtures.lattice;
import static com.blueprint.depgraph.Fixtures.proven;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.blueprint.depgraph.api.Declaration;
import com.blueprint.depgraph.model.DependencyGraph;
import org.junit.Test;

public class CoordinateAssignerTest {
    private static final double EPS = 1e-9;

    private static LayoutGraph placed(DependencyGraph g, LayoutConfig config, LayoutStats stats) {
        LayoutGraph lg = AcyclicTransform.apply(g, stats);
        LayerAssigner.assign(lg);
        CrossingReducer.reduce(lg, config, stats);
        CoordinateAssigner.assign(lg, config, stats);
        return lg;
    }

    @Test
    public void testNormalizedToPadding() {
        LayoutConfig config = LayoutConfig.defaults();
        LayoutGraph lg = placed(build(lattice()), config, new LayoutStats());
        double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
        for (int v = 0; v < lg.nodeCount(); v++) {
            minX = Math.min(minX, lg.centerX(v) - lg.width(v) / 2);
            minY = Math.min(minY, lg.centerY(v) - lg.height(v) / 2);
        }
        assertEquals(config.getPadding(), minX, EPS);
        assertEquals(config.getPadding(), minY, EPS);
    }

    @Test
    public void testCustomPadding() {
        LayoutConfig config = LayoutConfig.defaults();
        config.setPadding(55);
        LayoutGraph lg = placed(build(proven("solo")), config, new LayoutStats());
        assertEquals(55, lg.centerX(0) - lg.width(0) / 2, EPS);
        assertEquals(55, lg.centerY(0) - lg.height(0) / 2, EPS);
    }

    @Test
    public void testNoOverlapWithinLayer() {
        LayoutConfig config = LayoutConfig.defaults();
        List<Declaration> decls = new ArrayList<>();
        // wide fan-in onto one node pulls every child toward the same x
        String[] kids = new String[12];
        for (int i = 0; i < kids.length; i++)
            kids[i] = "child_with_a_long_label_" + i;
        decls.add(proven("root", kids));
        for (String k : kids)
            decls.add(proven(k, "leaf"));
        decls.add(proven("leaf"));
        LayoutGraph lg = placed(build(decls), config, new LayoutStats());

        for (List<Integer> row : lg.layers()) {
            for (int i = 0; i + 1 < row.size(); i++) {
                int a = row.get(i), b = row.get(i + 1);
                double rightOfA = lg.centerX(a) + lg.width(a) / 2;
                double leftOfB = lg.centerX(b) - lg.width(b) / 2;
                assertTrue(rightOfA + config.getNodeSpacing() <= leftOfB + 1e-6);
            }
        }
    }

    @Test
    public void testRowsFollowLayers() {
        LayoutConfig config = LayoutConfig.defaults();
        LayoutGraph lg = placed(build(lattice()), config, new LayoutStats());
        for (int v = 0; v < lg.nodeCount(); v++) {
            double expected = config.getPadding() + config.getNodeHeight() / 2
                    + lg.layer(v) * config.getLayerSpacing();
            assertEquals(expected, lg.centerY(v), EPS);
        }
    }

    @Test
    public void testWidthFromLabel() {
        LayoutConfig config = LayoutConfig.defaults();
        String longLabel = "twenty_characters_xx";
        LayoutGraph lg = placed(build(proven("a"), proven(longLabel)), config, new LayoutStats());
        assertEquals(config.getMinNodeWidth(), lg.width(0), EPS);
        assertEquals(20 * config.getCharWidth() + config.getLabelPadding(), lg.width(1), EPS);
        assertEquals(config.getNodeHeight(), lg.height(1), EPS);
    }

    @Test
    public void testLargeGraphCapsRefinement() {
        LayoutConfig config = LayoutConfig.defaults();
        config.setLargeGraphThreshold(2);
        LayoutStats stats = new LayoutStats();
        placed(build(lattice()), config, stats);
        assertTrue(stats.refinementIterations() <= 2);
    }

    @Test
    public void testResolveOverlapsKeepsOrder() {
        LayoutGraph lg = AcyclicTransform.apply(build(proven("a"), proven("b"), proven("c")), new LayoutStats());
        for (int v = 0; v < 3; v++)
            lg.setSize(v, 60, 36);
        double[] x = new double[3];
        // everybody wants the same spot
        CoordinateAssigner.resolveOverlaps(lg, Arrays.asList(0, 1, 2), new double[] { 100, 100, 100 }, x, 40);
        assertEquals(100, x[0] + 100, EPS);
        assertEquals(100, x[1], EPS);
        assertEquals(200, x[2], EPS);
    }
}
